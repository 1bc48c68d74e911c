package me.golemcore.planner.domain.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import me.golemcore.planner.adapter.outbound.storage.LocalStorageAdapter;
import me.golemcore.planner.domain.exception.InvalidArgumentException;
import me.golemcore.planner.domain.exception.NotFoundException;
import me.golemcore.planner.domain.exception.PermissionDeniedException;
import me.golemcore.planner.domain.model.Poll;
import me.golemcore.planner.domain.model.PollResults;
import me.golemcore.planner.domain.model.PollStatistics;
import me.golemcore.planner.infrastructure.config.AutoConfiguration;
import me.golemcore.planner.infrastructure.config.BotProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class PollServiceTest {

    private static final Instant NOW = Instant.parse("2026-03-02T09:00:00Z");
    private static final String CREATOR = "u1";

    @TempDir
    Path tempDir;

    private BotProperties properties;
    private LocalStorageAdapter storage;
    private ObjectMapper objectMapper;
    private Clock clock;
    private PollService service;

    @BeforeEach
    void setUp() {
        properties = new BotProperties();
        properties.getStorage().getLocal().setBasePath(tempDir.toString());
        storage = new LocalStorageAdapter(properties);
        storage.init();
        objectMapper = AutoConfiguration.objectMapper();
        clock = mock(Clock.class);
        when(clock.instant()).thenReturn(NOW);
        service = new PollService(storage, objectMapper, properties, clock);
    }

    private Poll lunchPoll(Integer minutes, boolean multiple) {
        return service.createPoll("Lunch?", List.of("Pizza", " Sushi ", "Salad"), CREATOR, "555", minutes, multiple);
    }

    @Test
    void createPollShouldTrimOptionsAndSetExpiry() {
        Poll poll = lunchPoll(60, true);

        assertTrue(poll.getId().startsWith("poll-"));
        assertEquals(List.of("Pizza", "Sushi", "Salad"), poll.getOptions());
        assertEquals(NOW.plus(Duration.ofHours(1)), poll.getExpiresAt());
        assertTrue(poll.isActive());
    }

    @Test
    void createPollShouldValidateInput() {
        properties.getPolls().setMaxOptions(3);

        assertThrows(InvalidArgumentException.class,
                () -> service.createPoll("Q", List.of("only"), CREATOR, null, null, true));
        assertThrows(InvalidArgumentException.class,
                () -> service.createPoll("Q", List.of("a", "b", "c", "d"), CREATOR, null, null, true));
        assertThrows(InvalidArgumentException.class,
                () -> service.createPoll(" ", List.of("a", "b"), CREATOR, null, null, true));
        assertThrows(InvalidArgumentException.class,
                () -> service.createPoll("Q", List.of("a", "b"), CREATOR, null, 0, true));
    }

    @Test
    void votesShouldBeTalliedAndReplacedPerUser() {
        Poll poll = lunchPoll(null, true);

        service.vote(poll.getId(), "u2", List.of(0, 1, 1));
        service.vote(poll.getId(), "u3", List.of(1));
        service.vote(poll.getId(), "u3", List.of(2));
        PollResults results = service.getResults(poll.getId());

        assertEquals(List.of(1, 1, 1), results.counts());
        assertEquals(2, results.totalVoters());
        assertEquals(3, results.totalVotes());
        assertEquals("Pizza: 1, Sushi: 1, Salad: 1", results.summary());
    }

    @Test
    void singleChoicePollShouldRejectMultipleOptions() {
        Poll poll = lunchPoll(null, false);

        assertThrows(InvalidArgumentException.class, () -> service.vote(poll.getId(), "u2", List.of(0, 1)));
        assertThrows(InvalidArgumentException.class, () -> service.vote(poll.getId(), "u2", List.of(3)));
        assertThrows(InvalidArgumentException.class, () -> service.vote(poll.getId(), "u2", List.of()));
    }

    @Test
    void expiredPollShouldRejectVotesAndClose() {
        Poll poll = lunchPoll(30, true);
        when(clock.instant()).thenReturn(NOW.plus(Duration.ofMinutes(31)));

        assertThrows(InvalidArgumentException.class, () -> service.vote(poll.getId(), "u2", List.of(0)));
        assertFalse(service.getPoll(poll.getId()).isActive());
        assertTrue(service.listActive().isEmpty());
    }

    @Test
    void listActiveShouldCloseExpiredPolls() {
        Poll shortPoll = lunchPoll(10, true);
        Poll openPoll = lunchPoll(null, true);
        when(clock.instant()).thenReturn(NOW.plus(Duration.ofMinutes(11)));

        List<Poll> active = service.listActive();

        assertEquals(List.of(openPoll.getId()), active.stream().map(Poll::getId).toList());
        assertFalse(service.getPoll(shortPoll.getId()).isActive());
    }

    @Test
    void closeAndDeleteShouldRequireCreatorOrElevated() {
        Poll poll = lunchPoll(null, true);

        assertThrows(PermissionDeniedException.class, () -> service.closePoll(poll.getId(), "u2", false));
        assertFalse(service.closePoll(poll.getId(), "u2", true).isActive());
        assertThrows(InvalidArgumentException.class, () -> service.vote(poll.getId(), "u2", List.of(0)));

        service.deletePoll(poll.getId(), CREATOR, false);
        assertThrows(NotFoundException.class, () -> service.getPoll(poll.getId()));
    }

    @Test
    void pollsShouldPersistAcrossInstances() {
        Poll poll = lunchPoll(null, true);
        service.vote(poll.getId(), "u2", List.of(1));

        PollService reloaded = new PollService(storage, objectMapper, properties, clock);

        assertEquals(List.of(0, 1, 0), reloaded.getResults(poll.getId()).counts());
        assertNull(reloaded.getPoll(poll.getId()).getExpiresAt());
    }

    @Test
    void statisticsShouldCountVotesAndRankUsers() {
        Poll lunch = lunchPoll(null, true);
        Poll dinner = service.createPoll("Dinner?", List.of("Soup", "Steak"), "u2", "555", 30, false);
        service.vote(lunch.getId(), "u3", List.of(0, 2));
        service.vote(lunch.getId(), "u4", List.of(1));
        service.vote(dinner.getId(), "u3", List.of(1));
        service.closePoll(lunch.getId(), CREATOR, false);

        PollStatistics stats = service.getStatistics(5);

        assertEquals(2, stats.totalPolls());
        assertEquals(1, stats.activePolls());
        assertEquals(4, stats.totalVotes());
        assertEquals(2.0, stats.averageVotesPerPoll(), 0.0001);
        assertEquals(List.of(new PollStatistics.Ranking("u3", 3), new PollStatistics.Ranking("u4", 1)),
                stats.topVoters());
        assertEquals(List.of(new PollStatistics.Ranking(CREATOR, 1), new PollStatistics.Ranking("u2", 1)),
                stats.topCreators());
        assertEquals(1, service.getStatistics(1).topVoters().size());
    }

    @Test
    void statisticsShouldHandleNoPolls() {
        PollStatistics stats = service.getStatistics(5);

        assertEquals(0, stats.totalPolls());
        assertEquals(0.0, stats.averageVotesPerPoll(), 0.0001);
        assertTrue(stats.topVoters().isEmpty());
        assertThrows(InvalidArgumentException.class, () -> service.getStatistics(0));
    }
}
