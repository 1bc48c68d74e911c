package me.golemcore.planner.adapter.inbound.command;

import me.golemcore.planner.domain.exception.InvalidArgumentException;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.time.LocalTime;
import java.time.ZoneId;
import java.util.Arrays;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class CommandArgumentsTest {

    private static final Instant NOW = Instant.parse("2026-03-02T15:00:00Z");
    private static final ZoneId BERLIN = ZoneId.of("Europe/Berlin");

    @Test
    void tokensShouldSplitOnWhitespace() {
        assertEquals(List.of("30m", "stand", "up"), CommandArguments.tokens(List.of(" 30m  stand\tup ")));
        assertEquals(List.of("a", "b"), CommandArguments.tokens(Arrays.asList("a", null, "b")));
        assertTrue(CommandArguments.tokens(null).isEmpty());
    }

    @Test
    void shouldParseCompoundDurations() {
        assertEquals(Duration.ofMinutes(90), CommandArguments.parseDuration("1h30m"));
        assertEquals(Duration.ofDays(2), CommandArguments.parseDuration("2d"));
        assertEquals(Duration.ofMinutes(45), CommandArguments.parseDuration("45m"));
        assertFalse(CommandArguments.isDuration("m"));
        assertFalse(CommandArguments.isDuration("10s"));
        assertThrows(InvalidArgumentException.class, () -> CommandArguments.parseDuration("0m"));
        assertThrows(InvalidArgumentException.class, () -> CommandArguments.parseDuration("soon"));
    }

    @Test
    void shouldValidateDateAndTime() {
        assertEquals(LocalTime.of(9, 5), CommandArguments.parseTime("9:05"));
        assertThrows(InvalidArgumentException.class, () -> CommandArguments.parseTime("24:00"));
        assertThrows(InvalidArgumentException.class, () -> CommandArguments.parseDate("2026-02-30"));
        assertThrows(InvalidArgumentException.class, () -> CommandArguments.parseDate("02.03.2026"));
    }

    @Test
    void parseWhenShouldAcceptRelativeDuration() {
        CommandArguments.When when = CommandArguments.parseWhen(List.of("30m", "tea"), NOW, BERLIN);

        assertEquals(NOW.plus(Duration.ofMinutes(30)), when.at());
        assertEquals(1, when.consumed());
    }

    @Test
    void parseWhenShouldUseTodayOrTomorrowInCallerZone() {
        // 15:00 UTC is 16:00 in Berlin
        CommandArguments.When later = CommandArguments.parseWhen(List.of("18:30"), NOW, BERLIN);
        CommandArguments.When passed = CommandArguments.parseWhen(List.of("08:00"), NOW, BERLIN);

        assertEquals(Instant.parse("2026-03-02T17:30:00Z"), later.at());
        assertEquals(Instant.parse("2026-03-03T07:00:00Z"), passed.at());
    }

    @Test
    void parseWhenShouldAcceptDateAndTime() {
        CommandArguments.When when = CommandArguments.parseWhen(List.of("2026-05-01", "09:00", "demo"), NOW, BERLIN);

        assertEquals(Instant.parse("2026-05-01T07:00:00Z"), when.at());
        assertEquals(2, when.consumed());
        assertThrows(InvalidArgumentException.class,
                () -> CommandArguments.parseWhen(List.of("2026-05-01"), NOW, BERLIN));
        assertThrows(InvalidArgumentException.class,
                () -> CommandArguments.parseWhen(List.of("tomorrow"), NOW, BERLIN));
    }

    @Test
    void shouldExtractMentions() {
        assertEquals(Optional.of("123"), CommandArguments.mentionedUser("<@123>"));
        assertEquals(Optional.of("456"), CommandArguments.mentionedUser("<@!456>"));
        assertTrue(CommandArguments.mentionedUser("<@&789>").isEmpty());
        assertTrue(CommandArguments.mentionedUser("@bob").isEmpty());
    }

    @Test
    void parsePositiveIntShouldRejectZeroAndText() {
        assertEquals(5, CommandArguments.parsePositiveInt("5", "Limit"));
        assertThrows(InvalidArgumentException.class, () -> CommandArguments.parsePositiveInt("0", "Limit"));
        assertThrows(InvalidArgumentException.class, () -> CommandArguments.parsePositiveInt("five", "Limit"));
    }

    @Test
    void joinShouldHandleOutOfRangeStart() {
        assertEquals("b c", CommandArguments.join(List.of("a", "b", "c"), 1));
        assertEquals("", CommandArguments.join(List.of("a"), 3));
    }

    @Test
    void parseRoleShouldAcceptMentionOrBareId() {
        assertEquals("700", CommandArguments.parseRole("<@&700>"));
        assertEquals("700", CommandArguments.parseRole("700"));
        assertThrows(InvalidArgumentException.class, () -> CommandArguments.parseRole("<@700>"));
        assertThrows(InvalidArgumentException.class, () -> CommandArguments.parseRole("admins"));
    }
}
