package me.golemcore.planner.domain.service;

/*
 * Copyright 2026 Aleksei Kuleshov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * Contact: alex@kuleshov.tech
 */

import me.golemcore.planner.domain.exception.InvalidArgumentException;
import me.golemcore.planner.domain.exception.NotFoundException;
import me.golemcore.planner.domain.exception.PermissionDeniedException;
import me.golemcore.planner.domain.exception.StorageException;
import me.golemcore.planner.domain.model.Poll;
import me.golemcore.planner.domain.model.PollResults;
import me.golemcore.planner.domain.model.PollStatistics;
import me.golemcore.planner.infrastructure.config.BotProperties;
import me.golemcore.planner.port.outbound.StoragePort;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.function.UnaryOperator;

/**
 * Polls with per-user votes, stored as one document in
 * {@code polls/polls.json}.
 *
 * <p>
 * Option indexes are zero-based. A new vote replaces the user's previous one.
 * Expired polls are closed lazily when they are voted on or listed.
 */
@Service
@Slf4j
public class PollService {

    private static final String POLLS_DIR = "polls";
    private static final String POLLS_FILE = "polls.json";
    private static final int MIN_OPTIONS = 2;
    private static final TypeReference<List<Poll>> POLL_LIST_TYPE_REF = new TypeReference<>() {
    };

    private final StoragePort storagePort;
    private final ObjectMapper objectMapper;
    private final BotProperties properties;
    private final Clock clock;

    private Map<String, Poll> polls;

    public PollService(StoragePort storagePort, ObjectMapper objectMapper, BotProperties properties, Clock clock) {
        this.storagePort = storagePort;
        this.objectMapper = objectMapper;
        this.properties = properties;
        this.clock = clock;
    }

    public synchronized Poll createPoll(String question, List<String> options, String creatorId,
            String channelId, Integer durationMinutes, boolean allowMultiple) {
        if (question == null || question.isBlank()) {
            throw new InvalidArgumentException("Poll question is required");
        }
        List<String> cleaned = options == null ? List.of()
                : options.stream().map(String::trim).filter(option -> !option.isEmpty()).toList();
        int maxOptions = properties.getPolls().getMaxOptions();
        if (cleaned.size() < MIN_OPTIONS || cleaned.size() > maxOptions) {
            throw new InvalidArgumentException(
                    "Polls need between " + MIN_OPTIONS + " and " + maxOptions + " options");
        }
        if (durationMinutes != null && durationMinutes <= 0) {
            throw new InvalidArgumentException("Poll duration must be positive");
        }

        Instant now = clock.instant();
        Poll poll = Poll.builder()
                .id("poll-" + UUID.randomUUID().toString().substring(0, 8))
                .question(question.trim())
                .options(new ArrayList<>(cleaned))
                .creatorId(creatorId)
                .channelId(channelId)
                .allowMultipleVotes(allowMultiple)
                .createdAt(now)
                .expiresAt(durationMinutes != null ? now.plus(Duration.ofMinutes(durationMinutes)) : null)
                .build();
        mutate(poll.getId(), existing -> poll);
        log.info("[Polls] Created poll {} with {} options", poll.getId(), cleaned.size());
        return copy(poll);
    }

    public synchronized Poll vote(String pollId, String userId, List<Integer> optionIndexes) {
        Poll poll = require(pollId);
        if (!poll.isActive()) {
            throw new InvalidArgumentException("Poll is closed");
        }
        if (poll.isExpired(clock.instant())) {
            mutate(pollId, PollService::closed);
            throw new InvalidArgumentException("Poll has expired");
        }
        if (optionIndexes == null || optionIndexes.isEmpty()) {
            throw new InvalidArgumentException("At least one option is required");
        }
        List<Integer> distinct = new ArrayList<>(new LinkedHashSet<>(optionIndexes));
        List<Integer> invalid = distinct.stream()
                .filter(index -> index == null || index < 0 || index >= poll.getOptions().size())
                .toList();
        if (!invalid.isEmpty()) {
            throw new InvalidArgumentException("Invalid option indexes: " + invalid);
        }
        if (!poll.isAllowMultipleVotes() && distinct.size() > 1) {
            throw new InvalidArgumentException("This poll only allows voting for one option");
        }

        Poll updated = mutate(pollId, existing -> {
            Poll next = copy(existing);
            next.getVotes().put(userId, distinct);
            return next;
        });
        log.debug("[Polls] {} voted {} in {}", userId, distinct, pollId);
        return copy(updated);
    }

    public synchronized Poll getPoll(String pollId) {
        return copy(require(pollId));
    }

    public synchronized PollResults getResults(String pollId) {
        Poll poll = require(pollId);
        List<Integer> counts = new ArrayList<>();
        for (int i = 0; i < poll.getOptions().size(); i++) {
            counts.add(0);
        }
        int totalVotes = 0;
        for (List<Integer> choice : poll.getVotes().values()) {
            for (Integer index : choice) {
                if (index >= 0 && index < counts.size()) {
                    counts.set(index, counts.get(index) + 1);
                    totalVotes++;
                }
            }
        }
        return new PollResults(copy(poll), counts, poll.getVotes().size(), totalVotes);
    }

    /**
     * Active polls, oldest first. Polls found expired are closed on the way.
     */
    public synchronized List<Poll> listActive() {
        Instant now = clock.instant();
        List<Poll> expired = loaded().values().stream()
                .filter(Poll::isActive)
                .filter(poll -> poll.isExpired(now))
                .toList();
        for (Poll poll : expired) {
            mutate(poll.getId(), PollService::closed);
            log.info("[Polls] Closed expired poll {}", poll.getId());
        }
        return loaded().values().stream()
                .filter(Poll::isActive)
                .sorted(Comparator.comparing(Poll::getCreatedAt, Comparator.nullsLast(Comparator.naturalOrder())))
                .map(PollService::copy)
                .toList();
    }

    /**
     * Totals over every stored poll, open or closed, with the top
     * {@code limit} voters and creators.
     */
    public synchronized PollStatistics getStatistics(int limit) {
        if (limit <= 0) {
            throw new InvalidArgumentException("Limit must be positive");
        }
        Instant now = clock.instant();
        Map<String, Integer> votesByUser = new HashMap<>();
        Map<String, Integer> pollsByCreator = new HashMap<>();
        int totalVotes = 0;
        int activePolls = 0;
        for (Poll poll : loaded().values()) {
            if (poll.isActive() && !poll.isExpired(now)) {
                activePolls++;
            }
            if (poll.getCreatorId() != null) {
                pollsByCreator.merge(poll.getCreatorId(), 1, Integer::sum);
            }
            for (Map.Entry<String, List<Integer>> ballot : poll.getVotes().entrySet()) {
                totalVotes += ballot.getValue().size();
                votesByUser.merge(ballot.getKey(), ballot.getValue().size(), Integer::sum);
            }
        }
        int totalPolls = loaded().size();
        double average = totalPolls == 0 ? 0.0 : (double) totalVotes / totalPolls;
        return new PollStatistics(totalPolls, activePolls, totalVotes, average, top(votesByUser, limit),
                top(pollsByCreator, limit));
    }

    private static List<PollStatistics.Ranking> top(Map<String, Integer> counts, int limit) {
        return counts.entrySet().stream()
                .sorted(Map.Entry.<String, Integer>comparingByValue().reversed()
                        .thenComparing(Map.Entry.<String, Integer>comparingByKey()))
                .limit(limit)
                .map(entry -> new PollStatistics.Ranking(entry.getKey(), entry.getValue()))
                .toList();
    }

    public synchronized Poll closePoll(String pollId, String requesterId, boolean elevated) {
        Poll poll = require(pollId);
        checkOwnership(poll, requesterId, elevated);
        Poll updated = mutate(pollId, PollService::closed);
        log.info("[Polls] Closed poll {}", pollId);
        return copy(updated);
    }

    public synchronized void deletePoll(String pollId, String requesterId, boolean elevated) {
        Poll poll = require(pollId);
        checkOwnership(poll, requesterId, elevated);
        mutate(pollId, existing -> null);
        log.info("[Polls] Deleted poll {}", pollId);
    }

    private static void checkOwnership(Poll poll, String requesterId, boolean elevated) {
        if (!elevated && !poll.getCreatorId().equals(requesterId)) {
            throw new PermissionDeniedException("Only the poll creator or an administrator can do this");
        }
    }

    private Poll require(String pollId) {
        Poll poll = pollId != null ? loaded().get(pollId) : null;
        if (poll == null) {
            throw new NotFoundException("Poll not found: " + pollId);
        }
        return poll;
    }

    /**
     * Replace one poll (or remove it when the change returns null) and persist.
     * The in-memory state is restored if the write fails.
     */
    private Poll mutate(String pollId, UnaryOperator<Poll> change) {
        Map<String, Poll> current = loaded();
        Poll previous = current.get(pollId);
        Poll next = change.apply(previous);
        if (next == null) {
            current.remove(pollId);
        } else {
            current.put(pollId, next);
        }
        try {
            persist(current);
        } catch (StorageException e) {
            if (previous == null) {
                current.remove(pollId);
            } else {
                current.put(pollId, previous);
            }
            throw e;
        }
        return next;
    }

    private Map<String, Poll> loaded() {
        if (polls == null) {
            polls = load();
        }
        return polls;
    }

    private Map<String, Poll> load() {
        String json = StorageSupport.join(storagePort.readDocument(POLLS_DIR, POLLS_FILE), "read polls");
        Map<String, Poll> result = new LinkedHashMap<>();
        if (json == null || json.isBlank()) {
            return result;
        }
        try {
            for (Poll poll : objectMapper.readValue(json, POLL_LIST_TYPE_REF)) {
                result.put(poll.getId(), poll);
            }
        } catch (JsonProcessingException e) {
            throw new StorageException("Polls file is unreadable", e);
        }
        return result;
    }

    private void persist(Map<String, Poll> current) {
        String json;
        try {
            json = objectMapper.writeValueAsString(new ArrayList<>(current.values()));
        } catch (JsonProcessingException e) {
            throw new StorageException("Failed to serialize polls", e);
        }
        StorageSupport.join(storagePort.writeDocument(POLLS_DIR, POLLS_FILE, json, true), "write polls");
    }

    private static Poll closed(Poll poll) {
        Poll next = copy(poll);
        next.setActive(false);
        return next;
    }

    private static Poll copy(Poll poll) {
        Map<String, List<Integer>> votes = new HashMap<>();
        poll.getVotes().forEach((user, choice) -> votes.put(user, new ArrayList<>(choice)));
        return poll.toBuilder()
                .options(new ArrayList<>(poll.getOptions()))
                .votes(votes)
                .build();
    }
}
