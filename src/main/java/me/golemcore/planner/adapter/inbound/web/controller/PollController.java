package me.golemcore.planner.adapter.inbound.web.controller;

import lombok.RequiredArgsConstructor;
import me.golemcore.planner.domain.model.Poll;
import me.golemcore.planner.domain.model.PollResults;
import me.golemcore.planner.domain.model.PollStatistics;
import me.golemcore.planner.domain.service.PollService;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.server.ResponseStatusException;
import reactor.core.publisher.Mono;

import java.time.Instant;
import java.util.List;

/**
 * Poll endpoints. Option indexes are zero-based.
 */
@RestController
@RequestMapping("/api/polls")
@RequiredArgsConstructor
public class PollController {

    private static final String USER_HEADER = ReminderController.USER_HEADER;

    private final PollService pollService;

    @GetMapping
    public Mono<ResponseEntity<List<PollDto>>> listActive() {
        List<PollDto> polls = pollService.listActive().stream()
                .map(PollController::toDto)
                .toList();
        return Mono.just(ResponseEntity.ok(polls));
    }

    @GetMapping("/stats")
    public Mono<ResponseEntity<PollStatistics>> getStatistics(@RequestParam(defaultValue = "5") int top) {
        return Mono.just(ResponseEntity.ok(pollService.getStatistics(top)));
    }

    @PostMapping
    public Mono<ResponseEntity<PollDto>> createPoll(@RequestHeader(USER_HEADER) String userId,
            @RequestBody CreatePollRequest request) {
        String creator = ReminderController.requireUser(userId);
        if (request == null) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "Request body is required");
        }
        Poll poll = pollService.createPoll(request.question(), request.options(), creator, request.channelId(),
                request.durationMinutes(), request.allowMultiple() == null || request.allowMultiple());
        return Mono.just(ResponseEntity.status(HttpStatus.CREATED).body(toDto(poll)));
    }

    @PostMapping("/{pollId}/votes")
    public Mono<ResponseEntity<PollDto>> vote(@RequestHeader(USER_HEADER) String userId,
            @PathVariable String pollId, @RequestBody VoteRequest request) {
        String voter = ReminderController.requireUser(userId);
        if (request == null) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "Request body is required");
        }
        Poll poll = pollService.vote(pollId, voter, request.options());
        return Mono.just(ResponseEntity.ok(toDto(poll)));
    }

    @GetMapping("/{pollId}/results")
    public Mono<ResponseEntity<ResultsDto>> getResults(@PathVariable String pollId) {
        PollResults results = pollService.getResults(pollId);
        return Mono.just(ResponseEntity.ok(new ResultsDto(toDto(results.poll()), results.counts(),
                results.totalVoters(), results.totalVotes())));
    }

    @PostMapping("/{pollId}/close")
    public Mono<ResponseEntity<PollDto>> closePoll(@RequestHeader(USER_HEADER) String userId,
            @PathVariable String pollId) {
        Poll poll = pollService.closePoll(pollId, ReminderController.requireUser(userId), false);
        return Mono.just(ResponseEntity.ok(toDto(poll)));
    }

    @DeleteMapping("/{pollId}")
    public Mono<ResponseEntity<Void>> deletePoll(@RequestHeader(USER_HEADER) String userId,
            @PathVariable String pollId) {
        pollService.deletePoll(pollId, ReminderController.requireUser(userId), false);
        return Mono.just(ResponseEntity.noContent().build());
    }

    private static PollDto toDto(Poll poll) {
        return new PollDto(poll.getId(), poll.getQuestion(), poll.getOptions(), poll.getCreatorId(),
                poll.getChannelId(), poll.isActive(), poll.isAllowMultipleVotes(), poll.getCreatedAt(),
                poll.getExpiresAt());
    }

    public record CreatePollRequest(
            String question,
            List<String> options,
            String channelId,
            Integer durationMinutes,
            Boolean allowMultiple) {
    }

    public record VoteRequest(List<Integer> options) {
    }

    public record PollDto(
            String id,
            String question,
            List<String> options,
            String creatorId,
            String channelId,
            boolean active,
            boolean allowMultipleVotes,
            Instant createdAt,
            Instant expiresAt) {
    }

    public record ResultsDto(PollDto poll, List<Integer> counts, int totalVoters, int totalVotes) {
    }
}
