package me.golemcore.planner.adapter.inbound.command;

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

import me.golemcore.planner.domain.exception.CalendarAuthException;
import me.golemcore.planner.domain.exception.InvalidArgumentException;
import me.golemcore.planner.domain.exception.NotFoundException;
import me.golemcore.planner.domain.exception.PermissionDeniedException;
import me.golemcore.planner.domain.exception.PlannerException;
import me.golemcore.planner.domain.exception.StorageException;
import me.golemcore.planner.domain.exception.TransientExternalException;
import me.golemcore.planner.domain.model.CalendarEvent;
import me.golemcore.planner.domain.model.EventBooking;
import me.golemcore.planner.domain.model.ExecutionLogEntry;
import me.golemcore.planner.domain.model.FreeSlot;
import me.golemcore.planner.domain.model.Interval;
import me.golemcore.planner.domain.model.JobStatus;
import me.golemcore.planner.domain.model.Poll;
import me.golemcore.planner.domain.model.PollResults;
import me.golemcore.planner.domain.model.PollStatistics;
import me.golemcore.planner.domain.model.Recurrence;
import me.golemcore.planner.domain.model.ReminderJob;
import me.golemcore.planner.domain.model.ReminderPayload;
import me.golemcore.planner.domain.model.ReminderTemplate;
import me.golemcore.planner.domain.model.ReminderTrigger;
import me.golemcore.planner.domain.model.UserPreferences;
import me.golemcore.planner.domain.service.CalendarAvailabilityService;
import me.golemcore.planner.domain.service.CalendarEventService;
import me.golemcore.planner.domain.service.CommandPermissionService;
import me.golemcore.planner.domain.service.PollService;
import me.golemcore.planner.domain.service.ReminderScheduler;
import me.golemcore.planner.domain.service.ReminderService;
import me.golemcore.planner.domain.service.ReminderTemplateService;
import me.golemcore.planner.domain.service.UserPreferencesService;
import me.golemcore.planner.infrastructure.config.BotProperties;
import me.golemcore.planner.port.inbound.CommandPort;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.CompletableFuture;
import java.util.stream.Collectors;

/**
 * Routes slash commands to the reminder, poll, calendar and preference
 * services.
 *
 * <p>
 * Replies are localized in the caller's language. Domain exceptions are
 * turned into failure results; they never escape to the chat adapter.
 *
 * @see CommandPort
 */
@Component
@Slf4j
public class CommandRouter implements CommandPort {

    private static final String CMD_HELP = "help";
    private static final String FORCE_FLAG = "--force";
    private static final String SINGLE_FLAG = "--single";
    private static final String NEWLINE = "\n";
    private static final int DEFAULT_LOG_LIMIT = 10;
    private static final int DEFAULT_EVENT_DAYS = 7;
    private static final int CRON_FIELDS = 5;
    private static final int STATS_TOP = 5;
    private static final DateTimeFormatter DATE_TIME_FORMAT = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm");
    private static final DateTimeFormatter TIME_FORMAT = DateTimeFormatter.ofPattern("HH:mm");

    private static final List<CommandDefinition> COMMANDS = List.of(
            new CommandDefinition(CMD_HELP, "Show available commands", "/help"),
            new CommandDefinition("remind", "Set a one-time reminder", "/remind <30m|18:30|YYYY-MM-DD HH:MM> <text>"),
            new CommandDefinition("remind_every", "Set a repeating reminder", "/remind_every <interval> <text>"),
            new CommandDefinition("remind_cron", "Set a cron reminder (UTC)", "/remind_cron <m h dom mon dow> <text>"),
            new CommandDefinition("poll_reminder", "Remind before a poll closes",
                    "/poll_reminder <poll_id> <minutes_before> [template]"),
            new CommandDefinition("reminders", "List your pending reminders", "/reminders"),
            new CommandDefinition("cancel_reminder", "Cancel a reminder", "/cancel_reminder <id>"),
            new CommandDefinition("reminder_logs", "Show recent deliveries", "/reminder_logs [limit]"),
            new CommandDefinition("templates", "List reminder templates", "/templates"),
            new CommandDefinition("free_slots", "Find common free time", "/free_slots <YYYY-MM-DD> [min] [@users]"),
            new CommandDefinition("add_event", "Create an event",
                    "/add_event <YYYY-MM-DD> <HH:MM> <duration> <title> [@attendees] [--force]"),
            new CommandDefinition("events", "List your upcoming events", "/events [days]"),
            new CommandDefinition("poll", "Create a poll", "/poll [duration] [--single] <question> | <a> | <b>"),
            new CommandDefinition("vote", "Vote in a poll", "/vote <poll_id> <option numbers>"),
            new CommandDefinition("poll_results", "Show poll results", "/poll_results <poll_id>"),
            new CommandDefinition("polls", "List active polls", "/polls"),
            new CommandDefinition("close_poll", "Close a poll", "/close_poll <poll_id>"),
            new CommandDefinition("pref", "Show or change preferences", "/pref [key] [value] | reset | unset <key>"),
            new CommandDefinition("language", "Set your language", "/language <en|ru>"),
            new CommandDefinition("timezone", "Set your timezone", "/timezone <Region/City>"),
            new CommandDefinition("link_calendar", "Link your calendar", "/link_calendar <calendar id>"),
            new CommandDefinition("stats", "Show poll statistics", "/stats"),
            new CommandDefinition("list_role_permissions", "Show which roles may run restricted commands",
                    "/list_role_permissions [@role]"),
            new CommandDefinition("add_role_permission", "Restrict a command to a role (admin)",
                    "/add_role_permission <@role> <command>"),
            new CommandDefinition("remove_role_permission", "Remove a command from a role (admin)",
                    "/remove_role_permission <@role> <command>"));

    private static final Set<String> KNOWN_COMMANDS = COMMANDS.stream()
            .map(CommandDefinition::name)
            .collect(Collectors.toUnmodifiableSet());

    private final ReminderService reminderService;
    private final ReminderScheduler reminderScheduler;
    private final ReminderTemplateService templateService;
    private final PollService pollService;
    private final CalendarAvailabilityService availabilityService;
    private final CalendarEventService eventService;
    private final UserPreferencesService preferencesService;
    private final CommandPermissionService permissionService;
    private final BotProperties properties;
    private final Clock clock;

    public CommandRouter(ReminderService reminderService, ReminderScheduler reminderScheduler,
            ReminderTemplateService templateService, PollService pollService,
            CalendarAvailabilityService availabilityService, CalendarEventService eventService,
            UserPreferencesService preferencesService, CommandPermissionService permissionService,
            BotProperties properties, Clock clock) {
        this.reminderService = reminderService;
        this.reminderScheduler = reminderScheduler;
        this.templateService = templateService;
        this.pollService = pollService;
        this.availabilityService = availabilityService;
        this.eventService = eventService;
        this.preferencesService = preferencesService;
        this.permissionService = permissionService;
        this.properties = properties;
        this.clock = clock;
        log.info("CommandRouter initialized with commands: {}", KNOWN_COMMANDS);
    }

    @Override
    public CompletableFuture<CommandResult> execute(String command, List<String> args, CommandContext caller) {
        return CompletableFuture.supplyAsync(() -> {
            if (caller == null || caller.userId() == null) {
                return CommandResult.failure("Unknown caller");
            }
            log.debug("Executing command: /{} (user={})", command, caller.userId());
            if (!hasCommand(command)) {
                return CommandResult.failure(msg(caller, "command.unknown", command));
            }
            List<String> tokens = CommandArguments.tokens(args);
            try {
                if (!permissionService.isAllowed(command, caller.roleIds(), caller.admin())) {
                    log.debug("Command /{} is restricted for {}", command, caller.userId());
                    return CommandResult.failure(msg(caller, "command.error.restricted", command));
                }
                return dispatch(command, tokens, caller);
            } catch (PlannerException e) {
                return failure(caller, e);
            }
        });
    }

    private CommandResult dispatch(String command, List<String> tokens, CommandContext caller) {
        return switch (command) {
        case CMD_HELP -> handleHelp(caller);
        case "remind" -> handleRemind(tokens, caller);
        case "remind_every" -> handleRemindEvery(tokens, caller);
        case "remind_cron" -> handleRemindCron(tokens, caller);
        case "poll_reminder" -> handlePollReminder(tokens, caller);
        case "reminders" -> handleReminders(caller);
        case "cancel_reminder" -> handleCancelReminder(tokens, caller);
        case "reminder_logs" -> handleReminderLogs(tokens, caller);
        case "templates" -> handleTemplates(caller);
        case "free_slots" -> handleFreeSlots(tokens, caller);
        case "add_event" -> handleAddEvent(tokens, caller);
        case "events" -> handleEvents(tokens, caller);
        case "poll" -> handlePoll(tokens, caller);
        case "vote" -> handleVote(tokens, caller);
        case "poll_results" -> handlePollResults(tokens, caller);
        case "polls" -> handlePolls(caller);
        case "close_poll" -> handleClosePoll(tokens, caller);
        case "pref" -> handlePref(tokens, caller);
        case "language" -> handleLanguage(tokens, caller);
        case "timezone" -> handleTimezone(tokens, caller);
        case "link_calendar" -> handleLinkCalendar(tokens, caller);
        case "stats" -> handleStats(caller);
        case "list_role_permissions" -> handleListRolePermissions(tokens, caller);
        case "add_role_permission" -> handleAddRolePermission(tokens, caller);
        case "remove_role_permission" -> handleRemoveRolePermission(tokens, caller);
        default -> CommandResult.failure(msg(caller, "command.unknown", command));
        };
    }

    @Override
    public boolean hasCommand(String command) {
        return KNOWN_COMMANDS.contains(command);
    }

    @Override
    public List<CommandDefinition> listCommands() {
        return COMMANDS;
    }

    // ==================== REMINDERS ====================

    private CommandResult handleHelp(CommandContext caller) {
        StringBuilder sb = new StringBuilder(msg(caller, "command.help.title")).append(NEWLINE);
        for (CommandDefinition definition : COMMANDS) {
            sb.append("`").append(definition.usage()).append("` - ").append(definition.description())
                    .append(NEWLINE);
        }
        return CommandResult.success(sb.toString());
    }

    private CommandResult handleRemind(List<String> tokens, CommandContext caller) {
        if (tokens.size() < 2) {
            return CommandResult.failure(msg(caller, "command.remind.usage"));
        }
        ZoneId zone = preferencesService.getZone(caller.userId());
        CommandArguments.When when = CommandArguments.parseWhen(tokens, clock.instant(), zone);
        String text = CommandArguments.join(tokens, when.consumed());
        if (text.isBlank()) {
            return CommandResult.failure(msg(caller, "command.remind.usage"));
        }
        String jobId = reminderService.createReminder(caller.userId(), ReminderTrigger.at(when.at()),
                messagePayload(caller, text));
        return CommandResult.success(msg(caller, "command.remind.created", jobId, format(when.at(), zone)), jobId);
    }

    private CommandResult handleRemindEvery(List<String> tokens, CommandContext caller) {
        if (tokens.size() < 2) {
            return CommandResult.failure(msg(caller, "command.remind-every.usage"));
        }
        Duration interval = CommandArguments.parseDuration(tokens.get(0));
        String jobId = reminderService.createReminder(caller.userId(), ReminderTrigger.every(interval),
                messagePayload(caller, CommandArguments.join(tokens, 1)));
        ReminderJob job = reminderScheduler.findJob(jobId, caller.userId(), caller.admin());
        ZoneId zone = preferencesService.getZone(caller.userId());
        return CommandResult.success(msg(caller, "command.remind-every.created", jobId, formatDuration(interval),
                format(job.getFireTime(), zone)), jobId);
    }

    private CommandResult handleRemindCron(List<String> tokens, CommandContext caller) {
        if (tokens.size() <= CRON_FIELDS) {
            return CommandResult.failure(msg(caller, "command.remind-cron.usage"));
        }
        String cron = String.join(" ", tokens.subList(0, CRON_FIELDS));
        String jobId = reminderService.createReminder(caller.userId(), ReminderTrigger.cron(cron),
                messagePayload(caller, CommandArguments.join(tokens, CRON_FIELDS)));
        ReminderJob job = reminderScheduler.findJob(jobId, caller.userId(), caller.admin());
        ZoneId zone = preferencesService.getZone(caller.userId());
        return CommandResult.success(msg(caller, "command.remind-cron.created", jobId, cron,
                format(job.getFireTime(), zone)), jobId);
    }

    private CommandResult handlePollReminder(List<String> tokens, CommandContext caller) {
        if (tokens.size() < 2) {
            return CommandResult.failure(msg(caller, "command.poll-reminder.usage"));
        }
        String pollId = tokens.get(0);
        int minutesBefore = CommandArguments.parsePositiveInt(tokens.get(1), "Minutes before");
        String template = tokens.size() > 2 ? tokens.get(2) : null;
        String jobId = reminderService.createPollReminder(caller.userId(), pollId, minutesBefore, template,
                caller.channelId());
        ReminderJob job = reminderScheduler.findJob(jobId, caller.userId(), caller.admin());
        ZoneId zone = preferencesService.getZone(caller.userId());
        return CommandResult.success(msg(caller, "command.poll-reminder.created", jobId, pollId,
                format(job.getFireTime(), zone)), jobId);
    }

    private CommandResult handleReminders(CommandContext caller) {
        List<ReminderJob> pending = reminderScheduler.getUserReminders(caller.userId()).stream()
                .filter(job -> job.getStatus() == JobStatus.PENDING)
                .toList();
        if (pending.isEmpty()) {
            return CommandResult.success(msg(caller, "command.reminders.empty"));
        }
        ZoneId zone = preferencesService.getZone(caller.userId());
        StringBuilder sb = new StringBuilder(msg(caller, "command.reminders.title", String.valueOf(pending.size())))
                .append(NEWLINE);
        for (ReminderJob job : pending) {
            sb.append("`").append(job.getId()).append("` ").append(format(job.getFireTime(), zone))
                    .append(" - ").append(describe(job.getPayload()));
            Recurrence recurrence = job.getRecurrence();
            if (recurrence.getType() == Recurrence.RecurrenceType.FIXED_INTERVAL) {
                sb.append(" (every ").append(formatDuration(recurrence.getInterval())).append(")");
            } else if (recurrence.getType() == Recurrence.RecurrenceType.CRON) {
                sb.append(" (cron `").append(recurrence.getCronExpression()).append("`)");
            }
            sb.append(NEWLINE);
        }
        return CommandResult.success(sb.toString(), pending);
    }

    private CommandResult handleCancelReminder(List<String> tokens, CommandContext caller) {
        if (tokens.isEmpty()) {
            return CommandResult.failure(msg(caller, "command.cancel.usage"));
        }
        String jobId = tokens.get(0);
        if (reminderScheduler.cancel(jobId, caller.userId(), caller.admin())) {
            return CommandResult.success(msg(caller, "command.cancel.done", jobId));
        }
        ReminderJob job = reminderScheduler.findJob(jobId, caller.userId(), caller.admin());
        return CommandResult.failure(msg(caller, "command.cancel.too-late", jobId,
                job.getStatus().name().toLowerCase(Locale.ROOT)));
    }

    private CommandResult handleReminderLogs(List<String> tokens, CommandContext caller) {
        int limit = tokens.isEmpty() ? DEFAULT_LOG_LIMIT : CommandArguments.parsePositiveInt(tokens.get(0), "Limit");
        List<ExecutionLogEntry> entries = reminderScheduler.getLogs(caller.userId(), limit);
        if (entries.isEmpty()) {
            return CommandResult.success(msg(caller, "command.logs.empty"));
        }
        ZoneId zone = preferencesService.getZone(caller.userId());
        StringBuilder sb = new StringBuilder(msg(caller, "command.logs.title")).append(NEWLINE);
        for (ExecutionLogEntry entry : entries) {
            sb.append(format(entry.getAttemptedAt(), zone)).append(" `").append(entry.getJobId()).append("` ")
                    .append(entry.getOutcome());
            if (entry.getOutcome() == ExecutionLogEntry.Outcome.ERROR) {
                sb.append(" (").append(entry.getErrorMessage()).append(", ").append(entry.getAttempts())
                        .append(" attempts)");
            }
            sb.append(NEWLINE);
        }
        return CommandResult.success(sb.toString(), entries);
    }

    private CommandResult handleTemplates(CommandContext caller) {
        List<ReminderTemplate> templates = templateService.listTemplates(caller.userId());
        StringBuilder sb = new StringBuilder(msg(caller, "command.templates.title")).append(NEWLINE);
        for (ReminderTemplate template : templates) {
            sb.append("`").append(template.getName()).append("` [")
                    .append(template.getPriority().name().toLowerCase(Locale.ROOT)).append("] ")
                    .append(template.getDescription() != null ? template.getDescription() : "").append(NEWLINE);
        }
        return CommandResult.success(sb.toString(), templates);
    }

    // ==================== CALENDAR ====================

    private CommandResult handleFreeSlots(List<String> tokens, CommandContext caller) {
        if (tokens.isEmpty()) {
            return CommandResult.failure(msg(caller, "command.free-slots.usage"));
        }
        ZoneId zone = preferencesService.getZone(caller.userId());
        LocalDate date = CommandArguments.parseDate(tokens.get(0));
        Duration minDuration = properties.getAvailability().getDefaultMinDuration();
        Set<String> users = new LinkedHashSet<>();
        users.add(caller.userId());
        for (String token : tokens.subList(1, tokens.size())) {
            Optional<String> mentioned = CommandArguments.mentionedUser(token);
            if (mentioned.isPresent()) {
                users.add(mentioned.get());
            } else {
                minDuration = CommandArguments.parseDuration(token);
            }
        }

        Interval window = workingDay(date, zone);
        List<FreeSlot> slots = availabilityService.findFreeSlots(users, window, minDuration);
        if (slots.isEmpty()) {
            return CommandResult.success(msg(caller, "command.free-slots.none", formatDuration(minDuration),
                    date.toString()), slots);
        }
        StringBuilder sb = new StringBuilder(msg(caller, "command.free-slots.title", date.toString(), zone.getId()))
                .append(NEWLINE);
        for (FreeSlot slot : slots) {
            sb.append(TIME_FORMAT.format(slot.start().atZone(zone))).append(" - ")
                    .append(TIME_FORMAT.format(slot.end().atZone(zone))).append(" (")
                    .append(formatDuration(slot.duration())).append(")").append(NEWLINE);
        }
        return CommandResult.success(sb.toString(), slots);
    }

    private CommandResult handleAddEvent(List<String> tokens, CommandContext caller) {
        if (tokens.size() < 4) {
            return CommandResult.failure(msg(caller, "command.add-event.usage"));
        }
        ZoneId zone = preferencesService.getZone(caller.userId());
        ZonedDateTime start = ZonedDateTime.of(CommandArguments.parseDate(tokens.get(0)),
                CommandArguments.parseTime(tokens.get(1)), zone);
        Duration duration = CommandArguments.parseDuration(tokens.get(2));

        boolean force = false;
        List<String> attendees = new ArrayList<>();
        List<String> titleWords = new ArrayList<>();
        for (String token : tokens.subList(3, tokens.size())) {
            Optional<String> mentioned = CommandArguments.mentionedUser(token);
            if (FORCE_FLAG.equals(token)) {
                force = true;
            } else if (mentioned.isPresent()) {
                attendees.add(mentioned.get());
            } else {
                titleWords.add(token);
            }
        }
        if (titleWords.isEmpty()) {
            return CommandResult.failure(msg(caller, "command.add-event.usage"));
        }

        Interval interval = Interval.of(start.toInstant(), duration);
        EventBooking booking = eventService.createEvent(caller.userId(), String.join(" ", titleWords), interval,
                attendees, null, null, force);
        if (!booking.isCreated()) {
            StringBuilder sb = new StringBuilder(msg(caller, "command.add-event.conflicts",
                    String.valueOf(booking.conflicts().size()))).append(NEWLINE);
            for (Interval conflict : booking.conflicts()) {
                sb.append(format(conflict.start(), zone)).append(" - ")
                        .append(TIME_FORMAT.format(conflict.end().atZone(zone))).append(NEWLINE);
            }
            sb.append(msg(caller, "command.add-event.force-hint"));
            return CommandResult.failure(sb.toString());
        }
        CalendarEvent event = booking.event();
        if (booking.conflicts().isEmpty()) {
            return CommandResult.success(msg(caller, "command.add-event.created", event.getId(), event.getTitle(),
                    format(event.getStartTime(), zone)), event);
        }
        return CommandResult.success(msg(caller, "command.add-event.created-with-conflicts", event.getId(),
                event.getTitle(), format(event.getStartTime(), zone), String.valueOf(booking.conflicts().size())),
                event);
    }

    private CommandResult handleEvents(List<String> tokens, CommandContext caller) {
        int days = tokens.isEmpty() ? DEFAULT_EVENT_DAYS : CommandArguments.parsePositiveInt(tokens.get(0), "Days");
        Instant now = clock.instant();
        List<CalendarEvent> events = eventService.listEvents(caller.userId(),
                Interval.of(now, Duration.ofDays(days)));
        if (events.isEmpty()) {
            return CommandResult.success(msg(caller, "command.events.empty", String.valueOf(days)));
        }
        ZoneId zone = preferencesService.getZone(caller.userId());
        StringBuilder sb = new StringBuilder(msg(caller, "command.events.title", String.valueOf(days)))
                .append(NEWLINE);
        for (CalendarEvent event : events) {
            sb.append("`").append(event.getId()).append("` ").append(format(event.getStartTime(), zone))
                    .append(" - ").append(TIME_FORMAT.format(event.getEndTime().atZone(zone))).append(" ")
                    .append(event.getTitle()).append(NEWLINE);
        }
        return CommandResult.success(sb.toString(), events);
    }

    // ==================== POLLS ====================

    private CommandResult handlePoll(List<String> tokens, CommandContext caller) {
        Integer durationMinutes = null;
        boolean allowMultiple = true;
        int index = 0;
        while (index < tokens.size()) {
            String token = tokens.get(index);
            if (SINGLE_FLAG.equals(token)) {
                allowMultiple = false;
            } else if (durationMinutes == null && CommandArguments.isDuration(token)) {
                durationMinutes = Math.toIntExact(CommandArguments.parseDuration(token).toMinutes());
            } else {
                break;
            }
            index++;
        }
        List<String> parts = Arrays.stream(CommandArguments.join(tokens, index).split("\\|"))
                .map(String::trim)
                .filter(part -> !part.isEmpty())
                .toList();
        if (parts.size() < 3) {
            return CommandResult.failure(msg(caller, "command.poll.usage"));
        }
        Poll poll = pollService.createPoll(parts.get(0), parts.subList(1, parts.size()), caller.userId(),
                caller.channelId(), durationMinutes, allowMultiple);
        StringBuilder sb = new StringBuilder(msg(caller, "command.poll.created", poll.getId(), poll.getQuestion()))
                .append(NEWLINE);
        for (int i = 0; i < poll.getOptions().size(); i++) {
            sb.append(i + 1).append(". ").append(poll.getOptions().get(i)).append(NEWLINE);
        }
        return CommandResult.success(sb.toString(), poll);
    }

    private CommandResult handleVote(List<String> tokens, CommandContext caller) {
        if (tokens.size() < 2) {
            return CommandResult.failure(msg(caller, "command.vote.usage"));
        }
        List<Integer> indexes = new ArrayList<>();
        for (String token : tokens.subList(1, tokens.size())) {
            for (String part : token.split(",")) {
                if (!part.isBlank()) {
                    indexes.add(CommandArguments.parsePositiveInt(part.trim(), "Option number") - 1);
                }
            }
        }
        pollService.vote(tokens.get(0), caller.userId(), indexes);
        return CommandResult.success(msg(caller, "command.vote.done", String.valueOf(indexes.size())));
    }

    private CommandResult handlePollResults(List<String> tokens, CommandContext caller) {
        if (tokens.isEmpty()) {
            return CommandResult.failure(msg(caller, "command.poll-results.usage"));
        }
        PollResults results = pollService.getResults(tokens.get(0));
        Poll poll = results.poll();
        StringBuilder sb = new StringBuilder(msg(caller, "command.poll-results.title", poll.getQuestion(),
                String.valueOf(results.totalVoters()))).append(NEWLINE);
        for (int i = 0; i < poll.getOptions().size(); i++) {
            sb.append(i + 1).append(". ").append(poll.getOptions().get(i)).append(": ")
                    .append(results.counts().get(i)).append(NEWLINE);
        }
        return CommandResult.success(sb.toString(), results);
    }

    private CommandResult handlePolls(CommandContext caller) {
        List<Poll> polls = pollService.listActive();
        if (polls.isEmpty()) {
            return CommandResult.success(msg(caller, "command.polls.empty"));
        }
        ZoneId zone = preferencesService.getZone(caller.userId());
        StringBuilder sb = new StringBuilder(msg(caller, "command.polls.title")).append(NEWLINE);
        for (Poll poll : polls) {
            sb.append("`").append(poll.getId()).append("` ").append(poll.getQuestion());
            if (poll.getExpiresAt() != null) {
                sb.append(" (until ").append(format(poll.getExpiresAt(), zone)).append(")");
            }
            sb.append(NEWLINE);
        }
        return CommandResult.success(sb.toString(), polls);
    }

    private CommandResult handleClosePoll(List<String> tokens, CommandContext caller) {
        if (tokens.isEmpty()) {
            return CommandResult.failure(msg(caller, "command.close-poll.usage"));
        }
        pollService.closePoll(tokens.get(0), caller.userId(), caller.admin());
        return CommandResult.success(msg(caller, "command.close-poll.done", tokens.get(0)));
    }

    private CommandResult handleStats(CommandContext caller) {
        PollStatistics stats = pollService.getStatistics(STATS_TOP);
        StringBuilder sb = new StringBuilder(msg(caller, "command.stats.title", String.valueOf(stats.totalPolls()),
                String.valueOf(stats.activePolls()), String.valueOf(stats.totalVotes()),
                String.format(Locale.ROOT, "%.1f", stats.averageVotesPerPoll()))).append(NEWLINE);
        appendRanking(sb, msg(caller, "command.stats.top-voters"), stats.topVoters());
        appendRanking(sb, msg(caller, "command.stats.top-creators"), stats.topCreators());
        return CommandResult.success(sb.toString(), stats);
    }

    private static void appendRanking(StringBuilder sb, String title, List<PollStatistics.Ranking> ranking) {
        if (ranking.isEmpty()) {
            return;
        }
        sb.append(title).append(NEWLINE);
        for (int i = 0; i < ranking.size(); i++) {
            PollStatistics.Ranking entry = ranking.get(i);
            sb.append(i + 1).append(". <@").append(entry.userId()).append(">: ").append(entry.count())
                    .append(NEWLINE);
        }
    }

    // ==================== ROLE PERMISSIONS ====================

    private CommandResult handleListRolePermissions(List<String> tokens, CommandContext caller) {
        if (!tokens.isEmpty()) {
            String roleId = CommandArguments.parseRole(tokens.get(0));
            Set<String> commands = permissionService.getRolePermissions(roleId);
            if (commands.isEmpty()) {
                return CommandResult.success(msg(caller, "command.role-permissions.none", roleId), commands);
            }
            return CommandResult.success(msg(caller, "command.role-permissions.role", roleId,
                    String.join(", ", new TreeSet<>(commands))), commands);
        }
        Map<String, Set<String>> roles = permissionService.listRoles();
        if (roles.isEmpty()) {
            return CommandResult.success(msg(caller, "command.role-permissions.empty"), roles);
        }
        StringBuilder sb = new StringBuilder(msg(caller, "command.role-permissions.title")).append(NEWLINE);
        roles.forEach((roleId, commands) -> sb.append("<@&").append(roleId).append(">: ")
                .append(String.join(", ", new TreeSet<>(commands))).append(NEWLINE));
        return CommandResult.success(sb.toString(), roles);
    }

    private CommandResult handleAddRolePermission(List<String> tokens, CommandContext caller) {
        requireAdmin(caller);
        if (tokens.size() != 2) {
            return CommandResult.failure(msg(caller, "command.add-role-permission.usage"));
        }
        String roleId = CommandArguments.parseRole(tokens.get(0));
        String command = requireKnownCommand(tokens.get(1));
        return permissionService.grant(roleId, command)
                ? CommandResult.success(msg(caller, "command.add-role-permission.done", command, roleId))
                : CommandResult.success(msg(caller, "command.add-role-permission.exists", command, roleId));
    }

    private CommandResult handleRemoveRolePermission(List<String> tokens, CommandContext caller) {
        requireAdmin(caller);
        if (tokens.size() != 2) {
            return CommandResult.failure(msg(caller, "command.remove-role-permission.usage"));
        }
        String roleId = CommandArguments.parseRole(tokens.get(0));
        String command = requireKnownCommand(tokens.get(1));
        return permissionService.revoke(roleId, command)
                ? CommandResult.success(msg(caller, "command.remove-role-permission.done", command, roleId))
                : CommandResult.failure(msg(caller, "command.remove-role-permission.missing", command, roleId));
    }

    private static void requireAdmin(CommandContext caller) {
        if (!caller.admin()) {
            throw new PermissionDeniedException("Only administrators can change command permissions");
        }
    }

    private String requireKnownCommand(String token) {
        String command = token.startsWith("/") ? token.substring(1) : token;
        command = command.toLowerCase(Locale.ROOT);
        if (!hasCommand(command)) {
            throw new InvalidArgumentException("Unknown command: " + command);
        }
        return command;
    }

    // ==================== PREFERENCES ====================

    private CommandResult handlePref(List<String> tokens, CommandContext caller) {
        String userId = caller.userId();
        if (tokens.isEmpty()) {
            UserPreferences prefs = preferencesService.getPreferences(userId);
            StringBuilder sb = new StringBuilder(msg(caller, "command.pref.title", prefs.getLanguage(),
                    prefs.getTimezone(), prefs.getCalendarId() != null ? prefs.getCalendarId() : "-"))
                    .append(NEWLINE);
            if (prefs.getCustom().isEmpty()) {
                sb.append(msg(caller, "command.pref.empty"));
            } else {
                prefs.getCustom().forEach((key, value) -> sb.append(key).append(" = ").append(value).append(NEWLINE));
            }
            return CommandResult.success(sb.toString(), prefs);
        }

        String first = tokens.get(0);
        if ("reset".equals(first) && tokens.size() == 1) {
            preferencesService.clearPreferences(userId);
            return CommandResult.success(msg(caller, "command.pref.reset"));
        }
        if ("unset".equals(first) && tokens.size() == 2) {
            String key = tokens.get(1);
            return preferencesService.removePreference(userId, key)
                    ? CommandResult.success(msg(caller, "command.pref.removed", key))
                    : CommandResult.failure(msg(caller, "command.pref.unset", key));
        }
        if (tokens.size() == 1) {
            String value = preferencesService.getPreference(userId, first, null);
            return value != null
                    ? CommandResult.success(msg(caller, "command.pref.value", first, value))
                    : CommandResult.success(msg(caller, "command.pref.unset", first));
        }
        preferencesService.setPreference(userId, first, CommandArguments.join(tokens, 1));
        return CommandResult.success(msg(caller, "command.pref.saved", first));
    }

    private CommandResult handleLanguage(List<String> tokens, CommandContext caller) {
        if (tokens.isEmpty()) {
            return CommandResult.failure(msg(caller, "command.language.usage"));
        }
        String language = tokens.get(0).toLowerCase(Locale.ROOT);
        preferencesService.setLanguage(caller.userId(), language);
        return CommandResult.success(msg(caller, "command.language.changed", language));
    }

    private CommandResult handleTimezone(List<String> tokens, CommandContext caller) {
        if (tokens.isEmpty()) {
            return CommandResult.failure(msg(caller, "command.timezone.usage"));
        }
        preferencesService.setTimezone(caller.userId(), tokens.get(0));
        return CommandResult.success(msg(caller, "command.timezone.changed", tokens.get(0)));
    }

    private CommandResult handleLinkCalendar(List<String> tokens, CommandContext caller) {
        if (tokens.isEmpty()) {
            return CommandResult.failure(msg(caller, "command.link-calendar.usage"));
        }
        preferencesService.linkCalendar(caller.userId(), tokens.get(0));
        return CommandResult.success(msg(caller, "command.link-calendar.done", tokens.get(0)));
    }

    // ==================== HELPERS ====================

    private CommandResult failure(CommandContext caller, PlannerException e) {
        log.debug("Command failed for {}: {}", caller.userId(), e.getMessage());
        String key;
        if (e instanceof InvalidArgumentException) {
            key = "command.error.invalid";
        } else if (e instanceof NotFoundException) {
            key = "command.error.not-found";
        } else if (e instanceof PermissionDeniedException) {
            key = "command.error.permission";
        } else if (e instanceof CalendarAuthException) {
            key = "command.error.calendar-auth";
        } else if (e instanceof TransientExternalException) {
            key = "command.error.unavailable";
        } else if (e instanceof StorageException) {
            log.error("Storage failure while handling a command", e);
            key = "command.error.storage";
        } else {
            key = "command.error.unavailable";
        }
        return CommandResult.failure(msg(caller, key, e.getMessage()));
    }

    private ReminderPayload messagePayload(CommandContext caller, String text) {
        return ReminderPayload.builder()
                .channelId(caller.channelId())
                .message(text)
                .build();
    }

    private static String describe(ReminderPayload payload) {
        if (payload.getTargetType() == ReminderPayload.TargetType.POLL) {
            return "poll " + payload.getTargetId();
        }
        if (payload.getMessage() != null && !payload.getMessage().isBlank()) {
            return payload.getMessage();
        }
        return "template " + payload.getTemplateName();
    }

    private Interval workingDay(LocalDate date, ZoneId zone) {
        BotProperties.AvailabilityProperties config = properties.getAvailability();
        Instant start = date.atStartOfDay(zone).plusHours(config.getDefaultDayStartHour()).toInstant();
        Instant end = date.atStartOfDay(zone).plusHours(config.getDefaultDayEndHour()).toInstant();
        return Interval.of(start, end);
    }

    private static String format(Instant instant, ZoneId zone) {
        return DATE_TIME_FORMAT.format(instant.atZone(zone)) + " " + zone.getId();
    }

    static String formatDuration(Duration duration) {
        long days = duration.toDays();
        int hours = duration.toHoursPart();
        int minutes = duration.toMinutesPart();
        StringBuilder sb = new StringBuilder();
        if (days > 0) {
            sb.append(days).append('d');
        }
        if (hours > 0) {
            sb.append(hours).append('h');
        }
        if (minutes > 0 || sb.length() == 0) {
            sb.append(minutes).append('m');
        }
        return sb.toString();
    }

    private String msg(CommandContext caller, String key, Object... args) {
        return preferencesService.getMessage(caller.userId(), key, args);
    }
}
