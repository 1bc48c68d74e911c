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

import me.golemcore.planner.domain.exception.InvalidArgumentException;

import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalTime;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parsing helpers for command arguments. Times are interpreted in the
 * caller's timezone.
 */
final class CommandArguments {

    private static final Pattern DURATION_PATTERN = Pattern.compile("^(?:(\\d+)d)?(?:(\\d+)h)?(?:(\\d+)m)?$");
    private static final Pattern DATE_PATTERN = Pattern.compile("^\\d{4}-\\d{2}-\\d{2}$");
    private static final Pattern TIME_PATTERN = Pattern.compile("^\\d{1,2}:\\d{2}$");
    private static final Pattern MENTION_PATTERN = Pattern.compile("^<@!?(\\d+)>$");
    private static final Pattern ROLE_PATTERN = Pattern.compile("^(?:<@&(\\d+)>|(\\d+))$");

    private CommandArguments() {
    }

    /**
     * Split every argument on whitespace.
     */
    static List<String> tokens(List<String> args) {
        List<String> tokens = new ArrayList<>();
        if (args == null) {
            return tokens;
        }
        for (String arg : args) {
            if (arg == null) {
                continue;
            }
            for (String token : arg.trim().split("\\s+")) {
                if (!token.isEmpty()) {
                    tokens.add(token);
                }
            }
        }
        return tokens;
    }

    static boolean isDuration(String token) {
        if (token == null || token.isEmpty()) {
            return false;
        }
        Matcher matcher = DURATION_PATTERN.matcher(token);
        return matcher.matches() && (matcher.group(1) != null || matcher.group(2) != null
                || matcher.group(3) != null);
    }

    /**
     * Parse {@code 90m}, {@code 2h}, {@code 1d}, {@code 1h30m}.
     */
    static Duration parseDuration(String token) {
        if (!isDuration(token)) {
            throw new InvalidArgumentException("Invalid duration '" + token + "', use e.g. 30m, 2h, 1d, 1h30m");
        }
        Matcher matcher = DURATION_PATTERN.matcher(token);
        matcher.matches();
        Duration duration = Duration.ZERO;
        if (matcher.group(1) != null) {
            duration = duration.plusDays(Long.parseLong(matcher.group(1)));
        }
        if (matcher.group(2) != null) {
            duration = duration.plusHours(Long.parseLong(matcher.group(2)));
        }
        if (matcher.group(3) != null) {
            duration = duration.plusMinutes(Long.parseLong(matcher.group(3)));
        }
        if (duration.isZero()) {
            throw new InvalidArgumentException("Duration must be positive");
        }
        return duration;
    }

    static LocalDate parseDate(String token) {
        if (token == null || !DATE_PATTERN.matcher(token).matches()) {
            throw new InvalidArgumentException("Invalid date '" + token + "', use YYYY-MM-DD");
        }
        try {
            return LocalDate.parse(token);
        } catch (DateTimeParseException e) {
            throw new InvalidArgumentException("Invalid date '" + token + "'");
        }
    }

    static LocalTime parseTime(String token) {
        if (token == null || !TIME_PATTERN.matcher(token).matches()) {
            throw new InvalidArgumentException("Invalid time '" + token + "', use HH:MM");
        }
        String[] parts = token.split(":");
        int hour = Integer.parseInt(parts[0]);
        int minute = Integer.parseInt(parts[1]);
        if (hour > 23 || minute > 59) {
            throw new InvalidArgumentException("Invalid time '" + token + "'");
        }
        return LocalTime.of(hour, minute);
    }

    /**
     * Parse the leading "when" of a reminder: a relative duration
     * ({@code 30m}), a time today or tomorrow ({@code 18:30}), or a date and
     * time ({@code 2026-05-01 09:00}).
     */
    static When parseWhen(List<String> tokens, Instant now, ZoneId zone) {
        if (tokens.isEmpty()) {
            throw new InvalidArgumentException("Missing time");
        }
        String first = tokens.get(0);
        if (isDuration(first)) {
            return new When(now.plus(parseDuration(first)), 1);
        }
        if (DATE_PATTERN.matcher(first).matches()) {
            if (tokens.size() < 2) {
                throw new InvalidArgumentException("Missing time after date");
            }
            ZonedDateTime at = ZonedDateTime.of(parseDate(first), parseTime(tokens.get(1)), zone);
            return new When(at.toInstant(), 2);
        }
        if (TIME_PATTERN.matcher(first).matches()) {
            ZonedDateTime today = ZonedDateTime.of(now.atZone(zone).toLocalDate(), parseTime(first), zone);
            Instant at = today.toInstant().isAfter(now) ? today.toInstant() : today.plusDays(1).toInstant();
            return new When(at, 1);
        }
        throw new InvalidArgumentException("Invalid time '" + first + "', use 30m, 18:30 or 2026-05-01 09:00");
    }

    /**
     * User id from a Discord mention ({@code <@123>} or {@code <@!123>}).
     */
    static Optional<String> mentionedUser(String token) {
        Matcher matcher = MENTION_PATTERN.matcher(token);
        return matcher.matches() ? Optional.of(matcher.group(1)) : Optional.empty();
    }

    /**
     * Role id from a role mention ({@code <@&123>}) or a bare numeric id.
     */
    static String parseRole(String token) {
        Matcher matcher = ROLE_PATTERN.matcher(token);
        if (!matcher.matches()) {
            throw new InvalidArgumentException("Expected a role mention or id: " + token);
        }
        return matcher.group(1) != null ? matcher.group(1) : matcher.group(2);
    }

    static int parsePositiveInt(String token, String what) {
        try {
            int value = Integer.parseInt(token);
            if (value <= 0) {
                throw new InvalidArgumentException(what + " must be positive");
            }
            return value;
        } catch (NumberFormatException e) {
            throw new InvalidArgumentException(what + " must be a number");
        }
    }

    static String join(List<String> tokens, int from) {
        return from >= tokens.size() ? "" : String.join(" ", tokens.subList(from, tokens.size()));
    }

    record When(Instant at, int consumed) {
    }
}
