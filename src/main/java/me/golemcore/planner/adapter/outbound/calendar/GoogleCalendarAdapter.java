package me.golemcore.planner.adapter.outbound.calendar;

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
import me.golemcore.planner.domain.exception.PlannerException;
import me.golemcore.planner.domain.exception.RateLimitException;
import me.golemcore.planner.domain.exception.TransientExternalException;
import me.golemcore.planner.domain.model.Interval;
import me.golemcore.planner.infrastructure.config.BotProperties;
import me.golemcore.planner.port.outbound.CalendarPort;
import com.google.api.client.googleapis.javanet.GoogleNetHttpTransport;
import com.google.api.client.googleapis.json.GoogleJsonError;
import com.google.api.client.googleapis.json.GoogleJsonResponseException;
import com.google.api.client.json.gson.GsonFactory;
import com.google.api.client.util.DateTime;
import com.google.api.services.calendar.Calendar;
import com.google.api.services.calendar.CalendarScopes;
import com.google.api.services.calendar.model.FreeBusyCalendar;
import com.google.api.services.calendar.model.FreeBusyRequest;
import com.google.api.services.calendar.model.FreeBusyRequestItem;
import com.google.api.services.calendar.model.FreeBusyResponse;
import com.google.api.services.calendar.model.TimePeriod;
import com.google.auth.http.HttpCredentialsAdapter;
import com.google.auth.oauth2.GoogleCredentials;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.security.GeneralSecurityException;
import java.time.Instant;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Google Calendar provider backed by the free/busy API.
 *
 * <p>
 * Credentials are a service-account JSON file that has been granted read
 * access to the users' calendars. Throttling maps to
 * {@link RateLimitException}; revoked or insufficient credentials map to
 * {@link CalendarAuthException}.
 */
@Component
@ConditionalOnProperty(name = "bot.calendar.google.enabled", havingValue = "true")
@Slf4j
public class GoogleCalendarAdapter implements CalendarPort {

    private static final int HTTP_UNAUTHORIZED = 401;
    private static final int HTTP_FORBIDDEN = 403;
    private static final int HTTP_TOO_MANY_REQUESTS = 429;
    private static final Set<String> RATE_LIMIT_REASONS = Set.of("rateLimitExceeded", "userRateLimitExceeded",
            "quotaExceeded");

    private final BotProperties properties;
    private volatile Calendar client;

    public GoogleCalendarAdapter(BotProperties properties) {
        this.properties = properties;
    }

    GoogleCalendarAdapter(BotProperties properties, Calendar client) {
        this.properties = properties;
        this.client = client;
    }

    @Override
    public Set<Interval> getBusyIntervals(String identity, Interval window) {
        FreeBusyRequest request = new FreeBusyRequest()
                .setTimeMin(new DateTime(window.start().toEpochMilli()))
                .setTimeMax(new DateTime(window.end().toEpochMilli()))
                .setItems(List.of(new FreeBusyRequestItem().setId(identity)));

        FreeBusyResponse response;
        try {
            response = client().freebusy().query(request).execute();
        } catch (GoogleJsonResponseException e) {
            GoogleJsonError details = e.getDetails();
            String reason = details != null && details.getErrors() != null && !details.getErrors().isEmpty()
                    ? details.getErrors().get(0).getReason()
                    : null;
            throw mapError(e.getStatusCode(), reason, e.getStatusMessage(), e);
        } catch (IOException e) {
            throw new TransientExternalException("Calendar request failed: " + e.getMessage(), e);
        }
        return toIntervals(identity, response);
    }

    static Set<Interval> toIntervals(String identity, FreeBusyResponse response) {
        Set<Interval> busy = new HashSet<>();
        if (response == null || response.getCalendars() == null) {
            return busy;
        }
        FreeBusyCalendar calendar = response.getCalendars().get(identity);
        if (calendar == null) {
            return busy;
        }
        if (calendar.getErrors() != null && !calendar.getErrors().isEmpty()) {
            String reason = calendar.getErrors().get(0).getReason();
            throw new CalendarAuthException("Calendar not accessible (" + reason + ")");
        }
        if (calendar.getBusy() == null) {
            return busy;
        }
        for (TimePeriod period : calendar.getBusy()) {
            Instant start = Instant.ofEpochMilli(period.getStart().getValue());
            Instant end = Instant.ofEpochMilli(period.getEnd().getValue());
            if (start.isBefore(end)) {
                busy.add(new Interval(start, end));
            }
        }
        return busy;
    }

    static PlannerException mapError(int status, String reason, String message, Throwable cause) {
        if (status == HTTP_TOO_MANY_REQUESTS || (status == HTTP_FORBIDDEN && RATE_LIMIT_REASONS.contains(reason))) {
            return new RateLimitException("Calendar rate limit exceeded", cause);
        }
        if (status == HTTP_UNAUTHORIZED || status == HTTP_FORBIDDEN) {
            return new CalendarAuthException("Calendar credentials rejected: " + message, cause);
        }
        return new TransientExternalException("Calendar request failed with HTTP " + status, cause);
    }

    private Calendar client() {
        Calendar current = client;
        if (current == null) {
            synchronized (this) {
                if (client == null) {
                    client = createClient();
                }
                current = client;
            }
        }
        return current;
    }

    private Calendar createClient() {
        BotProperties.GoogleCalendarProperties config = properties.getCalendar().getGoogle();
        try (InputStream in = Files.newInputStream(Path.of(config.getCredentialsPath()))) {
            GoogleCredentials credentials = GoogleCredentials.fromStream(in)
                    .createScoped(List.of(CalendarScopes.CALENDAR_READONLY));
            Calendar calendar = new Calendar.Builder(GoogleNetHttpTransport.newTrustedTransport(),
                    GsonFactory.getDefaultInstance(), new HttpCredentialsAdapter(credentials))
                    .setApplicationName(config.getApplicationName())
                    .build();
            log.info("[Calendar] Google Calendar client initialized");
            return calendar;
        } catch (IOException e) {
            throw new CalendarAuthException("Cannot load calendar credentials: " + e.getMessage(), e);
        } catch (GeneralSecurityException e) {
            throw new TransientExternalException("Cannot create calendar transport", e);
        }
    }
}
