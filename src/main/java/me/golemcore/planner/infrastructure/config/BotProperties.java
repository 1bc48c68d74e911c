package me.golemcore.planner.infrastructure.config;

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

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Centralized configuration properties for the bot, bound from
 * application.properties.
 *
 * <p>
 * All bot configuration is organized under the {@code bot.*} prefix. This class
 * contains nested property classes for different subsystems:
 * <ul>
 * <li>{@link StorageProperties} - workspace persistence</li>
 * <li>{@link SchedulerProperties} - reminder fire loop</li>
 * <li>{@link AvailabilityProperties} - free-slot search defaults</li>
 * <li>{@link DiscordProperties} - chat platform connection</li>
 * <li>{@link CalendarProperties} - external calendar provider</li>
 * <li>{@link PollProperties} - poll limits</li>
 * </ul>
 *
 * <p>
 * Uses Spring Boot's {@link ConfigurationProperties} for type-safe property
 * binding.
 *
 * @since 1.0
 */
@Component
@ConfigurationProperties(prefix = "bot")
@Data
public class BotProperties {

    private StorageProperties storage = new StorageProperties();
    private SchedulerProperties scheduler = new SchedulerProperties();
    private AvailabilityProperties availability = new AvailabilityProperties();
    private DiscordProperties discord = new DiscordProperties();
    private CalendarProperties calendar = new CalendarProperties();
    private PollProperties polls = new PollProperties();

    @Data
    public static class StorageProperties {
        private LocalStorageProperties local = new LocalStorageProperties();
    }

    @Data
    public static class LocalStorageProperties {
        private String basePath = "${user.home}/.golemcore/planner";
    }

    // ==================== SCHEDULER ====================

    @Data
    public static class SchedulerProperties {
        private boolean enabled = true;

        /** Delay between the end of one tick and the start of the next. */
        private Duration tickInterval = Duration.ofSeconds(5);

        /** Upper bound for a single delivery attempt. */
        private Duration deliveryTimeout = Duration.ofSeconds(10);

        /** Immediate retries after a failed delivery, within the same tick. */
        private int maxRetries = 3;

        /** Backoff before retry N is {@code retryBackoff * N}. */
        private Duration retryBackoff = Duration.ofMillis(200);

        /** How long shutdown waits for an in-flight tick. */
        private Duration shutdownGrace = Duration.ofSeconds(30);

        private int maxLogsPage = 100;
    }

    // ==================== AVAILABILITY ====================

    @Data
    public static class AvailabilityProperties {
        private Duration rateLimitBackoff = Duration.ofSeconds(1);
        private Duration defaultMinDuration = Duration.ofMinutes(30);
        private int defaultDayStartHour = 9;
        private int defaultDayEndHour = 17;
    }

    // ==================== DISCORD ====================

    @Data
    public static class DiscordProperties {
        private boolean enabled = false;
        private String token;

        /** Members holding any of these roles may manage other users' items. */
        private List<String> adminRoleIds = new ArrayList<>();
    }

    // ==================== CALENDAR ====================

    @Data
    public static class CalendarProperties {
        private GoogleCalendarProperties google = new GoogleCalendarProperties();
    }

    @Data
    public static class GoogleCalendarProperties {
        private boolean enabled = false;
        private String credentialsPath = "";
        private String applicationName = "golemcore-planner";
    }

    // ==================== POLLS ====================

    @Data
    public static class PollProperties {
        private int maxOptions = 20;
    }
}
