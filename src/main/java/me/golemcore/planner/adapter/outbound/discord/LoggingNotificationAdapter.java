package me.golemcore.planner.adapter.outbound.discord;

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

import me.golemcore.planner.port.outbound.NotificationPort;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.util.concurrent.CompletableFuture;

/**
 * Notification sink used when Discord is disabled. Reminders are written to
 * the application log, which lets the scheduler run headless.
 */
@Component
@ConditionalOnProperty(name = "bot.discord.enabled", havingValue = "false", matchIfMissing = true)
@Slf4j
public class LoggingNotificationAdapter implements NotificationPort {

    @Override
    public CompletableFuture<Void> deliver(String ownerId, String channelId, String content) {
        log.info("[Notify] to={} channel={}: {}", ownerId, channelId != null ? channelId : "dm", content);
        return CompletableFuture.completedFuture(null);
    }
}
