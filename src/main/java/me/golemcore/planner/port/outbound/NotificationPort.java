package me.golemcore.planner.port.outbound;

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

import java.util.concurrent.CompletableFuture;

/**
 * Outbound port delivering rendered reminder text to a chat platform. The
 * returned future completes exceptionally for any delivery that was not
 * confirmed by the platform.
 */
public interface NotificationPort {

    /**
     * @param ownerId
     *            user the reminder belongs to; receives a direct message when
     *            {@code channelId} is null
     * @param channelId
     *            target channel, or null
     * @param content
     *            rendered text
     */
    CompletableFuture<Void> deliver(String ownerId, String channelId, String content);
}
