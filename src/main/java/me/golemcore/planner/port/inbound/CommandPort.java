package me.golemcore.planner.port.inbound;

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

import java.util.List;
import java.util.Set;
import java.util.concurrent.CompletableFuture;

/**
 * Chat commands, independent of the platform that delivers them. Replies are
 * localized for the calling user.
 */
public interface CommandPort {

    /**
     * Run a command. Domain failures complete normally with an unsuccessful
     * {@link CommandResult}; the future only fails on programming errors.
     *
     * @param command
     *            command name without the leading slash
     * @param args
     *            raw option values; each is split on whitespace
     */
    CompletableFuture<CommandResult> execute(String command, List<String> args, CommandContext caller);

    boolean hasCommand(String command);

    List<CommandDefinition> listCommands();

    /**
     * Who is calling and from where.
     *
     * @param channelId
     *            guild channel the command came from, {@code null} for direct
     *            messages; one-off reminders are delivered there
     * @param admin
     *            the caller may cancel or close other users' items and
     *            bypasses command restrictions
     * @param roleIds
     *            platform roles of the caller, checked against command
     *            restrictions
     */
    record CommandContext(String userId, String channelId, boolean admin, Set<String> roleIds) {

        public CommandContext {
            userId = blankToNull(userId);
            channelId = blankToNull(channelId);
            roleIds = roleIds == null ? Set.of() : Set.copyOf(roleIds);
        }

        public CommandContext(String userId, String channelId, boolean admin) {
            this(userId, channelId, admin, Set.of());
        }

        private static String blankToNull(String value) {
            return value == null || value.isBlank() ? null : value.trim();
        }
    }

    /**
     * @param data
     *            structured result for non-chat callers, e.g. the created job
     *            id or the listed polls
     */
    record CommandResult(boolean success, String output, Object data) {

        public static CommandResult success(String output) {
            return new CommandResult(true, output, null);
        }

        public static CommandResult success(String output, Object data) {
            return new CommandResult(true, output, data);
        }

        public static CommandResult failure(String error) {
            return new CommandResult(false, error, null);
        }
    }

    record CommandDefinition(String name, String description, String usage) {
    }
}
