package me.golemcore.planner.domain.model;

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

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.HashMap;
import java.util.Map;

/**
 * What a reminder delivers: a raw message or a template reference, plus the
 * values substituted into it at fire time.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class ReminderPayload {

    /** Chat channel to post into; null means a direct message to the owner. */
    private String channelId;

    private String templateName;
    private String message;

    @Builder.Default
    private TargetType targetType = TargetType.NONE;

    private String targetId;

    @Builder.Default
    private Map<String, String> substitutions = new HashMap<>();

    public enum TargetType {
        NONE, POLL
    }

    @JsonIgnore
    public boolean hasContent() {
        return (message != null && !message.isBlank()) || (templateName != null && !templateName.isBlank());
    }

    public ReminderPayload copy() {
        return toBuilder()
                .substitutions(substitutions != null ? new HashMap<>(substitutions) : new HashMap<>())
                .build();
    }
}
