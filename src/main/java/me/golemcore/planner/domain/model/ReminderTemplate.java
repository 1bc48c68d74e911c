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

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Reusable reminder text with {@code {placeholder}} variables.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ReminderTemplate {

    private String name;
    private String description;
    private String messageTemplate;

    @Builder.Default
    private ReminderPriority priority = ReminderPriority.INFORMATIONAL;

    /** "0" for built-in templates. */
    private String createdBy;

    @Builder.Default
    private List<String> pingRoles = new ArrayList<>();

    @Builder.Default
    private List<String> pingUsers = new ArrayList<>();

    private Instant createdAt;
}
