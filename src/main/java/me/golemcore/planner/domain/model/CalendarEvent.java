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

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Event stored by the local calendar. Creator and attendees are busy for its
 * duration.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CalendarEvent {

    private String id;
    private String title;
    private String description;
    private String location;
    private Instant startTime;
    private Instant endTime;
    private String createdBy;

    @Builder.Default
    private List<String> attendees = new ArrayList<>();

    private Instant createdAt;

    @JsonIgnore
    public Interval toInterval() {
        return new Interval(startTime, endTime);
    }

    @JsonIgnore
    public boolean involves(String userId) {
        return userId.equals(createdBy) || (attendees != null && attendees.contains(userId));
    }
}
