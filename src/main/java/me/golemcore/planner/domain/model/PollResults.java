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

import java.util.List;

/**
 * Vote tally for a poll. {@code counts} is aligned with the poll's option
 * list.
 */
public record PollResults(Poll poll, List<Integer> counts, int totalVoters, int totalVotes) {

    /**
     * One-line summary such as {@code "Yes: 3, No: 1"}.
     */
    public String summary() {
        StringBuilder sb = new StringBuilder();
        List<String> options = poll.getOptions();
        for (int i = 0; i < options.size(); i++) {
            if (i > 0) {
                sb.append(", ");
            }
            sb.append(options.get(i)).append(": ").append(counts.get(i));
        }
        return sb.toString();
    }
}
