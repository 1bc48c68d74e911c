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

import java.time.Duration;
import java.time.Instant;

/**
 * A free range produced by the availability engine, with its length
 * precomputed.
 */
public record FreeSlot(Interval interval, Duration duration) {

    public static FreeSlot of(Interval interval) {
        return new FreeSlot(interval, interval.duration());
    }

    public Instant start() {
        return interval.start();
    }

    public Instant end() {
        return interval.end();
    }
}
