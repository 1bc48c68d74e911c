package me.golemcore.planner.domain.exception;

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

/**
 * Timeout or temporary unavailability of an external collaborator (calendar,
 * chat platform). Retried with bounded backoff by the owning component.
 */
public class TransientExternalException extends PlannerException {

    public TransientExternalException(String message) {
        super(message);
    }

    public TransientExternalException(String message, Throwable cause) {
        super(message, cause);
    }
}
