package me.golemcore.scheduler.domain.exception;

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
 * Base type for failures raised by the scheduling core. All subtypes are
 * unchecked: validation failures surface to the caller before any state is
 * touched, runtime failures inside a timer callback are logged at the engine
 * boundary.
 */
public abstract class ScheduleException extends RuntimeException {

    protected ScheduleException(String message) {
        super(message);
    }

    protected ScheduleException(String message, Throwable cause) {
        super(message, cause);
    }
}
