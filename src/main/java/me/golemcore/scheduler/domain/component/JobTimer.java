package me.golemcore.scheduler.domain.component;

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

import java.time.Instant;

/**
 * Timer facility used by the scheduling engine. One logical timer thread runs
 * the scheduled tasks; tasks must hand long-running work off to another
 * executor.
 */
public interface JobTimer {

    /**
     * Run a task once at the given instant. Instants in the past run as soon as
     * possible.
     */
    TimerHandle schedule(Runnable task, Instant at);

    /**
     * Handle of a pending timer task.
     */
    interface TimerHandle {

        /**
         * Prevent the task from running if it has not started yet. Idempotent.
         */
        void cancel();

        Instant getFireAt();
    }
}
