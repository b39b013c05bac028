package me.golemcore.scheduler.domain.model;

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

import java.util.function.Consumer;

/**
 * What happens when a job leaves the registry for good (retired after its last
 * fire, or canceled). Plain jobs do nothing; callback jobs notify the creator
 * once.
 */
public sealed interface JobCompletion permits JobCompletion.Plain, JobCompletion.Callback {

    void completed(ScheduledJob job);

    static JobCompletion none() {
        return Plain.INSTANCE;
    }

    static JobCompletion callback(Consumer<ScheduledJob> onCompleted) {
        return new Callback(onCompleted);
    }

    final class Plain implements JobCompletion {

        private static final Plain INSTANCE = new Plain();

        private Plain() {
        }

        @Override
        public void completed(ScheduledJob job) {
            // nothing to notify
        }
    }

    record Callback(Consumer<ScheduledJob> onCompleted) implements JobCompletion {

        public Callback {
            if (onCompleted == null) {
                throw new IllegalArgumentException("Completion callback is required");
            }
        }

        @Override
        public void completed(ScheduledJob job) {
            onCompleted.accept(job);
        }
    }
}
