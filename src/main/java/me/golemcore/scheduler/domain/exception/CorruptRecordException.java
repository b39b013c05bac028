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
 * Persisted job record is missing a required field or holds a malformed one.
 */
public class CorruptRecordException extends ScheduleException {

    private final String jobId;

    public CorruptRecordException(String jobId, String reason) {
        super("Corrupt record " + jobId + ": " + reason);
        this.jobId = jobId;
    }

    public CorruptRecordException(String jobId, String reason, Throwable cause) {
        super("Corrupt record " + jobId + ": " + reason, cause);
        this.jobId = jobId;
    }

    public String getJobId() {
        return jobId;
    }
}
