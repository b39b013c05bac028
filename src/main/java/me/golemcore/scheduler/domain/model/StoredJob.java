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

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * Durable form of a job: the tuple
 * {@code (pattern, owner, messageTemplate, metadata, postInThread)}. The job id
 * is the storage key and is not part of the tuple.
 */
public record StoredJob(
        String pattern,
        Owner owner,
        String messageTemplate,
        MessageMetadata metadata,
        boolean postInThread) {

    /**
     * Stored owner. {@code room} is the delivery room; {@code originRoom} is
     * only written when the creating room differs from it.
     */
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record Owner(String id, String name, String room, String originRoom) {
    }
}
