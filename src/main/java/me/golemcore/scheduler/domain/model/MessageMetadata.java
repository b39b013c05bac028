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
 * Provenance of the originating request plus, after the latest delivery, the
 * thread and permalink of that delivery.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record MessageMetadata(String messageId, String threadId, String lastUrl) {

    public static MessageMetadata of(String messageId) {
        return new MessageMetadata(messageId, null, null);
    }

    public MessageMetadata withDelivery(String newThreadId, String newLastUrl) {
        return new MessageMetadata(messageId,
                newThreadId != null ? newThreadId : threadId,
                newLastUrl != null ? newLastUrl : lastUrl);
    }
}
