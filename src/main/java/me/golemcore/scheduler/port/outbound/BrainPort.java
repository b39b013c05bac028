package me.golemcore.scheduler.port.outbound;

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

import com.fasterxml.jackson.databind.JsonNode;

import java.util.Map;

/**
 * Port for the bot's shared key-value brain. Records are grouped under a
 * namespace key and addressed by id. Calls are synchronous within the process
 * and each single {@code set} or {@code delete} is crash-consistent.
 *
 * <p>
 * Implementations signal an unavailable store with
 * {@link me.golemcore.scheduler.domain.exception.PersistenceException}.
 */
public interface BrainPort {

    /**
     * Read all records stored under a namespace, in insertion order. Returns an
     * empty map for an unknown namespace.
     */
    Map<String, JsonNode> get(String namespace);

    /**
     * Create or replace one record.
     */
    void set(String namespace, String id, JsonNode record);

    /**
     * Remove one record. Removing an absent id is a no-op.
     */
    void delete(String namespace, String id);
}
