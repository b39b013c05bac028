package me.golemcore.scheduler.domain.service;

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

import me.golemcore.scheduler.domain.exception.CorruptRecordException;
import me.golemcore.scheduler.domain.model.JobNamespace;
import me.golemcore.scheduler.domain.model.MessageMetadata;
import me.golemcore.scheduler.domain.model.ScheduledJob;
import me.golemcore.scheduler.domain.model.StoredJob;
import me.golemcore.scheduler.port.outbound.BrainPort;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.Map;

/**
 * Round-trips jobs to and from the brain. Each job is stored under its
 * namespace key as the positional array
 * {@code [pattern, owner, messageTemplate, metadata, postInThread]}, keyed by
 * job id.
 */
@Service
@Slf4j
public class JobPersistenceService {

    private static final int IDX_PATTERN = 0;
    private static final int IDX_OWNER = 1;
    private static final int IDX_MESSAGE = 2;
    private static final int IDX_METADATA = 3;
    private static final int IDX_POST_IN_THREAD = 4;
    private static final int TUPLE_SIZE = 5;

    private final BrainPort brain;
    private final ObjectMapper objectMapper;

    public JobPersistenceService(BrainPort brain, ObjectMapper objectMapper) {
        this.brain = brain;
        this.objectMapper = objectMapper;
    }

    /**
     * Write a job's durable fields.
     *
     * @throws me.golemcore.scheduler.domain.exception.PersistenceException
     *             if the brain is unavailable
     */
    public void save(JobNamespace namespace, ScheduledJob job) {
        brain.set(namespace.getStorageKey(), job.getId(), encode(job.serialize()));
        log.debug("[Persistence] Saved {} job {}", namespace, job.getId());
    }

    public void delete(JobNamespace namespace, String id) {
        brain.delete(namespace.getStorageKey(), id);
        log.debug("[Persistence] Deleted {} job {}", namespace, id);
    }

    /**
     * Raw records of a namespace, undecoded so that one corrupt record does not
     * hide the others.
     */
    public Map<String, JsonNode> loadAll(JobNamespace namespace) {
        return brain.get(namespace.getStorageKey());
    }

    public JsonNode encode(StoredJob stored) {
        ArrayNode tuple = objectMapper.createArrayNode();
        tuple.add(stored.pattern());
        tuple.add(objectMapper.valueToTree(stored.owner()));
        tuple.add(stored.messageTemplate());
        tuple.add(objectMapper.valueToTree(stored.metadata()));
        tuple.add(stored.postInThread());
        return tuple;
    }

    /**
     * Decode a stored tuple back into a job.
     *
     * @throws CorruptRecordException
     *             if the tuple is malformed
     */
    public ScheduledJob decode(String id, JsonNode record) {
        if (record == null || !record.isArray() || record.size() < TUPLE_SIZE) {
            throw new CorruptRecordException(id, "expected a " + TUPLE_SIZE + "-element array");
        }
        JsonNode pattern = record.get(IDX_PATTERN);
        JsonNode message = record.get(IDX_MESSAGE);
        JsonNode postInThread = record.get(IDX_POST_IN_THREAD);
        if (!pattern.isTextual() || !message.isTextual()) {
            throw new CorruptRecordException(id, "pattern and message must be strings");
        }
        if (!postInThread.isBoolean()) {
            throw new CorruptRecordException(id, "postInThread must be a boolean");
        }
        if (!record.get(IDX_OWNER).isObject() || !record.get(IDX_METADATA).isObject()) {
            throw new CorruptRecordException(id, "owner and metadata must be objects");
        }

        StoredJob stored;
        try {
            stored = new StoredJob(
                    pattern.asText(),
                    objectMapper.treeToValue(record.get(IDX_OWNER), StoredJob.Owner.class),
                    message.asText(),
                    objectMapper.treeToValue(record.get(IDX_METADATA), MessageMetadata.class),
                    postInThread.asBoolean());
        } catch (JsonProcessingException | IllegalArgumentException e) {
            throw new CorruptRecordException(id, e.getMessage(), e);
        }
        return ScheduledJob.deserialize(id, stored);
    }
}
