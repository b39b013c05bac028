package me.golemcore.scheduler.adapter.outbound.brain;

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

import me.golemcore.scheduler.domain.exception.PersistenceException;
import me.golemcore.scheduler.infrastructure.config.SchedulerProperties;
import me.golemcore.scheduler.port.outbound.BrainPort;
import me.golemcore.scheduler.port.outbound.StoragePort;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.HashMap;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.CompletionException;

/**
 * {@link BrainPort} kept in the local workspace. Each namespace is one JSON
 * object file, {@code brain/<namespace>.json}, mapping record id to record.
 * Every {@code set} and {@code delete} rewrites the file atomically; writes are
 * serialized by this adapter's monitor.
 *
 * <p>
 * A namespace is read from disk on first access and cached. If a write fails
 * the cache entry is dropped so the next access re-reads the file.
 */
@Component
@Slf4j
public class StorageBrainAdapter implements BrainPort {

    private static final String FILE_SUFFIX = ".json";

    private final StoragePort storagePort;
    private final ObjectMapper objectMapper;
    private final String directory;
    private final Map<String, ObjectNode> cache = new HashMap<>();

    public StorageBrainAdapter(StoragePort storagePort, ObjectMapper objectMapper, SchedulerProperties properties) {
        this.storagePort = storagePort;
        this.objectMapper = objectMapper;
        this.directory = properties.getStorage().getBrainDirectory();
    }

    @Override
    public synchronized Map<String, JsonNode> get(String namespace) {
        ObjectNode records = load(namespace);
        Map<String, JsonNode> result = new LinkedHashMap<>();
        Iterator<Map.Entry<String, JsonNode>> fields = records.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            result.put(field.getKey(), field.getValue().deepCopy());
        }
        return result;
    }

    @Override
    public synchronized void set(String namespace, String id, JsonNode record) {
        ObjectNode updated = load(namespace).deepCopy();
        updated.set(id, record.deepCopy());
        write(namespace, updated);
    }

    @Override
    public synchronized void delete(String namespace, String id) {
        ObjectNode current = load(namespace);
        if (!current.has(id)) {
            return;
        }
        ObjectNode updated = current.deepCopy();
        updated.remove(id);
        write(namespace, updated);
    }

    private ObjectNode load(String namespace) {
        ObjectNode cached = cache.get(namespace);
        if (cached != null) {
            return cached;
        }
        ObjectNode records = read(namespace);
        cache.put(namespace, records);
        return records;
    }

    private ObjectNode read(String namespace) {
        String json;
        try {
            json = storagePort.getText(directory, fileName(namespace)).join();
        } catch (CompletionException e) {
            throw new PersistenceException("Failed to read brain namespace " + namespace, e.getCause());
        }
        if (json == null || json.isBlank()) {
            return objectMapper.createObjectNode();
        }
        try {
            JsonNode node = objectMapper.readTree(json);
            if (node instanceof ObjectNode objectNode) {
                return objectNode;
            }
            throw new PersistenceException("Brain namespace " + namespace + " is not a JSON object", null);
        } catch (JsonProcessingException e) {
            throw new PersistenceException("Brain namespace " + namespace + " is not valid JSON", e);
        }
    }

    private void write(String namespace, ObjectNode records) {
        try {
            String json = objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(records);
            storagePort.putTextAtomic(directory, fileName(namespace), json, true).join();
            cache.put(namespace, records);
        } catch (JsonProcessingException e) {
            cache.remove(namespace);
            throw new PersistenceException("Failed to encode brain namespace " + namespace, e);
        } catch (CompletionException e) {
            cache.remove(namespace);
            log.error("[Brain] Failed to write namespace {}: {}", namespace, e.getMessage());
            throw new PersistenceException("Failed to write brain namespace " + namespace, e.getCause());
        }
    }

    private static String fileName(String namespace) {
        return namespace + FILE_SUFFIX;
    }
}
