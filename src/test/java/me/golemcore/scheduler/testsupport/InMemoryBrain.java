package me.golemcore.scheduler.testsupport;

import me.golemcore.scheduler.domain.exception.PersistenceException;
import me.golemcore.scheduler.port.outbound.BrainPort;
import com.fasterxml.jackson.databind.JsonNode;

import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Brain kept in memory. Writes can be switched to fail to simulate an
 * unavailable store.
 */
public class InMemoryBrain implements BrainPort {

    private final Map<String, Map<String, JsonNode>> namespaces = new HashMap<>();
    private volatile boolean failWrites;
    private int writes;

    @Override
    public synchronized Map<String, JsonNode> get(String namespace) {
        return new LinkedHashMap<>(namespaces.getOrDefault(namespace, Map.of()));
    }

    @Override
    public synchronized void set(String namespace, String id, JsonNode record) {
        checkWritable();
        namespaces.computeIfAbsent(namespace, key -> new LinkedHashMap<>()).put(id, record.deepCopy());
        writes++;
    }

    @Override
    public synchronized void delete(String namespace, String id) {
        checkWritable();
        Map<String, JsonNode> records = namespaces.get(namespace);
        if (records != null) {
            records.remove(id);
        }
        writes++;
    }

    public synchronized JsonNode record(String namespace, String id) {
        return namespaces.getOrDefault(namespace, Map.of()).get(id);
    }

    public synchronized int writes() {
        return writes;
    }

    public void setFailWrites(boolean failWrites) {
        this.failWrites = failWrites;
    }

    private void checkWritable() {
        if (failWrites) {
            throw new PersistenceException("Brain unavailable", null);
        }
    }
}
