package me.golemcore.scheduler.adapter.outbound.brain;

import me.golemcore.scheduler.adapter.outbound.storage.LocalStorageAdapter;
import me.golemcore.scheduler.domain.exception.PersistenceException;
import me.golemcore.scheduler.infrastructure.config.SchedulerConfiguration;
import me.golemcore.scheduler.infrastructure.config.SchedulerProperties;
import me.golemcore.scheduler.port.outbound.StoragePort;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.anyBoolean;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class StorageBrainAdapterTest {

    private static final String NAMESPACE = "hubot_schedules";

    @TempDir
    Path tempDir;

    private ObjectMapper objectMapper;
    private SchedulerProperties properties;
    private StorageBrainAdapter brain;

    @BeforeEach
    void setUp() {
        objectMapper = SchedulerConfiguration.objectMapper();
        properties = new SchedulerProperties();
        properties.getStorage().getLocal().setBasePath(tempDir.toString());
        LocalStorageAdapter storage = new LocalStorageAdapter(properties);
        storage.init();
        brain = new StorageBrainAdapter(storage, objectMapper, properties);
    }

    private StorageBrainAdapter reopen() {
        LocalStorageAdapter storage = new LocalStorageAdapter(properties);
        storage.init();
        return new StorageBrainAdapter(storage, objectMapper, properties);
    }

    @Test
    void shouldReturnEmptyMapForUnknownNamespace() {
        assertTrue(brain.get(NAMESPACE).isEmpty());
    }

    @Test
    void shouldPersistRecordsAcrossInstances() throws Exception {
        brain.set(NAMESPACE, "12", objectMapper.readTree("[\"0 9 * * 1\", {\"id\": \"U1\"}]"));
        brain.set(NAMESPACE, "3", objectMapper.readTree("[\"0 10 * * 1\"]"));

        Map<String, JsonNode> records = reopen().get(NAMESPACE);

        assertEquals(List.of("12", "3"), List.copyOf(records.keySet()));
        assertEquals("0 9 * * 1", records.get("12").get(0).asText());
        assertTrue(Files.exists(tempDir.resolve("brain").resolve(NAMESPACE + ".json")));
    }

    @Test
    void shouldKeepNamespacesApart() throws Exception {
        brain.set(NAMESPACE, "1", objectMapper.readTree("[1]"));
        brain.set("hubot_reminders", "1", objectMapper.readTree("[2]"));

        assertEquals(1, brain.get(NAMESPACE).get("1").get(0).asInt());
        assertEquals(2, brain.get("hubot_reminders").get("1").get(0).asInt());
    }

    @Test
    void shouldDeleteRecord() throws Exception {
        brain.set(NAMESPACE, "1", objectMapper.readTree("[1]"));
        brain.set(NAMESPACE, "2", objectMapper.readTree("[2]"));

        brain.delete(NAMESPACE, "1");
        brain.delete(NAMESPACE, "absent");

        assertEquals(List.of("2"), List.copyOf(reopen().get(NAMESPACE).keySet()));
    }

    @Test
    void shouldNotExposeCachedNodes() throws Exception {
        brain.set(NAMESPACE, "1", objectMapper.readTree("[1]"));

        ((ArrayNode) brain.get(NAMESPACE).get("1")).add(99);

        assertEquals(1, brain.get(NAMESPACE).get("1").size());
    }

    @Test
    void shouldRejectCorruptFile() throws IOException {
        Files.writeString(tempDir.resolve("brain").resolve(NAMESPACE + ".json"), "{not json");

        assertThrows(PersistenceException.class, () -> brain.get(NAMESPACE));
    }

    @Test
    void shouldRejectNonObjectFile() throws IOException {
        Files.writeString(tempDir.resolve("brain").resolve(NAMESPACE + ".json"), "[1, 2]");

        assertThrows(PersistenceException.class, () -> brain.get(NAMESPACE));
    }

    @Test
    void shouldWrapWriteFailures() throws Exception {
        StoragePort failing = mock(StoragePort.class);
        when(failing.getText(anyString(), anyString())).thenReturn(CompletableFuture.completedFuture(null));
        when(failing.putTextAtomic(anyString(), anyString(), anyString(), anyBoolean()))
                .thenReturn(CompletableFuture.failedFuture(new UncheckedIOException(new IOException("disk full"))));
        StorageBrainAdapter failingBrain = new StorageBrainAdapter(failing, objectMapper, properties);
        JsonNode record = objectMapper.readTree("[1]");

        assertThrows(PersistenceException.class, () -> failingBrain.set(NAMESPACE, "1", record));
        assertTrue(failingBrain.get(NAMESPACE).isEmpty());
    }
}
