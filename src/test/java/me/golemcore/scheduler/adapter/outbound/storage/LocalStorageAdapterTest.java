package me.golemcore.scheduler.adapter.outbound.storage;

import me.golemcore.scheduler.infrastructure.config.SchedulerProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.concurrent.ExecutionException;

import static org.junit.jupiter.api.Assertions.*;

class LocalStorageAdapterTest {

    private static final String TEST_DIR = "test-dir";
    private static final String FILE_1 = "file1.json";

    @TempDir
    Path tempDir;

    private LocalStorageAdapter storageAdapter;

    @BeforeEach
    void setUp() {
        SchedulerProperties properties = new SchedulerProperties();
        properties.getStorage().getLocal().setBasePath(tempDir.toString());

        storageAdapter = new LocalStorageAdapter(properties);
        storageAdapter.init();
    }

    @Test
    void shouldCreateBrainDirectoryOnInit() {
        assertTrue(Files.isDirectory(tempDir.resolve("brain")));
    }

    @Test
    void putAtomicAndGetText() throws ExecutionException, InterruptedException {
        storageAdapter.putTextAtomic(TEST_DIR, FILE_1, "{\"a\":1}", false).get();

        assertEquals("{\"a\":1}", storageAdapter.getText(TEST_DIR, FILE_1).get());
        assertFalse(Files.exists(tempDir.resolve(TEST_DIR).resolve(FILE_1 + ".tmp")));
    }

    @Test
    void putAtomicKeepsBackupOfPreviousVersion() throws Exception {
        storageAdapter.putTextAtomic(TEST_DIR, FILE_1, "v1", true).get();
        storageAdapter.putTextAtomic(TEST_DIR, FILE_1, "v2", true).get();

        assertEquals("v2", storageAdapter.getText(TEST_DIR, FILE_1).get());
        assertEquals("v1", Files.readString(tempDir.resolve(TEST_DIR).resolve(FILE_1 + ".bak")));
    }

    @Test
    void putAtomicWithoutBackupLeavesNoBackup() throws ExecutionException, InterruptedException {
        storageAdapter.putTextAtomic(TEST_DIR, FILE_1, "v1", false).get();
        storageAdapter.putTextAtomic(TEST_DIR, FILE_1, "v2", false).get();

        assertFalse(Files.exists(tempDir.resolve(TEST_DIR).resolve(FILE_1 + ".bak")));
    }

    @Test
    void getText_returnsNullForNonExisting() throws ExecutionException, InterruptedException {
        assertNull(storageAdapter.getText("directory", "non-existing.json").get());
    }

    @Test
    void shouldCreateNestedDirectoriesOnPut() throws ExecutionException, InterruptedException {
        storageAdapter.putTextAtomic(TEST_DIR, "deep/nested/file.json", "deep content", false).get();

        assertEquals("deep content", storageAdapter.getText(TEST_DIR, "deep/nested/file.json").get());
    }

    // ==================== Path traversal ====================

    @Test
    void shouldBlockPathTraversal() {
        ExecutionException ex = assertThrows(ExecutionException.class,
                () -> storageAdapter.putTextAtomic("test", "../../etc/passwd", "hack", false).get());
        assertTrue(ex.getCause() instanceof IllegalArgumentException);
    }

    @Test
    void shouldBlockPathTraversalOnGet() {
        ExecutionException ex = assertThrows(ExecutionException.class,
                () -> storageAdapter.getText("test", "../../../secret").get());
        assertTrue(ex.getCause() instanceof IllegalArgumentException);
    }
}
