package me.golemcore.todo.adapter.outbound.storage;

import me.golemcore.todo.infrastructure.config.TodoProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.concurrent.ExecutionException;

import static org.junit.jupiter.api.Assertions.*;

class LocalStorageAdapterTest {

    private static final String TEST_DIR = "tasks";
    private static final String FILE = "tasks.json";

    @TempDir
    Path tempDir;

    private LocalStorageAdapter storageAdapter;

    @BeforeEach
    void setUp() {
        TodoProperties properties = new TodoProperties();
        properties.getStorage().getLocal().setBasePath(tempDir.toString());

        storageAdapter = new LocalStorageAdapter(properties);
        storageAdapter.init();
    }

    @Test
    void init_createsTasksDirectory() {
        assertTrue(Files.isDirectory(tempDir.resolve(TEST_DIR)));
    }

    @Test
    void putTextAtomicAndGetText() throws ExecutionException, InterruptedException {
        String content = "[ {\"title\" : \"Übung\"} ]";

        storageAdapter.putTextAtomic(TEST_DIR, FILE, content, false).get();

        assertEquals(content, storageAdapter.getText(TEST_DIR, FILE).get());
    }

    @Test
    void putTextAtomic_writesUtf8AndLeavesNoTempFile() throws Exception {
        storageAdapter.putTextAtomic(TEST_DIR, FILE, "café", false).get();

        Path target = tempDir.resolve(TEST_DIR).resolve(FILE);
        assertEquals("café", Files.readString(target, StandardCharsets.UTF_8));
        assertFalse(Files.exists(tempDir.resolve(TEST_DIR).resolve(FILE + ".tmp")));
    }

    @Test
    void putTextAtomic_overwritesWholeFile() throws Exception {
        storageAdapter.putTextAtomic(TEST_DIR, FILE, "a much longer first version", false).get();
        storageAdapter.putTextAtomic(TEST_DIR, FILE, "short", false).get();

        assertEquals("short", storageAdapter.getText(TEST_DIR, FILE).get());
    }

    @Test
    void putTextAtomic_withBackupKeepsPreviousVersion() throws Exception {
        storageAdapter.putTextAtomic(TEST_DIR, FILE, "v1", true).get();
        storageAdapter.putTextAtomic(TEST_DIR, FILE, "v2", true).get();

        Path backup = tempDir.resolve(TEST_DIR).resolve(FILE + ".bak");
        assertEquals("v1", Files.readString(backup));
        assertEquals("v2", storageAdapter.getText(TEST_DIR, FILE).get());
    }

    @Test
    void putTextAtomic_withoutBackupCreatesNoBakFile() throws Exception {
        storageAdapter.putTextAtomic(TEST_DIR, FILE, "v1", false).get();
        storageAdapter.putTextAtomic(TEST_DIR, FILE, "v2", false).get();

        assertFalse(Files.exists(tempDir.resolve(TEST_DIR).resolve(FILE + ".bak")));
    }

    @Test
    void getText_returnsNullForMissingFile() throws ExecutionException, InterruptedException {
        assertNull(storageAdapter.getText(TEST_DIR, "missing.json").get());
    }

    @Test
    void exists_reflectsFileState() throws ExecutionException, InterruptedException {
        assertFalse(storageAdapter.exists(TEST_DIR, FILE).get());

        storageAdapter.putTextAtomic(TEST_DIR, FILE, "[]", false).get();

        assertTrue(storageAdapter.exists(TEST_DIR, FILE).get());
    }

    @Test
    void pathTraversal_isBlocked() {
        ExecutionException e = assertThrows(ExecutionException.class,
                () -> storageAdapter.getText("../outside", FILE).get());
        assertInstanceOf(IllegalArgumentException.class, e.getCause());

        assertThrows(ExecutionException.class,
                () -> storageAdapter.putTextAtomic(TEST_DIR, "../../escape.json", "x", false).get());
    }

    @Test
    void putTextAtomic_failsWhenTargetIsADirectory() throws Exception {
        Files.createDirectories(tempDir.resolve(TEST_DIR).resolve("blocked.json"));
        Files.writeString(tempDir.resolve(TEST_DIR).resolve("blocked.json").resolve("child"), "x");

        assertThrows(ExecutionException.class,
                () -> storageAdapter.putTextAtomic(TEST_DIR, "blocked.json", "data", false).get());
        assertFalse(Files.exists(tempDir.resolve(TEST_DIR).resolve("blocked.json.tmp")));
    }
}
