package me.golemcore.groupdesk.adapter.outbound.storage;

import me.golemcore.groupdesk.infrastructure.config.GroupDeskProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class LocalStorageAdapterTest {

    private static final String TEST_DIR = "tasks";

    @TempDir
    Path tempDir;

    private LocalStorageAdapter storageAdapter;

    @BeforeEach
    void setUp() {
        GroupDeskProperties properties = new GroupDeskProperties();
        properties.getStorage().getLocal().setBasePath(tempDir.toString());

        storageAdapter = new LocalStorageAdapter(properties);
        storageAdapter.init();
    }

    @Test
    void shouldCreateKnownDirectoriesOnInit() {
        for (String dir : LocalStorageAdapter.DIRECTORIES) {
            assertTrue(Files.isDirectory(tempDir.resolve(dir)), dir);
        }
    }

    @Test
    void putAndGetText() {
        storageAdapter.putTextAtomic(TEST_DIR, "task-1.json", "{\"id\":\"task-1\"}");

        assertEquals("{\"id\":\"task-1\"}", storageAdapter.getText(TEST_DIR, "task-1.json"));
        assertFalse(Files.exists(tempDir.resolve(TEST_DIR).resolve("task-1.json.tmp")));
    }

    @Test
    void shouldOverwriteExistingFile() {
        storageAdapter.putTextAtomic(TEST_DIR, "task-1.json", "old");
        storageAdapter.putTextAtomic(TEST_DIR, "task-1.json", "new");

        assertEquals("new", storageAdapter.getText(TEST_DIR, "task-1.json"));
    }

    @Test
    void getText_returnsNullForMissingFile() {
        assertNull(storageAdapter.getText(TEST_DIR, "missing.json"));
        assertFalse(storageAdapter.exists(TEST_DIR, "missing.json"));
    }

    @Test
    void listObjects_walksNestedDirectoriesWithRelativePaths() {
        storageAdapter.putTextAtomic("messages", "tenant-1/b.json", "b");
        storageAdapter.putTextAtomic("messages", "tenant-1/a.json", "a");
        storageAdapter.putTextAtomic("messages", "tenant-2/c.json", "c");

        assertEquals(List.of("tenant-1/a.json", "tenant-1/b.json", "tenant-2/c.json"),
                storageAdapter.listObjects("messages", ""));
        assertEquals(List.of("tenant-1/a.json", "tenant-1/b.json"),
                storageAdapter.listObjects("messages", "tenant-1"));
        assertTrue(storageAdapter.listObjects("messages", "tenant-3").isEmpty());
    }

    @Test
    void shouldBlockPathTraversal() {
        assertThrows(IllegalArgumentException.class,
                () -> storageAdapter.putTextAtomic(TEST_DIR, "../../escape.json", "x"));
        assertThrows(IllegalArgumentException.class, () -> storageAdapter.getText("..", "../etc/passwd"));
    }
}
