package me.golemcore.clarity.adapter.outbound.storage;

import me.golemcore.clarity.infrastructure.config.ClarityProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;

import static org.junit.jupiter.api.Assertions.*;

class LocalStorageAdapterTest {

    private static final String TURNS = "turns";

    @TempDir
    Path tempDir;

    private LocalStorageAdapter storageAdapter;

    @BeforeEach
    void setUp() {
        ClarityProperties properties = new ClarityProperties();
        properties.getStorage().getLocal().setBasePath(tempDir.toString());

        storageAdapter = new LocalStorageAdapter(properties);
        storageAdapter.init();
    }

    @Test
    void initCreatesWorkspaceDirectories() {
        for (String dir : LocalStorageAdapter.WORKSPACE_DIRECTORIES) {
            assertTrue(Files.isDirectory(tempDir.resolve(dir)), dir);
        }
    }

    @Test
    void putTextAtomicAndGetText() throws ExecutionException, InterruptedException {
        storageAdapter.putTextAtomic(TURNS, "a.json", "{\"id\":\"a\"}", false).get();

        assertEquals("{\"id\":\"a\"}", storageAdapter.getText(TURNS, "a.json").get());
        assertTrue(storageAdapter.exists(TURNS, "a.json").get());
        assertFalse(Files.exists(tempDir.resolve(TURNS).resolve("a.json.tmp")));
    }

    @Test
    void putTextAtomicKeepsBackupOfPreviousVersion() throws ExecutionException, InterruptedException, IOException {
        storageAdapter.putTextAtomic("capsule", "capsule.json", "v1", true).get();
        storageAdapter.putTextAtomic("capsule", "capsule.json", "v2", true).get();

        assertEquals("v2", storageAdapter.getText("capsule", "capsule.json").get());
        assertEquals("v1", Files.readString(tempDir.resolve("capsule").resolve("capsule.json.bak")));
    }

    @Test
    void getTextReturnsNullForMissingFile() throws ExecutionException, InterruptedException {
        assertNull(storageAdapter.getText(TURNS, "missing.json").get());
    }

    @Test
    void deleteObjectRemovesFileAndBackup() throws ExecutionException, InterruptedException {
        storageAdapter.putTextAtomic("capsule", "capsule.json", "v1", true).get();
        storageAdapter.putTextAtomic("capsule", "capsule.json", "v2", true).get();

        storageAdapter.deleteObject("capsule", "capsule.json").get();

        assertFalse(storageAdapter.exists("capsule", "capsule.json").get());
        assertFalse(Files.exists(tempDir.resolve("capsule").resolve("capsule.json.bak")));
    }

    @Test
    void deleteObjectIgnoresMissingFile() {
        assertDoesNotThrow(() -> storageAdapter.deleteObject(TURNS, "missing.json").get());
    }

    @Test
    void listObjectsSkipsBackupsAndUsesForwardSlashes() throws ExecutionException, InterruptedException {
        storageAdapter.putTextAtomic("learning", "patterns/style_preference/b.json", "{}", false).get();
        storageAdapter.putTextAtomic("learning", "patterns/topic_recurrence/a.json", "{}", true).get();
        storageAdapter.putTextAtomic("learning", "patterns/topic_recurrence/a.json", "{}", true).get();

        List<String> files = storageAdapter.listObjects("learning", "patterns").get();

        assertEquals(List.of("patterns/style_preference/b.json", "patterns/topic_recurrence/a.json"), files);
    }

    @Test
    void listObjectsReturnsEmptyForMissingPrefix() throws ExecutionException, InterruptedException {
        assertTrue(storageAdapter.listObjects("learning", "nothing-here").get().isEmpty());
    }

    @Test
    void appendTextAppendsLines() throws ExecutionException, InterruptedException {
        storageAdapter.appendText("redactions", "t1.jsonl", "{\"v\":1}\n").get();
        storageAdapter.appendText("redactions", "t1.jsonl", "{\"v\":2}\n").get();

        assertEquals("{\"v\":1}\n{\"v\":2}\n", storageAdapter.getText("redactions", "t1.jsonl").get());
    }

    @Test
    void shouldBlockPathTraversal() {
        CompletionException ex = assertThrows(CompletionException.class,
                () -> storageAdapter.getText(TURNS, "../../etc/passwd").join());

        assertInstanceOf(IllegalArgumentException.class, ex.getCause());
        assertTrue(ex.getCause().getMessage().contains("Path traversal blocked"));
    }
}
