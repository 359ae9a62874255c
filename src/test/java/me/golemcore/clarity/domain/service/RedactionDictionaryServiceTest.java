package me.golemcore.clarity.domain.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import me.golemcore.clarity.adapter.outbound.storage.LocalStorageAdapter;
import me.golemcore.clarity.domain.exception.StorageException;
import me.golemcore.clarity.infrastructure.config.AutoConfiguration;
import me.golemcore.clarity.infrastructure.config.ClarityProperties;
import me.golemcore.clarity.port.outbound.StoragePort;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.CompletableFuture;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyBoolean;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class RedactionDictionaryServiceTest {

    @TempDir
    Path tempDir;

    private LocalStorageAdapter storage;
    private ObjectMapper objectMapper;
    private RedactionDictionaryService service;

    @BeforeEach
    void setUp() {
        ClarityProperties properties = new ClarityProperties();
        properties.getStorage().getLocal().setBasePath(tempDir.toString());
        storage = new LocalStorageAdapter(properties);
        storage.init();
        objectMapper = AutoConfiguration.objectMapper();
        service = new RedactionDictionaryService(storage, objectMapper);
    }

    @Test
    void shouldStartEmptyWithoutDictionaryFile() {
        assertTrue(service.tokens().isEmpty());
    }

    @Test
    void shouldAddTrimmedTokensSortedCaseInsensitively() {
        assertTrue(service.add("  Zed Corp "));
        assertTrue(service.add("alice"));
        assertTrue(service.add("Bob"));

        assertEquals(List.of("alice", "Bob", "Zed Corp"), service.tokens());
    }

    @Test
    void shouldRejectBlankAndDuplicateTokens() {
        assertTrue(service.add("Alice"));

        assertFalse(service.add("   "));
        assertFalse(service.add(null));
        assertFalse(service.add("ALICE"));
        assertEquals(List.of("Alice"), service.tokens());
    }

    @Test
    void shouldRemoveTokenIgnoringCase() {
        service.add("Alice");
        service.add("Bob");

        assertTrue(service.remove("alice"));
        assertFalse(service.remove("carol"));
        assertEquals(List.of("Bob"), service.tokens());
    }

    @Test
    void shouldWipeAllTokens() {
        service.add("Alice");
        service.wipe();

        assertTrue(service.tokens().isEmpty());
    }

    @Test
    void shouldPersistAcrossInstances() {
        service.add("Alice");
        service.add("555-1234");

        RedactionDictionaryService reloaded = new RedactionDictionaryService(storage, objectMapper);

        assertEquals(List.of("555-1234", "Alice"), reloaded.tokens());
    }

    @Test
    void shouldChangeFingerprintOnlyWhenTokensChange() {
        String empty = service.fingerprint();
        service.add("Alice");
        String withAlice = service.fingerprint();
        service.add("alice");

        assertNotEquals(empty, withAlice);
        assertEquals(withAlice, service.fingerprint());
    }

    @Test
    void shouldStartEmptyWhenDictionaryFileIsCorrupt() {
        storage.putTextAtomic(RedactionDictionaryService.DICTIONARY_DIR, RedactionDictionaryService.DICTIONARY_FILE,
                "{not json", false).join();

        assertTrue(service.tokens().isEmpty());
    }

    @Test
    void shouldKeepPreviousTokensWhenWriteFails() {
        StoragePort failing = mock(StoragePort.class);
        when(failing.getText(anyString(), anyString()))
                .thenReturn(CompletableFuture.completedFuture("{\"tokens\":[\"Alice\"]}"));
        when(failing.putTextAtomic(anyString(), anyString(), anyString(), anyBoolean()))
                .thenReturn(CompletableFuture.failedFuture(new IOException("disk full")));
        RedactionDictionaryService broken = new RedactionDictionaryService(failing, objectMapper);

        StorageException error = assertThrows(StorageException.class, () -> broken.add("Bob"));

        assertInstanceOf(IOException.class, error.getCause());
        assertEquals(List.of("Alice"), broken.tokens());
    }

    @Test
    void shouldNormalizeRawTokenList() {
        assertEquals(List.of("a", "B"), RedactionDictionaryService.normalize(List.of(" B", "a", "", "b ")));
    }
}
