package me.golemcore.host.adapter.outbound.storage;

import me.golemcore.host.infrastructure.config.HostProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.CompletionException;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class LocalStorageAdapterTest {

    @TempDir
    Path tempDir;

    private LocalStorageAdapter adapter;

    @BeforeEach
    void setUp() {
        HostProperties properties = new HostProperties();
        properties.getStorage().getLocal().setBasePath(tempDir.toString());
        adapter = new LocalStorageAdapter(properties);
        adapter.init();
    }

    @Test
    void shouldCreateAuditDirectoryOnInit() {
        assertTrue(Files.isDirectory(tempDir.resolve("audit")));
    }

    @Test
    void shouldAppendLinesToFile() {
        adapter.appendText("audit", "security-2026-03-01.jsonl", "{\"a\":1}\n").join();
        adapter.appendText("audit", "security-2026-03-01.jsonl", "{\"a\":2}\n").join();

        String content = adapter.getText("audit", "security-2026-03-01.jsonl").join();

        assertEquals("{\"a\":1}\n{\"a\":2}\n", content);
    }

    @Test
    void shouldReturnNullForMissingFile() {
        assertNull(adapter.getText("audit", "missing.jsonl").join());
    }

    @Test
    void shouldListFilesByPrefixInOrder() {
        adapter.appendText("audit", "security-2026-03-02.jsonl", "x\n").join();
        adapter.appendText("audit", "security-2026-03-01.jsonl", "x\n").join();
        adapter.appendText("audit", "other.txt", "x\n").join();

        List<String> files = adapter.listObjects("audit", "security-").join();

        assertEquals(List.of("security-2026-03-01.jsonl", "security-2026-03-02.jsonl"), files);
    }

    @Test
    void shouldListNothingForMissingDirectory() {
        assertTrue(adapter.listObjects("nowhere", "").join().isEmpty());
    }

    @Test
    void shouldCreateRequestedDirectory() {
        adapter.ensureDirectory("exports").join();

        assertTrue(Files.isDirectory(tempDir.resolve("exports")));
    }

    @Test
    void shouldBlockPathTraversal() {
        CompletionException ex = assertThrows(CompletionException.class,
                () -> adapter.appendText("audit", "../../escape.txt", "x").join());

        assertInstanceOf(IllegalArgumentException.class, ex.getCause());
    }
}
