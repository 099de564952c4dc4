package cloud.rentdesk.sdk.context;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class FileContextIdStoreTest {

    @TempDir
    Path tempDir;

    @Test
    void survivesANewInstance() throws IOException {
        Path file = tempDir.resolve("state/context.properties");
        new FileContextIdStore(file).save("ctx-42");

        FileContextIdStore reopened = new FileContextIdStore(file);

        assertEquals("ctx-42", reopened.load().orElseThrow());
        assertTrue(Files.readString(file).contains(ContextIdStore.KEY + "=ctx-42"));
    }

    @Test
    void overwritesWithoutLeavingTempFiles() throws IOException {
        Path file = tempDir.resolve("context.properties");
        FileContextIdStore store = new FileContextIdStore(file);

        store.save("ctx-1");
        store.save("ctx-2");

        assertEquals("ctx-2", store.load().orElseThrow());
        try (Stream<Path> entries = Files.list(tempDir)) {
            assertEquals(1, entries.count());
        }
    }

    @Test
    void clearRemovesTheFile() {
        Path file = tempDir.resolve("context.properties");
        FileContextIdStore store = new FileContextIdStore(file);
        store.save("ctx-1");

        store.clear();
        store.clear();

        assertFalse(Files.exists(file));
        assertTrue(store.load().isEmpty());
    }

    @Test
    void ignoresBlankIds() {
        FileContextIdStore store = new FileContextIdStore(tempDir.resolve("context.properties"));

        store.save("  ");

        assertTrue(store.load().isEmpty());
    }
}
