package cloud.rentdesk.sdk.context;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Objects;
import java.util.Optional;
import java.util.Properties;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * {@link ContextIdStore} backed by a small properties file. Writes go to a sibling temp file that is then moved
 * over the target, so a crash never leaves a half-written file behind.
 */
public final class FileContextIdStore implements ContextIdStore {

    private static final Logger LOGGER = Logger.getLogger(FileContextIdStore.class.getName());

    private final Path file;
    private final Object lock = new Object();

    public FileContextIdStore(Path file) {
        this.file = Objects.requireNonNull(file, "file").toAbsolutePath();
    }

    public Path getFile() {
        return file;
    }

    @Override
    public Optional<String> load() {
        synchronized (lock) {
            if (!Files.isRegularFile(file)) {
                return Optional.empty();
            }
            Properties properties = new Properties();
            try (InputStream in = Files.newInputStream(file)) {
                properties.load(in);
            } catch (IOException ex) {
                LOGGER.log(Level.WARNING, ex, () -> "[rentdesk-sdk] failed to read context store " + file);
                return Optional.empty();
            }
            String value = properties.getProperty(KEY);
            return value == null || value.isBlank() ? Optional.empty() : Optional.of(value.trim());
        }
    }

    @Override
    public void save(String contextId) {
        if (contextId == null || contextId.isBlank()) {
            return;
        }
        synchronized (lock) {
            Properties properties = new Properties();
            properties.setProperty(KEY, contextId);
            try {
                Path parent = file.getParent();
                if (parent != null) {
                    Files.createDirectories(parent);
                }
                Path temp = Files.createTempFile(parent, file.getFileName().toString(), ".tmp");
                try (OutputStream out = Files.newOutputStream(temp)) {
                    properties.store(out, "rentdesk active context");
                }
                move(temp);
            } catch (IOException ex) {
                LOGGER.log(Level.WARNING, ex, () -> "[rentdesk-sdk] failed to store context id in " + file);
            }
        }
    }

    @Override
    public void clear() {
        synchronized (lock) {
            try {
                Files.deleteIfExists(file);
            } catch (IOException ex) {
                LOGGER.log(Level.WARNING, ex, () -> "[rentdesk-sdk] failed to clear context store " + file);
            }
        }
    }

    private void move(Path temp) throws IOException {
        try {
            Files.move(temp, file, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
        } catch (AtomicMoveNotSupportedException ex) {
            Files.move(temp, file, StandardCopyOption.REPLACE_EXISTING);
        } finally {
            Files.deleteIfExists(temp);
        }
    }
}
