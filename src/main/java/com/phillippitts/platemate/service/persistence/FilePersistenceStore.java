package com.phillippitts.platemate.service.persistence;

import com.phillippitts.platemate.exception.PersistenceException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Objects;
import java.util.Optional;

/**
 * Stores state in a single file. Writes go to a sibling temp file that is then moved over the
 * target, so a crash never leaves a half-written state file.
 */
public class FilePersistenceStore implements PersistenceStore {

    private static final Logger LOG = LogManager.getLogger(FilePersistenceStore.class);

    private final Path file;

    public FilePersistenceStore(Path file) {
        this.file = Objects.requireNonNull(file, "file").toAbsolutePath();
    }

    @Override
    public Optional<byte[]> loadState() {
        if (!Files.exists(file)) {
            return Optional.empty();
        }
        try {
            return Optional.of(Files.readAllBytes(file));
        } catch (IOException e) {
            throw new PersistenceException("Failed to read state file " + file, e);
        }
    }

    @Override
    public synchronized void saveState(byte[] state) {
        Objects.requireNonNull(state, "state");
        Path tmp = null;
        try {
            Path dir = file.getParent();
            if (dir != null) {
                Files.createDirectories(dir);
            }
            tmp = Files.createTempFile(dir, file.getFileName().toString(), ".tmp");
            Files.write(tmp, state);
            try {
                Files.move(tmp, file, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(tmp, file, StandardCopyOption.REPLACE_EXISTING);
            }
            LOG.debug("Saved {} bytes of state to {}", state.length, file);
        } catch (IOException e) {
            deleteQuietly(tmp);
            throw new PersistenceException("Failed to write state file " + file, e);
        }
    }

    public Path getFile() {
        return file;
    }

    private static void deleteQuietly(Path tmp) {
        if (tmp == null) {
            return;
        }
        try {
            Files.deleteIfExists(tmp);
        } catch (IOException e) {
            LOG.debug("Could not delete temp file {}: {}", tmp, e.getMessage());
        }
    }
}
