package com.example.reference_oracle.store;

import com.example.reference_oracle.error.StateStorageException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Optional;

/**
 * Keeps the state blob in a single file. Saves go through a sibling temp file
 * and a rename, so readers see either the old blob or the new one.
 */
public class FileStateStorage implements StateStorage {

    private static final Logger log = LoggerFactory.getLogger(FileStateStorage.class);

    private final Path path;

    public FileStateStorage(Path path) {
        this.path = path.toAbsolutePath();
    }

    public Path getPath() {
        return path;
    }

    @Override
    public Optional<byte[]> load() {
        if (!Files.exists(path)) {
            return Optional.empty();
        }
        try {
            return Optional.of(Files.readAllBytes(path));
        } catch (IOException e) {
            throw new StateStorageException("Failed to read state from " + path, e);
        }
    }

    @Override
    public void save(byte[] blob) {
        Path tmp = path.resolveSibling(path.getFileName() + ".tmp");
        try {
            Path parent = path.getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            Files.write(tmp, blob);
            try {
                Files.move(tmp, path, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            } catch (AtomicMoveNotSupportedException e) {
                log.debug("Atomic move not supported for {}, falling back to replace", path);
                Files.move(tmp, path, StandardCopyOption.REPLACE_EXISTING);
            }
        } catch (IOException e) {
            throw new StateStorageException("Failed to write state to " + path, e);
        }
    }
}
