package com.clinicsync.client.store;

import com.clinicsync.core.error.PersistenceException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Optional;

/**
 * One file per key under a base directory.
 * <p>
 * Writes go to a temporary file in the same directory and are then moved over the target,
 * so a crash mid-write leaves the previous snapshot intact.
 * </p>
 */
public class FileDurableStore implements IDurableStore {
    private static final Logger log = LoggerFactory.getLogger(FileDurableStore.class);

    private static final String SUFFIX = ".json";
    private static final String TEMP_SUFFIX = ".tmp";

    private final Path baseDir;

    public FileDurableStore(Path baseDir) {
        this.baseDir = baseDir;
        try {
            Files.createDirectories(baseDir);
        } catch (IOException e) {
            throw new PersistenceException(baseDir.toString(), "Cannot create storage directory", e);
        }
        log.info("File store at {}", baseDir.toAbsolutePath());
    }

    @Override
    public Optional<String> read(String key) {
        Path file = fileFor(key);
        try {
            return Optional.of(Files.readString(file, StandardCharsets.UTF_8));
        } catch (NoSuchFileException e) {
            return Optional.empty();
        } catch (IOException e) {
            throw new PersistenceException(key, "Read failed", e);
        }
    }

    @Override
    public void write(String key, String value) {
        Path target = fileFor(key);
        Path temp = target.resolveSibling(target.getFileName() + TEMP_SUFFIX);
        try {
            Files.writeString(temp, value, StandardCharsets.UTF_8);
            try {
                Files.move(temp, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING);
            }
        } catch (IOException e) {
            throw new PersistenceException(key, "Write failed", e);
        }
    }

    @Override
    public void delete(String key) {
        try {
            Files.deleteIfExists(fileFor(key));
        } catch (IOException e) {
            throw new PersistenceException(key, "Delete failed", e);
        }
    }

    Path fileFor(String key) {
        // Keys contain ':' which is not portable in file names
        String name = key.replaceAll("[^A-Za-z0-9._-]", "_");
        return baseDir.resolve(name + SUFFIX);
    }
}
