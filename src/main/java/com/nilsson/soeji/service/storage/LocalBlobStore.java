package com.nilsson.soeji.service.storage;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;

/**
 <h2>LocalBlobStore</h2>
 <p>
 {@link BlobStore} backed by a directory on the local disk. Objects are written to a temporary
 sibling first and moved into place, so a reader never observes a half-written object.
 </p>
 */
public class LocalBlobStore implements BlobStore {

    private static final Logger logger = LoggerFactory.getLogger(LocalBlobStore.class);

    private final Path baseDir;

    public LocalBlobStore(Path baseDir) {
        this.baseDir = baseDir.toAbsolutePath().normalize();
    }

    public Path getBaseDir() {
        return baseDir;
    }

    @Override
    public void put(String key, byte[] content, String contentType) throws StorageException {
        Path target = resolve(key);
        Path temp = null;
        try {
            Files.createDirectories(target.getParent());
            temp = Files.createTempFile(target.getParent(), ".upload-", ".tmp");
            Files.write(temp, content);
            try {
                Files.move(temp, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING);
            }
            logger.debug("Stored {} ({} bytes, {})", key, content.length, contentType);
        } catch (IOException e) {
            discardTemp(temp);
            throw new StorageException("Failed to store object: " + key, e);
        }
    }

    private static void discardTemp(Path temp) {
        if (temp == null) return;
        try {
            Files.deleteIfExists(temp);
        } catch (IOException e) {
            logger.warn("Could not remove temporary file {}: {}", temp, e.getMessage());
        }
    }

    @Override
    public byte[] get(String key) throws StorageException {
        Path path = resolve(key);
        try {
            return Files.readAllBytes(path);
        } catch (NoSuchFileException e) {
            throw new StorageException("Object not found: " + key, e);
        } catch (IOException e) {
            throw new StorageException("Failed to read object: " + key, e);
        }
    }

    @Override
    public void delete(String key) throws StorageException {
        try {
            Files.deleteIfExists(resolve(key));
        } catch (IOException e) {
            throw new StorageException("Failed to delete object: " + key, e);
        }
    }

    @Override
    public boolean exists(String key) throws StorageException {
        return Files.exists(resolve(key));
    }

    private Path resolve(String key) throws StorageException {
        Path path = baseDir.resolve(key).normalize();
        if (!path.startsWith(baseDir) || path.equals(baseDir)) {
            throw new StorageException("Invalid object key: " + key);
        }
        return path;
    }
}
