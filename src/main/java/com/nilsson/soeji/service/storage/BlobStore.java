package com.nilsson.soeji.service.storage;

/**
 Key/value object storage for original images and their derived artifacts. Keys are
 deterministic (see {@link StorageKeys}), so writing the same content twice lands on the same
 object.
 */
public interface BlobStore {

    void put(String key, byte[] content, String contentType) throws StorageException;

    /**
     @throws StorageException if the object does not exist or cannot be read
     */
    byte[] get(String key) throws StorageException;

    /**
     Removes the object. Deleting a key that does not exist is not an error.
     */
    void delete(String key) throws StorageException;

    boolean exists(String key) throws StorageException;
}
