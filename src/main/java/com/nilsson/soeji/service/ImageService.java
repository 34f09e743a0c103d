package com.nilsson.soeji.service;

import com.nilsson.soeji.data.ImageRepository;
import com.nilsson.soeji.data.TagRepository;
import com.nilsson.soeji.model.ImageRecord;
import com.nilsson.soeji.service.search.SearchIndexSynchronizer;
import com.nilsson.soeji.service.storage.BlobStore;
import com.nilsson.soeji.service.storage.StorageException;
import com.nilsson.soeji.service.storage.StorageKeys;
import com.nilsson.soeji.service.tags.TagIndexer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.inject.Inject;
import java.sql.SQLException;
import java.util.List;
import java.util.Optional;

/**
 Lookup and operator deletion of stored images.
 */
public class ImageService {

    private static final Logger logger = LoggerFactory.getLogger(ImageService.class);

    private final ImageRepository imageRepository;
    private final TagRepository tagRepository;
    private final TagIndexer tagIndexer;
    private final SearchIndexSynchronizer synchronizer;
    private final BlobStore blobStore;

    @Inject
    public ImageService(ImageRepository imageRepository, TagRepository tagRepository, TagIndexer tagIndexer,
                        SearchIndexSynchronizer synchronizer, BlobStore blobStore) {
        this.imageRepository = imageRepository;
        this.tagRepository = tagRepository;
        this.tagIndexer = tagIndexer;
        this.synchronizer = synchronizer;
        this.blobStore = blobStore;
    }

    public Optional<ImageRecord> findImage(long imageId) throws SQLException {
        return imageRepository.findById(imageId);
    }

    /**
     Deletes an image with its metadata and tag associations, removes its search document and
     its stored objects, then re-evaluates the tags it carried.

     @return false if no such image exists
     */
    public boolean deleteImage(long imageId) throws SQLException {
        Optional<ImageRecord> image = imageRepository.findById(imageId);
        if (image.isEmpty()) return false;

        List<Long> tagIds = tagRepository.findTagIdsForImage(imageId);
        if (!imageRepository.delete(imageId)) return false;

        synchronizer.removeImage(imageId);
        deleteBlobs(image.get());
        tagIndexer.reevaluate(tagIds);

        logger.info("Deleted image {} ({}), {} tags re-evaluated", imageId, image.get().getFilename(), tagIds.size());
        return true;
    }

    private void deleteBlobs(ImageRecord image) {
        String originalKey = image.getStorageKey();
        for (String key : List.of(originalKey,
                StorageKeys.sibling(originalKey, StorageKeys.LOSSLESS_SUFFIX),
                StorageKeys.sibling(originalKey, StorageKeys.METADATA_SUFFIX))) {
            try {
                blobStore.delete(key);
            } catch (StorageException e) {
                // Content-addressed objects left behind are harmless
                logger.warn("Could not delete stored object {}: {}", key, e.getMessage());
            }
        }
    }
}
