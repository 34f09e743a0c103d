package com.nilsson.soeji.service.tags;

import com.nilsson.soeji.data.ImageRepository;
import com.nilsson.soeji.data.TagRepository;
import com.nilsson.soeji.model.TagRecord;
import com.nilsson.soeji.service.parser.ParsedTag;
import com.nilsson.soeji.service.parser.PromptParser;
import com.nilsson.soeji.service.search.SearchIndexSynchronizer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.inject.Inject;
import java.sql.SQLException;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.Optional;

/**
 Manual tagging. A user tag always makes its tag search-worthy, so every change is followed by
 tag re-evaluation and a refresh of the image's tag facets.
 */
public class UserTagService {

    private static final Logger logger = LoggerFactory.getLogger(UserTagService.class);

    private final ImageRepository imageRepository;
    private final TagRepository tagRepository;
    private final TagIndexer tagIndexer;
    private final SearchIndexSynchronizer synchronizer;

    @Inject
    public UserTagService(ImageRepository imageRepository, TagRepository tagRepository,
                          TagIndexer tagIndexer, SearchIndexSynchronizer synchronizer) {
        this.imageRepository = imageRepository;
        this.tagRepository = tagRepository;
        this.tagIndexer = tagIndexer;
        this.synchronizer = synchronizer;
    }

    /**
     Attaches a tag to an image. Adding a tag the image already carries changes nothing.

     @return true if a new association was created
     @throws IllegalArgumentException if the name normalizes to nothing
     @throws NoSuchElementException if the image does not exist
     */
    public boolean addUserTag(long imageId, String name) throws SQLException {
        String normalized = normalize(name);
        requireImage(imageId);

        TagRecord tag = tagRepository.findOrCreate(normalized);
        boolean added = tagRepository.addUserTag(imageId, tag.id);
        if (added) {
            logger.info("Added user tag '{}' to image {}", normalized, imageId);
            tagIndexer.reevaluate(List.of(tag.id));
            synchronizer.refreshImageTags(imageId);
        }
        return added;
    }

    /**
     Detaches a user-added tag. Tags that came from the image's metadata stay.

     @return true if an association was removed
     */
    public boolean removeUserTag(long imageId, String name) throws SQLException {
        String normalized = normalize(name);
        Optional<TagRecord> tag = tagRepository.findByName(normalized);
        if (tag.isEmpty()) return false;

        boolean removed = tagRepository.removeUserTag(imageId, tag.get().id);
        if (removed) {
            logger.info("Removed user tag '{}' from image {}", normalized, imageId);
            tagIndexer.reevaluate(List.of(tag.get().id));
            synchronizer.refreshImageTags(imageId);
        }
        return removed;
    }

    private void requireImage(long imageId) throws SQLException {
        if (imageRepository.findById(imageId).isEmpty()) {
            throw new NoSuchElementException("Image not found: " + imageId);
        }
    }

    static String normalize(String name) {
        ParsedTag parsed = PromptParser.parseTagWeight(name);
        if (parsed == null) {
            throw new IllegalArgumentException("Not a valid tag name: " + name);
        }
        return parsed.getName();
    }
}
