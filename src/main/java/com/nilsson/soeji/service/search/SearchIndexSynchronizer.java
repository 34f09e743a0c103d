package com.nilsson.soeji.service.search;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.nilsson.soeji.data.ImageRepository;
import com.nilsson.soeji.model.ImageRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.inject.Inject;
import java.sql.SQLException;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 <h2>SearchIndexSynchronizer</h2>
 <p>
 Translates relational records into {@link DocumentIndex} operations. It is the only writer of
 the {@code images} and {@code tags} collections. Both are projections that can be rebuilt from
 the relational store at any time.
 </p>
 */
public class SearchIndexSynchronizer {

    private static final Logger logger = LoggerFactory.getLogger(SearchIndexSynchronizer.class);

    public static final IndexSettings IMAGE_SETTINGS = new IndexSettings(
            List.of("prompt", "v4BaseCaption", "v4CharCaptions", "tags", "positiveTags", "userTags"),
            List.of("tags", "positiveTags", "negativeTags", "userTags", "seed", "width", "height"),
            List.of("createdAt", "seed", "width", "height"));

    public static final IndexSettings TAG_SETTINGS = new IndexSettings(
            List.of("name", "nameTokens"),
            List.of("category"),
            List.of("imageCount", "name"));

    private final DocumentIndex index;
    private final ImageRepository imageRepository;
    private final ObjectMapper mapper;

    @Inject
    public SearchIndexSynchronizer(DocumentIndex index, ImageRepository imageRepository, ObjectMapper mapper) {
        this.index = index;
        this.imageRepository = imageRepository;
        this.mapper = mapper;
    }

    /**
     Declares the attribute sets of both collections. Safe to call on every start.
     */
    public void configureCollections() {
        index.configure(DocumentIndex.IMAGES, IMAGE_SETTINGS);
        index.configure(DocumentIndex.TAGS, TAG_SETTINGS);
    }

    // --- Images ---

    /**
     Writes the full document of an image loaded with its metadata and tags.
     */
    public void publishImage(ImageRecord image) {
        index.addDocuments(DocumentIndex.IMAGES, List.of(toNode(ImageDocument.from(image))));
        logger.debug("Published image document {}", image.getId());
    }

    public void publishImages(List<ImageRecord> images) {
        index.addDocuments(DocumentIndex.IMAGES, images.stream()
                .map(image -> toNode(ImageDocument.from(image)))
                .collect(Collectors.toList()));
    }

    /**
     Partial update: only the given attributes of the image document change.
     */
    public void updateImage(long imageId, Map<String, ?> fields) {
        ObjectNode partial = mapper.valueToTree(fields);
        partial.put("id", imageId);
        index.updateDocuments(DocumentIndex.IMAGES, List.of(partial));
    }

    /**
     Rewrites the tag facet arrays of an image from its current associations. An image that no
     longer exists loses its document.
     */
    public void refreshImageTags(long imageId) throws SQLException {
        Optional<ImageRecord> image = imageRepository.findById(imageId);
        if (image.isEmpty()) {
            removeImage(imageId);
            return;
        }
        ImageDocument document = ImageDocument.from(image.get());
        ObjectNode partial = mapper.createObjectNode();
        partial.put("id", imageId);
        partial.set(ImageDocument.TAGS, mapper.valueToTree(document.getTags()));
        partial.set(ImageDocument.POSITIVE_TAGS, mapper.valueToTree(document.getPositiveTags()));
        partial.set(ImageDocument.NEGATIVE_TAGS, mapper.valueToTree(document.getNegativeTags()));
        partial.set(ImageDocument.USER_TAGS, mapper.valueToTree(document.getUserTags()));
        partial.set(ImageDocument.WEIGHTED_TAGS, mapper.valueToTree(document.getWeightedTags()));
        index.updateDocuments(DocumentIndex.IMAGES, List.of(partial));
    }

    public void removeImage(long imageId) {
        if (!index.deleteDocument(DocumentIndex.IMAGES, String.valueOf(imageId))) {
            logger.debug("Image document {} was not indexed", imageId);
        }
    }

    // --- Tags ---

    public void upsertTags(List<TagDocument> tags) {
        index.addDocuments(DocumentIndex.TAGS, tags.stream().map(this::toNode).collect(Collectors.toList()));
    }

    public void removeTag(long tagId) {
        index.deleteDocument(DocumentIndex.TAGS, String.valueOf(tagId));
    }

    public void clearTags() {
        index.deleteAllDocuments(DocumentIndex.TAGS);
    }

    private ObjectNode toNode(Object document) {
        return mapper.valueToTree(document);
    }
}
