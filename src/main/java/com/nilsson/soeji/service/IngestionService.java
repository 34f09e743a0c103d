package com.nilsson.soeji.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.nilsson.soeji.data.ImageRepository;
import com.nilsson.soeji.data.TagConflictException;
import com.nilsson.soeji.model.GenerationMetadata;
import com.nilsson.soeji.model.ImageRecord;
import com.nilsson.soeji.model.ImageTagRecord;
import com.nilsson.soeji.model.NewImage;
import com.nilsson.soeji.service.ProcessingException.ErrorCode;
import com.nilsson.soeji.service.derivative.LosslessEncoder;
import com.nilsson.soeji.service.derivative.MetadataSidecar;
import com.nilsson.soeji.service.png.PngChunkReader;
import com.nilsson.soeji.service.reader.MetadataReadResult;
import com.nilsson.soeji.service.reader.MetadataReaderRegistry;
import com.nilsson.soeji.service.search.IndexException;
import com.nilsson.soeji.service.search.SearchIndexSynchronizer;
import com.nilsson.soeji.service.storage.BlobStore;
import com.nilsson.soeji.service.storage.ContentHasher;
import com.nilsson.soeji.service.storage.StorageException;
import com.nilsson.soeji.service.storage.StorageKeys;
import com.nilsson.soeji.service.tags.TagIndexer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.sql.SQLException;
import java.time.Clock;
import java.time.Instant;
import java.util.LinkedHashSet;
import java.util.Optional;
import java.util.Set;

/**
 <h2>IngestionService</h2>
 <p>
 Turns the raw bytes of an uploaded PNG into a stored, persisted and searchable image. Content is
 addressed by its SHA-256 hash, so uploading the same bytes twice returns the existing image
 without touching storage, the database or the index a second time.
 </p>
 <h3>Pipeline:</h3>
 <ol>
 <li>Signature check, hash and duplicate lookup.</li>
 <li>Dimensions from the IHDR header, metadata from the Comment chunk.</li>
 <li>Original, lossless derivative and metadata sidecar written to the blob store.</li>
 <li>Image, metadata and tag associations persisted in one transaction.</li>
 <li>Touched tags re-evaluated, image document published.</li>
 </ol>
 <p>
 The blob store, database and index share no transaction. A failure after the blobs are written
 leaves harmless content-addressed objects behind; a failure after persistence leaves an
 unindexed image that the reindex tool repairs.
 </p>
 */
public class IngestionService {

    private static final Logger logger = LoggerFactory.getLogger(IngestionService.class);

    private final ImageRepository imageRepository;
    private final MetadataReaderRegistry readerRegistry;
    private final PngChunkReader chunkReader;
    private final BlobStore blobStore;
    private final LosslessEncoder losslessEncoder;
    private final TagIndexer tagIndexer;
    private final SearchIndexSynchronizer synchronizer;
    private final ObjectMapper mapper;
    private final Clock clock;
    private final IngestionOptions options;

    public IngestionService(ImageRepository imageRepository, MetadataReaderRegistry readerRegistry,
                            PngChunkReader chunkReader, BlobStore blobStore, LosslessEncoder losslessEncoder,
                            TagIndexer tagIndexer, SearchIndexSynchronizer synchronizer,
                            ObjectMapper mapper, Clock clock, IngestionOptions options) {
        this.imageRepository = imageRepository;
        this.readerRegistry = readerRegistry;
        this.chunkReader = chunkReader;
        this.blobStore = blobStore;
        this.losslessEncoder = losslessEncoder;
        this.tagIndexer = tagIndexer;
        this.synchronizer = synchronizer;
        this.mapper = mapper;
        this.clock = clock;
        this.options = options;
    }

    /**
     Same pipeline with different derivative switches, sharing every collaborator.
     */
    public IngestionService withOptions(IngestionOptions newOptions) {
        return new IngestionService(imageRepository, readerRegistry, chunkReader, blobStore, losslessEncoder,
                tagIndexer, synchronizer, mapper, clock, newOptions);
    }

    public IngestionOptions getOptions() {
        return options;
    }

    public IngestResult ingest(byte[] bytes, String filename) throws ProcessingException {
        if (!PngChunkReader.hasSignature(bytes)) {
            throw new ProcessingException(ErrorCode.NOT_PNG, "Not a PNG file: " + filename);
        }

        String hash = ContentHasher.sha256Hex(bytes);
        Optional<ImageRecord> existing = findExisting(hash);
        if (existing.isPresent()) {
            logger.info("Duplicate upload {} matches image {}", filename, existing.get().getId());
            return IngestResult.duplicate(existing.get());
        }

        // --- Extraction ---
        MetadataReadResult readResult = readerRegistry.detectAndRead(bytes, filename);
        GenerationMetadata metadata = readResult.getMetadata();
        metadata.applyHeaderDimensions(chunkReader.readDimensions(bytes));
        Integer width = metadata.getWidth();
        Integer height = metadata.getHeight();

        Instant now = clock.instant();

        // --- Storage ---
        String originalKey = StorageKeys.original(hash);
        try {
            blobStore.put(originalKey, bytes, StorageKeys.PNG_CONTENT_TYPE);
        } catch (StorageException e) {
            throw new ProcessingException(ErrorCode.STORAGE_FAILED, "Failed to store " + originalKey, e);
        }

        boolean hasLossless = options.isLosslessEnabled() && storeLosslessDerivative(hash, bytes);
        storeSidecar(hash, readResult, now, filename);

        // --- Persistence ---
        NewImage newImage = new NewImage(filename, originalKey, hash, width, height, hasLossless, true, now);
        ImageRecord created;
        try {
            Optional<ImageRecord> inserted = imageRepository.create(newImage, metadata);
            if (inserted.isEmpty()) {
                ImageRecord winner = imageRepository.findByHash(hash)
                        .orElseThrow(() -> new SQLException("Image " + hash + " conflicted but cannot be found"));
                logger.info("Concurrent upload of {} resolved to image {}", filename, winner.getId());
                return IngestResult.duplicate(winner);
            }
            created = inserted.get();
        } catch (TagConflictException e) {
            throw new ProcessingException(ErrorCode.TAG_CONFLICT, "Could not resolve tag '" + e.getTagName() + "'", e);
        } catch (SQLException e) {
            throw new ProcessingException(ErrorCode.PERSISTENCE_FAILED, "Failed to persist " + filename, e);
        }

        // --- Indexing ---
        Set<Long> tagIds = new LinkedHashSet<>();
        for (ImageTagRecord tag : created.getTags()) {
            tagIds.add(tag.tagId);
        }
        try {
            tagIndexer.reevaluate(tagIds);
            synchronizer.publishImage(created);
        } catch (SQLException | IndexException e) {
            throw new ProcessingException(ErrorCode.INDEX_FAILED, "Image " + created.getId() + " persisted but not indexed", e);
        }

        logger.info("Ingested {} as image {} ({} tags, format {})",
                filename, created.getId(), tagIds.size(), readResult.getFormat());
        return IngestResult.created(created, readResult.getFormat());
    }

    private Optional<ImageRecord> findExisting(String hash) throws ProcessingException {
        try {
            return imageRepository.findByHash(hash);
        } catch (SQLException e) {
            throw new ProcessingException(ErrorCode.PERSISTENCE_FAILED, "Duplicate lookup failed for " + hash, e);
        }
    }

    private boolean storeLosslessDerivative(String hash, byte[] bytes) throws ProcessingException {
        String key = StorageKeys.sibling(StorageKeys.original(hash), losslessEncoder.keySuffix());
        byte[] encoded;
        try {
            encoded = losslessEncoder.encode(bytes);
        } catch (IOException e) {
            if (options.isLosslessFailureFatal()) {
                throw new ProcessingException(ErrorCode.DERIVATIVE_FAILED, "Failed to derive " + key, e);
            }
            logger.warn("Lossless derivative {} skipped, repairable by reindex: {}", key, e.getMessage());
            return false;
        }
        try {
            blobStore.put(key, encoded, losslessEncoder.contentType());
            return true;
        } catch (StorageException e) {
            throw new ProcessingException(ErrorCode.STORAGE_FAILED, "Failed to store " + key, e);
        }
    }

    private void storeSidecar(String hash, MetadataReadResult readResult, Instant uploadedAt, String filename)
            throws ProcessingException {
        String key = StorageKeys.metadata(hash);
        try {
            byte[] json = MetadataSidecar.of(readResult, uploadedAt, filename).toJson(mapper);
            blobStore.put(key, json, StorageKeys.JSON_CONTENT_TYPE);
        } catch (JsonProcessingException e) {
            throw new ProcessingException(ErrorCode.STORAGE_FAILED, "Failed to serialize " + key, e);
        } catch (StorageException e) {
            throw new ProcessingException(ErrorCode.STORAGE_FAILED, "Failed to store " + key, e);
        }
    }
}
