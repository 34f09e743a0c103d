package com.nilsson.soeji.service.reindex;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.nilsson.soeji.data.ImageRepository;
import com.nilsson.soeji.data.TagRepository;
import com.nilsson.soeji.model.ImageRecord;
import com.nilsson.soeji.service.derivative.LosslessEncoder;
import com.nilsson.soeji.service.derivative.MetadataSidecar;
import com.nilsson.soeji.service.png.PngChunkReader;
import com.nilsson.soeji.service.reader.MetadataReadResult;
import com.nilsson.soeji.service.reader.MetadataReaderRegistry;
import com.nilsson.soeji.service.reindex.ReindexSummary.TargetCounts;
import com.nilsson.soeji.service.search.ImageDocument;
import com.nilsson.soeji.service.search.IndexException;
import com.nilsson.soeji.service.search.SearchIndexSynchronizer;
import com.nilsson.soeji.service.search.TagDocument;
import com.nilsson.soeji.service.storage.BlobStore;
import com.nilsson.soeji.service.storage.StorageKeys;
import com.nilsson.soeji.service.tags.TagEvaluation;
import com.nilsson.soeji.service.tags.TagPopularityEvaluator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.inject.Inject;
import java.sql.SQLException;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 <h2>ReindexService</h2>
 <p>
 Offline repair driver over the relational store, which is the source of truth. Each target
 closes one of the gaps the ingestion pipeline can leave behind:
 </p>
 <ul>
 <li><b>lossless-derivative:</b> re-encodes the original of every image flagged as missing its
 lossless copy, then sets the flag in the database and the image document.</li>
 <li><b>metadata-sidecar:</b> re-reads the original's metadata and writes the missing sidecar.</li>
 <li><b>reindex-images:</b> upserts the document of every image. Nothing is cleared.</li>
 <li><b>reindex-tags:</b> clears the tag collection and writes every qualifying tag again.</li>
 </ul>
 <p>
 Work runs in fixed-size batches, each drained by a bounded pool of workers, with an optional
 pause between batches. A failing item is logged and counted; the run continues. In dry-run mode
 the same per-item lines are logged with a {@code [dry-run]} marker and nothing is written.
 </p>
 */
public class ReindexService {

    private static final Logger logger = LoggerFactory.getLogger(ReindexService.class);
    static final int TAG_BATCH_SIZE = 1000;

    @FunctionalInterface
    private interface ImageJob {
        /**
         @return false if the image was skipped
         */
        boolean run(long imageId) throws Exception;
    }

    // --- Dependencies ---
    private final ImageRepository imageRepository;
    private final TagRepository tagRepository;
    private final BlobStore blobStore;
    private final LosslessEncoder losslessEncoder;
    private final MetadataReaderRegistry readerRegistry;
    private final PngChunkReader chunkReader;
    private final SearchIndexSynchronizer synchronizer;
    private final ObjectMapper mapper;
    private final Clock clock;

    @Inject
    public ReindexService(ImageRepository imageRepository, TagRepository tagRepository, BlobStore blobStore,
                          LosslessEncoder losslessEncoder, MetadataReaderRegistry readerRegistry,
                          PngChunkReader chunkReader, SearchIndexSynchronizer synchronizer,
                          ObjectMapper mapper, Clock clock) {
        this.imageRepository = imageRepository;
        this.tagRepository = tagRepository;
        this.blobStore = blobStore;
        this.losslessEncoder = losslessEncoder;
        this.readerRegistry = readerRegistry;
        this.chunkReader = chunkReader;
        this.synchronizer = synchronizer;
        this.mapper = mapper;
        this.clock = clock;
    }

    public ReindexSummary run(ReindexOptions options) throws SQLException, InterruptedException {
        logger.info("=== Reindex ===");
        logger.info("Options: {}", options);

        ReindexSummary summary = new ReindexSummary();
        try (BoundedWorkerPool pool = new BoundedWorkerPool(options.getConcurrency())) {
            for (ReindexTarget target : options.targets()) {
                TargetCounts counts = summary.start(target);
                switch (target) {
                    case LOSSLESS_DERIVATIVE:
                        generateLosslessDerivatives(options, pool, counts);
                        break;
                    case METADATA_SIDECAR:
                        generateMetadataSidecars(options, pool, counts);
                        break;
                    case REINDEX_IMAGES:
                        reindexImages(options, pool, counts);
                        break;
                    case REINDEX_TAGS:
                        reindexTags(options, counts);
                        break;
                }
                logger.info("Completed {}: {}", target, counts);
            }
        }

        logger.info("=== Reindex completed ===");
        return summary;
    }

    // --- Derivatives ---

    private void generateLosslessDerivatives(ReindexOptions options, BoundedWorkerPool pool, TargetCounts counts)
            throws SQLException, InterruptedException {
        logger.info("=== Processing {} ===", ReindexTarget.LOSSLESS_DERIVATIVE);
        List<Long> ids = imageRepository.findIdsWithoutLosslessDerivative();
        logger.info("Found {} images without lossless derivative", ids.size());

        runInBatches(ids, options, pool, counts, imageId -> {
            Optional<ImageRecord> image = imageRepository.findById(imageId);
            if (image.isEmpty()) return skipMissing(imageId);

            String originalKey = image.get().getStorageKey();
            String key = StorageKeys.sibling(originalKey, losslessEncoder.keySuffix());
            if (options.isDryRun()) {
                logger.info("  [dry-run] {}", key);
                return true;
            }

            byte[] encoded = losslessEncoder.encode(blobStore.get(originalKey));
            blobStore.put(key, encoded, losslessEncoder.contentType());
            imageRepository.markLosslessDerivative(imageId);
            synchronizer.updateImage(imageId, Map.of(ImageDocument.HAS_LOSSLESS_DERIVATIVE, true));
            logger.info("  [generated] {}", key);
            return true;
        });
    }

    private void generateMetadataSidecars(ReindexOptions options, BoundedWorkerPool pool, TargetCounts counts)
            throws SQLException, InterruptedException {
        logger.info("=== Processing {} ===", ReindexTarget.METADATA_SIDECAR);
        List<Long> ids = imageRepository.findIdsWithoutMetadataFile();
        logger.info("Found {} images without metadata sidecar", ids.size());

        runInBatches(ids, options, pool, counts, imageId -> {
            Optional<ImageRecord> image = imageRepository.findById(imageId);
            if (image.isEmpty()) return skipMissing(imageId);

            String originalKey = image.get().getStorageKey();
            String key = StorageKeys.sibling(originalKey, StorageKeys.METADATA_SUFFIX);
            if (options.isDryRun()) {
                logger.info("  [dry-run] {}", key);
                return true;
            }

            byte[] original = blobStore.get(originalKey);
            MetadataReadResult result = readerRegistry.detectAndRead(original, originalKey);
            result.getMetadata().applyHeaderDimensions(chunkReader.readDimensions(original));
            byte[] json = MetadataSidecar.of(result, clock.instant(), image.get().getFilename()).toJson(mapper);
            blobStore.put(key, json, StorageKeys.JSON_CONTENT_TYPE);
            imageRepository.markMetadataFile(imageId);
            logger.info("  [generated] {}", key);
            return true;
        });
    }

    // --- Search index ---

    private void reindexImages(ReindexOptions options, BoundedWorkerPool pool, TargetCounts counts)
            throws SQLException, InterruptedException {
        logger.info("=== Reindexing images ===");
        if (!options.isDryRun()) {
            synchronizer.configureCollections();
        }
        List<Long> ids = imageRepository.findAllIds();
        logger.info("Found {} images to reindex", ids.size());

        runInBatches(ids, options, pool, counts, imageId -> {
            Optional<ImageRecord> image = imageRepository.findById(imageId);
            if (image.isEmpty()) return skipMissing(imageId);

            if (options.isDryRun()) {
                logger.info("  [dry-run] {}", image.get().getStorageKey());
                return true;
            }
            synchronizer.publishImage(image.get());
            logger.info("  [indexed] {}", image.get().getStorageKey());
            return true;
        });
    }

    private void reindexTags(ReindexOptions options, TargetCounts counts) throws SQLException, InterruptedException {
        logger.info("=== Reindexing tags ===");
        if (!options.isDryRun()) {
            synchronizer.configureCollections();
            synchronizer.clearTags();
        }

        List<TagDocument> qualifying = new ArrayList<>();
        int[] evaluated = {0};
        tagRepository.forEachTagStats(stats -> {
            evaluated[0]++;
            TagEvaluation evaluation = TagPopularityEvaluator.evaluate(stats);
            if (evaluation.shouldIndex()) {
                qualifying.add(TagDocument.of(stats.tag, evaluation.getDisplayCount()));
            } else {
                counts.skipped();
            }
        });
        logger.info("Found {} tags to evaluate", evaluated[0]);
        logger.info("{} tags qualified for indexing", qualifying.size());

        for (int i = 0; i < qualifying.size(); i += TAG_BATCH_SIZE) {
            List<TagDocument> chunk = qualifying.subList(i, Math.min(i + TAG_BATCH_SIZE, qualifying.size()));
            if (options.isDryRun()) {
                chunk.forEach(tag -> {
                    logger.info("  [dry-run] {}", tag.getName());
                    counts.processed();
                });
            } else {
                try {
                    synchronizer.upsertTags(chunk);
                    chunk.forEach(tag -> {
                        logger.info("  [indexed] {}", tag.getName());
                        counts.processed();
                    });
                } catch (IndexException e) {
                    logger.error("  [failed] {} tags starting at {}: {}", chunk.size(), chunk.get(0).getName(), e.getMessage(), e);
                    chunk.forEach(tag -> counts.failed());
                }
            }
            pauseBetweenBatches(options, i + TAG_BATCH_SIZE < qualifying.size());
        }
    }

    // --- Batching ---

    private void runInBatches(List<Long> ids, ReindexOptions options, BoundedWorkerPool pool,
                              TargetCounts counts, ImageJob job) throws InterruptedException {
        if (ids.isEmpty()) {
            logger.info("No images to process");
            return;
        }

        int batchSize = options.getBatchSize();
        int batches = (ids.size() + batchSize - 1) / batchSize;
        for (int i = 0; i < ids.size(); i += batchSize) {
            List<Long> batch = ids.subList(i, Math.min(i + batchSize, ids.size()));
            logger.info("Processing batch {}/{}...", i / batchSize + 1, batches);

            pool.drain(batch, imageId -> {
                if (job.run(imageId)) counts.processed();
                else counts.skipped();
            }, (imageId, error) -> {
                counts.failed();
                logger.error("  [failed] image {}: {}", imageId, error.getMessage());
                logger.debug("Failure detail for image {}", imageId, error);
            });

            pauseBetweenBatches(options, i + batchSize < ids.size());
        }
    }

    private static void pauseBetweenBatches(ReindexOptions options, boolean moreToCome) throws InterruptedException {
        if (moreToCome && options.getSleepMillis() > 0) {
            Thread.sleep(options.getSleepMillis());
        }
    }

    private static boolean skipMissing(long imageId) {
        logger.info("  [skipped] image {} no longer exists", imageId);
        return false;
    }
}
