package com.nilsson.soeji.service;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.inject.Inject;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 <h2>FolderImportService</h2>
 <p>
 Bulk ingestion of every PNG in a folder (not recursive). Files are submitted in batches to the
 shared worker executor; each file goes through the normal {@link IngestionService} pipeline, so
 re-importing a folder only reports duplicates.
 </p>
 <p>
 Imports never fail on a missing lossless derivative: those are logged and left to the
 reindex tool. One failing file never aborts the folder.
 </p>
 */
public class FolderImportService {

    private static final Logger logger = LoggerFactory.getLogger(FolderImportService.class);
    static final int BATCH_SIZE = 20;

    // --- Dependencies ---
    private final IngestionService ingestion;
    private final ExecutorService executor;

    @Inject
    public FolderImportService(IngestionService ingestion, ExecutorService executor) {
        this.ingestion = ingestion.withOptions(ingestion.getOptions().withLosslessFailureFatal(false));
        this.executor = executor;
    }

    /**
     Imports the folder and waits for every file to finish.

     @throws IOException if the folder cannot be listed
     */
    public ImportSummary importFolder(Path folder) throws IOException, InterruptedException {
        if (!Files.isDirectory(folder)) {
            throw new IOException("Not a directory: " + folder);
        }

        List<Path> files;
        try (Stream<Path> listing = Files.list(folder)) {
            files = listing.filter(FolderImportService::isPngFile).sorted().collect(Collectors.toList());
        }
        logger.info("Importing {} files from {}", files.size(), folder);

        ImportSummary summary = new ImportSummary();
        for (int i = 0; i < files.size(); i += BATCH_SIZE) {
            List<Path> batch = files.subList(i, Math.min(i + BATCH_SIZE, files.size()));
            processBatch(batch, summary);
        }

        logger.info("Import of {} finished: {} created, {} duplicate, {} failed",
                folder, summary.getCreated(), summary.getDuplicate(), summary.getFailed());
        return summary;
    }

    // --- Core Processing Logic ---

    private void processBatch(List<Path> batch, ImportSummary summary) throws InterruptedException {
        List<Future<IngestResult>> futures = new ArrayList<>();
        for (Path file : batch) {
            futures.add(executor.submit(ingestTask(file)));
        }

        for (int i = 0; i < batch.size(); i++) {
            Path file = batch.get(i);
            try {
                IngestResult result = futures.get(i).get();
                if (result.isDuplicate()) {
                    logger.info("[duplicate] {} (image {})", file.getFileName(), result.getImage().getId());
                    summary.duplicate++;
                } else {
                    logger.info("[created] {} (image {})", file.getFileName(), result.getImage().getId());
                    summary.created++;
                }
            } catch (ExecutionException e) {
                Throwable cause = e.getCause() != null ? e.getCause() : e;
                logger.error("[failed] {}: {}", file.getFileName(), cause.getMessage(), cause);
                summary.failures.add(file);
            }
        }
    }

    private Callable<IngestResult> ingestTask(Path file) {
        return () -> ingestion.ingest(Files.readAllBytes(file), file.getFileName().toString());
    }

    static boolean isPngFile(Path file) {
        return Files.isRegularFile(file)
                && file.getFileName().toString().toLowerCase(Locale.ROOT).endsWith(".png");
    }

    // --- Data Transfer Objects ---

    /**
     Per-outcome counts of one folder import.
     */
    public static class ImportSummary {
        private int created;
        private int duplicate;
        private final List<Path> failures = new ArrayList<>();

        public int getCreated() {
            return created;
        }

        public int getDuplicate() {
            return duplicate;
        }

        public int getFailed() {
            return failures.size();
        }

        public List<Path> getFailures() {
            return Collections.unmodifiableList(failures);
        }

        public boolean hasFailures() {
            return !failures.isEmpty();
        }
    }
}
