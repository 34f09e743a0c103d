package com.nilsson.soeji.main;

import ch.qos.logback.classic.Level;
import com.google.inject.Guice;
import com.google.inject.Injector;
import com.nilsson.soeji.data.DatabaseService;
import com.nilsson.soeji.service.FolderImportService;
import com.nilsson.soeji.service.FolderImportService.ImportSummary;
import com.nilsson.soeji.service.reindex.ReindexOptions;
import com.nilsson.soeji.service.reindex.ReindexService;
import com.nilsson.soeji.service.reindex.ReindexSummary;
import com.nilsson.soeji.service.reindex.ReindexTarget;
import com.nilsson.soeji.service.search.SearchIndexSynchronizer;
import com.nilsson.soeji.service.search.SqliteDocumentIndex;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Arrays;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.TimeUnit;

/**
 <h2>Launcher</h2>
 <p>
 Command-line entry point of the operator tools.
 </p>
 <h3>Commands:</h3>
 <ul>
 <li>{@code reindex [--only TARGET] [--batch-size N] [--concurrency N] [--sleep MS] [--dry-run] [--verbose]}</li>
 <li>{@code import <folder> [--verbose]}</li>
 </ul>
 <p>
 Exits with status 1 on invalid arguments or when any item failed.
 </p>
 */
public class Launcher {

    private static final Logger logger = LoggerFactory.getLogger(Launcher.class);
    private static final long EXECUTOR_SHUTDOWN_SECONDS = 30;

    static final int EXIT_OK = 0;
    static final int EXIT_FAILURE = 1;

    // ------------------------------------------------------------------------
    // Entry Point
    // ------------------------------------------------------------------------

    public static void main(String[] args) {
        System.exit(run(args));
    }

    static int run(String[] args) {
        if (args.length == 0) {
            printUsage();
            return EXIT_FAILURE;
        }

        String command = args[0];
        List<String> rest = Arrays.asList(args).subList(1, args.length);
        try {
            switch (command) {
                case "reindex":
                    return reindex(parseReindexOptions(rest));
                case "import":
                    return importFolder(parseImportFolder(rest), rest.contains("--verbose"));
                default:
                    throw new IllegalArgumentException("Unknown command '" + command + "'");
            }
        } catch (IllegalArgumentException e) {
            logger.error("Error: {}", e.getMessage());
            printUsage();
            return EXIT_FAILURE;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            logger.error("Interrupted");
            return EXIT_FAILURE;
        } catch (Exception e) {
            logger.error("{} failed", command, e);
            return EXIT_FAILURE;
        }
    }

    // ------------------------------------------------------------------------
    // Commands
    // ------------------------------------------------------------------------

    private static int reindex(ReindexOptions options) throws Exception {
        if (options.isVerbose()) enableVerboseLogging();

        Injector injector = createInjector();
        try {
            ReindexSummary summary = injector.getInstance(ReindexService.class).run(options);
            logger.info("Summary:\n{}", summary);
            return summary.hasFailures() ? EXIT_FAILURE : EXIT_OK;
        } finally {
            shutdown(injector);
        }
    }

    private static int importFolder(Path folder, boolean verbose) throws Exception {
        if (verbose) enableVerboseLogging();

        Injector injector = createInjector();
        try {
            injector.getInstance(SearchIndexSynchronizer.class).configureCollections();
            ImportSummary summary = injector.getInstance(FolderImportService.class).importFolder(folder);
            return summary.hasFailures() ? EXIT_FAILURE : EXIT_OK;
        } finally {
            shutdown(injector);
        }
    }

    // ------------------------------------------------------------------------
    // Argument Parsing
    // ------------------------------------------------------------------------

    static ReindexOptions parseReindexOptions(List<String> args) {
        ReindexOptions.Builder builder = ReindexOptions.builder();
        for (int i = 0; i < args.size(); i++) {
            String arg = args.get(i);
            switch (arg) {
                case "--only":
                    builder.only(ReindexTarget.fromWireName(valueOf(args, ++i, arg)));
                    break;
                case "--batch-size":
                    builder.batchSize(parseInt(valueOf(args, ++i, arg), arg));
                    break;
                case "--concurrency":
                    builder.concurrency(parseInt(valueOf(args, ++i, arg), arg));
                    break;
                case "--sleep":
                    builder.sleepMillis(parseInt(valueOf(args, ++i, arg), arg));
                    break;
                case "--dry-run":
                    builder.dryRun(true);
                    break;
                case "--verbose":
                    builder.verbose(true);
                    break;
                default:
                    throw new IllegalArgumentException("Unknown option '" + arg + "'");
            }
        }
        return builder.build();
    }

    static Path parseImportFolder(List<String> args) {
        Path folder = null;
        for (String arg : args) {
            if (arg.equals("--verbose")) continue;
            if (arg.startsWith("--")) throw new IllegalArgumentException("Unknown option '" + arg + "'");
            if (folder != null) throw new IllegalArgumentException("import takes exactly one folder");
            folder = Paths.get(arg);
        }
        if (folder == null) throw new IllegalArgumentException("import requires a folder");
        return folder;
    }

    private static String valueOf(List<String> args, int index, String option) {
        if (index >= args.size()) throw new IllegalArgumentException(option + " requires a value");
        return args.get(index);
    }

    private static int parseInt(String value, String option) {
        try {
            return Integer.parseInt(value);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(option + " expects a number, got '" + value + "'");
        }
    }

    // ------------------------------------------------------------------------
    // Lifecycle
    // ------------------------------------------------------------------------

    private static Injector createInjector() {
        return Guice.createInjector(new AppModule(AppConfig.load()));
    }

    static void shutdown(Injector injector) {
        ExecutorService executor = injector.getInstance(ExecutorService.class);
        executor.shutdown();
        try {
            if (!executor.awaitTermination(EXECUTOR_SHUTDOWN_SECONDS, TimeUnit.SECONDS)) {
                logger.warn("Workers still running after {}s, interrupting", EXECUTOR_SHUTDOWN_SECONDS);
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
        injector.getInstance(SqliteDocumentIndex.class).shutdown();
        injector.getInstance(DatabaseService.class).shutdown();
    }

    private static void enableVerboseLogging() {
        org.slf4j.Logger root = LoggerFactory.getLogger("com.nilsson.soeji");
        if (root instanceof ch.qos.logback.classic.Logger) {
            ((ch.qos.logback.classic.Logger) root).setLevel(Level.DEBUG);
        }
    }

    private static void printUsage() {
        System.err.println("Usage:");
        System.err.println("  reindex [--only " + ReindexTarget.validNames().replace(", ", "|") + "]"
                + " [--batch-size N] [--concurrency N] [--sleep MS] [--dry-run] [--verbose]");
        System.err.println("  import <folder> [--verbose]");
    }
}
