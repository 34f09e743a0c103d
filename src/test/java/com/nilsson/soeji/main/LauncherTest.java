package com.nilsson.soeji.main;

import com.google.inject.Guice;
import com.google.inject.Injector;
import com.nilsson.soeji.service.reindex.ReindexOptions;
import com.nilsson.soeji.service.reindex.ReindexTarget;
import com.nilsson.soeji.testsupport.TestStores;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;
import java.util.Properties;
import java.util.concurrent.ExecutorService;

import static org.junit.jupiter.api.Assertions.*;

class LauncherTest {

    @TempDir
    Path tempDir;

    @Test
    void testShutdown_stopsWorkerPool() throws Exception {
        Properties properties = new Properties();
        properties.setProperty(AppConfig.DB_URL, TestStores.jdbcUrl(tempDir, "soeji.db"));
        properties.setProperty(AppConfig.SEARCH_URL, TestStores.jdbcUrl(tempDir, "search.db"));
        properties.setProperty(AppConfig.BLOB_ROOT, tempDir.resolve("blobs").toString());
        Injector injector = Guice.createInjector(new AppModule(new AppConfig(properties)));
        ExecutorService executor = injector.getInstance(ExecutorService.class);
        executor.submit(() -> { }).get();

        Launcher.shutdown(injector);

        assertTrue(executor.isShutdown());
        assertTrue(executor.isTerminated());
    }

    @Test
    void testParseReindexOptions_allFlags() {
        ReindexOptions options = Launcher.parseReindexOptions(List.of(
                "--only", "tags", "--batch-size", "50", "--concurrency", "2", "--sleep", "250", "--dry-run", "--verbose"));

        assertEquals(List.of(ReindexTarget.REINDEX_TAGS), options.targets());
        assertEquals(50, options.getBatchSize());
        assertEquals(2, options.getConcurrency());
        assertEquals(250, options.getSleepMillis());
        assertTrue(options.isDryRun());
        assertTrue(options.isVerbose());
    }

    @Test
    void testParseReindexOptions_noFlagsRunsEverything() {
        ReindexOptions options = Launcher.parseReindexOptions(List.of());

        assertEquals(4, options.targets().size());
        assertFalse(options.isDryRun());
    }

    @Test
    void testParseReindexOptions_rejectsBadInput() {
        assertThrows(IllegalArgumentException.class, () -> Launcher.parseReindexOptions(List.of("--only", "thumbnails")));
        assertThrows(IllegalArgumentException.class, () -> Launcher.parseReindexOptions(List.of("--batch-size")));
        assertThrows(IllegalArgumentException.class, () -> Launcher.parseReindexOptions(List.of("--batch-size", "many")));
        assertThrows(IllegalArgumentException.class, () -> Launcher.parseReindexOptions(List.of("--concurrency", "0")));
        assertThrows(IllegalArgumentException.class, () -> Launcher.parseReindexOptions(List.of("--force")));
    }

    @Test
    void testParseImportFolder() {
        assertEquals(Paths.get("incoming"), Launcher.parseImportFolder(List.of("--verbose", "incoming")));
        assertThrows(IllegalArgumentException.class, () -> Launcher.parseImportFolder(List.of()));
        assertThrows(IllegalArgumentException.class, () -> Launcher.parseImportFolder(List.of("a", "b")));
        assertThrows(IllegalArgumentException.class, () -> Launcher.parseImportFolder(List.of("--recursive", "a")));
    }

    @Test
    void testRun_invalidArgumentsExitWithFailure() {
        assertEquals(Launcher.EXIT_FAILURE, Launcher.run(new String[0]));
        assertEquals(Launcher.EXIT_FAILURE, Launcher.run(new String[]{"serve"}));
        assertEquals(Launcher.EXIT_FAILURE, Launcher.run(new String[]{"reindex", "--only", "nope"}));
        assertEquals(Launcher.EXIT_FAILURE, Launcher.run(new String[]{"import"}));
    }
}
