package com.nilsson.soeji.testsupport;

import com.google.inject.Guice;
import com.google.inject.Injector;
import com.google.inject.Module;
import com.google.inject.util.Modules;
import com.nilsson.soeji.data.DatabaseService;
import com.nilsson.soeji.main.AppConfig;
import com.nilsson.soeji.main.AppModule;
import com.nilsson.soeji.service.search.SearchIndexSynchronizer;
import com.nilsson.soeji.service.search.SqliteDocumentIndex;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Properties;
import java.util.concurrent.ExecutorService;

/**
 The production object graph on stores inside a temporary directory. Modules passed to
 {@link #start} override the application bindings.
 */
public final class TestApp implements AutoCloseable {

    private final Injector injector;
    private final Path blobRoot;

    private TestApp(Injector injector, Path blobRoot) {
        this.injector = injector;
        this.blobRoot = blobRoot;
    }

    public static TestApp start(Path dir, Module... overrides) {
        Properties properties = new Properties();
        properties.setProperty(AppConfig.DB_URL, TestStores.jdbcUrl(dir, "soeji.db"));
        properties.setProperty(AppConfig.SEARCH_URL, TestStores.jdbcUrl(dir, "search.db"));
        properties.setProperty(AppConfig.BLOB_ROOT, dir.resolve("blobs").toString());
        return start(properties, overrides);
    }

    public static TestApp start(Properties properties, Module... overrides) {
        AppConfig config = new AppConfig(properties);
        Module module = Modules.override(new AppModule(config)).with(overrides);
        TestApp app = new TestApp(Guice.createInjector(module), Paths.get(config.getBlobRoot()));
        app.get(SearchIndexSynchronizer.class).configureCollections();
        return app;
    }

    public <T> T get(Class<T> type) {
        return injector.getInstance(type);
    }

    public Path getBlobRoot() {
        return blobRoot;
    }

    @Override
    public void close() {
        get(ExecutorService.class).shutdownNow();
        get(SqliteDocumentIndex.class).shutdown();
        get(DatabaseService.class).shutdown();
    }
}
