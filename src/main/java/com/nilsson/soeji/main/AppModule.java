package com.nilsson.soeji.main;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.google.inject.AbstractModule;
import com.google.inject.Provides;
import com.google.inject.Singleton;
import com.nilsson.soeji.data.DatabaseService;
import com.nilsson.soeji.data.ImageRepository;
import com.nilsson.soeji.data.TagRepository;
import com.nilsson.soeji.service.FolderImportService;
import com.nilsson.soeji.service.ImageService;
import com.nilsson.soeji.service.IngestionOptions;
import com.nilsson.soeji.service.IngestionService;
import com.nilsson.soeji.service.derivative.LosslessEncoder;
import com.nilsson.soeji.service.derivative.PngLosslessEncoder;
import com.nilsson.soeji.service.parser.PromptParser;
import com.nilsson.soeji.service.png.PngChunkReader;
import com.nilsson.soeji.service.reader.MetadataReaderRegistry;
import com.nilsson.soeji.service.reader.NovelAIPngReader;
import com.nilsson.soeji.service.reindex.ReindexService;
import com.nilsson.soeji.service.search.DocumentIndex;
import com.nilsson.soeji.service.search.SearchIndexSynchronizer;
import com.nilsson.soeji.service.search.SearchService;
import com.nilsson.soeji.service.search.SqliteDocumentIndex;
import com.nilsson.soeji.service.storage.BlobStore;
import com.nilsson.soeji.service.storage.LocalBlobStore;
import com.nilsson.soeji.service.tags.TagIndexer;
import com.nilsson.soeji.service.tags.TagPopularityEvaluator;
import com.nilsson.soeji.service.tags.TagSuggestionCache;
import com.nilsson.soeji.service.tags.UserTagService;

import java.nio.file.Paths;
import java.time.Clock;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

public class AppModule extends AbstractModule {

    private final AppConfig config;

    public AppModule(AppConfig config) {
        this.config = config;
    }

    @Override
    protected void configure() {
        bind(AppConfig.class).toInstance(config);

        bind(PngChunkReader.class).in(Singleton.class);
        bind(NovelAIPngReader.class).in(Singleton.class);
        bind(MetadataReaderRegistry.class).in(Singleton.class);
        bind(ImageRepository.class).in(Singleton.class);
        bind(SearchIndexSynchronizer.class).in(Singleton.class);
        bind(SearchService.class).in(Singleton.class);
        bind(TagPopularityEvaluator.class).in(Singleton.class);
        bind(TagIndexer.class).in(Singleton.class);
        bind(UserTagService.class).in(Singleton.class);
        bind(ImageService.class).in(Singleton.class);
        bind(FolderImportService.class).in(Singleton.class);
        bind(ReindexService.class).in(Singleton.class);
        bind(LosslessEncoder.class).to(PngLosslessEncoder.class).in(Singleton.class);
    }

    @Provides
    @Singleton
    public ObjectMapper provideObjectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        mapper.configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
        return mapper;
    }

    @Provides
    @Singleton
    public Clock provideClock() {
        return Clock.systemUTC();
    }

    @Provides
    @Singleton
    public PromptParser providePromptParser(ObjectMapper mapper) {
        return new PromptParser(mapper);
    }

    // --- Stores ---

    @Provides
    @Singleton
    public DatabaseService provideDatabaseService() {
        return new DatabaseService(config.getDbUrl());
    }

    @Provides
    @Singleton
    public TagRepository provideTagRepository(DatabaseService db) {
        return new TagRepository(db, config.getTagLookupMaxAttempts());
    }

    @Provides
    @Singleton
    public SqliteDocumentIndex provideSqliteDocumentIndex(ObjectMapper mapper) {
        return new SqliteDocumentIndex(config.getSearchUrl(), mapper);
    }

    @Provides
    @Singleton
    public DocumentIndex provideDocumentIndex(SqliteDocumentIndex index) {
        return index;
    }

    @Provides
    @Singleton
    public BlobStore provideBlobStore() {
        return new LocalBlobStore(Paths.get(config.getBlobRoot()));
    }

    // --- Services ---

    @Provides
    @Singleton
    public TagSuggestionCache provideTagSuggestionCache(TagRepository tagRepository, Clock clock) {
        return new TagSuggestionCache(tagRepository, clock, config.getTagCacheStaleAfter());
    }

    @Provides
    @Singleton
    public IngestionService provideIngestionService(ImageRepository imageRepository,
                                                    MetadataReaderRegistry readerRegistry,
                                                    PngChunkReader chunkReader,
                                                    BlobStore blobStore,
                                                    LosslessEncoder losslessEncoder,
                                                    TagIndexer tagIndexer,
                                                    SearchIndexSynchronizer synchronizer,
                                                    ObjectMapper mapper,
                                                    Clock clock) {
        IngestionOptions options = new IngestionOptions(config.isLosslessEnabled(), config.isLosslessFailureFatal());
        return new IngestionService(imageRepository, readerRegistry, chunkReader, blobStore, losslessEncoder,
                tagIndexer, synchronizer, mapper, clock, options);
    }

    /**
     Shared pool for folder imports. Daemon threads, so pending work never blocks JVM exit.
     */
    @Provides
    @Singleton
    public ExecutorService provideExecutorService() {
        return Executors.newFixedThreadPool(
                Runtime.getRuntime().availableProcessors() + 2,
                new ThreadFactory() {
                    private final AtomicInteger count = new AtomicInteger(1);

                    @Override
                    public Thread newThread(Runnable r) {
                        Thread t = new Thread(r);
                        t.setDaemon(true);
                        t.setName("Ingest-Worker-" + count.getAndIncrement());
                        return t;
                    }
                }
        );
    }
}
