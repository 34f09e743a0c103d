package com.nilsson.soeji.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.nilsson.soeji.data.ImageRepository;
import com.nilsson.soeji.data.TagRepository;
import com.nilsson.soeji.model.ImageRecord;
import com.nilsson.soeji.service.ProcessingException.ErrorCode;
import com.nilsson.soeji.service.derivative.LosslessEncoder;
import com.nilsson.soeji.service.derivative.MetadataSidecar;
import com.nilsson.soeji.service.search.DocumentIndex;
import com.nilsson.soeji.service.storage.BlobStore;
import com.nilsson.soeji.service.storage.ContentHasher;
import com.nilsson.soeji.service.storage.StorageKeys;
import com.nilsson.soeji.testsupport.TestApp;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.stream.Collectors;

import static com.nilsson.soeji.testsupport.PngFixtures.*;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

/**
 End-to-end ingestion against the wired application on temporary stores.
 */
class IngestionServiceTest {

    private static final String COMMENT = "{\"prompt\":\"1girl, {smile}, artist:someone\","
            + "\"uc\":\"lowres, blurry\",\"seed\":42,\"steps\":28,\"scale\":5.0,\"sampler\":\"k_euler\","
            + "\"width\":832,\"height\":1216}";

    @TempDir
    Path tempDir;

    private TestApp app;
    private IngestionService ingestion;

    @BeforeEach
    void setUp() {
        app = TestApp.start(tempDir);
        ingestion = app.get(IngestionService.class);
    }

    @AfterEach
    void tearDown() {
        if (app != null) app.close();
    }

    @Test
    void testIngest_storesPersistsAndIndexes() throws Exception {
        byte[] png = withComment(COMMENT, 0x336699);
        String hash = ContentHasher.sha256Hex(png);

        IngestResult result = ingestion.ingest(png, "upload.png");

        assertEquals(IngestResult.Status.CREATED, result.getStatus());
        assertEquals("nai", result.getMetadataFormat());
        ImageRecord image = result.getImage();
        assertEquals(StorageKeys.original(hash), image.getStorageKey());
        assertEquals("upload.png", image.getFilename());
        assertTrue(image.hasLosslessDerivative());
        assertTrue(image.hasMetadataFile());

        BlobStore blobs = app.get(BlobStore.class);
        assertArrayEquals(png, blobs.get(StorageKeys.original(hash)));
        assertTrue(blobs.exists(StorageKeys.lossless(hash)));

        ObjectMapper mapper = app.get(ObjectMapper.class);
        MetadataSidecar sidecar = MetadataSidecar.fromJson(mapper, blobs.get(StorageKeys.metadata(hash)));
        assertEquals("nai", sidecar.getFormat());
        assertEquals("upload.png", sidecar.getFilename());
        assertEquals("1girl, {smile}, artist:someone", sidecar.getMetadata().getPrompt());
        assertNotNull(sidecar.getUploadedAt());

        List<String> tagNames = image.getTags().stream().map(t -> t.tagName).collect(Collectors.toList());
        assertEquals(List.of("1girl", "smile", "artist:someone", "lowres", "blurry"), tagNames);
        assertEquals(42L, image.getMetadata().getSeed());

        DocumentIndex index = app.get(DocumentIndex.class);
        JsonNode document = index.getDocument(DocumentIndex.IMAGES, String.valueOf(image.getId())).orElseThrow();
        assertEquals(3, document.get("positiveTags").size());
        assertEquals(2, document.get("negativeTags").size());

        TagRepository tags = app.get(TagRepository.class);
        long smileId = tags.findByName("smile").orElseThrow().id;
        long lowresId = tags.findByName("lowres").orElseThrow().id;
        assertTrue(index.getDocument(DocumentIndex.TAGS, String.valueOf(smileId)).isPresent());
        assertTrue(index.getDocument(DocumentIndex.TAGS, String.valueOf(lowresId)).isEmpty(),
                "tags only seen in negative prompts stay out of search");
    }

    @Test
    void testIngest_sameBytesTwiceIsDuplicate() throws Exception {
        byte[] png = withComment(COMMENT, 0x010203);

        IngestResult first = ingestion.ingest(png, "a.png");
        IngestResult second = ingestion.ingest(png, "renamed.png");

        assertTrue(second.isDuplicate());
        assertEquals(first.getImage().getId(), second.getImage().getId());
        assertNull(second.getMetadataFormat());
        assertEquals(1, app.get(ImageRepository.class).countImages());
    }

    @Test
    void testIngest_rejectsNonPng() throws Exception {
        byte[] text = "GIF89a not a png".getBytes(StandardCharsets.US_ASCII);

        ProcessingException e = assertThrows(ProcessingException.class, () -> ingestion.ingest(text, "fake.png"));

        assertEquals(ErrorCode.NOT_PNG, e.getCode());
        assertEquals(0, app.get(ImageRepository.class).countImages());
    }

    @Test
    void testIngest_headerDimensionsWinOverMetadata() throws Exception {
        byte[] png = png(16, 12, 0xAABBCC, tEXt("Comment", "{\"prompt\":\"cat\",\"width\":832,\"height\":1216}"));

        ImageRecord image = ingestion.ingest(png, "small.png").getImage();

        assertEquals(16, image.getWidth());
        assertEquals(12, image.getHeight());
        assertEquals(16, image.getMetadata().getWidth());
    }

    @Test
    void testIngest_pngWithoutMetadataIsAccepted() throws Exception {
        IngestResult result = ingestion.ingest(png(4, 4, 0x00FF00), "plain.png");

        assertEquals(IngestResult.Status.CREATED, result.getStatus());
        assertTrue(result.getImage().getTags().isEmpty());
        assertEquals(4, result.getImage().getWidth());
    }

    @Test
    void testIngest_losslessDisabled() throws Exception {
        IngestionService noLossless = ingestion.withOptions(new IngestionOptions(false, true));
        byte[] png = withComment(COMMENT, 0x445566);

        ImageRecord image = noLossless.ingest(png, "a.png").getImage();

        assertFalse(image.hasLosslessDerivative());
        assertFalse(app.get(BlobStore.class).exists(StorageKeys.lossless(ContentHasher.sha256Hex(png))));
    }

    @Test
    void testIngest_derivativeFailureIsFatalByDefault() throws Exception {
        LosslessEncoder failing = failingEncoder();
        app.close();
        app = TestApp.start(tempDir, binder -> binder.bind(LosslessEncoder.class).toInstance(failing));
        ingestion = app.get(IngestionService.class);

        ProcessingException e = assertThrows(ProcessingException.class,
                () -> ingestion.ingest(withComment(COMMENT, 0x778899), "a.png"));

        assertEquals(ErrorCode.DERIVATIVE_FAILED, e.getCode());
        assertEquals(0, app.get(ImageRepository.class).countImages());
    }

    @Test
    void testIngest_nonFatalDerivativeFailureLeavesRepairableImage() throws Exception {
        LosslessEncoder failing = failingEncoder();
        app.close();
        app = TestApp.start(tempDir, binder -> binder.bind(LosslessEncoder.class).toInstance(failing));
        IngestionService lenient = app.get(IngestionService.class)
                .withOptions(new IngestionOptions(true, false));

        ImageRecord image = lenient.ingest(withComment(COMMENT, 0x778899), "a.png").getImage();

        assertFalse(image.hasLosslessDerivative());
        assertEquals(List.of(image.getId()), app.get(ImageRepository.class).findIdsWithoutLosslessDerivative());
    }

    @Test
    void testIngest_concurrentUploadsShareOneNewTag() throws Exception {
        byte[] first = withComment("{\"prompt\":\"fresh_tag, cat\"}", 0x111111);
        byte[] second = withComment("{\"prompt\":\"fresh_tag, dog\"}", 0x222222);
        CountDownLatch start = new CountDownLatch(1);
        ExecutorService executor = Executors.newFixedThreadPool(2);
        IngestResult a;
        IngestResult b;
        try {
            Future<IngestResult> futureA = executor.submit(() -> {
                start.await();
                return ingestion.ingest(first, "a.png");
            });
            Future<IngestResult> futureB = executor.submit(() -> {
                start.await();
                return ingestion.ingest(second, "b.png");
            });
            start.countDown();
            a = futureA.get(30, TimeUnit.SECONDS);
            b = futureB.get(30, TimeUnit.SECONDS);
        } finally {
            executor.shutdownNow();
        }

        assertEquals(IngestResult.Status.CREATED, a.getStatus());
        assertEquals(IngestResult.Status.CREATED, b.getStatus());

        TagRepository tags = app.get(TagRepository.class);
        assertEquals(3, tags.countTags(), "fresh_tag, cat and dog");
        long sharedId = tags.findByName("fresh_tag").orElseThrow().id;
        assertTrue(tags.findTagIdsForImage(a.getImage().getId()).contains(sharedId));
        assertTrue(tags.findTagIdsForImage(b.getImage().getId()).contains(sharedId));
        assertEquals(2, tags.getStats(sharedId).orElseThrow().metadataPositive);

        JsonNode tagDocument = app.get(DocumentIndex.class)
                .getDocument(DocumentIndex.TAGS, String.valueOf(sharedId)).orElseThrow();
        assertEquals("fresh_tag", tagDocument.get("name").asText());
    }

    private static LosslessEncoder failingEncoder() throws IOException {
        LosslessEncoder encoder = mock(LosslessEncoder.class);
        when(encoder.keySuffix()).thenReturn(StorageKeys.LOSSLESS_SUFFIX);
        when(encoder.contentType()).thenReturn(StorageKeys.PNG_CONTENT_TYPE);
        when(encoder.encode(any())).thenThrow(new IOException("encoder crashed"));
        return encoder;
    }
}
