package com.nilsson.soeji.service;

import com.nilsson.soeji.data.TagRepository;
import com.nilsson.soeji.model.ImageRecord;
import com.nilsson.soeji.service.search.DocumentIndex;
import com.nilsson.soeji.service.storage.BlobStore;
import com.nilsson.soeji.service.storage.StorageKeys;
import com.nilsson.soeji.service.tags.UserTagService;
import com.nilsson.soeji.testsupport.TestApp;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;

import static com.nilsson.soeji.testsupport.PngFixtures.withComment;
import static org.junit.jupiter.api.Assertions.*;

class ImageServiceTest {

    @TempDir
    Path tempDir;

    private TestApp app;
    private ImageService images;

    @BeforeEach
    void setUp() {
        app = TestApp.start(tempDir);
        images = app.get(ImageService.class);
    }

    @AfterEach
    void tearDown() {
        app.close();
    }

    @Test
    void testDeleteImage_removesEverythingAndReevaluatesTags() throws Exception {
        IngestionService ingestion = app.get(IngestionService.class);
        ImageRecord doomed = ingestion.ingest(withComment("{\"prompt\":\"lonely_tag, shared\"}", 0x102030), "a.png").getImage();
        ingestion.ingest(withComment("{\"prompt\":\"shared\"}", 0x405060), "b.png");

        TagRepository tags = app.get(TagRepository.class);
        DocumentIndex index = app.get(DocumentIndex.class);
        long lonelyId = tags.findByName("lonely_tag").orElseThrow().id;
        long sharedId = tags.findByName("shared").orElseThrow().id;
        assertTrue(index.getDocument(DocumentIndex.TAGS, String.valueOf(lonelyId)).isPresent());

        assertTrue(images.deleteImage(doomed.getId()));

        assertTrue(images.findImage(doomed.getId()).isEmpty());
        assertTrue(index.getDocument(DocumentIndex.IMAGES, String.valueOf(doomed.getId())).isEmpty());
        assertTrue(index.getDocument(DocumentIndex.TAGS, String.valueOf(lonelyId)).isEmpty());
        assertEquals(1, index.getDocument(DocumentIndex.TAGS, String.valueOf(sharedId)).orElseThrow()
                .get("imageCount").asInt());

        BlobStore blobs = app.get(BlobStore.class);
        String key = doomed.getStorageKey();
        assertFalse(blobs.exists(key));
        assertFalse(blobs.exists(StorageKeys.sibling(key, StorageKeys.LOSSLESS_SUFFIX)));
        assertFalse(blobs.exists(StorageKeys.sibling(key, StorageKeys.METADATA_SUFFIX)));
    }

    @Test
    void testDeleteImage_unknownId() throws Exception {
        assertFalse(images.deleteImage(12345));
    }

    @Test
    void testUserTagFlowThroughIndex() throws Exception {
        IngestionService ingestion = app.get(IngestionService.class);
        ingestion.ingest(withComment("{\"prompt\":\"cat\",\"uc\":\"blurry\"}", 0x0A0B0C), "cat.png");
        ImageRecord image = ingestion.ingest(withComment("{\"prompt\":\"dog\"}", 0x0C0B0A), "dog.png").getImage();
        UserTagService userTags = app.get(UserTagService.class);
        DocumentIndex index = app.get(DocumentIndex.class);
        long blurryId = app.get(TagRepository.class).findByName("blurry").orElseThrow().id;

        assertTrue(userTags.addUserTag(image.getId(), "Blurry"));

        assertEquals(1, index.getDocument(DocumentIndex.TAGS, String.valueOf(blurryId)).orElseThrow()
                .get("imageCount").asInt());
        assertEquals("blurry", index.getDocument(DocumentIndex.IMAGES, String.valueOf(image.getId())).orElseThrow()
                .get("userTags").get(0).asText());

        assertTrue(userTags.removeUserTag(image.getId(), "blurry"));

        assertTrue(index.getDocument(DocumentIndex.TAGS, String.valueOf(blurryId)).isEmpty());
        assertEquals(0, index.getDocument(DocumentIndex.IMAGES, String.valueOf(image.getId())).orElseThrow()
                .get("userTags").size());
    }
}
