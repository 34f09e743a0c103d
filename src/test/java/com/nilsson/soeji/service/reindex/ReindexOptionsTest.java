package com.nilsson.soeji.service.reindex;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ReindexOptionsTest {

    @Test
    void testDefaults() {
        ReindexOptions options = ReindexOptions.defaults();

        assertEquals(ReindexOptions.DEFAULT_BATCH_SIZE, options.getBatchSize());
        assertEquals(ReindexOptions.DEFAULT_CONCURRENCY, options.getConcurrency());
        assertEquals(0, options.getSleepMillis());
        assertFalse(options.isDryRun());
        assertEquals(List.of(ReindexTarget.values()), options.targets());
    }

    @Test
    void testOnlyRestrictsTargets() {
        ReindexOptions options = ReindexOptions.builder().only(ReindexTarget.REINDEX_TAGS).build();

        assertEquals(List.of(ReindexTarget.REINDEX_TAGS), options.targets());
    }

    @Test
    void testBuilderRejectsInvalidValues() {
        assertThrows(IllegalArgumentException.class, () -> ReindexOptions.builder().batchSize(0));
        assertThrows(IllegalArgumentException.class, () -> ReindexOptions.builder().concurrency(0));
        assertThrows(IllegalArgumentException.class, () -> ReindexOptions.builder().sleepMillis(-1));
    }

    @Test
    void testTargetNamesAndAliases() {
        assertEquals(ReindexTarget.LOSSLESS_DERIVATIVE, ReindexTarget.fromWireName("lossless-derivative"));
        assertEquals(ReindexTarget.LOSSLESS_DERIVATIVE, ReindexTarget.fromWireName("lossless-webp"));
        assertEquals(ReindexTarget.METADATA_SIDECAR, ReindexTarget.fromWireName("Metadata-JSON"));
        assertEquals(ReindexTarget.REINDEX_IMAGES, ReindexTarget.fromWireName(" images "));
        assertEquals("reindex-tags", ReindexTarget.REINDEX_TAGS.toString());

        IllegalArgumentException e = assertThrows(IllegalArgumentException.class, () -> ReindexTarget.fromWireName("thumbnails"));
        assertTrue(e.getMessage().contains("reindex-images"));
    }
}
