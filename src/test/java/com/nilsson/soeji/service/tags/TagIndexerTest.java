package com.nilsson.soeji.service.tags;

import com.nilsson.soeji.model.TagRecord;
import com.nilsson.soeji.service.search.SearchIndexSynchronizer;
import com.nilsson.soeji.service.search.TagDocument;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.MockitoAnnotations;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

class TagIndexerTest {

    @Mock
    private TagPopularityEvaluator evaluator;
    @Mock
    private SearchIndexSynchronizer synchronizer;
    @Mock
    private TagSuggestionCache cache;

    private AutoCloseable mocks;
    private TagIndexer indexer;

    @BeforeEach
    void setUp() {
        mocks = MockitoAnnotations.openMocks(this);
        indexer = new TagIndexer(evaluator, synchronizer, cache);
    }

    @AfterEach
    void tearDown() throws Exception {
        mocks.close();
    }

    @Test
    @SuppressWarnings("unchecked")
    void testReevaluate_upsertsQualifyingAndRemovesOthers() throws Exception {
        TagRecord smile = new TagRecord(1, "smile", null);
        when(evaluator.evaluate(1)).thenReturn(new TagEvaluation(smile, true, 4));
        when(evaluator.evaluate(2)).thenReturn(new TagEvaluation(new TagRecord(2, "blurry", null), false, 0));
        when(evaluator.evaluate(3)).thenReturn(TagEvaluation.missing());

        indexer.reevaluate(List.of(1L, 2L, 3L, 1L));

        ArgumentCaptor<List<TagDocument>> captor = ArgumentCaptor.forClass(List.class);
        verify(synchronizer).upsertTags(captor.capture());
        assertEquals(1, captor.getValue().size());
        assertEquals("smile", captor.getValue().get(0).getName());
        assertEquals(4, captor.getValue().get(0).getImageCount());
        verify(synchronizer).removeTag(2);
        verify(synchronizer).removeTag(3);
        verify(evaluator, times(1)).evaluate(1);
        verify(cache).markStale();
    }

    @Test
    void testReevaluate_nothingToDo() throws Exception {
        indexer.reevaluate(List.of());

        verifyNoInteractions(evaluator, synchronizer, cache);
    }
}
