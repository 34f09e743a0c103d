package com.nilsson.soeji.service.tags;

import com.nilsson.soeji.data.TagRepository;
import com.nilsson.soeji.model.TagRecord;
import com.nilsson.soeji.model.TagStats;
import org.junit.jupiter.api.Test;

import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

class TagPopularityEvaluatorTest {

    private static final TagRecord TAG = new TagRecord(1, "blurry", null);

    @Test
    void testEvaluate_mostlyPositiveQualifies() {
        TagEvaluation evaluation = TagPopularityEvaluator.evaluate(new TagStats(TAG, 3, 2, 0));

        assertTrue(evaluation.shouldIndex());
        assertEquals(3, evaluation.getDisplayCount());
    }

    @Test
    void testEvaluate_mostlyNegativeIsHidden() {
        TagEvaluation evaluation = TagPopularityEvaluator.evaluate(new TagStats(TAG, 2, 3, 0));

        assertFalse(evaluation.shouldIndex());
        assertEquals(2, evaluation.getDisplayCount());
    }

    @Test
    void testEvaluate_evenSplitIsHidden() {
        assertFalse(TagPopularityEvaluator.evaluate(new TagStats(TAG, 2, 2, 0)).shouldIndex());
    }

    @Test
    void testEvaluate_userTagAlwaysQualifies() {
        TagEvaluation userOnly = TagPopularityEvaluator.evaluate(new TagStats(TAG, 0, 0, 1));
        TagEvaluation userOverNegative = TagPopularityEvaluator.evaluate(new TagStats(TAG, 0, 5, 2));

        assertTrue(userOnly.shouldIndex());
        assertEquals(1, userOnly.getDisplayCount());
        assertTrue(userOverNegative.shouldIndex());
        assertEquals(2, userOverNegative.getDisplayCount(), "negative uses never count");
    }

    @Test
    void testEvaluate_unusedTagIsHidden() {
        TagEvaluation evaluation = TagPopularityEvaluator.evaluate(new TagStats(TAG, 0, 0, 0));

        assertFalse(evaluation.shouldIndex());
        assertSame(TAG, evaluation.getTag());
    }

    @Test
    void testEvaluate_byIdLoadsStats() throws Exception {
        TagRepository repository = mock(TagRepository.class);
        when(repository.getStats(1)).thenReturn(Optional.of(new TagStats(TAG, 1, 0, 0)));
        when(repository.getStats(2)).thenReturn(Optional.empty());
        TagPopularityEvaluator evaluator = new TagPopularityEvaluator(repository);

        assertTrue(evaluator.evaluate(1).shouldIndex());

        TagEvaluation missing = evaluator.evaluate(2);
        assertFalse(missing.shouldIndex());
        assertNull(missing.getTag());
    }
}
