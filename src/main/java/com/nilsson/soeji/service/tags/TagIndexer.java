package com.nilsson.soeji.service.tags;

import com.nilsson.soeji.service.search.SearchIndexSynchronizer;
import com.nilsson.soeji.service.search.TagDocument;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.inject.Inject;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;

/**
 Re-evaluates tags after their associations changed and brings the {@code tags} collection in
 line: qualifying tags are (re)written with their current count, all others are removed.
 */
public class TagIndexer {

    private static final Logger logger = LoggerFactory.getLogger(TagIndexer.class);

    private final TagPopularityEvaluator evaluator;
    private final SearchIndexSynchronizer synchronizer;
    private final TagSuggestionCache suggestionCache;

    @Inject
    public TagIndexer(TagPopularityEvaluator evaluator, SearchIndexSynchronizer synchronizer,
                      TagSuggestionCache suggestionCache) {
        this.evaluator = evaluator;
        this.synchronizer = synchronizer;
        this.suggestionCache = suggestionCache;
    }

    public void reevaluate(Collection<Long> tagIds) throws SQLException {
        if (tagIds.isEmpty()) return;

        List<TagDocument> upserts = new ArrayList<>();
        for (long tagId : new LinkedHashSet<>(tagIds)) {
            TagEvaluation evaluation = evaluator.evaluate(tagId);
            if (evaluation.shouldIndex()) {
                upserts.add(TagDocument.of(evaluation.getTag(), evaluation.getDisplayCount()));
            } else {
                synchronizer.removeTag(tagId);
            }
        }
        if (!upserts.isEmpty()) {
            synchronizer.upsertTags(upserts);
        }
        logger.debug("Re-evaluated {} tags, {} indexed", tagIds.size(), upserts.size());
        suggestionCache.markStale();
    }
}
