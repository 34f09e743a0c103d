package com.nilsson.soeji.service.tags;

import com.nilsson.soeji.data.TagRepository;
import com.nilsson.soeji.model.TagStats;

import javax.inject.Inject;
import java.sql.SQLException;

/**
 <h2>TagPopularityEvaluator</h2>
 <p>
 Decides whether a tag is exposed to search. A tag qualifies when any user attached it by hand,
 or when more than half of its metadata uses are positive. A tag mostly seen in negative prompts
 (such as {@code blurry}) is kept out of suggestions.
 </p>
 */
public class TagPopularityEvaluator {

    private final TagRepository tagRepository;

    @Inject
    public TagPopularityEvaluator(TagRepository tagRepository) {
        this.tagRepository = tagRepository;
    }

    public TagEvaluation evaluate(long tagId) throws SQLException {
        return tagRepository.getStats(tagId)
                .map(TagPopularityEvaluator::evaluate)
                .orElseGet(TagEvaluation::missing);
    }

    public static TagEvaluation evaluate(TagStats stats) {
        int metadataTotal = stats.metadataPositive + stats.metadataNegative;
        boolean userTag = stats.user > 0;
        boolean positiveTag = metadataTotal > 0 && (double) stats.metadataPositive / metadataTotal > 0.5;
        return new TagEvaluation(stats.tag, userTag || positiveTag, stats.metadataPositive + stats.user);
    }
}
