package com.nilsson.soeji.service.tags;

import com.nilsson.soeji.model.TagRecord;

/**
 Outcome of popularity evaluation for one tag.
 */
public final class TagEvaluation {

    private static final TagEvaluation MISSING = new TagEvaluation(null, false, 0);

    private final TagRecord tag;
    private final boolean shouldIndex;
    private final int displayCount;

    public TagEvaluation(TagRecord tag, boolean shouldIndex, int displayCount) {
        this.tag = tag;
        this.shouldIndex = shouldIndex;
        this.displayCount = displayCount;
    }

    /**
     Evaluation of a tag that no longer exists.
     */
    public static TagEvaluation missing() {
        return MISSING;
    }

    /**
     The evaluated tag, or {@code null} if it does not exist.
     */
    public TagRecord getTag() {
        return tag;
    }

    public boolean shouldIndex() {
        return shouldIndex;
    }

    /**
     Positive metadata uses plus user uses. Negative-prompt uses never count.
     */
    public int getDisplayCount() {
        return displayCount;
    }

    @Override
    public String toString() {
        return "TagEvaluation{" + (tag == null ? "missing" : tag.name)
                + ", shouldIndex=" + shouldIndex + ", displayCount=" + displayCount + "}";
    }
}
