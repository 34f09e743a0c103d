package com.nilsson.soeji.service.search;

import java.util.ArrayList;
import java.util.List;

/**
 Parameters of an image search as a client submits them.
 */
public final class ImageSearchRequest {

    private final String query;
    private final List<String> tags;
    private final boolean positiveTagsOnly;
    private final boolean andMode;
    private final String sort;
    private final int limit;
    private final int offset;

    private ImageSearchRequest(Builder builder) {
        this.query = builder.query == null ? "" : builder.query;
        this.tags = List.copyOf(builder.tags);
        this.positiveTagsOnly = builder.positiveTagsOnly;
        this.andMode = builder.andMode;
        this.sort = builder.sort;
        this.limit = builder.limit;
        this.offset = builder.offset;
    }

    public static Builder builder() {
        return new Builder();
    }

    public String getQuery() {
        return query;
    }

    public List<String> getTags() {
        return tags;
    }

    /**
     When set, tag filters match {@code positiveTags} and the text only searches positive prompt
     attributes.
     */
    public boolean isPositiveTagsOnly() {
        return positiveTagsOnly;
    }

    public boolean isAndMode() {
        return andMode;
    }

    /**
     Sort expression such as {@code seed:asc}, or {@code null} for newest first.
     */
    public String getSort() {
        return sort;
    }

    public int getLimit() {
        return limit;
    }

    public int getOffset() {
        return offset;
    }

    public static final class Builder {
        private String query;
        private final List<String> tags = new ArrayList<>();
        private boolean positiveTagsOnly;
        private boolean andMode;
        private String sort;
        private int limit = SearchQuery.DEFAULT_LIMIT;
        private int offset;

        private Builder() {
        }

        public Builder query(String query) {
            this.query = query;
            return this;
        }

        public Builder tag(String tag) {
            this.tags.add(tag);
            return this;
        }

        public Builder positiveTagsOnly(boolean positiveTagsOnly) {
            this.positiveTagsOnly = positiveTagsOnly;
            return this;
        }

        public Builder andMode(boolean andMode) {
            this.andMode = andMode;
            return this;
        }

        public Builder sort(String sort) {
            this.sort = sort;
            return this;
        }

        public Builder limit(int limit) {
            this.limit = limit;
            return this;
        }

        public Builder offset(int offset) {
            this.offset = offset;
            return this;
        }

        public ImageSearchRequest build() {
            return new ImageSearchRequest(this);
        }
    }
}
