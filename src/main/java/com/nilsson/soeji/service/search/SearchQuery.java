package com.nilsson.soeji.service.search;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 <h2>SearchQuery</h2>
 <p>
 A query against one collection of a {@link DocumentIndex}: free text, equality filters
 (combined with AND), sort clauses, paging and the attributes the text is matched against.
 </p>
 <p>
 With {@link MatchingStrategy#ALL} a document must contain every query word; with
 {@link MatchingStrategy#ANY} one word suffices and documents matching more words rank first.
 Words match attribute words by prefix.
 </p>
 */
public final class SearchQuery {

    public static final int DEFAULT_LIMIT = 20;

    public enum MatchingStrategy {ALL, ANY}

    private final String text;
    private final List<Filter> filters;
    private final List<Sort> sort;
    private final int limit;
    private final int offset;
    private final List<String> searchableFields;
    private final MatchingStrategy matchingStrategy;

    private SearchQuery(Builder builder) {
        this.text = builder.text == null ? "" : builder.text;
        this.filters = List.copyOf(builder.filters);
        this.sort = List.copyOf(builder.sort);
        this.limit = builder.limit;
        this.offset = builder.offset;
        this.searchableFields = builder.searchableFields == null ? null : List.copyOf(builder.searchableFields);
        this.matchingStrategy = builder.matchingStrategy;
    }

    public static Builder builder() {
        return new Builder();
    }

    public String getText() {
        return text;
    }

    public List<Filter> getFilters() {
        return filters;
    }

    public List<Sort> getSort() {
        return sort;
    }

    public int getLimit() {
        return limit;
    }

    public int getOffset() {
        return offset;
    }

    /**
     Attributes the text is restricted to, or {@code null} for every searchable attribute.
     */
    public List<String> getSearchableFields() {
        return searchableFields;
    }

    public MatchingStrategy getMatchingStrategy() {
        return matchingStrategy;
    }

    // --- Clauses ---

    /**
     {@code field = value}. Against an array attribute the filter holds when any element equals
     the value.
     */
    public static final class Filter {
        private final String field;
        private final Object value;

        public Filter(String field, Object value) {
            this.field = Objects.requireNonNull(field, "field");
            this.value = Objects.requireNonNull(value, "value");
        }

        public String getField() {
            return field;
        }

        public Object getValue() {
            return value;
        }

        @Override
        public String toString() {
            return field + " = \"" + value + "\"";
        }
    }

    public static final class Sort {
        private final String field;
        private final boolean descending;

        public Sort(String field, boolean descending) {
            this.field = Objects.requireNonNull(field, "field");
            this.descending = descending;
        }

        /**
         Parses {@code field:asc} or {@code field:desc}; a bare field sorts ascending.
         */
        public static Sort parse(String expression) {
            String trimmed = expression.trim();
            int colon = trimmed.lastIndexOf(':');
            if (colon < 0) {
                return new Sort(trimmed, false);
            }
            String direction = trimmed.substring(colon + 1).trim();
            if (!direction.equals("asc") && !direction.equals("desc")) {
                throw new IllegalArgumentException("Invalid sort direction in '" + expression + "'");
            }
            return new Sort(trimmed.substring(0, colon).trim(), direction.equals("desc"));
        }

        public String getField() {
            return field;
        }

        public boolean isDescending() {
            return descending;
        }

        @Override
        public String toString() {
            return field + (descending ? ":desc" : ":asc");
        }
    }

    // --- Builder ---

    public static final class Builder {
        private String text;
        private final List<Filter> filters = new ArrayList<>();
        private final List<Sort> sort = new ArrayList<>();
        private int limit = DEFAULT_LIMIT;
        private int offset;
        private List<String> searchableFields;
        private MatchingStrategy matchingStrategy = MatchingStrategy.ANY;

        private Builder() {
        }

        public Builder text(String text) {
            this.text = text;
            return this;
        }

        public Builder filter(String field, Object value) {
            filters.add(new Filter(field, value));
            return this;
        }

        public Builder sort(String expression) {
            sort.add(Sort.parse(expression));
            return this;
        }

        public Builder limit(int limit) {
            if (limit < 0) throw new IllegalArgumentException("limit must not be negative");
            this.limit = limit;
            return this;
        }

        public Builder offset(int offset) {
            if (offset < 0) throw new IllegalArgumentException("offset must not be negative");
            this.offset = offset;
            return this;
        }

        public Builder searchableFields(List<String> fields) {
            this.searchableFields = fields;
            return this;
        }

        public Builder matchingStrategy(MatchingStrategy strategy) {
            this.matchingStrategy = Objects.requireNonNull(strategy, "strategy");
            return this;
        }

        public SearchQuery build() {
            return new SearchQuery(this);
        }
    }
}
