package com.nilsson.soeji.service.search;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.Objects;

/**
 Declared attribute sets of one collection. Searchable attributes feed full-text matching;
 only filterable attributes may appear in filters and only sortable ones in sort clauses.
 A searchable list of {@code ["*"]} means every attribute.
 */
public final class IndexSettings {

    public static final String ALL_ATTRIBUTES = "*";

    private final List<String> searchableAttributes;
    private final List<String> filterableAttributes;
    private final List<String> sortableAttributes;

    @JsonCreator
    public IndexSettings(@JsonProperty("searchableAttributes") List<String> searchableAttributes,
                         @JsonProperty("filterableAttributes") List<String> filterableAttributes,
                         @JsonProperty("sortableAttributes") List<String> sortableAttributes) {
        this.searchableAttributes = searchableAttributes == null ? List.of(ALL_ATTRIBUTES) : List.copyOf(searchableAttributes);
        this.filterableAttributes = filterableAttributes == null ? List.of() : List.copyOf(filterableAttributes);
        this.sortableAttributes = sortableAttributes == null ? List.of() : List.copyOf(sortableAttributes);
    }

    public static IndexSettings defaults() {
        return new IndexSettings(null, null, null);
    }

    @JsonProperty("searchableAttributes")
    public List<String> getSearchableAttributes() {
        return searchableAttributes;
    }

    @JsonProperty("filterableAttributes")
    public List<String> getFilterableAttributes() {
        return filterableAttributes;
    }

    @JsonProperty("sortableAttributes")
    public List<String> getSortableAttributes() {
        return sortableAttributes;
    }

    public boolean isSearchable(String field) {
        return searchableAttributes.contains(ALL_ATTRIBUTES) || searchableAttributes.contains(field);
    }

    public boolean isFilterable(String field) {
        return filterableAttributes.contains(field);
    }

    public boolean isSortable(String field) {
        return sortableAttributes.contains(field);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof IndexSettings)) return false;
        IndexSettings that = (IndexSettings) o;
        return searchableAttributes.equals(that.searchableAttributes)
                && filterableAttributes.equals(that.filterableAttributes)
                && sortableAttributes.equals(that.sortableAttributes);
    }

    @Override
    public int hashCode() {
        return Objects.hash(searchableAttributes, filterableAttributes, sortableAttributes);
    }
}
