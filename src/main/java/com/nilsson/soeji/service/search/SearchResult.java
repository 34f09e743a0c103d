package com.nilsson.soeji.service.search;

import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.List;

public final class SearchResult {

    private final List<ObjectNode> hits;
    private final long totalHits;
    private final int limit;
    private final int offset;

    public SearchResult(List<ObjectNode> hits, long totalHits, int limit, int offset) {
        this.hits = List.copyOf(hits);
        this.totalHits = totalHits;
        this.limit = limit;
        this.offset = offset;
    }

    public List<ObjectNode> getHits() {
        return hits;
    }

    /**
     Number of documents that matched before paging.
     */
    public long getTotalHits() {
        return totalHits;
    }

    public int getLimit() {
        return limit;
    }

    public int getOffset() {
        return offset;
    }
}
