package com.nilsson.soeji.service.search;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;

import javax.inject.Inject;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.stream.Collectors;

/**
 <h2>SearchService</h2>
 <p>
 Read side of the search collections. Image searches understand the syntax of
 {@link SearchQueryParser}. The index has no negation, so excluded terms are applied to the
 retrieved hits: the service over-fetches three pages from the start, drops hits containing an
 excluded term and pages the remainder itself.
 </p>
 */
public class SearchService {

    static final String DEFAULT_IMAGE_SORT = "createdAt:desc";
    static final String TAG_SORT = "imageCount:desc";
    private static final int EXCLUSION_OVERFETCH = 3;
    private static final List<String> POSITIVE_SEARCH_FIELDS = List.of("positiveTags", "prompt", "v4BaseCaption");

    private final DocumentIndex index;
    private final ObjectMapper mapper;

    @Inject
    public SearchService(DocumentIndex index, ObjectMapper mapper) {
        this.index = index;
        this.mapper = mapper;
    }

    public SearchResult searchImages(ImageSearchRequest request) {
        SearchQueryParser.ParsedQuery parsed = SearchQueryParser.parse(request.getQuery());
        boolean useAnd = request.isAndMode() || parsed.isUseAnd();
        boolean excluding = !parsed.getExcludeTerms().isEmpty();

        String tagField = request.isPositiveTagsOnly() ? ImageDocument.POSITIVE_TAGS : ImageDocument.TAGS;
        SearchQuery.Builder query = SearchQuery.builder()
                .text(String.join(" ", parsed.getIncludeTerms()))
                .limit(request.getLimit() * (excluding ? EXCLUSION_OVERFETCH : 1))
                .offset(excluding ? 0 : request.getOffset())
                .sort(request.getSort() != null ? request.getSort() : DEFAULT_IMAGE_SORT)
                .matchingStrategy(useAnd ? SearchQuery.MatchingStrategy.ALL : SearchQuery.MatchingStrategy.ANY);
        for (String tag : request.getTags()) {
            query.filter(tagField, tag.trim());
        }
        if (request.isPositiveTagsOnly()) {
            query.searchableFields(POSITIVE_SEARCH_FIELDS);
        }

        SearchResult result = index.search(DocumentIndex.IMAGES, query.build());
        if (!excluding) {
            return result;
        }

        List<String> excluded = parsed.getExcludeTerms().stream()
                .map(t -> t.toLowerCase(Locale.ROOT))
                .collect(Collectors.toList());
        List<ObjectNode> kept = result.getHits().stream()
                .filter(hit -> {
                    String text = searchableText(hit);
                    return excluded.stream().noneMatch(text::contains);
                })
                .collect(Collectors.toList());

        int from = Math.min(request.getOffset(), kept.size());
        int to = Math.min(from + request.getLimit(), kept.size());
        List<ObjectNode> page = kept.subList(from, to);
        return new SearchResult(page, page.size(), request.getLimit(), request.getOffset());
    }

    /**
     Tags whose name matches the query, most used first. A blank query returns nothing.
     */
    public List<TagDocument> searchTags(String query, int limit) {
        if (query == null || query.isBlank()) {
            return List.of();
        }
        SearchQuery tagQuery = SearchQuery.builder()
                .text(query)
                .limit(limit)
                .sort(TAG_SORT)
                .build();

        List<TagDocument> tags = new ArrayList<>();
        for (ObjectNode hit : index.search(DocumentIndex.TAGS, tagQuery).getHits()) {
            try {
                tags.add(mapper.treeToValue(hit, TagDocument.class));
            } catch (JsonProcessingException e) {
                throw new IndexException("Malformed tag document: " + hit, e);
            }
        }
        return tags;
    }

    private static String searchableText(ObjectNode hit) {
        List<String> parts = new ArrayList<>();
        addText(parts, hit.get("prompt"));
        addText(parts, hit.get("v4BaseCaption"));
        addText(parts, hit.get(ImageDocument.POSITIVE_TAGS));
        addText(parts, hit.get(ImageDocument.TAGS));
        return String.join(" ", parts).toLowerCase(Locale.ROOT);
    }

    private static void addText(List<String> parts, JsonNode node) {
        if (node == null || node.isNull()) return;
        if (node.isArray()) {
            node.forEach(element -> addText(parts, element));
        } else if (!node.asText().isEmpty()) {
            parts.add(node.asText());
        }
    }
}
