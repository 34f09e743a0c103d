package com.nilsson.soeji.service.search;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 <h2>SearchQueryParser</h2>
 <p>
 Parses the image search box syntax:
 </p>
 <ul>
 <li>{@code cat dog}: any of the terms.</li>
 <li>{@code cat AND dog} or {@code cat +dog}: all of the terms.</li>
 <li>{@code cat -dog}: cat, but not dog.</li>
 <li>{@code "red eyes"}: a quoted term is kept as one term.</li>
 </ul>
 */
public final class SearchQueryParser {

    private static final Pattern TERM = Pattern.compile("(\"[^\"]*\"|\\S+)");
    private static final Pattern SURROUNDING_QUOTES = Pattern.compile("^[\"']|[\"']$");
    private static final String AND_OPERATOR = " AND ";

    private SearchQueryParser() {
    }

    public static ParsedQuery parse(String query) {
        List<String> include = new ArrayList<>();
        List<String> exclude = new ArrayList<>();
        boolean useAnd = false;

        if (query == null || query.isBlank()) {
            return new ParsedQuery(include, exclude, false);
        }

        if (query.contains(AND_OPERATOR)) {
            useAnd = true;
            for (String raw : query.split(AND_OPERATOR)) {
                String part = raw.trim();
                if (part.startsWith("-")) {
                    exclude.add(part.substring(1).trim());
                } else if (part.startsWith("+")) {
                    include.add(part.substring(1).trim());
                } else if (!part.isEmpty()) {
                    include.add(part);
                }
            }
        } else {
            Matcher m = TERM.matcher(query);
            while (m.find()) {
                String term = m.group(1);
                if (term.startsWith("-")) {
                    exclude.add(unquote(term.substring(1)));
                } else if (term.startsWith("+")) {
                    useAnd = true;
                    include.add(unquote(term.substring(1)));
                } else {
                    String clean = unquote(term);
                    if (!clean.isEmpty()) include.add(clean);
                }
            }
        }
        return new ParsedQuery(include, exclude, useAnd);
    }

    private static String unquote(String term) {
        return SURROUNDING_QUOTES.matcher(term).replaceAll("");
    }

    public static final class ParsedQuery {
        private final List<String> includeTerms;
        private final List<String> excludeTerms;
        private final boolean useAnd;

        public ParsedQuery(List<String> includeTerms, List<String> excludeTerms, boolean useAnd) {
            this.includeTerms = List.copyOf(includeTerms);
            this.excludeTerms = List.copyOf(excludeTerms);
            this.useAnd = useAnd;
        }

        public List<String> getIncludeTerms() {
            return includeTerms;
        }

        public List<String> getExcludeTerms() {
            return excludeTerms;
        }

        public boolean isUseAnd() {
            return useAnd;
        }
    }
}
