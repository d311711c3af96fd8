package eu.virtualparadox.ragcore.rag.retriever.model;

import java.util.Collections;
import java.util.Map;
import java.util.TreeMap;

/**
 * @param ownerScope     scope the search is confined to
 * @param query          natural-language query text
 * @param maxResults     upper bound on returned results, {@value #MIN_RESULTS}..{@value #MAX_RESULTS}
 * @param filter         exact-match metadata predicates, all of which must hold (may be empty)
 * @param scoreThreshold minimum score in {@code [0, 1]}, or {@code null} for no threshold
 */
public record SearchRequest(String ownerScope,
                            String query,
                            int maxResults,
                            Map<String, String> filter,
                            Double scoreThreshold) {

    public static final int MIN_RESULTS = 1;
    public static final int MAX_RESULTS = 100;
    public static final int DEFAULT_RESULTS = 10;

    public SearchRequest {
        filter = filter == null ? Collections.emptyMap() : Collections.unmodifiableMap(new TreeMap<>(filter));
    }

    public static SearchRequest of(final String ownerScope, final String query) {
        return new SearchRequest(ownerScope, query, DEFAULT_RESULTS, null, null);
    }
}
