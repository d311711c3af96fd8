package eu.virtualparadox.ragcore.rag.index.model;

import java.util.Collections;
import java.util.Map;
import java.util.TreeMap;

/**
 * Nearest-neighbour lookup handed to the vector index.
 *
 * @param vector     query embedding
 * @param limit      maximum number of candidates
 * @param ownerScope scope the candidates must belong to
 * @param filter     exact-match metadata predicates, all of which must hold; sorted by key
 */
public record NearestNeighborQuery(float[] vector, int limit, String ownerScope, Map<String, String> filter) {

    public NearestNeighborQuery {
        filter = filter == null ? Collections.emptyMap() : Collections.unmodifiableMap(new TreeMap<>(filter));
    }
}
