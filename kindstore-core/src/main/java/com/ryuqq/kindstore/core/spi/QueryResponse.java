package com.ryuqq.kindstore.core.spi;

import com.ryuqq.kindstore.core.key.Key;

import java.util.List;
import java.util.Map;

/**
 * One batch of query results returned by an {@link Adapter}.
 *
 * @param entities the results of this batch, in query order
 * @param cursor opaque cursor resuming right after the last result of this batch
 *
 * @author Kindstore Team
 * @since 1.0.0
 */
public record QueryResponse(List<Entry> entities, String cursor) {

    public QueryResponse {
        entities = entities == null ? List.of() : List.copyOf(entities);
    }

    /**
     * A single query result.
     *
     * @param key the entity key
     * @param data the entity data, or {@code null} for keys-only queries
     */
    public record Entry(Key key, Map<String, Object> data) {

        public Entry {
            if (key == null) {
                throw new IllegalArgumentException("key cannot be null");
            }
        }
    }
}
