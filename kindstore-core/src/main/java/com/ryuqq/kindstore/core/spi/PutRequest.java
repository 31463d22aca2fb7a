package com.ryuqq.kindstore.core.spi;

import com.ryuqq.kindstore.core.key.Key;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Request to persist one entity.
 *
 * @param key the entity key (possibly partial)
 * @param unindexed wire field names that must be excluded from indexes
 * @param properties wire field name to wire value, in declaration order
 *
 * @author Kindstore Team
 * @since 1.0.0
 */
public record PutRequest(Key key, List<String> unindexed, Map<String, Object> properties) {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException if key or properties is null
     */
    public PutRequest {
        if (key == null) {
            throw new IllegalArgumentException("key cannot be null");
        }
        if (properties == null) {
            throw new IllegalArgumentException("properties cannot be null");
        }
        unindexed = unindexed == null ? List.of() : List.copyOf(unindexed);
        properties = Collections.unmodifiableMap(new LinkedHashMap<>(properties));
    }
}
