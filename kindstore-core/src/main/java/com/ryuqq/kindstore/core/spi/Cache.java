package com.ryuqq.kindstore.core.spi;

import java.time.Duration;
import java.util.Collection;
import java.util.Map;

/**
 * Cache backend SPI consumed by caching adapters.
 *
 * <p>The cache is an opaque compare-and-swap key/value store in the style of memcached.
 * Keys are opaque strings; values are byte arrays.</p>
 *
 * <p><strong>Implementation Requirements:</strong></p>
 * <ul>
 *   <li>Thread-safe: all methods may be called concurrently</li>
 *   <li>{@link #cas} must be atomic with respect to every other mutation of the same key</li>
 *   <li>Expired entries behave exactly like absent entries</li>
 * </ul>
 *
 * @author Kindstore Team
 * @since 1.0.0
 */
public interface Cache {

    /**
     * Gets multiple values.
     *
     * @param keys the keys to look up
     * @return the values that were found; absent keys are omitted
     */
    Map<String, byte[]> getMulti(Collection<String> keys);

    /**
     * Sets multiple values unconditionally.
     *
     * @param values key to value
     * @param ttl expiry of every written entry
     */
    void setMulti(Map<String, byte[]> values, Duration ttl);

    /**
     * Gets a value together with its compare-and-swap token.
     *
     * @param key the key to look up
     * @return the value and its token, or {@code null} if the key is absent
     */
    CasValue gets(String key);

    /**
     * Stores a value only if the key is absent.
     *
     * @param key the key
     * @param value the value
     * @param ttl expiry of the entry
     * @return true if the value was stored
     */
    boolean add(String key, byte[] value, Duration ttl);

    /**
     * Stores a value only if the entry still carries the given token.
     *
     * @param key the key
     * @param value the new value
     * @param casToken the token obtained from {@link #gets(String)}
     * @param ttl expiry of the entry
     * @return the outcome of the swap
     */
    CasResult cas(String key, byte[] value, long casToken, Duration ttl);

    /**
     * Deletes multiple keys. Missing keys are ignored.
     *
     * @param keys the keys to delete
     */
    void deleteMulti(Collection<String> keys);

    /**
     * A cached value and the token that identifies its current version.
     *
     * @param value the cached bytes
     * @param casToken the compare-and-swap token
     */
    record CasValue(byte[] value, long casToken) {
    }

    /**
     * Outcome of a compare-and-swap.
     */
    enum CasResult {
        /** The value was replaced. */
        STORED,
        /** The entry changed since the token was issued. */
        EXISTS,
        /** The entry no longer exists. */
        NOT_FOUND
    }
}
