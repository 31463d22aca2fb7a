package com.ryuqq.kindstore.adapter.inmemory.cache;

import com.ryuqq.kindstore.core.spi.Cache;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Arrays;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * In-memory implementation of {@link Cache} SPI for testing and reference purposes.
 *
 * <p>memcached 방식의 compare-and-swap 캐시를 재현합니다.</p>
 *
 * <p><strong>동작:</strong></p>
 * <ul>
 *   <li>모든 쓰기는 새 CAS 토큰을 발급</li>
 *   <li>{@link #cas}는 토큰이 일치할 때만 저장 (다르면 EXISTS, 없으면 NOT_FOUND)</li>
 *   <li>만료된 항목은 조회 시점에 없는 것으로 취급</li>
 * </ul>
 *
 * <p>만료 시각 계산에 {@link Clock}을 사용하므로 테스트에서 시간을 제어할 수 있습니다.</p>
 *
 * @author Kindstore Team
 * @since 1.0.0
 */
public class InMemoryCache implements Cache {

    private final ConcurrentHashMap<String, Item> items = new ConcurrentHashMap<>();
    private final AtomicLong tokens = new AtomicLong();
    private final Clock clock;

    private record Item(byte[] value, long casToken, Instant expiresAt) {

        boolean isExpired(Instant now) {
            return expiresAt != null && !now.isBefore(expiresAt);
        }
    }

    public InMemoryCache() {
        this(Clock.systemUTC());
    }

    public InMemoryCache(Clock clock) {
        if (clock == null) {
            throw new IllegalArgumentException("clock cannot be null");
        }
        this.clock = clock;
    }

    @Override
    public Map<String, byte[]> getMulti(Collection<String> keys) {
        if (keys == null) {
            throw new IllegalArgumentException("keys cannot be null");
        }
        Map<String, byte[]> found = new LinkedHashMap<>();
        for (String key : keys) {
            Item item = live(key);
            if (item != null) {
                found.put(key, Arrays.copyOf(item.value(), item.value().length));
            }
        }
        return found;
    }

    @Override
    public void setMulti(Map<String, byte[]> values, Duration ttl) {
        if (values == null) {
            throw new IllegalArgumentException("values cannot be null");
        }
        for (Map.Entry<String, byte[]> entry : values.entrySet()) {
            items.put(entry.getKey(), newItem(entry.getValue(), ttl));
        }
    }

    @Override
    public CasValue gets(String key) {
        Item item = live(key);
        if (item == null) {
            return null;
        }
        return new CasValue(Arrays.copyOf(item.value(), item.value().length), item.casToken());
    }

    @Override
    public boolean add(String key, byte[] value, Duration ttl) {
        Item item = newItem(value, ttl);
        Item result = items.compute(key, (k, existing) ->
            existing == null || existing.isExpired(clock.instant()) ? item : existing);
        return result == item;
    }

    @Override
    public CasResult cas(String key, byte[] value, long casToken, Duration ttl) {
        Item replacement = newItem(value, ttl);
        CasResult[] result = new CasResult[1];
        items.compute(key, (k, existing) -> {
            if (existing == null || existing.isExpired(clock.instant())) {
                result[0] = CasResult.NOT_FOUND;
                return null;
            }
            if (existing.casToken() != casToken) {
                result[0] = CasResult.EXISTS;
                return existing;
            }
            result[0] = CasResult.STORED;
            return replacement;
        });
        return result[0];
    }

    @Override
    public void deleteMulti(Collection<String> keys) {
        if (keys == null) {
            throw new IllegalArgumentException("keys cannot be null");
        }
        for (String key : keys) {
            items.remove(key);
        }
    }

    /**
     * 만료되지 않은 항목 수 (테스트용).
     */
    public int size() {
        Instant now = clock.instant();
        int count = 0;
        for (Item item : items.values()) {
            if (!item.isExpired(now)) {
                count++;
            }
        }
        return count;
    }

    private Item live(String key) {
        if (key == null) {
            throw new IllegalArgumentException("key cannot be null");
        }
        Item item = items.get(key);
        if (item == null) {
            return null;
        }
        if (item.isExpired(clock.instant())) {
            items.remove(key, item);
            return null;
        }
        return item;
    }

    private Item newItem(byte[] value, Duration ttl) {
        if (value == null) {
            throw new IllegalArgumentException("value cannot be null");
        }
        Instant expiresAt = ttl == null || ttl.isZero() ? null : clock.instant().plus(ttl);
        return new Item(Arrays.copyOf(value, value.length), tokens.incrementAndGet(), expiresAt);
    }
}
