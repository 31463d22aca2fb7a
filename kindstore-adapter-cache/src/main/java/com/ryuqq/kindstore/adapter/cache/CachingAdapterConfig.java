package com.ryuqq.kindstore.adapter.cache;

import java.time.Duration;

/**
 * {@link CachingAdapter} 설정.
 *
 * <p><strong>기본값:</strong></p>
 * <ul>
 *   <li>namespace: "kindstore" - 캐시 키 접두사</li>
 *   <li>lockTimeout: 60초 - 쓰기 중 잠금 토큰의 만료 시간 (프로세스가 중단되어도 캐시가 묶이지 않도록)</li>
 *   <li>itemTimeout: 1일 - 캐시된 엔티티의 만료 시간</li>
 * </ul>
 *
 * @param namespace 캐시 키 접두사
 * @param lockTimeout 잠금 토큰 만료 시간
 * @param itemTimeout 캐시 항목 만료 시간
 * @author Kindstore Team
 * @since 1.0.0
 */
public record CachingAdapterConfig(String namespace, Duration lockTimeout, Duration itemTimeout) {

    public static final String DEFAULT_NAMESPACE = "kindstore";
    public static final Duration DEFAULT_LOCK_TIMEOUT = Duration.ofSeconds(60);
    public static final Duration DEFAULT_ITEM_TIMEOUT = Duration.ofDays(1);

    public CachingAdapterConfig() {
        this(DEFAULT_NAMESPACE, DEFAULT_LOCK_TIMEOUT, DEFAULT_ITEM_TIMEOUT);
    }

    public CachingAdapterConfig {
        if (namespace == null || namespace.isBlank()) {
            throw new IllegalArgumentException("namespace cannot be null or blank");
        }
        if (lockTimeout == null || lockTimeout.isNegative() || lockTimeout.isZero()) {
            throw new IllegalArgumentException("lockTimeout must be positive (current: " + lockTimeout + ")");
        }
        if (itemTimeout == null || itemTimeout.isNegative() || itemTimeout.isZero()) {
            throw new IllegalArgumentException("itemTimeout must be positive (current: " + itemTimeout + ")");
        }
    }

    public CachingAdapterConfig withNamespace(String namespace) {
        return new CachingAdapterConfig(namespace, lockTimeout, itemTimeout);
    }

    public CachingAdapterConfig withLockTimeout(Duration lockTimeout) {
        return new CachingAdapterConfig(namespace, lockTimeout, itemTimeout);
    }

    public CachingAdapterConfig withItemTimeout(Duration itemTimeout) {
        return new CachingAdapterConfig(namespace, lockTimeout, itemTimeout);
    }
}
