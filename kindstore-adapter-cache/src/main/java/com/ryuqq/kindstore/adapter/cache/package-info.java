/**
 * 캐시 일관성 어댑터.
 *
 * <p>{@link com.ryuqq.kindstore.adapter.cache.CachingAdapter}는 임의의
 * {@link com.ryuqq.kindstore.core.spi.Adapter} 위에 {@link com.ryuqq.kindstore.core.spi.Cache}를
 * 얹어 get을 캐시하고 put/delete 시 무효화합니다.</p>
 *
 * @author Kindstore Team
 * @since 1.0.0
 */
package com.ryuqq.kindstore.adapter.cache;
