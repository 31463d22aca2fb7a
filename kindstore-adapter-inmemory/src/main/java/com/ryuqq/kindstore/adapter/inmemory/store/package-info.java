/**
 * In-memory document store adapter.
 *
 * <p>{@link com.ryuqq.kindstore.adapter.inmemory.store.InMemoryAdapter}는 테스트와 참조 구현을 위한
 * {@link com.ryuqq.kindstore.core.spi.Adapter} 구현체입니다.</p>
 *
 * @author Kindstore Team
 * @since 1.0.0
 */
package com.ryuqq.kindstore.adapter.inmemory.store;
