/**
 * Service Provider Interfaces for the external collaborators of the mapper.
 *
 * <h2>Interfaces</h2>
 * <ul>
 *   <li>{@link com.ryuqq.kindstore.core.spi.Adapter} - storage backend (get/put/delete/query/transactions)</li>
 *   <li>{@link com.ryuqq.kindstore.core.spi.Cache} - compare-and-swap cache backend</li>
 *   <li>{@link com.ryuqq.kindstore.core.spi.Adapters} - process-wide default adapter</li>
 * </ul>
 *
 * <h2>Value Types</h2>
 * <ul>
 *   <li>{@link com.ryuqq.kindstore.core.spi.PutRequest} - one entity to persist</li>
 *   <li>{@link com.ryuqq.kindstore.core.spi.QueryOptions} - query batch options</li>
 *   <li>{@link com.ryuqq.kindstore.core.spi.QueryResponse} - one batch of query results</li>
 * </ul>
 *
 * @since 1.0.0
 * @author Kindstore Team
 */
package com.ryuqq.kindstore.core.spi;
