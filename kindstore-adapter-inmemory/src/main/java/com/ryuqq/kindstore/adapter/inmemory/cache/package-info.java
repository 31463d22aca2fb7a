/**
 * In-memory compare-and-swap cache.
 *
 * @author Kindstore Team
 * @since 1.0.0
 */
package com.ryuqq.kindstore.adapter.inmemory.cache;
