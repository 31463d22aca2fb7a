package com.ryuqq.kindstore.core.spi;

import com.ryuqq.kindstore.core.key.Key;
import com.ryuqq.kindstore.core.query.Query;
import com.ryuqq.kindstore.core.transaction.Propagation;
import com.ryuqq.kindstore.core.transaction.Transaction;

import java.util.List;
import java.util.Map;

/**
 * Storage backend SPI.
 *
 * <p>An Adapter determines how models interact with the underlying datastore. The core
 * never talks to a datastore client directly: every batch operation, query and transaction
 * goes through the adapter resolved for the model's kind.</p>
 *
 * <p><strong>Responsibilities:</strong></p>
 * <ul>
 *   <li>Batch get/put/delete by key, with results aligned to the input order</li>
 *   <li>Id allocation for partial keys on put</li>
 *   <li>Cursor-based query execution</li>
 *   <li>Per-thread transaction stacks with {@link Propagation} semantics</li>
 * </ul>
 *
 * <p><strong>Implementation Requirements:</strong></p>
 * <ul>
 *   <li>Thread-safe: all methods may be called concurrently from multiple threads</li>
 *   <li>Transaction state is thread-local; a transaction is never shared across threads</li>
 *   <li>Commit conflicts are reported as
 *       {@link com.ryuqq.kindstore.core.transaction.TransactionFailedException}</li>
 * </ul>
 *
 * @author Kindstore Team
 * @since 1.0.0
 */
public interface Adapter {

    /**
     * Gets multiple entities by their keys.
     *
     * @param keys complete keys to look up
     * @return entity data for each key, in input order; {@code null} where the entity does not exist
     */
    List<Map<String, Object>> getMulti(List<Key> keys);

    /**
     * Stores multiple entities.
     *
     * <p>Partial keys are completed with newly allocated ids.</p>
     *
     * @param requests the entities to persist
     * @return the complete key of each stored entity, in input order
     */
    List<Key> putMulti(List<PutRequest> requests);

    /**
     * Deletes multiple entities by their keys. Deleting a missing entity is not an error.
     *
     * @param keys complete keys to delete
     */
    void deleteMulti(List<Key> keys);

    /**
     * Runs one batch of a query.
     *
     * @param query the prepared query
     * @param options batch size, offset, limit, cursor and keys-only flag
     * @return the batch of results and the cursor that resumes right after it
     */
    QueryResponse query(Query query, QueryOptions options);

    /**
     * Creates a transaction and pushes it onto the current thread's transaction stack.
     *
     * @param propagation how the new transaction relates to an enclosing one
     * @return the transaction (not yet begun)
     */
    Transaction transaction(Propagation propagation);

    /**
     * Whether the current thread has an open transaction on this adapter.
     *
     * @return true if the transaction stack is not empty
     */
    boolean inTransaction();

    /**
     * The innermost open transaction of the current thread.
     *
     * @return the current transaction
     * @throws IllegalStateException if there is no open transaction
     */
    Transaction currentTransaction();
}
