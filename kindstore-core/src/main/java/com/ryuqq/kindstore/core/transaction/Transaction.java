package com.ryuqq.kindstore.core.transaction;

/**
 * Datastore transaction SPI.
 *
 * <p>Transactions are created by {@link com.ryuqq.kindstore.core.spi.Adapter#transaction(Propagation)},
 * which also pushes them onto the calling thread's transaction stack. Callers follow the
 * scoped-acquisition pattern: {@code begin}, run the body, then {@code commit} or
 * {@code rollback}, and finally {@code end} on every exit path.</p>
 *
 * <p><strong>Implementation Requirements:</strong></p>
 * <ul>
 *   <li>{@link #rollback()} and {@link #end()} are idempotent</li>
 *   <li>{@link #commit()} throws {@link TransactionFailedException} when the changes
 *       conflict with concurrent writes</li>
 *   <li>{@link #end()} removes the transaction from the adapter's stack</li>
 * </ul>
 *
 * @author Kindstore Team
 * @since 1.0.0
 */
public interface Transaction {

    /**
     * Starts this transaction.
     */
    void begin();

    /**
     * Commits this transaction.
     *
     * @throws TransactionFailedException if the transaction could not be applied
     */
    void commit();

    /**
     * Rolls this transaction back.
     */
    void rollback();

    /**
     * Cleans up this transaction and pops it off the transaction stack.
     */
    void end();

    /**
     * Current lifecycle state.
     *
     * @return the state
     */
    TransactionState state();
}
