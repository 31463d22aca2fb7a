package com.ryuqq.kindstore.core.transaction;

/**
 * Thrown by {@link Transactional} when it runs out of retries while trying to
 * apply a transaction.
 *
 * @author Kindstore Team
 * @since 1.0.0
 */
public class RetriesExceededException extends TransactionException {

    private static final long serialVersionUID = 1L;

    /**
     * @param cause the last transaction failure that caused a retry
     */
    public RetriesExceededException(TransactionFailedException cause) {
        super(cause == null ? "Transaction retries exceeded" : cause.getMessage(), cause);
    }

    @Override
    public synchronized TransactionFailedException getCause() {
        return (TransactionFailedException) super.getCause();
    }
}
