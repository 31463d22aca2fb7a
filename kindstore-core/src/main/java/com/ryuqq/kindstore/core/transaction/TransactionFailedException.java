package com.ryuqq.kindstore.core.transaction;

/**
 * Thrown by adapters when a transaction cannot be applied, typically because it
 * conflicts with a concurrent write. {@link Transactional} retries on this error.
 *
 * @author Kindstore Team
 * @since 1.0.0
 */
public class TransactionFailedException extends TransactionException {

    private static final long serialVersionUID = 1L;

    public TransactionFailedException(String message) {
        super(message);
    }

    /**
     * @param message a message
     * @param cause the exception that caused the transaction to fail (nullable)
     */
    public TransactionFailedException(String message, Throwable cause) {
        super(message, cause);
    }
}
