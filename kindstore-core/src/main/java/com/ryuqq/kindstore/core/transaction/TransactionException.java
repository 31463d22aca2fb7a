package com.ryuqq.kindstore.core.transaction;

/**
 * Base class for transaction errors.
 *
 * @author Kindstore Team
 * @since 1.0.0
 */
public class TransactionException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    public TransactionException(String message) {
        super(message);
    }

    public TransactionException(String message, Throwable cause) {
        super(message, cause);
    }
}
