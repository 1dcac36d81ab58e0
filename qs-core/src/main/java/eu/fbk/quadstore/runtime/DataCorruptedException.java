package eu.fbk.quadstore.runtime;

import java.io.IOException;

/**
 * Signals that the quadruples persisted by an executor can no longer be trusted.
 * <p>
 * Executors throw it when a write transaction could be neither committed nor rolled back, or
 * when a persisted row cannot be decoded back into a quadruple (e.g., an unknown flavor code).
 * Unlike other {@code IOException}s, re-attempting the operation does not help: the table has
 * to be inspected and repaired first.
 * </p>
 */
public class DataCorruptedException extends IOException {

    private static final long serialVersionUID = 1L;

    /**
     * Creates a new instance for the failed executor operation described by the message.
     *
     * @param message
     *            the transaction or row affected and what went wrong with it
     * @param cause
     *            the failure that left the data in an unknown state
     */
    public DataCorruptedException(final String message, final Throwable cause) {
        super(message, cause);
    }

}
