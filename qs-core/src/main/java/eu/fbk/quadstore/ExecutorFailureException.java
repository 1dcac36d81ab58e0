package eu.fbk.quadstore;

import java.io.IOException;

/**
 * Signals the failure of the executor backing a {@link QuadrupleStore}.
 * <p>
 * The original failure (connectivity, constraint violation, timeout, corruption, ...) is
 * available as the {@link #getCause() cause}. When this exception is thrown by a mutating
 * operation, the executor has rolled back the transaction and the stored quadruples are unchanged.
 * </p>
 */
public class ExecutorFailureException extends IOException {

    private static final long serialVersionUID = 1L;

    /**
     * Creates a new instance with the error message and cause specified.
     *
     * @param message
     *            a message describing the failed operation
     * @param cause
     *            the failure reported by the executor
     */
    public ExecutorFailureException(final String message, final Throwable cause) {
        super(message, cause);
    }

}
