package eu.fbk.quadstore.data;

import javax.annotation.Nullable;

/**
 * A callback receiving the elements of a sequence pushed by a producer, such as the rows
 * selected by a {@code QuadrupleTransaction}.
 * <p>
 * {@link #handle(Object)} is invoked once per element, never with null, and then one last time
 * with null to mark the end of the sequence. An exception thrown by the handler aborts the
 * sequence: no end marker follows, and the producer reports the exception to its caller.
 * Handlers are used by a single thread at a time.
 * </p>
 *
 * @param <T>
 *            the type of element
 */
public interface Handler<T> {

    /**
     * Receives the next element, or null once the sequence is over.
     *
     * @param element
     *            the element, or null as end-of-sequence marker
     * @throws Throwable
     *             on failure, aborting the sequence
     */
    void handle(@Nullable T element) throws Throwable;

}
