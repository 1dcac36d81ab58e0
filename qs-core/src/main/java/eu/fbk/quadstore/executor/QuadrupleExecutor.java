package eu.fbk.quadstore.executor;

import java.io.IOException;

import eu.fbk.quadstore.runtime.Component;
import eu.fbk.quadstore.runtime.DataCorruptedException;

/**
 * A storage for quadruples executing compiled lookups and mutations.
 * <p>
 * A {@code QuadrupleExecutor} abstracts the access to the backend physically storing a set of
 * quadruples (a SQL database, an in-memory structure, ...). Access to its contents occurs only in
 * the scope of a {@link QuadrupleTransaction}, which can either be read-only or read/write and
 * provides atomicity: its changes are either all persisted or all discarded. Translating a
 * {@link eu.fbk.quadstore.planner.Lookup} into a backend-specific query is a responsibility of
 * the executor. Note that a {@code QuadrupleExecutor} obeys the general contract and lifecycle of
 * {@link Component}; implementations are expected to be thread safe, with the isolation between
 * concurrent transactions they document.
 * </p>
 */
public interface QuadrupleExecutor extends Component {

    /**
     * Begins a new read-only / read-write transaction. The transaction must be ended as soon as
     * possible via {@link QuadrupleTransaction#end(boolean)}.
     *
     * @param readOnly
     *            <tt>true</tt> if the transaction is not allowed to modify stored quadruples
     * @return the created transaction
     * @throws DataCorruptedException
     *             in case a transaction cannot be started due to the stored data being damaged
     * @throws IOException
     *             if another IO error occurs while starting the transaction
     * @throws IllegalStateException
     *             if the executor is not initialized or has been closed
     */
    QuadrupleTransaction begin(boolean readOnly) throws DataCorruptedException, IOException,
            IllegalStateException;

}
