package eu.fbk.quadstore.executor;

import java.io.IOException;

import eu.fbk.quadstore.data.Handler;
import eu.fbk.quadstore.data.QuadrupleRow;
import eu.fbk.quadstore.planner.Lookup;
import eu.fbk.quadstore.runtime.DataCorruptedException;

/**
 * A unit of work over the contents of a {@link QuadrupleExecutor}.
 * <p>
 * Quadruples are identified by their id: at most one row per id is stored, and
 * {@link #insert(QuadrupleRow)} never replaces an existing row. Write methods are not available
 * for read-only transactions (an {@link IllegalStateException} is thrown in that case).
 * </p>
 * <p>
 * Transactions are terminated via {@link #end(boolean)}, whose parameter specifies whether
 * changes should be committed. If {@code end()} throws an {@code IOException}, a rollback must be
 * assumed even if a commit was asked; if it throws a {@code DataCorruptedException}, neither
 * commit nor rollback were possible and the stored data is in an unknown state.
 * </p>
 * <p>
 * {@code QuadrupleTransaction} objects are not required to be thread safe.
 * </p>
 */
public interface QuadrupleTransaction {

    /**
     * Inserts the row specified, unless a row with the same id is already stored.
     *
     * @param row
     *            the row to insert
     * @return true if the row has been inserted, false if its id was already stored
     * @throws IOException
     *             in case some IO error occurs
     * @throws IllegalStateException
     *             if the transaction has been already ended, or if it is read-only
     */
    boolean insert(QuadrupleRow row) throws IOException, IllegalStateException;

    /**
     * Deletes the row with the id specified, if stored.
     *
     * @param id
     *            the quadruple id
     * @return true if a row has been deleted
     * @throws IOException
     *             in case some IO error occurs
     * @throws IllegalStateException
     *             if the transaction has been already ended, or if it is read-only
     */
    boolean delete(long id) throws IOException, IllegalStateException;

    /**
     * Deletes all the rows matching the lookup specified.
     *
     * @param lookup
     *            the lookup; a lookup without conditions deletes every row
     * @return the number of rows deleted
     * @throws IOException
     *             in case some IO error occurs
     * @throws IllegalStateException
     *             if the transaction has been already ended, or if it is read-only
     */
    long delete(Lookup lookup) throws IOException, IllegalStateException;

    /**
     * Deletes all the stored rows.
     *
     * @return the number of rows deleted
     * @throws IOException
     *             in case some IO error occurs
     * @throws IllegalStateException
     *             if the transaction has been already ended, or if it is read-only
     */
    long clear() throws IOException, IllegalStateException;

    /**
     * Tests whether a row with the id specified is stored.
     *
     * @param id
     *            the quadruple id
     * @return true if the row exists
     * @throws IOException
     *             in case some IO error occurs
     * @throws IllegalStateException
     *             if the transaction has been already ended
     */
    boolean contains(long id) throws IOException, IllegalStateException;

    /**
     * Forwards all the rows matching the lookup specified to the supplied handler, followed by a
     * final null. An exception thrown by the handler stops the iteration and is propagated,
     * wrapped in an {@code IOException} if it is not already an {@code IOException} or an
     * unchecked exception.
     *
     * @param lookup
     *            the lookup; a lookup without conditions selects every row
     * @param handler
     *            the handler notified of matching rows
     * @throws IOException
     *             in case some IO error occurs
     * @throws IllegalStateException
     *             if the transaction has been already ended
     */
    void select(Lookup lookup, Handler<? super QuadrupleRow> handler) throws IOException,
            IllegalStateException;

    /**
     * Returns the number of stored rows.
     *
     * @return the number of rows
     * @throws IOException
     *             in case some IO error occurs
     * @throws IllegalStateException
     *             if the transaction has been already ended
     */
    long count() throws IOException, IllegalStateException;

    /**
     * Ends the transaction, either committing or rolling back its changes. If commit is
     * requested but fails, a rollback is forced and an {@code IOException} is thrown.
     *
     * @param commit
     *            true in case changes made by the transaction should be committed
     * @throws IOException
     *             in case the commit request cannot be satisfied; a rollback has been performed
     * @throws DataCorruptedException
     *             in case it was possible neither to commit nor to roll back
     * @throws IllegalStateException
     *             if the transaction has been already ended
     */
    void end(boolean commit) throws DataCorruptedException, IOException, IllegalStateException;

}
