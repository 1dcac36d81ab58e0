package eu.fbk.quadstore.executor;

import java.io.IOException;

import com.google.common.collect.ForwardingObject;

import eu.fbk.quadstore.data.Handler;
import eu.fbk.quadstore.data.QuadrupleRow;
import eu.fbk.quadstore.planner.Lookup;

/**
 * A {@code QuadrupleTransaction} that forwards all its method calls to another
 * {@code QuadrupleTransaction}.
 */
public abstract class ForwardingQuadrupleTransaction extends ForwardingObject implements
        QuadrupleTransaction {

    @Override
    protected abstract QuadrupleTransaction delegate();

    @Override
    public boolean insert(final QuadrupleRow row) throws IOException {
        return delegate().insert(row);
    }

    @Override
    public boolean delete(final long id) throws IOException {
        return delegate().delete(id);
    }

    @Override
    public long delete(final Lookup lookup) throws IOException {
        return delegate().delete(lookup);
    }

    @Override
    public long clear() throws IOException {
        return delegate().clear();
    }

    @Override
    public boolean contains(final long id) throws IOException {
        return delegate().contains(id);
    }

    @Override
    public void select(final Lookup lookup, final Handler<? super QuadrupleRow> handler)
            throws IOException {
        delegate().select(lookup, handler);
    }

    @Override
    public long count() throws IOException {
        return delegate().count();
    }

    @Override
    public void end(final boolean commit) throws IOException {
        delegate().end(commit);
    }

}
