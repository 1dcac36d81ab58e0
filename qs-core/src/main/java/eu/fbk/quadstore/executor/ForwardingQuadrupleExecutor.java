package eu.fbk.quadstore.executor;

import java.io.IOException;

import com.google.common.collect.ForwardingObject;

/**
 * A {@code QuadrupleExecutor} that forwards all its method calls to another
 * {@code QuadrupleExecutor}.
 * <p>
 * This class provides a starting point for implementing the decorator pattern on top of the
 * {@code QuadrupleExecutor} interface. Subclasses must implement method {@link #delegate()} and
 * override the methods they want to decorate.
 * </p>
 */
public abstract class ForwardingQuadrupleExecutor extends ForwardingObject implements
        QuadrupleExecutor {

    @Override
    protected abstract QuadrupleExecutor delegate();

    @Override
    public void init() throws IOException {
        delegate().init();
    }

    @Override
    public QuadrupleTransaction begin(final boolean readOnly) throws IOException {
        return delegate().begin(readOnly);
    }

    @Override
    public void close() {
        delegate().close();
    }

}
