package eu.fbk.quadstore.runtime;

import java.io.Closeable;
import java.io.IOException;

/**
 * A QuadStore component backed by some external resource.
 * <p>
 * The <i>lifecycle</i> of a {@code Component} is the following:
 * <ul>
 * <li>The {@code Component} instance is created, configuring itself based on the parameters
 * supplied to its constructor. In case the configuration is incorrect, an exception will be
 * thrown; otherwise, the component is configured but still inactive: no persistent data is
 * being modified and no resource that needs to be later freed is being allocated.</li>
 * <li>Method {@link #init()} is called to make the component operational; differently from the
 * constructor, {@code init()} is allowed to allocate resources (e.g., connection pools) and to
 * access persisted data.</li>
 * <li>Methods of the specific component interface are called by external code. Whether they can
 * be called concurrently depends on the type of component, as documented in its Javadoc.</li>
 * <li>Method {@link #close()} is called to dispose the {@code Component}, freeing allocated
 * resources. It can be called at any time after instantiation, even before initialization, and
 * calling it more than once has no effect.</li>
 * </ul>
 * </p>
 * <p>
 * Components access external resources, hence methods in this interface and its specializations
 * may throw {@link IOException}s. As a special kind of <tt>IOException</tt>, they may throw a
 * {@link DataCorruptedException} in case the persisted data is left in an unknown state.
 * </p>
 */
public interface Component extends Closeable {

    /**
     * Initializes the {@code Component}. This method is called after instantiation and before any
     * other instance method is called.
     *
     * @throws IOException
     *             in case initialization fails
     * @throws IllegalStateException
     *             in case the component has already been initialized or closed
     */
    void init() throws IOException, IllegalStateException;

    /**
     * Closes this {@code Component}, freeing allocated resources and aborting any ongoing
     * transaction. Closing a component has no impact on stored data, which will be accessed
     * unchanged the next time a similarly configured component is created.
     */
    @Override
    void close();

}
