package io.observer.hub;

/**
 * Lifecycle contract shared by every hub type.
 *
 * <p>A hub is live from construction until {@link #close()}. Closing clears all registered
 * callbacks; any later subscribe or publish call fails with {@link IllegalStateException},
 * while {@link Subscription#unsubscribe()} on an outstanding subscription stays a no-op.
 *
 * @see Hubs
 */
public interface Hub extends AutoCloseable {

    /**
     * Gets the number of callbacks currently registered with this hub.
     *
     * @return the subscriber count
     */
    int getSubscriberCount();

    /**
     * Checks if this hub has been closed.
     *
     * @return true if the hub has been closed, false otherwise
     */
    boolean isClosed();

    /**
     * Closes the hub and releases all subscriptions. Calling it again has no effect.
     */
    @Override
    void close();
}
