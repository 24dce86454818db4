package io.observer.hub;

/**
 * Represents a subscription to a hub that can be cancelled.
 * This interface follows the Disposable pattern for resource management.
 */
public interface Subscription {

    /**
     * Cancels this subscription, removing the associated callback from the hub.
     * After calling this method, the callback will no longer receive values.
     *
     * <p>This method is idempotent - calling it multiple times has no additional effect.
     * It is also safe to call after the hub has been closed, in which case it does nothing.
     */
    void unsubscribe();

    /**
     * Checks if this subscription is still active.
     *
     * @return true if the subscription is active, false if it has been unsubscribed
     *         or its hub has been closed
     */
    boolean isActive();

    /**
     * Gets the id the hub assigned to this subscription. Ids start at 1 and are never
     * reused within the lifetime of a hub.
     *
     * @return the subscription id
     */
    long getId();
}
