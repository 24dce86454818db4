package io.observer.hub;

import java.util.*;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Consumer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Abstract base class for hub implementations providing shared functionality.
 *
 * <p>This class owns the {@link CallbackRegistry}, the {@link Dispatcher}, the closed flag and
 * the metrics. All hub state, including state kept by subclasses, is guarded by {@link #lock}.
 * Critical sections are kept short: a publish computes its targets and takes a snapshot under
 * the lock, then invokes the callbacks after releasing it. A callback may therefore subscribe,
 * unsubscribe or publish on the same hub without deadlocking.
 *
 * <p>Subclasses follow the same pattern:
 * <ul>
 *   <li>subscribe: under {@link #lock}, call {@link #ensureNotClosed()} and {@link #register(Consumer)}
 *       then update their own structures with the returned id</li>
 *   <li>publish: under {@link #lock}, call {@link #ensureNotClosed()} and build the targets with
 *       {@link #resolve(Collection)} or {@link #snapshot()}; outside the lock, call
 *       {@link #deliver(List, Object)}</li>
 *   <li>override {@link #onUnsubscribe(long)} and {@link #onClose()} to keep their own
 *       structures in step with the registry</li>
 * </ul>
 *
 * @param <T> the type of value published through the hub
 */
public abstract class AbstractHub<T> implements Hub {

    private static final Logger LOGGER = LoggerFactory.getLogger(AbstractHub.class);

    /**
     * Guards the registry and any state kept by subclasses. Never held while callbacks run.
     */
    protected final Object lock = new Object();

    private final CallbackRegistry<T> registry = new CallbackRegistry<>();
    private final Dispatcher dispatcher;

    private final AtomicLong notificationCount = new AtomicLong(0);
    private final AtomicLong unmatchedNotificationCount = new AtomicLong(0);

    // Track if the hub has been closed
    private volatile boolean closed = false;

    /**
     * Creates a hub that invokes callbacks on the publishing thread.
     */
    protected AbstractHub() {
        this(null);
    }

    /**
     * Creates a hub with optional parallel delivery.
     *
     * <p>Callbacks may publish back into the hub from executor threads: the publishing thread runs
     * the tasks the executor has not started yet, so nested publishes complete even on a pool with
     * a single thread.
     *
     * @param callbackExecutor executor running one task per callback, null for delivery on the
     *                         publishing thread
     */
    protected AbstractHub(ExecutorService callbackExecutor) {
        this.dispatcher = new Dispatcher(callbackExecutor);
    }

    /**
     * Subscription handle bound to one registry id.
     */
    private final class HubSubscription implements Subscription {
        private final long id;
        private final AtomicBoolean active = new AtomicBoolean(true);

        private HubSubscription(long id) {
            this.id = id;
        }

        @Override
        public void unsubscribe() {
            // Only the first call reaches the hub
            if (active.compareAndSet(true, false)) {
                removeRegistration(id);
            }
        }

        @Override
        public boolean isActive() {
            return active.get() && !closed;
        }

        @Override
        public long getId() {
            return id;
        }

        @Override
        public String toString() {
            return AbstractHub.this.getClass().getSimpleName() + "Subscription{id=" + id + ", active=" + isActive() + '}';
        }
    }

    /**
     * Stores a callback in the registry. Must be called while holding {@link #lock}, after
     * {@link #ensureNotClosed()}.
     *
     * @param callback the callback to store
     * @return the subscription handle for the new registration
     */
    protected final Subscription register(Consumer<? super T> callback) {
        synchronized (lock) {
            long id = registry.add(callback);
            LOGGER.debug("Registered subscriber #{} on {}", id, hubName());
            return new HubSubscription(id);
        }
    }

    private void removeRegistration(long id) {
        synchronized (lock) {
            if (closed) {
                // Registry was already cleared on close
                return;
            }
            if (registry.remove(id)) {
                onUnsubscribe(id);
                LOGGER.debug("Removed subscriber #{} from {}", id, hubName());
            }
        }
    }

    /**
     * Called under {@link #lock} after the registration with the given id has been removed.
     *
     * @param id the removed subscription id
     */
    protected void onUnsubscribe(long id) {
    }

    /**
     * Called under {@link #lock} while the hub is being closed, after the registry was cleared.
     */
    protected void onClose() {
    }

    /**
     * Resolves subscription ids to a snapshot of their callbacks. Must be called while holding
     * {@link #lock}.
     *
     * @param ids the matched ids; ids removed in the meantime are skipped
     * @return the registrations to deliver to
     */
    protected final List<Registration<T>> resolve(Collection<Long> ids) {
        synchronized (lock) {
            return registry.resolve(ids);
        }
    }

    /**
     * Gets a snapshot of every registered callback. Must be called while holding {@link #lock}.
     *
     * @return the registrations to deliver to
     */
    protected final List<Registration<T>> snapshot() {
        synchronized (lock) {
            return registry.snapshot();
        }
    }

    /**
     * Invokes the targets with the value and returns once all of them completed. Must be called
     * WITHOUT holding {@link #lock}.
     *
     * @param targets snapshot taken by {@link #resolve(Collection)} or {@link #snapshot()}
     * @param value the value to deliver
     */
    protected final void deliver(List<Registration<T>> targets, T value) {
        notificationCount.incrementAndGet();
        if (targets.isEmpty()) {
            unmatchedNotificationCount.incrementAndGet();
            LOGGER.debug("Notification on {} matched no subscribers", hubName());
            return;
        }
        dispatcher.dispatch(targets, value);
    }

    /**
     * Invokes one callback immediately on the calling thread, isolating its failures the same way
     * {@link #deliver(List, Object)} does. Must be called WITHOUT holding {@link #lock}.
     *
     * @param identifier name used when logging a failure
     * @param callback the callback to invoke
     * @param value the value to pass
     */
    protected final void deliverNow(String identifier, Consumer<? super T> callback, T value) {
        dispatcher.invokeNow(identifier, callback, value);
    }

    // Metrics and debugging methods

    /**
     * Gets the total number of publish calls that reached delivery.
     *
     * @return the notification count
     */
    public long getNotificationCount() {
        return notificationCount.get();
    }

    /**
     * Gets the number of publish calls that matched no subscriber.
     *
     * @return the unmatched notification count
     */
    public long getUnmatchedNotificationCount() {
        return unmatchedNotificationCount.get();
    }

    @Override
    public int getSubscriberCount() {
        synchronized (lock) {
            return registry.size();
        }
    }

    /**
     * Checks whether callbacks are delivered through an executor.
     *
     * @return true if each callback runs as its own task
     */
    public boolean isParallelDelivery() {
        return dispatcher.isParallel();
    }

    /**
     * Gets detailed metrics about the hub state as a consistent snapshot.
     *
     * @return a map of metric names to their values
     */
    public Map<String, Object> getDetailedMetrics() {
        synchronized (lock) {
            Map<String, Object> metrics = new LinkedHashMap<>();
            metrics.put("notificationCount", getNotificationCount());
            metrics.put("unmatchedNotificationCount", getUnmatchedNotificationCount());
            metrics.put("subscriberCount", registry.size());
            metrics.put("parallelDelivery", dispatcher.isParallel());
            metrics.put("closed", closed);
            return metrics;
        }
    }

    @Override
    public void close() {
        int removedCount;
        synchronized (lock) {
            if (closed) {
                LOGGER.debug("{} already closed", hubName());
                return;
            }

            LOGGER.info("Closing {} - Notifications: {}, Unmatched: {}, Active subscribers: {}",
                hubName(), getNotificationCount(), getUnmatchedNotificationCount(), registry.size());

            removedCount = registry.size();
            registry.clear();
            onClose();
            closed = true;
        }
        LOGGER.info("{} closed - Removed {} subscribers", hubName(), removedCount);
    }

    @Override
    public boolean isClosed() {
        return closed;
    }

    /**
     * Ensures the hub is not closed before performing operations.
     *
     * @throws IllegalStateException if the hub has been closed
     */
    protected void ensureNotClosed() {
        if (closed) {
            throw new IllegalStateException(hubName() + " has been closed");
        }
    }

    private String hubName() {
        return getClass().getSimpleName();
    }
}
