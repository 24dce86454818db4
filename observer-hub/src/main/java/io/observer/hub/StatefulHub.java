package io.observer.hub;

import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ExecutorService;
import java.util.function.Consumer;
import javax.annotation.Nonnull;

/**
 * Hub that retains the last published value.
 *
 * <p>{@link #state()} returns the value of the most recent {@link #publish(Object)}, or the initial
 * value if nothing has been published yet. The state is replaced under the hub lock together
 * with taking the subscriber snapshot, so concurrent publishers observe a single order.
 *
 * <p>A new subscriber may ask to be called once with the current state straight away. That call
 * happens on the subscribing thread before the callback is registered, so it cannot be confused
 * with a delivery triggered by a concurrent publish.
 *
 * @param <T> the type of the state
 * @see ReactiveHub
 */
public class StatefulHub<T> extends AbstractHub<T> {

    // Guarded by lock
    private T state;

    /**
     * Creates a stateful hub that invokes callbacks on the publishing thread.
     *
     * @param initialState the state returned until the first publish, may be null
     */
    public StatefulHub(T initialState) {
        this(initialState, null);
    }

    /**
     * Creates a stateful hub with optional parallel delivery.
     *
     * @param initialState the state returned until the first publish, may be null
     * @param callbackExecutor executor for parallel delivery, null for delivery on the publishing thread
     */
    public StatefulHub(T initialState, ExecutorService callbackExecutor) {
        super(callbackExecutor);
        this.state = initialState;
    }

    /**
     * Gets the current state.
     *
     * @return the last published value, or the initial value
     * @throws IllegalStateException if the hub has been closed
     */
    public T state() {
        synchronized (lock) {
            ensureNotClosed();
            return state;
        }
    }

    /**
     * Adds a callback invoked with every future state.
     *
     * @param callback the callback
     * @return a Subscription that can be used to unsubscribe
     */
    public Subscription subscribe(@Nonnull Consumer<? super T> callback) {
        return subscribe(callback, false);
    }

    /**
     * Adds a callback invoked with every future state.
     *
     * @param callback the callback
     * @param notifyCurrentState if true, the callback is invoked once with the current state
     *                           before this method registers it and returns
     * @return a Subscription that can be used to unsubscribe
     * @throws NullPointerException if callback is null
     * @throws IllegalStateException if the hub has been closed
     */
    public Subscription subscribe(@Nonnull Consumer<? super T> callback, boolean notifyCurrentState) {
        Objects.requireNonNull(callback, "Subscriber callback must not be null");
        if (notifyCurrentState) {
            deliverNow("(current state)", callback, state());
        }
        synchronized (lock) {
            ensureNotClosed();
            return register(callback);
        }
    }

    /**
     * Replaces the state and invokes every callback registered at call time with it.
     *
     * @param value the new state, may be null
     * @throws IllegalStateException if the hub has been closed
     */
    public void publish(T value) {
        List<Registration<T>> targets;
        synchronized (lock) {
            ensureNotClosed();
            state = value;
            targets = snapshot();
        }
        deliver(targets, value);
    }

    @Override
    public Map<String, Object> getDetailedMetrics() {
        synchronized (lock) {
            Map<String, Object> metrics = super.getDetailedMetrics();
            metrics.put("state", state);
            return metrics;
        }
    }

    @Override
    protected void onClose() {
        state = null;
    }
}
