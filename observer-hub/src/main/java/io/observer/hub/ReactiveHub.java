package io.observer.hub;

import java.util.Objects;
import java.util.concurrent.ExecutorService;
import java.util.function.Consumer;
import java.util.function.Supplier;
import javax.annotation.Nonnull;

/**
 * Stateful hub whose values are computed by a state supplier instead of being passed in.
 *
 * <p>The supplier is called once at construction to produce the initial state and once per
 * {@link #publish()}. Each result is broadcast through an inner {@link StatefulHub}.
 *
 * <p>Usage example:
 * <pre>{@code
 * AtomicInteger counter = new AtomicInteger();
 * try (ReactiveHub<Integer> hub = new ReactiveHub<>(counter::incrementAndGet)) {
 *     hub.subscribe(count -> System.out.println("count is " + count));
 *     hub.publish();   // prints "count is 2", the initial state was 1
 * }
 * }</pre>
 *
 * <p>Two threads calling {@link #publish()} concurrently may broadcast their results in a
 * different order than the supplier produced them.
 *
 * @param <T> the type of the state
 */
public class ReactiveHub<T> implements Hub {

    private final Supplier<? extends T> stateSupplier;
    private final StatefulHub<T> hub;

    /**
     * Creates a reactive hub that invokes callbacks on the publishing thread.
     *
     * @param stateSupplier produces the state, called once now for the initial state
     * @throws HubException if the supplier fails while computing the initial state
     */
    public ReactiveHub(@Nonnull Supplier<? extends T> stateSupplier) {
        this(stateSupplier, null);
    }

    /**
     * Creates a reactive hub with optional parallel delivery.
     *
     * @param stateSupplier produces the state, called once now for the initial state
     * @param callbackExecutor executor for parallel delivery, null for delivery on the publishing thread
     * @throws HubException if the supplier fails while computing the initial state
     */
    public ReactiveHub(@Nonnull Supplier<? extends T> stateSupplier, ExecutorService callbackExecutor) {
        this.stateSupplier = Objects.requireNonNull(stateSupplier, "State supplier must not be null");
        this.hub = new StatefulHub<>(computeState(), callbackExecutor);
    }

    /**
     * Computes a new state, broadcasts it to every subscriber and returns it.
     *
     * @return the value that was broadcast
     * @throws HubException if the supplier fails; the state is left unchanged and nobody is notified
     * @throws IllegalStateException if the hub has been closed
     */
    public T publish() {
        ensureNotClosed();
        T value = computeState();
        hub.publish(value);
        return value;
    }

    public T state() {
        return hub.state();
    }

    public Subscription subscribe(@Nonnull Consumer<? super T> callback) {
        return hub.subscribe(callback);
    }

    /**
     * @see StatefulHub#subscribe(Consumer, boolean)
     */
    public Subscription subscribe(@Nonnull Consumer<? super T> callback, boolean notifyCurrentState) {
        return hub.subscribe(callback, notifyCurrentState);
    }

    @Override
    public int getSubscriberCount() {
        return hub.getSubscriberCount();
    }

    public long getNotificationCount() {
        return hub.getNotificationCount();
    }

    @Override
    public boolean isClosed() {
        return hub.isClosed();
    }

    @Override
    public void close() {
        hub.close();
    }

    private T computeState() {
        try {
            return stateSupplier.get();
        } catch (RuntimeException e) {
            throw new HubException("State supplier failed: " + e.getMessage(), e);
        }
    }

    private void ensureNotClosed() {
        if (hub.isClosed()) {
            throw new IllegalStateException("ReactiveHub has been closed");
        }
    }
}
