package io.observer.hub;

import java.util.List;
import java.util.Objects;
import java.util.concurrent.ExecutorService;
import java.util.function.Consumer;
import java.util.function.Predicate;
import javax.annotation.Nonnull;

/**
 * Hub that broadcasts every published value to every registered callback.
 *
 * <p>This is the primitive the filtered hubs build on: they only use {@link #subscribe(Consumer)},
 * {@link #publish(Object)} and the returned {@link Subscription}.
 *
 * <p>Usage example:
 * <pre>{@code
 * try (StatelessHub<String> hub = new StatelessHub<>()) {
 *     Subscription subscription = hub.subscribe(message -> System.out.println(message));
 *     hub.publish("hello");
 *     subscription.unsubscribe();
 * }
 * }</pre>
 *
 * @param <T> the type of value published through the hub
 * @see StatefulHub
 */
public class StatelessHub<T> extends AbstractHub<T> {

    /**
     * Creates a hub that invokes callbacks on the publishing thread.
     */
    public StatelessHub() {
        super();
    }

    /**
     * Creates a hub with optional parallel delivery.
     *
     * @param callbackExecutor executor for parallel delivery, null for delivery on the publishing thread
     */
    public StatelessHub(ExecutorService callbackExecutor) {
        super(callbackExecutor);
    }

    /**
     * Adds a callback invoked with every published value.
     *
     * @param callback the callback
     * @return a Subscription that can be used to unsubscribe
     * @throws NullPointerException if callback is null
     * @throws IllegalStateException if the hub has been closed
     */
    public Subscription subscribe(@Nonnull Consumer<? super T> callback) {
        Objects.requireNonNull(callback, "Subscriber callback must not be null");
        synchronized (lock) {
            ensureNotClosed();
            return register(callback);
        }
    }

    /**
     * Adds a callback that only sees the published values accepted by the filter.
     *
     * <p>Example:
     * <pre>{@code
     * hub.subscribe(order -> order.getAmount() > 1000, order -> processLargeOrder(order));
     * }</pre>
     *
     * @param filter predicate a value must satisfy to be delivered
     * @param callback the callback
     * @return a Subscription that can be used to unsubscribe
     * @throws NullPointerException if filter or callback is null
     */
    public Subscription subscribe(@Nonnull Predicate<? super T> filter, @Nonnull Consumer<? super T> callback) {
        Objects.requireNonNull(filter, "Filter must not be null");
        Objects.requireNonNull(callback, "Subscriber callback must not be null");
        return subscribe(value -> {
            if (filter.test(value)) {
                callback.accept(value);
            }
        });
    }

    /**
     * Invokes every callback registered at call time with the value and returns once all of
     * them have completed. Publishing to a hub without subscribers does nothing.
     *
     * @param value the value to publish, may be null
     * @throws IllegalStateException if the hub has been closed
     */
    public void publish(T value) {
        List<Registration<T>> targets;
        synchronized (lock) {
            ensureNotClosed();
            targets = snapshot();
        }
        deliver(targets, value);
    }
}
