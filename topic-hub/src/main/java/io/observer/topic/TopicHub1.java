package io.observer.topic;

import io.observer.hub.Hub;
import io.observer.hub.Subscription;
import java.util.Arrays;
import java.util.Collection;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.function.Consumer;
import javax.annotation.Nonnull;

/**
 * One-dimensional topic hub: subscribers and publishers pass a single collection of topics.
 *
 * <p>Example:
 * <pre>{@code
 * TopicHub1<Integer> hub = new TopicHub1<>();
 * hub.subscribe(Set.of("x"), value -> System.out.println(value));
 * hub.publish(List.of("x"), 2);   // prints 2
 * hub.publish(List.of("y"), 3);   // nothing
 * }</pre>
 *
 * <p>All matching is done by the wrapped {@link TopicHub}.
 *
 * @param <T> the type of value published through the hub
 */
public class TopicHub1<T> implements Hub {

    private final TopicHub<T> hub;

    public TopicHub1() {
        this(null);
    }

    /**
     * @param callbackExecutor executor for parallel delivery, null for delivery on the publishing thread
     */
    public TopicHub1(ExecutorService callbackExecutor) {
        this.hub = new TopicHub<>(1, callbackExecutor);
    }

    /**
     * @see TopicHub#subscribe(java.util.List, Consumer)
     */
    public Subscription subscribe(@Nonnull Collection<String> topics, @Nonnull Consumer<? super T> callback) {
        return hub.subscribe(Arrays.asList(topics), callback);
    }

    /**
     * @see TopicHub#publish(java.util.List, Object)
     */
    public void publish(@Nonnull Collection<String> topics, T value) {
        hub.publish(Arrays.asList(topics), value);
    }

    public Map<String, Object> getDetailedMetrics() {
        return hub.getDetailedMetrics();
    }

    @Override
    public int getSubscriberCount() {
        return hub.getSubscriberCount();
    }

    @Override
    public boolean isClosed() {
        return hub.isClosed();
    }

    @Override
    public void close() {
        hub.close();
    }
}
