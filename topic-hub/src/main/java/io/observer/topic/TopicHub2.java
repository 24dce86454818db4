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
 * Two-dimensional topic hub: a subscriber matches when both dimensions intersect.
 * Delegates to a {@link TopicHub} with 2 dimensions.
 *
 * @param <T> the type of value published through the hub
 */
public class TopicHub2<T> implements Hub {

    private final TopicHub<T> hub;

    public TopicHub2() {
        this(null);
    }

    /**
     * @param callbackExecutor executor for parallel delivery, null for delivery on the publishing thread
     */
    public TopicHub2(ExecutorService callbackExecutor) {
        this.hub = new TopicHub<>(2, callbackExecutor);
    }

    /**
     * @see TopicHub#subscribe(java.util.List, Consumer)
     */
    public Subscription subscribe(@Nonnull Collection<String> topics1,
                                  @Nonnull Collection<String> topics2,
                                  @Nonnull Consumer<? super T> callback) {
        return hub.subscribe(Arrays.asList(topics1, topics2), callback);
    }

    /**
     * @see TopicHub#publish(java.util.List, Object)
     */
    public void publish(@Nonnull Collection<String> topics1,
                        @Nonnull Collection<String> topics2,
                        T value) {
        hub.publish(Arrays.asList(topics1, topics2), value);
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
