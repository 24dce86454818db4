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
 * Three-dimensional topic hub.
 * Delegates to a {@link TopicHub} with 3 dimensions.
 *
 * @param <T> the type of value published through the hub
 */
public class TopicHub3<T> implements Hub {

    private final TopicHub<T> hub;

    public TopicHub3() {
        this(null);
    }

    /**
     * @param callbackExecutor executor for parallel delivery, null for delivery on the publishing thread
     */
    public TopicHub3(ExecutorService callbackExecutor) {
        this.hub = new TopicHub<>(3, callbackExecutor);
    }

    /**
     * @see TopicHub#subscribe(java.util.List, Consumer)
     */
    public Subscription subscribe(@Nonnull Collection<String> topics1,
                                  @Nonnull Collection<String> topics2,
                                  @Nonnull Collection<String> topics3,
                                  @Nonnull Consumer<? super T> callback) {
        return hub.subscribe(Arrays.asList(topics1, topics2, topics3), callback);
    }

    /**
     * @see TopicHub#publish(java.util.List, Object)
     */
    public void publish(@Nonnull Collection<String> topics1,
                        @Nonnull Collection<String> topics2,
                        @Nonnull Collection<String> topics3,
                        T value) {
        hub.publish(Arrays.asList(topics1, topics2, topics3), value);
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
