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
 * Four-dimensional topic hub.
 * Delegates to a {@link TopicHub} with 4 dimensions.
 *
 * @param <T> the type of value published through the hub
 */
public class TopicHub4<T> implements Hub {

    private final TopicHub<T> hub;

    public TopicHub4() {
        this(null);
    }

    /**
     * @param callbackExecutor executor for parallel delivery, null for delivery on the publishing thread
     */
    public TopicHub4(ExecutorService callbackExecutor) {
        this.hub = new TopicHub<>(4, callbackExecutor);
    }

    /**
     * @see TopicHub#subscribe(java.util.List, Consumer)
     */
    public Subscription subscribe(@Nonnull Collection<String> topics1,
                                  @Nonnull Collection<String> topics2,
                                  @Nonnull Collection<String> topics3,
                                  @Nonnull Collection<String> topics4,
                                  @Nonnull Consumer<? super T> callback) {
        return hub.subscribe(Arrays.asList(topics1, topics2, topics3, topics4), callback);
    }

    /**
     * @see TopicHub#publish(java.util.List, Object)
     */
    public void publish(@Nonnull Collection<String> topics1,
                        @Nonnull Collection<String> topics2,
                        @Nonnull Collection<String> topics3,
                        @Nonnull Collection<String> topics4,
                        T value) {
        hub.publish(Arrays.asList(topics1, topics2, topics3, topics4), value);
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
