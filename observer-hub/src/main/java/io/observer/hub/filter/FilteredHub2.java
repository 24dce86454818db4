package io.observer.hub.filter;

import io.observer.hub.Hub;
import io.observer.hub.Subscription;
import java.util.Collection;
import java.util.concurrent.ExecutorService;
import java.util.function.Consumer;
import javax.annotation.Nonnull;

/**
 * Two-dimensional topic filtering, built on a {@link FilteredHub} whose values carry the
 * second dimension's topics. A subscriber matches only when both dimensions intersect.
 *
 * @param <K1> the first dimension's topic type
 * @param <K2> the second dimension's topic type
 * @param <T> the type of value published through the hub
 */
public class FilteredHub2<K1, K2, T> implements Hub {

    private final FilteredHub<K1, TopicMessage<K2, T>> hub;

    public FilteredHub2() {
        this(null);
    }

    public FilteredHub2(ExecutorService callbackExecutor) {
        this.hub = new FilteredHub<>(callbackExecutor);
    }

    public Subscription subscribe(@Nonnull Collection<? extends K1> topics1,
                                  @Nonnull Collection<? extends K2> topics2,
                                  @Nonnull Consumer<? super T> callback) {
        return hub.subscribe(topics1, TopicMessage.unwrapping(topics2, callback));
    }

    public void publish(@Nonnull Collection<? extends K1> topics1,
                        @Nonnull Collection<? extends K2> topics2,
                        T value) {
        hub.publish(topics1, new TopicMessage<>(topics2, value));
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
