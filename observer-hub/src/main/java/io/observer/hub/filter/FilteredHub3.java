package io.observer.hub.filter;

import io.observer.hub.Hub;
import io.observer.hub.Subscription;
import java.util.Collection;
import java.util.concurrent.ExecutorService;
import java.util.function.Consumer;
import javax.annotation.Nonnull;

/**
 * Three-dimensional topic filtering, layered on {@link FilteredHub2}.
 */
public class FilteredHub3<K1, K2, K3, T> implements Hub {

    private final FilteredHub2<K1, K2, TopicMessage<K3, T>> hub;

    public FilteredHub3() {
        this(null);
    }

    public FilteredHub3(ExecutorService callbackExecutor) {
        this.hub = new FilteredHub2<>(callbackExecutor);
    }

    public Subscription subscribe(@Nonnull Collection<? extends K1> topics1,
                                  @Nonnull Collection<? extends K2> topics2,
                                  @Nonnull Collection<? extends K3> topics3,
                                  @Nonnull Consumer<? super T> callback) {
        return hub.subscribe(topics1, topics2, TopicMessage.unwrapping(topics3, callback));
    }

    public void publish(@Nonnull Collection<? extends K1> topics1,
                        @Nonnull Collection<? extends K2> topics2,
                        @Nonnull Collection<? extends K3> topics3,
                        T value) {
        hub.publish(topics1, topics2, new TopicMessage<>(topics3, value));
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
