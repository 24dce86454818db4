package io.observer.hub.filter;

import io.observer.hub.Hub;
import io.observer.hub.Subscription;
import java.util.Collection;
import java.util.concurrent.ExecutorService;
import java.util.function.Consumer;
import javax.annotation.Nonnull;

/**
 * Four-dimensional topic filtering, layered on {@link FilteredHub3}.
 */
public class FilteredHub4<K1, K2, K3, K4, T> implements Hub {

    private final FilteredHub3<K1, K2, K3, TopicMessage<K4, T>> hub;

    public FilteredHub4() {
        this(null);
    }

    public FilteredHub4(ExecutorService callbackExecutor) {
        this.hub = new FilteredHub3<>(callbackExecutor);
    }

    public Subscription subscribe(@Nonnull Collection<? extends K1> topics1,
                                  @Nonnull Collection<? extends K2> topics2,
                                  @Nonnull Collection<? extends K3> topics3,
                                  @Nonnull Collection<? extends K4> topics4,
                                  @Nonnull Consumer<? super T> callback) {
        return hub.subscribe(topics1, topics2, topics3, TopicMessage.unwrapping(topics4, callback));
    }

    public void publish(@Nonnull Collection<? extends K1> topics1,
                        @Nonnull Collection<? extends K2> topics2,
                        @Nonnull Collection<? extends K3> topics3,
                        @Nonnull Collection<? extends K4> topics4,
                        T value) {
        hub.publish(topics1, topics2, topics3, new TopicMessage<>(topics4, value));
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
