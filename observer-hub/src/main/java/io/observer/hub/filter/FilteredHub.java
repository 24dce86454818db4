package io.observer.hub.filter;

import io.observer.hub.Hub;
import io.observer.hub.StatelessHub;
import io.observer.hub.Subscription;
import java.util.Collection;
import java.util.concurrent.ExecutorService;
import java.util.function.Consumer;
import javax.annotation.Nonnull;

/**
 * One-dimensional topic filtering for topics of any type.
 *
 * <p>Topics are compared with {@code equals}/{@code hashCode}, so they may be strings, enums,
 * numbers or even hubs and lambdas used as identity tokens. A subscriber receives a value when
 * its topics and the published topics share at least one element. There is no wildcard.
 *
 * <p>Nothing is indexed: every publish goes to each subscriber of the underlying
 * {@link StatelessHub}, which tests the intersection itself. Publishing is O(subscribers).
 * The string topic hubs of the {@code topic-hub} module index their subscriptions instead.
 *
 * @param <K> the topic type
 * @param <T> the type of value published through the hub
 * @see FilteredHub2
 */
public class FilteredHub<K, T> implements Hub {

    private final StatelessHub<TopicMessage<K, T>> hub;

    public FilteredHub() {
        this(null);
    }

    /**
     * @param callbackExecutor executor for parallel delivery, null for delivery on the publishing thread
     */
    public FilteredHub(ExecutorService callbackExecutor) {
        this.hub = new StatelessHub<>(callbackExecutor);
    }

    /**
     * Adds a callback invoked with values published under at least one of the topics.
     *
     * @param topics the topics to listen to; an empty collection never matches
     * @param callback the callback
     * @return a Subscription that can be used to unsubscribe
     */
    public Subscription subscribe(@Nonnull Collection<? extends K> topics, @Nonnull Consumer<? super T> callback) {
        return hub.subscribe(TopicMessage.unwrapping(topics, callback));
    }

    /**
     * Publishes the value under the topics and returns once every matching callback completed.
     *
     * @param topics the topics of the value; an empty collection reaches nobody
     * @param value the value to publish
     */
    public void publish(@Nonnull Collection<? extends K> topics, T value) {
        hub.publish(new TopicMessage<>(topics, value));
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
