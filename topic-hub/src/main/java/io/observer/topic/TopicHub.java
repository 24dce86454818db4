package io.observer.topic;

import io.observer.hub.AbstractHub;
import io.observer.hub.Registration;
import io.observer.hub.Subscription;
import java.util.*;
import java.util.concurrent.ExecutorService;
import java.util.function.Consumer;
import javax.annotation.Nonnull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Hub routing values by string topics across a fixed number of dimensions.
 *
 * <p>A subscriber registers one set of topics per dimension. A value published with one list of
 * topics per dimension reaches the subscriber when, in <em>every</em> dimension, the two share a
 * topic or either side contains {@link TopicIndex#WILDCARD}. An empty collection in any dimension
 * never matches.
 *
 * <p>Subscriptions are kept in a {@link TopicIndex}, so a publish only visits the subtrees its
 * topics lead to. The index and the registry are guarded by the hub lock; callbacks run after
 * the lock has been released, on the publishing thread or on the supplied executor.
 *
 * <p>Usage example:
 * <pre>{@code
 * try (TopicHub<String> hub = new TopicHub<>(2)) {
 *     hub.subscribe(List.of(Set.of("eu"), Set.of("fx", "rates")), update -> System.out.println(update));
 *     hub.publish(List.of(List.of("eu", "us"), List.of("fx")), "EURUSD 1.08");   // delivered
 *     hub.publish(List.of(List.of("eu"), List.of("equities")), "SAP 182.4");     // not delivered
 * }
 * }</pre>
 *
 * <p>{@link TopicHub1} through {@link TopicHub4} offer the same hub with one parameter per dimension.
 *
 * @param <T> the type of value published through the hub
 */
public class TopicHub<T> extends AbstractHub<T> {

    private static final Logger LOGGER = LoggerFactory.getLogger(TopicHub.class);

    // Guarded by lock
    private final TopicIndex index;
    private final Map<Long, List<Set<String>>> topicsById = new HashMap<>();

    /**
     * Creates a topic hub that invokes callbacks on the publishing thread.
     *
     * @param dimensions the number of topic dimensions, at least 1
     * @throws IllegalArgumentException if dimensions is less than 1
     */
    public TopicHub(int dimensions) {
        this(dimensions, null);
    }

    /**
     * Creates a topic hub with optional parallel delivery.
     *
     * @param dimensions the number of topic dimensions, at least 1
     * @param callbackExecutor executor for parallel delivery, null for delivery on the publishing thread
     * @throws IllegalArgumentException if dimensions is less than 1
     */
    public TopicHub(int dimensions, ExecutorService callbackExecutor) {
        super(callbackExecutor);
        this.index = new TopicIndex(dimensions);
    }

    public int dimensions() {
        return index.dimensions();
    }

    /**
     * Adds a callback for values whose topics intersect {@code topics} in every dimension.
     *
     * <p>The topics are copied, so changing the passed collections afterwards has no effect.
     *
     * @param topics one collection of topics per dimension
     * @param callback the callback
     * @return a Subscription that can be used to unsubscribe
     * @throws IllegalArgumentException if the number of collections differs from {@link #dimensions()}
     * @throws NullPointerException if callback, a collection or a topic is null
     * @throws IllegalStateException if the hub has been closed
     */
    public Subscription subscribe(@Nonnull List<? extends Collection<String>> topics,
                                  @Nonnull Consumer<? super T> callback) {
        Objects.requireNonNull(callback, "Subscriber callback must not be null");
        List<Set<String>> topicSets = index.copyOf(topics);

        synchronized (lock) {
            ensureNotClosed();
            Subscription subscription = register(callback);
            if (index.insert(topicSets, subscription.getId())) {
                topicsById.put(subscription.getId(), topicSets);
            } else {
                LOGGER.debug("Subscriber #{} has an empty dimension in {} and will never match",
                    subscription.getId(), topicSets);
            }
            return subscription;
        }
    }

    /**
     * Publishes the value to every subscriber whose topics intersect {@code topics} in every
     * dimension, and returns once all of them have completed.
     *
     * @param topics one collection of topics per dimension
     * @param value the value to publish, may be null
     * @throws IllegalArgumentException if the number of collections differs from {@link #dimensions()}
     * @throws NullPointerException if a collection or a topic is null
     * @throws IllegalStateException if the hub has been closed
     */
    public void publish(@Nonnull List<? extends Collection<String>> topics, T value) {
        List<Registration<T>> targets;
        synchronized (lock) {
            ensureNotClosed();
            targets = resolve(index.match(topics));
        }
        deliver(targets, value);
    }

    /**
     * Gets the topics a live subscription was registered with.
     *
     * @param subscription a subscription returned by this hub
     * @return the copied topic sets, or an empty optional if the subscription is no longer
     *         registered or never could match
     */
    public Optional<List<Set<String>>> getTopics(@Nonnull Subscription subscription) {
        Objects.requireNonNull(subscription, "Subscription must not be null");
        synchronized (lock) {
            return Optional.ofNullable(topicsById.get(subscription.getId()));
        }
    }

    /**
     * Gets the number of nodes currently held by the topic index.
     *
     * @return the index node count
     */
    public int getIndexNodeCount() {
        synchronized (lock) {
            return index.nodeCount();
        }
    }

    @Override
    protected void onUnsubscribe(long id) {
        List<Set<String>> topicSets = topicsById.remove(id);
        if (topicSets != null) {
            index.remove(topicSets, id);
        }
    }

    @Override
    protected void onClose() {
        topicsById.clear();
        index.clear();
    }

    @Override
    public Map<String, Object> getDetailedMetrics() {
        synchronized (lock) {
            Map<String, Object> metrics = super.getDetailedMetrics();
            metrics.put("dimensions", index.dimensions());
            metrics.put("indexNodeCount", index.nodeCount());
            return metrics;
        }
    }
}
