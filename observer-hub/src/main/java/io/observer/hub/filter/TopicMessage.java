package io.observer.hub.filter;

import java.util.*;
import java.util.function.Consumer;

/**
 * A value travelling through a filtered hub together with the topics it was published under.
 *
 * <p>Each dimension of a filtered hub wraps the value of the layer above it in one more
 * {@code TopicMessage}. Subscribers unwrap it again with {@link #unwrapping(Collection, Consumer)}.
 *
 * @param <K> the topic type, compared with {@code equals}/{@code hashCode}
 * @param <T> the type of the carried value
 */
public final class TopicMessage<K, T> {

    private final Set<K> topics;
    private final T value;

    public TopicMessage(Collection<? extends K> topics, T value) {
        this.topics = copyOf(topics);
        this.value = value;
    }

    public Set<K> getTopics() {
        return topics;
    }

    public T getValue() {
        return value;
    }

    /**
     * Checks whether this message shares at least one topic with the given set.
     * An empty set on either side never matches.
     *
     * @param wanted the topics a subscriber registered for
     * @return true if the intersection is non-empty
     */
    public boolean matchesAny(Set<?> wanted) {
        Set<?> smaller = topics.size() <= wanted.size() ? topics : wanted;
        Set<?> larger = smaller == topics ? wanted : topics;
        for (Object topic : smaller) {
            if (larger.contains(topic)) {
                return true;
            }
        }
        return false;
    }

    /**
     * Builds the callback a subscriber registers one layer down: it passes the carried value on
     * when the message topics intersect {@code topics} and drops the message otherwise.
     *
     * @param topics the topics the subscriber is interested in, copied
     * @param callback receives the unwrapped value
     */
    static <K, T> Consumer<TopicMessage<K, T>> unwrapping(Collection<? extends K> topics, Consumer<? super T> callback) {
        Objects.requireNonNull(callback, "Subscriber callback must not be null");
        Set<K> wanted = copyOf(topics);
        return message -> {
            if (message.matchesAny(wanted)) {
                callback.accept(message.getValue());
            }
        };
    }

    static <K> Set<K> copyOf(Collection<? extends K> topics) {
        Objects.requireNonNull(topics, "Topics must not be null");
        if (topics.isEmpty()) {
            return Collections.emptySet();
        }
        return Collections.unmodifiableSet(new HashSet<>(topics));
    }

    @Override
    public String toString() {
        return "TopicMessage{" +
                "topics=" + topics +
                ", value=" + value +
                '}';
    }
}
