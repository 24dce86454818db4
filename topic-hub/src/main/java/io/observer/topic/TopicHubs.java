package io.observer.topic;

import io.observer.hub.Hubs;
import java.util.function.Function;
import javax.annotation.Nonnull;

/**
 * Scoped lifecycle helpers for topic hubs. Each creates the hub, applies the body and closes the
 * hub on every exit path.
 *
 * @see Hubs#withHub(java.util.function.Supplier, Function)
 */
public final class TopicHubs {

    private TopicHubs() {
        // utility class
    }

    public static <T, R> R withTopicHub(int dimensions,
                                        @Nonnull Function<? super TopicHub<T>, ? extends R> body) {
        return Hubs.<TopicHub<T>, R>withHub(() -> new TopicHub<T>(dimensions), body);
    }

    public static <T, R> R withTopicHub1(@Nonnull Function<? super TopicHub1<T>, ? extends R> body) {
        return Hubs.<TopicHub1<T>, R>withHub(() -> new TopicHub1<T>(), body);
    }

    public static <T, R> R withTopicHub2(@Nonnull Function<? super TopicHub2<T>, ? extends R> body) {
        return Hubs.<TopicHub2<T>, R>withHub(() -> new TopicHub2<T>(), body);
    }

    public static <T, R> R withTopicHub3(@Nonnull Function<? super TopicHub3<T>, ? extends R> body) {
        return Hubs.<TopicHub3<T>, R>withHub(() -> new TopicHub3<T>(), body);
    }

    public static <T, R> R withTopicHub4(@Nonnull Function<? super TopicHub4<T>, ? extends R> body) {
        return Hubs.<TopicHub4<T>, R>withHub(() -> new TopicHub4<T>(), body);
    }
}
