package io.observer.hub;

import io.observer.hub.filter.FilteredHub;
import java.util.Objects;
import java.util.function.Function;
import java.util.function.Supplier;
import javax.annotation.Nonnull;

/**
 * Scoped hub lifecycle: each helper creates a hub, applies the body to it and closes the hub on
 * every exit path, including when the body throws.
 *
 * <p>Example:
 * <pre>{@code
 * int received = Hubs.withStatefulHub(0, hub -> {
 *     hub.publish(42);
 *     return hub.state();
 * });
 * }</pre>
 */
public final class Hubs {

    private Hubs() {
        // utility class
    }

    /**
     * Creates a hub with the factory, applies the body and closes the hub.
     *
     * @param factory creates the hub
     * @param body work to do while the hub is live
     * @param <H> the hub type
     * @param <R> the result type
     * @return the result of the body
     */
    public static <H extends Hub, R> R withHub(@Nonnull Supplier<? extends H> factory,
                                               @Nonnull Function<? super H, ? extends R> body) {
        Objects.requireNonNull(factory, "Hub factory must not be null");
        Objects.requireNonNull(body, "Body must not be null");
        try (H hub = factory.get()) {
            return body.apply(hub);
        }
    }

    public static <T, R> R withStatelessHub(@Nonnull Function<? super StatelessHub<T>, ? extends R> body) {
        return Hubs.<StatelessHub<T>, R>withHub(() -> new StatelessHub<T>(), body);
    }

    public static <T, R> R withStatefulHub(T initialState,
                                           @Nonnull Function<? super StatefulHub<T>, ? extends R> body) {
        return Hubs.<StatefulHub<T>, R>withHub(() -> new StatefulHub<T>(initialState), body);
    }

    public static <T, R> R withReactiveHub(@Nonnull Supplier<? extends T> stateSupplier,
                                           @Nonnull Function<? super ReactiveHub<T>, ? extends R> body) {
        return Hubs.<ReactiveHub<T>, R>withHub(() -> new ReactiveHub<T>(stateSupplier), body);
    }

    public static <K, T, R> R withFilteredHub(@Nonnull Function<? super FilteredHub<K, T>, ? extends R> body) {
        return Hubs.<FilteredHub<K, T>, R>withHub(() -> new FilteredHub<K, T>(), body);
    }
}
