package io.observer.hub;

import java.util.Objects;
import java.util.function.Consumer;

/**
 * An entry of a {@link CallbackRegistry}: a subscription id and the callback stored under it.
 *
 * @param <T> the type of value the callback accepts
 */
public final class Registration<T> {

    private final long id;
    private final Consumer<? super T> callback;

    Registration(long id, Consumer<? super T> callback) {
        this.id = id;
        this.callback = Objects.requireNonNull(callback, "Callback must not be null");
    }

    public long getId() {
        return id;
    }

    public Consumer<? super T> getCallback() {
        return callback;
    }

    @Override
    public String toString() {
        return "Registration{id=" + id + '}';
    }
}
