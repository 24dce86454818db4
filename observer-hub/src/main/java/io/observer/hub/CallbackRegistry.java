package io.observer.hub;

import java.util.*;
import java.util.function.Consumer;

/**
 * Mapping from subscription id to callback.
 *
 * <p>Ids are allocated as the previous maximum plus one, starting at 1, and are never reused
 * for the lifetime of the registry, even after {@link #clear()}.
 *
 * <p><b>Thread Safety:</b> This class is NOT thread-safe. Hubs guard every access with their
 * own lock and only hand snapshots (see {@link #resolve(Collection)} and {@link #snapshot()})
 * to the code that invokes callbacks, so callbacks may subscribe or unsubscribe re-entrantly.
 *
 * @param <T> the type of value the callbacks accept
 */
public final class CallbackRegistry<T> {

    private final Map<Long, Registration<T>> registrations = new LinkedHashMap<>();
    private long lastId = 0;

    /**
     * Stores the callback under a freshly allocated id.
     *
     * @param callback the callback to store
     * @return the allocated id
     * @throws NullPointerException if callback is null
     */
    public long add(Consumer<? super T> callback) {
        Objects.requireNonNull(callback, "Callback must not be null");
        long id = ++lastId;
        registrations.put(id, new Registration<>(id, callback));
        return id;
    }

    /**
     * Removes the callback stored under the given id. An absent id is not an error.
     *
     * @param id the subscription id
     * @return true if a callback was removed, false if the id was not present
     */
    public boolean remove(long id) {
        return registrations.remove(id) != null;
    }

    /**
     * Resolves ids to the callbacks currently stored under them, in ascending id order.
     * Ids that are no longer present are skipped silently.
     *
     * @param ids the ids to resolve
     * @return a snapshot of the matching registrations (never {@code null})
     */
    public List<Registration<T>> resolve(Collection<Long> ids) {
        if (ids.isEmpty() || registrations.isEmpty()) {
            return Collections.emptyList();
        }
        List<Long> ordered = new ArrayList<>(ids);
        Collections.sort(ordered);

        List<Registration<T>> resolved = new ArrayList<>(ordered.size());
        for (Long id : ordered) {
            Registration<T> registration = registrations.get(id);
            if (registration != null) {
                resolved.add(registration);
            }
        }
        return resolved;
    }

    /**
     * Gets a snapshot of every registration in ascending id order.
     *
     * @return a new list that is unaffected by later changes to the registry
     */
    public List<Registration<T>> snapshot() {
        if (registrations.isEmpty()) {
            return Collections.emptyList();
        }
        return new ArrayList<>(registrations.values());
    }

    public boolean contains(long id) {
        return registrations.containsKey(id);
    }

    public int size() {
        return registrations.size();
    }

    public boolean isEmpty() {
        return registrations.isEmpty();
    }

    /**
     * Removes every registration. The id counter is not reset.
     */
    public void clear() {
        registrations.clear();
    }
}
