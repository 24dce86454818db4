package io.observer.hub;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;
import java.util.Set;
import java.util.function.Consumer;

import static org.assertj.core.api.Assertions.*;

@DisplayName("CallbackRegistry Tests")
class CallbackRegistryTest {

    private CallbackRegistry<String> registry;

    @BeforeEach
    void setUp() {
        registry = new CallbackRegistry<>();
    }

    @Test
    @DisplayName("Should allocate ids starting at 1 and increasing by one")
    void shouldAllocateIncreasingIds() {
        assertThat(registry.add(value -> { })).isEqualTo(1L);
        assertThat(registry.add(value -> { })).isEqualTo(2L);
        assertThat(registry.add(value -> { })).isEqualTo(3L);
        assertThat(registry.size()).isEqualTo(3);
    }

    @Test
    @DisplayName("Should never reuse an id after removal or clear")
    void shouldNeverReuseIds() {
        long first = registry.add(value -> { });
        registry.remove(first);
        long second = registry.add(value -> { });
        registry.clear();
        long third = registry.add(value -> { });

        assertThat(second).isGreaterThan(first);
        assertThat(third).isGreaterThan(second);
    }

    @Test
    @DisplayName("Should treat removal of an unknown id as a no-op")
    void shouldIgnoreUnknownIdOnRemove() {
        long id = registry.add(value -> { });

        assertThat(registry.remove(id)).isTrue();
        assertThat(registry.remove(id)).isFalse();
        assertThat(registry.remove(42L)).isFalse();
        assertThat(registry.isEmpty()).isTrue();
    }

    @Test
    @DisplayName("Should resolve only ids that are still present, in id order")
    void shouldResolvePresentIdsInOrder() {
        Consumer<String> a = value -> { };
        Consumer<String> b = value -> { };
        Consumer<String> c = value -> { };
        long idA = registry.add(a);
        long idB = registry.add(b);
        long idC = registry.add(c);
        registry.remove(idB);

        List<Registration<String>> resolved = registry.resolve(Arrays.asList(idC, idB, idA, 99L));

        assertThat(resolved).extracting(Registration::getId).containsExactly(idA, idC);
        assertThat(resolved).extracting(Registration::getCallback).containsExactly(a, c);
    }

    @Test
    @DisplayName("Should return snapshots unaffected by later changes")
    void shouldReturnDetachedSnapshots() {
        long id = registry.add(value -> { });
        List<Registration<String>> snapshot = registry.snapshot();
        List<Registration<String>> resolved = registry.resolve(Set.of(id));

        registry.remove(id);
        registry.add(value -> { });

        assertThat(snapshot).hasSize(1);
        assertThat(resolved).hasSize(1);
        assertThat(registry.contains(id)).isFalse();
    }

    @Test
    @DisplayName("Should return empty results for an empty registry")
    void shouldHandleEmptyRegistry() {
        assertThat(registry.snapshot()).isEmpty();
        assertThat(registry.resolve(Set.of(1L, 2L))).isEmpty();
    }

    @Test
    @DisplayName("Should reject null callbacks")
    void shouldRejectNullCallback() {
        assertThatThrownBy(() -> registry.add(null))
            .isInstanceOf(NullPointerException.class)
            .hasMessageContaining("Callback must not be null");
    }
}
