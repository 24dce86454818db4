package io.observer.hub;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.*;

class ReactiveHubTest {

    @Test
    @DisplayName("Should compute the initial state from the supplier")
    void shouldComputeInitialState() {
        AtomicInteger counter = new AtomicInteger();

        try (ReactiveHub<Integer> hub = new ReactiveHub<>(counter::incrementAndGet)) {
            assertThat(hub.state()).isEqualTo(1);
        }
    }

    @Test
    @DisplayName("Should broadcast and return the freshly computed state")
    void shouldBroadcastComputedState() {
        AtomicInteger counter = new AtomicInteger();
        List<Integer> received = new ArrayList<>();

        try (ReactiveHub<Integer> hub = new ReactiveHub<>(counter::incrementAndGet)) {
            hub.subscribe(received::add);

            int published = hub.publish();

            assertThat(published).isEqualTo(2);
            assertThat(hub.state()).isEqualTo(2);
            assertThat(received).containsExactly(2);
        }
    }

    @Test
    @DisplayName("Should invoke a new subscriber with the current state when requested")
    void shouldNotifyCurrentState() {
        AtomicInteger counter = new AtomicInteger(10);
        List<Integer> received = new ArrayList<>();

        try (ReactiveHub<Integer> hub = new ReactiveHub<>(counter::incrementAndGet)) {
            hub.publish();
            hub.subscribe(received::add, true);
            hub.publish();

            assertThat(received).containsExactly(12, 13);
        }
    }

    @Test
    @DisplayName("Should wrap a failing supplier in HubException and keep the state")
    void shouldWrapSupplierFailure() {
        AtomicBoolean fail = new AtomicBoolean(false);
        AtomicInteger counter = new AtomicInteger();
        List<Integer> received = new ArrayList<>();

        try (ReactiveHub<Integer> hub = new ReactiveHub<>(() -> {
            if (fail.get()) {
                throw new IllegalStateException("sensor offline");
            }
            return counter.incrementAndGet();
        })) {
            hub.subscribe(received::add);
            fail.set(true);

            assertThatThrownBy(hub::publish)
                .isInstanceOf(HubException.class)
                .hasMessageContaining("sensor offline")
                .hasCauseInstanceOf(IllegalStateException.class);
            assertThat(hub.state()).isEqualTo(1);
            assertThat(received).isEmpty();
        }
    }

    @Test
    @DisplayName("Should fail construction when the initial state cannot be computed")
    void shouldFailConstructionWhenSupplierFails() {
        assertThatThrownBy(() -> new ReactiveHub<Integer>(() -> {
            throw new IllegalArgumentException("no state");
        }))
            .isInstanceOf(HubException.class)
            .hasCauseInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("Should not call the supplier after close")
    void shouldNotCallSupplierAfterClose() {
        AtomicInteger calls = new AtomicInteger();
        ReactiveHub<Integer> hub = new ReactiveHub<>(calls::incrementAndGet);

        hub.close();

        assertThat(hub.isClosed()).isTrue();
        assertThatThrownBy(hub::publish)
            .isInstanceOf(IllegalStateException.class)
            .hasMessage("ReactiveHub has been closed");
        assertThat(calls.get()).isEqualTo(1);
    }
}
