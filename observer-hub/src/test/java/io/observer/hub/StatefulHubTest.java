package io.observer.hub;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.*;

class StatefulHubTest {

    private StatefulHub<String> hub;

    @BeforeEach
    void setUp() {
        hub = new StatefulHub<>("initial");
    }

    @AfterEach
    void tearDown() {
        hub.close();
    }

    @Test
    @DisplayName("Should return the initial state until the first publish")
    void shouldReturnInitialState() {
        assertThat(hub.state()).isEqualTo("initial");
    }

    @Test
    @DisplayName("Should retain the latest published value")
    void shouldRetainLatestValue() {
        hub.publish("first");
        hub.publish("second");

        assertThat(hub.state()).isEqualTo("second");
    }

    @Test
    @DisplayName("Should update the state even without subscribers")
    void shouldUpdateStateWithoutSubscribers() {
        hub.publish("lonely");

        assertThat(hub.state()).isEqualTo("lonely");
        assertThat(hub.getUnmatchedNotificationCount()).isEqualTo(1);
    }

    @Test
    @DisplayName("Should invoke a new subscriber with the current state when requested")
    void shouldNotifyCurrentStateOnSubscribe() {
        hub.publish("latest");
        List<String> received = new ArrayList<>();

        hub.subscribe(received::add, true);

        assertThat(received).containsExactly("latest");
    }

    @Test
    @DisplayName("Should not invoke a new subscriber immediately by default")
    void shouldNotNotifyCurrentStateByDefault() {
        List<String> received = new ArrayList<>();

        hub.subscribe(received::add);
        hub.subscribe(received::add, false);

        assertThat(received).isEmpty();
    }

    @Test
    @DisplayName("Should make the immediate call before the callback is registered")
    void shouldCallBeforeRegistering() {
        AtomicInteger subscribersDuringCall = new AtomicInteger(-1);

        hub.subscribe(value -> {
            if (subscribersDuringCall.get() < 0) {
                subscribersDuringCall.set(hub.getSubscriberCount());
            }
        }, true);

        assertThat(subscribersDuringCall.get()).isZero();
        assertThat(hub.getSubscriberCount()).isEqualTo(1);
    }

    @Test
    @DisplayName("Should register the subscriber even if the immediate call fails")
    void shouldRegisterWhenImmediateCallFails() {
        List<String> received = new ArrayList<>();

        hub.subscribe(value -> {
            if (value.equals("initial")) {
                throw new IllegalArgumentException("rejected");
            }
            received.add(value);
        }, true);
        hub.publish("next");

        assertThat(received).containsExactly("next");
    }

    @Test
    @DisplayName("Should let subscribers read the new state while being notified")
    void shouldExposeNewStateToSubscribers() {
        List<String> seen = new ArrayList<>();
        hub.subscribe(value -> seen.add(value + "=" + hub.state()));

        hub.publish("x");

        assertThat(seen).containsExactly("x=x");
    }

    @Test
    @DisplayName("Should stop delivering after unsubscribe")
    void shouldStopAfterUnsubscribe() {
        List<String> received = new ArrayList<>();
        Subscription subscription = hub.subscribe(received::add);

        hub.publish("a");
        subscription.unsubscribe();
        subscription.unsubscribe();
        hub.publish("b");

        assertThat(received).containsExactly("a");
        assertThat(hub.state()).isEqualTo("b");
    }

    @Test
    @DisplayName("Should accept a null initial state")
    void shouldAcceptNullInitialState() {
        try (StatefulHub<String> empty = new StatefulHub<>(null)) {
            List<String> received = new ArrayList<>();
            empty.subscribe(received::add, true);

            assertThat(empty.state()).isNull();
            assertThat(received).containsExactly((String) null);
        }
    }

    @Test
    @DisplayName("Should fail fast on use after close")
    void shouldFailFastAfterClose() {
        hub.close();

        assertThatThrownBy(() -> hub.state())
            .isInstanceOf(IllegalStateException.class)
            .hasMessage("StatefulHub has been closed");
        assertThatThrownBy(() -> hub.publish("late"))
            .isInstanceOf(IllegalStateException.class);
        assertThatThrownBy(() -> hub.subscribe(value -> { }, true))
            .isInstanceOf(IllegalStateException.class);
    }

    @Test
    @DisplayName("Should include the state in the detailed metrics")
    void shouldReportStateInMetrics() {
        hub.publish("reported");

        assertThat(hub.getDetailedMetrics())
            .containsEntry("state", "reported")
            .containsEntry("notificationCount", 1L);
    }
}
