package io.observer.topic;

import io.observer.hub.Subscription;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.*;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.*;

/**
 * Tests for the fixed-arity topic hubs and their scoped helpers.
 */
class TopicHubArityTest {

    @Test
    @DisplayName("Should route a single dimension")
    void shouldRouteOneDimension() {
        try (TopicHub1<Integer> hub = new TopicHub1<>()) {
            List<Integer> received = new ArrayList<>();
            hub.subscribe(List.of("x"), received::add);

            hub.publish(List.of("x"), 2);
            hub.publish(List.of("y"), 3);

            assertThat(received).containsExactly(2);
            assertThat(hub.getDetailedMetrics()).containsEntry("dimensions", 1);
        }
    }

    @Test
    @DisplayName("Should require both dimensions to match")
    void shouldRouteTwoDimensions() {
        try (TopicHub2<String> hub = new TopicHub2<>()) {
            List<String> received = new ArrayList<>();
            hub.subscribe(List.of("x"), List.of("y"), received::add);

            hub.publish(List.of("x"), List.of("z"), "miss");
            hub.publish(List.of("x"), List.of("y"), "hit");

            assertThat(received).containsExactly("hit");
        }
    }

    @Test
    @DisplayName("Should apply wildcards in any of three dimensions")
    void shouldRouteThreeDimensions() {
        try (TopicHub3<String> hub = new TopicHub3<>()) {
            List<String> received = new ArrayList<>();
            hub.subscribe(List.of("eu"), List.of("*"), List.of("trade"), received::add);

            hub.publish(List.of("eu"), List.of("fx"), List.of("trade"), "fx trade");
            hub.publish(List.of("*"), List.of("rates"), List.of("trade"), "any region");
            hub.publish(List.of("eu"), List.of("fx"), List.of("quote"), "quote");

            assertThat(received).containsExactly("fx trade", "any region");
        }
    }

    @Test
    @DisplayName("Should route four dimensions and unsubscribe")
    void shouldRouteFourDimensions() {
        try (TopicHub4<Integer> hub = new TopicHub4<>()) {
            List<Integer> received = new ArrayList<>();
            Subscription subscription = hub.subscribe(
                List.of("a"), List.of("b"), List.of("c"), List.of("d", "e"), received::add);

            hub.publish(List.of("a"), List.of("b"), List.of("c"), List.of("e"), 1);
            hub.publish(List.of("a"), List.of("b"), List.of("x"), List.of("e"), 2);
            subscription.unsubscribe();
            hub.publish(List.of("a"), List.of("b"), List.of("c"), List.of("d"), 3);

            assertThat(received).containsExactly(1);
            assertThat(hub.getSubscriberCount()).isZero();
            assertThat(hub.getDetailedMetrics()).containsEntry("indexNodeCount", 0);
        }
    }

    @Test
    @DisplayName("Should close scoped hubs after the body, also when it throws")
    void shouldCloseScopedHubs() {
        AtomicReference<TopicHub2<String>> captured = new AtomicReference<>();

        List<String> received = TopicHubs.<String, List<String>>withTopicHub2(hub -> {
            captured.set(hub);
            List<String> values = new ArrayList<>();
            hub.subscribe(List.of("x"), List.of("*"), values::add);
            hub.publish(List.of("x"), List.of("y"), "scoped");
            return values;
        });

        assertThat(received).containsExactly("scoped");
        assertThat(captured.get().isClosed()).isTrue();

        AtomicReference<TopicHub<String>> generic = new AtomicReference<>();
        assertThatThrownBy(() -> TopicHubs.<String, Void>withTopicHub(3, hub -> {
            generic.set(hub);
            throw new IllegalStateException("body failed");
        })).hasMessage("body failed");
        assertThat(generic.get().isClosed()).isTrue();
    }

    @Test
    @DisplayName("Should provide scoped hubs of every arity")
    void shouldProvideEveryArity() {
        assertThat(TopicHubs.<String, Integer>withTopicHub1(hub -> hub.getDetailedMetrics().size())).isPositive();
        assertThat(TopicHubs.<String, Boolean>withTopicHub3(TopicHub3::isClosed)).isFalse();
        assertThat(TopicHubs.<String, Boolean>withTopicHub4(TopicHub4::isClosed)).isFalse();
    }
}
