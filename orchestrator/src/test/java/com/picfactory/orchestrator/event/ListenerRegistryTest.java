package com.picfactory.orchestrator.event;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class ListenerRegistryTest {

    @Test
    void publish_skipsFailingListenerAndReachesTheRest() {
        ListenerRegistry<String> registry = new ListenerRegistry<>("test");
        List<String> received = new ArrayList<>();
        registry.subscribe(e -> {
            throw new IllegalStateException("broken");
        });
        registry.subscribe(received::add);

        registry.publish("hello");

        assertThat(received).containsExactly("hello");
    }

    @Test
    void unsubscribe_removesOnlyThatListener() {
        ListenerRegistry<String> registry = new ListenerRegistry<>("test");
        List<String> first = new ArrayList<>();
        List<String> second = new ArrayList<>();
        Subscription sub = registry.subscribe(first::add);
        registry.subscribe(second::add);

        sub.unsubscribe();
        registry.publish("x");

        assertThat(first).isEmpty();
        assertThat(second).containsExactly("x");
        assertThat(registry.size()).isEqualTo(1);
    }
}
