package com.picfactory.orchestrator.event;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

/**
 * Typed fan-out point for one kind of event.
 *
 * Listeners run synchronously on the publishing thread. A listener that
 * throws is logged and skipped so one bad observer cannot stall a job loop.
 *
 * @param <E> event type
 */
public class ListenerRegistry<E> {

    private static final Logger log = LoggerFactory.getLogger(ListenerRegistry.class);

    private final String name;
    private final List<Consumer<? super E>> listeners = new CopyOnWriteArrayList<>();

    public ListenerRegistry(String name) {
        this.name = name;
    }

    public Subscription subscribe(Consumer<? super E> listener) {
        listeners.add(listener);
        return () -> listeners.remove(listener);
    }

    public void publish(E event) {
        for (Consumer<? super E> listener : listeners) {
            try {
                listener.accept(event);
            } catch (Exception e) {
                log.warn("Listener for '{}' events failed: {}", name, e.getMessage(), e);
            }
        }
    }

    public int size() {
        return listeners.size();
    }
}
