package com.switchyard.core.events;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

/**
 * In-process pub/sub for session lifecycle events.
 * <p>
 * Subscribers register for one {@link SwitchyardEvent.Type} or for everything. Delivery is
 * synchronous on the publishing thread; a failing subscriber never affects the publisher or
 * other subscribers.
 */
@Service
public class EventBus {

    private static final Logger log = LoggerFactory.getLogger(EventBus.class);

    private final Map<SwitchyardEvent.Type, List<Consumer<SwitchyardEvent>>> typedSubscribers =
            new EnumMap<>(SwitchyardEvent.Type.class);

    private final List<Consumer<SwitchyardEvent>> globalSubscribers = new CopyOnWriteArrayList<>();

    public EventBus() {
        for (SwitchyardEvent.Type type : SwitchyardEvent.Type.values()) {
            typedSubscribers.put(type, new CopyOnWriteArrayList<>());
        }
    }

    public void publish(SwitchyardEvent event) {
        log.debug("Publishing {} for session {}", event.type().wireName(), event.sessionName());

        for (Consumer<SwitchyardEvent> subscriber : typedSubscribers.get(event.type())) {
            deliverSafely(subscriber, event);
        }
        for (Consumer<SwitchyardEvent> subscriber : globalSubscribers) {
            deliverSafely(subscriber, event);
        }
    }

    /**
     * Subscribe to one kind of event.
     *
     * @return a {@link Subscription} handle to unsubscribe later
     */
    public Subscription subscribe(SwitchyardEvent.Type type, Consumer<SwitchyardEvent> consumer) {
        List<Consumer<SwitchyardEvent>> subscribers = typedSubscribers.get(type);
        subscribers.add(consumer);
        return () -> subscribers.remove(consumer);
    }

    public Subscription subscribeAll(Consumer<SwitchyardEvent> consumer) {
        globalSubscribers.add(consumer);
        return () -> globalSubscribers.remove(consumer);
    }

    @FunctionalInterface
    public interface Subscription {
        void unsubscribe();
    }

    private void deliverSafely(Consumer<SwitchyardEvent> subscriber, SwitchyardEvent event) {
        try {
            subscriber.accept(event);
        } catch (Exception e) {
            log.warn("Subscriber threw exception processing {}: {}",
                    event.type().wireName(), e.getMessage(), e);
        }
    }
}
