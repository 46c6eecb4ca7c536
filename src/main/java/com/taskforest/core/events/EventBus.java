package com.taskforest.core.events;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

/**
 * Fans reconstruction events out to in-process listeners.
 * <p>
 * Parallel workspace passes publish concurrently. A listener that throws is logged
 * and skipped; it never fails the pass that published.
 */
@Service
public class EventBus {

    private static final Logger log = LoggerFactory.getLogger(EventBus.class);

    private final List<Consumer<HierarchyEvent>> listeners = new CopyOnWriteArrayList<>();

    public void publish(HierarchyEvent event) {
        log.debug("Publishing {} for workspace '{}'", event.eventType(), event.workspace());
        for (Consumer<HierarchyEvent> listener : listeners) {
            deliverSafely(listener, event);
        }
    }

    /** Receives every event, from every pass. */
    public void listen(Consumer<HierarchyEvent> listener) {
        listeners.add(listener);
    }

    /**
     * Receives only the events of one workspace; null selects tasks without a
     * workspace and the shared pass.
     */
    public void listen(String workspace, Consumer<HierarchyEvent> listener) {
        String key = workspace == null ? "" : workspace;
        listen(event -> {
            if (key.equals(event.workspace())) {
                listener.accept(event);
            }
        });
    }

    private void deliverSafely(Consumer<HierarchyEvent> listener, HierarchyEvent event) {
        try {
            listener.accept(event);
        } catch (RuntimeException e) {
            log.warn("Listener failed on {} for task {}: {}", event.eventType(), event.taskId(), e.getMessage(), e);
        }
    }
}
