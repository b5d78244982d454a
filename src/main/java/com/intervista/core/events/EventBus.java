package com.intervista.core.events;

import com.intervista.core.model.ProgressEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

/**
 * In-memory fan-out of {@link ProgressEvent}s to subscribers of one session or of every session.
 * <p>
 * Delivery is synchronous on the publishing thread, in subscription order. A subscriber that throws
 * is logged and skipped. Subscriptions to a session end by themselves once its
 * {@link ProgressEvent.Kind#SESSION_FINISHED} event has been delivered.
 */
@Service
public class EventBus {

    private static final Logger log = LoggerFactory.getLogger(EventBus.class);

    /** sessionId is null for subscriptions to every session. */
    private record Registration(String sessionId, Consumer<ProgressEvent> consumer) {

        boolean wants(ProgressEvent event) {
            return sessionId == null || sessionId.equals(event.sessionId());
        }
    }

    private final CopyOnWriteArrayList<Registration> registrations = new CopyOnWriteArrayList<>();

    public void publish(ProgressEvent event) {
        log.debug("Publishing {} for session {}", event.kind(), event.sessionId());
        for (Registration registration : registrations) {
            if (registration.wants(event)) {
                deliver(registration, event);
            }
        }
        if (event.kind() == ProgressEvent.Kind.SESSION_FINISHED) {
            registrations.removeIf(r -> event.sessionId().equals(r.sessionId()));
        }
    }

    /**
     * Subscribes to the events of one session.
     *
     * @return a handle that ends the subscription
     */
    public Subscription subscribe(String sessionId, Consumer<ProgressEvent> consumer) {
        return register(new Registration(sessionId, consumer));
    }

    public Subscription subscribeAll(Consumer<ProgressEvent> consumer) {
        return register(new Registration(null, consumer));
    }

    /** Live subscriptions, for diagnostics. */
    public int subscriptionCount() {
        return registrations.size();
    }

    /**
     * Handle for cancelling a subscription. Cancelling twice, or after the session finished, does nothing.
     */
    @FunctionalInterface
    public interface Subscription {
        void unsubscribe();
    }

    private Subscription register(Registration registration) {
        registrations.add(registration);
        log.debug("Subscribed to {}", registration.sessionId() == null ? "all sessions" : registration.sessionId());
        // identity removal: the same consumer may be registered more than once
        return () -> registrations.removeIf(r -> r == registration);
    }

    private void deliver(Registration registration, ProgressEvent event) {
        try {
            registration.consumer().accept(event);
        } catch (RuntimeException e) {
            log.warn("Progress subscriber failed on {} of session {}: {}",
                    event.kind(), event.sessionId(), e.getMessage(), e);
        }
    }
}
