package com.flagship.equipment_booking.observability;

import com.flagship.equipment_booking.store.Actor;

import java.util.Optional;

/**
 * Thread-local holder for the actor of the current request.
 *
 * Populated by {@link CorrelationIdFilter} from the X-Actor-Id and
 * X-Actor-Name headers. Authentication is handled upstream.
 */
public final class ActorContext {

    public static final String ACTOR_ID_HEADER = "X-Actor-Id";
    public static final String ACTOR_NAME_HEADER = "X-Actor-Name";

    private static final ThreadLocal<Actor> actor = new ThreadLocal<>();

    private ActorContext() {
        // Utility class
    }

    public static Optional<Actor> current() {
        return Optional.ofNullable(actor.get());
    }

    public static void set(String id, String name) {
        if (id == null || id.isBlank()) {
            actor.remove();
            return;
        }
        actor.set(Actor.of(id, name == null || name.isBlank() ? id : name));
    }

    public static void clear() {
        actor.remove();
    }
}
