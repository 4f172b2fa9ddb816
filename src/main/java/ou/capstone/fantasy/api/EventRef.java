package ou.capstone.fantasy.api;

import java.util.Objects;
import java.util.Optional;

/** A resolved event on the results website. The name is known only when a page supplied it. */
public record EventRef(String eventId, String name) {

    public EventRef {
        Objects.requireNonNull(eventId, "eventId is required");
        eventId = eventId.trim();
        if (eventId.isEmpty()) {
            throw new IllegalArgumentException("eventId must not be blank");
        }
    }

    public static EventRef of(final String eventId) {
        return new EventRef(eventId, null);
    }

    public Optional<String> displayName() {
        return Optional.ofNullable(name);
    }
}
