package com.devmanager.orchestrator.model;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.time.Instant;
import java.util.Map;

/**
 * One message in the Manager/Worker conversation.
 * Immutable once appended to a {@link ProjectState}.
 */
@JsonInclude(JsonInclude.Include.NON_EMPTY)
public record Turn(Sender sender, String message, Instant timestamp, Map<String, String> metadata) {

    public Turn {
        if (sender == null) throw new IllegalArgumentException("sender is required");
        message  = message == null ? "" : message;
        metadata = metadata == null ? Map.of() : Map.copyOf(metadata);
    }

    /** Create a turn stamped with the current time. */
    public static Turn of(Sender sender, String message) {
        return new Turn(sender, message, Instant.now(), Map.of());
    }
}
