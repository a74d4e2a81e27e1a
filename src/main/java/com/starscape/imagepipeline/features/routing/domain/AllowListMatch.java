package com.starscape.imagepipeline.features.routing.domain;

import java.util.Objects;
import java.util.Set;

/**
 * Matches when the field value equals one of the allowed values exactly.
 */
public record AllowListMatch(EventField field, Set<String> allowed) implements EventFilter {

    public AllowListMatch {
        Objects.requireNonNull(field, "field");
        if (allowed == null || allowed.isEmpty()) {
            throw new IllegalArgumentException("Allow-list cannot be empty");
        }
        allowed = Set.copyOf(allowed);
    }

    @Override
    public boolean matches(NormalizedEvent event) {
        return field.valueOf(event).map(allowed::contains).orElse(false);
    }
}
