package com.starscape.imagepipeline.features.routing.domain;

import java.util.List;
import java.util.Objects;

/**
 * Matches when the field value starts with one of the configured prefixes.
 * An absent field never matches.
 */
public record PrefixMatch(EventField field, List<String> prefixes) implements EventFilter {

    public PrefixMatch {
        Objects.requireNonNull(field, "field");
        if (prefixes == null || prefixes.isEmpty()) {
            throw new IllegalArgumentException("At least one prefix is required");
        }
        prefixes = List.copyOf(prefixes);
    }

    @Override
    public boolean matches(NormalizedEvent event) {
        return field.valueOf(event)
                .map(value -> prefixes.stream().anyMatch(value::startsWith))
                .orElse(false);
    }
}
