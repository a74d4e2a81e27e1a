package com.starscape.imagepipeline.features.routing.domain;

import java.util.List;

/**
 * Result of unwrapping one inbound envelope: the events that normalized cleanly,
 * plus the records that did not.
 */
public record ParsedEnvelope(List<NormalizedEvent> events, List<ParseFailure> failures) {

    public ParsedEnvelope {
        events = List.copyOf(events);
        failures = List.copyOf(failures);
    }

    public static ParsedEnvelope empty() {
        return new ParsedEnvelope(List.of(), List.of());
    }

    public boolean hasFailures() {
        return !failures.isEmpty();
    }
}
