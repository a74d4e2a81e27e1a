package com.starscape.imagepipeline.features.routing.domain;

import java.util.Objects;
import java.util.Optional;

/**
 * The part of an event a filter looks at: the provider event name, the normalized kind,
 * or one named message attribute.
 */
public record EventField(Source source, String attributeName) {

    public enum Source {
        EVENT_NAME,
        KIND,
        ATTRIBUTE
    }

    public EventField {
        Objects.requireNonNull(source, "source");
        if (source == Source.ATTRIBUTE && (attributeName == null || attributeName.isBlank())) {
            throw new IllegalArgumentException("Attribute fields need an attribute name");
        }
    }

    public static EventField eventName() {
        return new EventField(Source.EVENT_NAME, null);
    }

    public static EventField kind() {
        return new EventField(Source.KIND, null);
    }

    public static EventField attribute(String attributeName) {
        return new EventField(Source.ATTRIBUTE, attributeName);
    }

    public Optional<String> valueOf(NormalizedEvent event) {
        return switch (source) {
            case EVENT_NAME -> Optional.of(event.eventName());
            case KIND -> Optional.of(event.kind().getEventNamePrefix());
            case ATTRIBUTE -> event.attribute(attributeName);
        };
    }
}
