package com.starscape.imagepipeline.features.routing.domain;

import java.util.Optional;

/**
 * Normalized event kinds. Object-store event names are sub-typed
 * ("ObjectCreated:Put", "ObjectRemoved:Delete"); the kind is the part before the colon.
 */
public enum EventKind {
    OBJECT_CREATED("ObjectCreated"),
    OBJECT_REMOVED("ObjectRemoved"),
    ATTRIBUTE_CHANGED("AttributeChanged");

    private final String eventNamePrefix;

    EventKind(String eventNamePrefix) {
        this.eventNamePrefix = eventNamePrefix;
    }

    public String getEventNamePrefix() {
        return eventNamePrefix;
    }

    /**
     * Resolve the kind of an object-store event name.
     * Only object events are recognized here; attribute messages carry no event name.
     */
    public static Optional<EventKind> fromObjectEventName(String eventName) {
        if (eventName == null) {
            return Optional.empty();
        }
        if (eventName.equals(OBJECT_CREATED.eventNamePrefix) || eventName.startsWith(OBJECT_CREATED.eventNamePrefix + ":")) {
            return Optional.of(OBJECT_CREATED);
        }
        if (eventName.equals(OBJECT_REMOVED.eventNamePrefix) || eventName.startsWith(OBJECT_REMOVED.eventNamePrefix + ":")) {
            return Optional.of(OBJECT_REMOVED);
        }
        return Optional.empty();
    }
}
