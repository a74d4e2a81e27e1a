package com.starscape.imagepipeline.features.routing.domain;

import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Internal form of one inbound event, produced by the envelope parser.
 * The object key is always fully decoded by the time an instance exists.
 */
public record NormalizedEvent(
    EventKind kind,
    String eventName,
    String objectKey,
    String containerId,
    Map<String, String> attributes,
    Map<String, String> payload
) {

    public static final String ATTRIBUTE_CHANGED_EVENT_NAME = "AttributeChanged";

    public NormalizedEvent {
        Objects.requireNonNull(kind, "kind");
        if (eventName == null || eventName.isBlank()) {
            throw new IllegalArgumentException("Event name cannot be blank");
        }
        if (objectKey == null || objectKey.isEmpty()) {
            throw new IllegalArgumentException("Object key cannot be empty");
        }
        if (kind != EventKind.ATTRIBUTE_CHANGED && (containerId == null || containerId.isBlank())) {
            throw new IllegalArgumentException("Object events require a container id");
        }
        attributes = attributes == null ? Map.of() : Map.copyOf(attributes);
        payload = payload == null ? Map.of() : Map.copyOf(payload);
    }

    public static NormalizedEvent objectEvent(EventKind kind, String eventName, String containerId, String objectKey) {
        return new NormalizedEvent(kind, eventName, objectKey, containerId, Map.of(), Map.of());
    }

    public static NormalizedEvent attributeChanged(String objectKey, Map<String, String> attributes,
                                                   Map<String, String> payload) {
        return new NormalizedEvent(EventKind.ATTRIBUTE_CHANGED, ATTRIBUTE_CHANGED_EVENT_NAME,
                objectKey, null, attributes, payload);
    }

    public Optional<String> attribute(String name) {
        return Optional.ofNullable(attributes.get(name));
    }

    public Optional<String> payloadValue(String name) {
        return Optional.ofNullable(payload.get(name));
    }
}
