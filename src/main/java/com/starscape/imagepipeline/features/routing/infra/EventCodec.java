package com.starscape.imagepipeline.features.routing.infra;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.starscape.imagepipeline.common.exception.EnvelopeParseException;
import com.starscape.imagepipeline.features.routing.domain.NormalizedEvent;
import org.springframework.stereotype.Component;

/**
 * JSON form of a normalized event, used as the body of buffered-queue messages.
 */
@Component
public class EventCodec {

    private final ObjectMapper objectMapper;

    public EventCodec(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public String encode(NormalizedEvent event) {
        try {
            return objectMapper.writeValueAsString(event);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize event for " + event.objectKey(), e);
        }
    }

    /**
     * @throws EnvelopeParseException if the body is not a valid encoded event
     */
    public NormalizedEvent decode(String body) {
        if (body == null || body.isBlank()) {
            throw new EnvelopeParseException("Empty queued event");
        }
        try {
            return objectMapper.readValue(body, NormalizedEvent.class);
        } catch (JsonProcessingException e) {
            throw new EnvelopeParseException("Undecodable queued event", e);
        }
    }
}
