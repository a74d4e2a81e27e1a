package com.starscape.imagepipeline.features.routing.infra.envelope;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * One record of a queue batch. The body is itself JSON: a pub/sub wrapper
 * or an object-store notification.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record QueueMessage(
    @JsonProperty("messageId") String messageId,
    @JsonProperty("body") String body,
    @JsonProperty("eventSource") String eventSource
) {}
