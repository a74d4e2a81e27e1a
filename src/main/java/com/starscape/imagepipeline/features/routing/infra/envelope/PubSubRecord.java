package com.starscape.imagepipeline.features.routing.infra.envelope;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * One record of a pub/sub event batch, delivered by a push subscription.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record PubSubRecord(
    @JsonProperty("EventSource") String eventSource,
    @JsonProperty("Sns") PubSubMessage message
) {}
