package com.starscape.imagepipeline.features.routing.infra.envelope;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * One entry of an object-store notification's event list.
 * The object key arrives URL-encoded.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ObjectStoreRecord(
    @JsonProperty("eventSource") String eventSource,
    @JsonProperty("eventTime") String eventTime,
    @JsonProperty("eventName") String eventName,
    @JsonProperty("s3") ObjectStoreEntity entity
) {}
