package com.starscape.imagepipeline.features.routing.infra.envelope;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

@JsonIgnoreProperties(ignoreUnknown = true)
public record ObjectStoreObject(
    @JsonProperty("key") String key,
    @JsonProperty("size") Long size,
    @JsonProperty("eTag") String etag
) {}
