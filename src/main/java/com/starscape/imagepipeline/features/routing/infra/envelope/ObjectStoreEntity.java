package com.starscape.imagepipeline.features.routing.infra.envelope;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

@JsonIgnoreProperties(ignoreUnknown = true)
public record ObjectStoreEntity(
    @JsonProperty("bucket") ObjectStoreBucket bucket,
    @JsonProperty("object") ObjectStoreObject object
) {}
