package com.starscape.imagepipeline.features.routing.infra.envelope;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

@JsonIgnoreProperties(ignoreUnknown = true)
public record ObjectStoreBucket(
    @JsonProperty("name") String name,
    @JsonProperty("arn") String arn
) {}
