package com.starscape.imagepipeline.features.routing.infra.envelope;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

@JsonIgnoreProperties(ignoreUnknown = true)
public record MessageAttribute(
    @JsonProperty("Type") String type,
    @JsonProperty("Value") String value
) {}
