package com.starscape.imagepipeline.features.changestream.domain;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Map;

/**
 * Flat change-stream record as stored in the change log payload column.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ChangeRecordPayload(
    @JsonProperty("eventName") String eventName,
    @JsonProperty("key") String key,
    @JsonProperty("oldImage") Map<String, String> oldImage,
    @JsonProperty("newImage") Map<String, String> newImage
) {}
