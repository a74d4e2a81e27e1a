package com.starscape.imagepipeline.features.routing.infra.envelope;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Map;

/**
 * Pub/sub notification wrapper. The message is a JSON string carrying either an
 * object-store notification or, for attribute messages, the fields of the change.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record PubSubMessage(
    @JsonProperty("Type") String type,
    @JsonProperty("MessageId") String messageId,
    @JsonProperty("TopicArn") String topicArn,
    @JsonProperty("Message") String message,
    @JsonProperty("MessageAttributes") Map<String, MessageAttribute> messageAttributes
) {}
