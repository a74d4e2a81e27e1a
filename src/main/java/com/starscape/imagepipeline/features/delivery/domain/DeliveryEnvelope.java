package com.starscape.imagepipeline.features.delivery.domain;

/**
 * One received queue message. The receipt handle identifies this particular receive;
 * the receive count is 1 on first delivery and grows on every redelivery.
 */
public record DeliveryEnvelope(
    String messageId,
    String receiptHandle,
    String body,
    int receiveCount
) {}
