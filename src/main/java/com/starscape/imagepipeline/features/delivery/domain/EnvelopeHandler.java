package com.starscape.imagepipeline.features.delivery.domain;

/**
 * Business logic applied to one queued envelope. Throwing marks the envelope as failed.
 */
@FunctionalInterface
public interface EnvelopeHandler {

    void handle(DeliveryEnvelope envelope);
}
