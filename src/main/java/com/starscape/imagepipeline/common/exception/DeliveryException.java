package com.starscape.imagepipeline.common.exception;

import com.starscape.imagepipeline.features.routing.domain.DeliveryResult;

import java.util.List;

/**
 * Thrown after an inbound batch has been fanned out when at least one direct-push
 * consumer failed. The upstream transport treats this as "redeliver the whole batch".
 */
public class DeliveryException extends RuntimeException {

    private final transient List<DeliveryResult> failures;

    public DeliveryException(String message, List<DeliveryResult> failures) {
        super(message);
        this.failures = List.copyOf(failures);
    }

    public List<DeliveryResult> getFailures() {
        return failures;
    }
}
