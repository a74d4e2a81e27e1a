package com.starscape.imagepipeline.features.routing.app;

import com.starscape.imagepipeline.features.routing.domain.DeliveryResult;

import java.util.List;

/**
 * Summary of one inbound batch after fan-out.
 */
public record IngressResult(int events, int quarantined, List<DeliveryResult> deliveries) {

    public IngressResult {
        deliveries = List.copyOf(deliveries);
    }

    public List<DeliveryResult> failures() {
        return deliveries.stream().filter(DeliveryResult::isFailed).toList();
    }
}
