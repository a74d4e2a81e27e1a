package com.starscape.imagepipeline.features.routing.api.dto;

import com.starscape.imagepipeline.features.routing.app.IngressResult;

import java.util.List;

public record IngressResponse(
    int events,
    int quarantined,
    List<Delivery> deliveries
) {
    public record Delivery(String subscription, String mode, String status) {}

    public static IngressResponse from(IngressResult result) {
        List<Delivery> deliveries = result.deliveries().stream()
                .map(d -> new Delivery(d.subscription(), d.mode().name(), d.status().name()))
                .toList();
        return new IngressResponse(result.events(), result.quarantined(), deliveries);
    }
}
