package com.starscape.imagepipeline.features.routing.domain;

/**
 * Outcome of delivering one event to one subscription.
 */
public record DeliveryResult(String subscription, DeliveryMode mode, Status status, String error) {

    public enum Status {
        DELIVERED,
        ENQUEUED,
        FAILED
    }

    public static DeliveryResult delivered(Subscription subscription) {
        return new DeliveryResult(subscription.name(), subscription.mode(), Status.DELIVERED, null);
    }

    public static DeliveryResult enqueued(Subscription subscription) {
        return new DeliveryResult(subscription.name(), subscription.mode(), Status.ENQUEUED, null);
    }

    public static DeliveryResult failed(Subscription subscription, Throwable error) {
        String message = error.getMessage() != null ? error.getMessage() : error.getClass().getSimpleName();
        return new DeliveryResult(subscription.name(), subscription.mode(), Status.FAILED, message);
    }

    public boolean isFailed() {
        return status == Status.FAILED;
    }
}
