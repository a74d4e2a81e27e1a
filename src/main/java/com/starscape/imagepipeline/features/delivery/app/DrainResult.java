package com.starscape.imagepipeline.features.delivery.app;

/**
 * Counts from one drain of a delivery queue.
 */
public record DrainResult(int received, int acknowledged, int retrying, int quarantined, int dropped) {

    public static DrainResult empty() {
        return new DrainResult(0, 0, 0, 0, 0);
    }
}
