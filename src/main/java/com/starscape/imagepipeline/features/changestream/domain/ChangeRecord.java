package com.starscape.imagepipeline.features.changestream.domain;

import java.util.Map;
import java.util.Objects;

/**
 * One decoded metadata-store mutation, positioned in the change log by its sequence number.
 * Old image is present for MODIFY and REMOVE, new image for INSERT and MODIFY.
 */
public record ChangeRecord(
    long sequence,
    ChangeOperation operation,
    String key,
    Map<String, String> oldImage,
    Map<String, String> newImage
) {

    public ChangeRecord {
        Objects.requireNonNull(operation, "operation");
        if (key == null || key.isEmpty()) {
            throw new IllegalArgumentException("Change record key cannot be empty");
        }
        oldImage = oldImage == null ? null : Map.copyOf(oldImage);
        newImage = newImage == null ? null : Map.copyOf(newImage);
    }

    public boolean isRemove() {
        return operation == ChangeOperation.REMOVE;
    }
}
