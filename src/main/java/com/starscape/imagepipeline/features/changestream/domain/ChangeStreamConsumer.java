package com.starscape.imagepipeline.features.changestream.domain;

import java.util.List;

/**
 * Receives ordered batches of change records. Throwing fails the whole batch,
 * which the reader then bisects.
 */
@FunctionalInterface
public interface ChangeStreamConsumer {

    void accept(List<ChangeRecord> batch);
}
