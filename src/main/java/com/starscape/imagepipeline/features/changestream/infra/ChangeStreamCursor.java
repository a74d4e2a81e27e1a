package com.starscape.imagepipeline.features.changestream.infra;

import jakarta.persistence.*;

import java.time.Instant;

/**
 * Durable position of one change-stream consumer. Starts before the first entry.
 */
@Entity
@Table(name = "change_stream_cursors")
public class ChangeStreamCursor {

    @Id
    @Column(name = "consumer_name")
    private String consumerName;

    @Column(name = "last_sequence", nullable = false)
    private long lastSequence;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    protected ChangeStreamCursor() {
        // JPA constructor
    }

    public ChangeStreamCursor(String consumerName) {
        this.consumerName = consumerName;
        this.lastSequence = 0L;
        this.updatedAt = Instant.now();
    }

    public String getConsumerName() { return consumerName; }
    public long getLastSequence() { return lastSequence; }
    public Instant getUpdatedAt() { return updatedAt; }

    public void advanceTo(long sequence) {
        if (sequence < lastSequence) {
            throw new IllegalStateException(
                "Cursor " + consumerName + " cannot move back from " + lastSequence + " to " + sequence);
        }
        this.lastSequence = sequence;
        this.updatedAt = Instant.now();
    }
}
