package com.starscape.imagepipeline.features.changestream.infra;

import com.starscape.imagepipeline.features.changestream.domain.ChangeOperation;
import jakarta.persistence.*;

import java.time.Instant;

/**
 * Row of the ordered metadata change log. The identity sequence gives the stream order.
 */
@Entity
@Table(name = "image_change_log")
public class ChangeLogEntry {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "sequence_id")
    private Long sequence;

    @Enumerated(EnumType.STRING)
    @Column(name = "operation_type", nullable = false)
    private ChangeOperation operation;

    @Column(name = "image_name", nullable = false)
    private String imageName;

    @Column(name = "payload", nullable = false, length = 8192)
    private String payload;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    protected ChangeLogEntry() {
        // JPA constructor
    }

    public ChangeLogEntry(ChangeOperation operation, String imageName, String payload) {
        this.operation = operation;
        this.imageName = imageName;
        this.payload = payload;
        this.createdAt = Instant.now();
    }

    public Long getSequence() { return sequence; }
    public ChangeOperation getOperation() { return operation; }
    public String getImageName() { return imageName; }
    public String getPayload() { return payload; }
    public Instant getCreatedAt() { return createdAt; }
}
