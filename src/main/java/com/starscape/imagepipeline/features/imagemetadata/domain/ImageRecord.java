package com.starscape.imagepipeline.features.imagemetadata.domain;

import jakarta.persistence.*;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Metadata of one stored image, keyed by the decoded object key.
 * A record exists while its object exists in the blob store.
 */
@Entity
@Table(name = "image_records")
public class ImageRecord {

    public static final String NAME_ATTRIBUTE = "ImageName";
    public static final String BUCKET_ATTRIBUTE = "BucketName";
    public static final String DESCRIPTION_ATTRIBUTE = "Description";

    @Id
    @Column(name = "image_name", nullable = false, length = 1024)
    private String name;

    @Column(name = "bucket_name", nullable = false)
    private String bucket;

    @Column(name = "description", length = 4096)
    private String description;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    protected ImageRecord() {
        // JPA constructor
    }

    public ImageRecord(String name, String bucket) {
        if (name == null || name.isEmpty()) {
            throw new IllegalArgumentException("Image name cannot be empty");
        }
        if (bucket == null || bucket.isBlank()) {
            throw new IllegalArgumentException("Bucket name cannot be blank");
        }
        this.name = name;
        this.bucket = bucket;
        this.createdAt = Instant.now();
        this.updatedAt = this.createdAt;
    }

    /**
     * @return true if the bucket actually changed
     */
    public boolean moveToBucket(String newBucket) {
        if (bucket.equals(newBucket)) {
            return false;
        }
        this.bucket = newBucket;
        this.updatedAt = Instant.now();
        return true;
    }

    /**
     * @return true if the description actually changed
     */
    public boolean describe(String newDescription) {
        if (newDescription == null ? description == null : newDescription.equals(description)) {
            return false;
        }
        this.description = newDescription;
        this.updatedAt = Instant.now();
        return true;
    }

    /**
     * Flat attribute view used for change-log images.
     */
    public Map<String, String> toImage() {
        Map<String, String> image = new LinkedHashMap<>();
        image.put(NAME_ATTRIBUTE, name);
        image.put(BUCKET_ATTRIBUTE, bucket);
        if (description != null) {
            image.put(DESCRIPTION_ATTRIBUTE, description);
        }
        return image;
    }

    // Getters
    public String getName() { return name; }
    public String getBucket() { return bucket; }
    public String getDescription() { return description; }
    public Instant getCreatedAt() { return createdAt; }
    public Instant getUpdatedAt() { return updatedAt; }
}
