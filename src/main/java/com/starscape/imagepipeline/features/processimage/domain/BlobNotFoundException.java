package com.starscape.imagepipeline.features.processimage.domain;

public class BlobNotFoundException extends RuntimeException {

    public BlobNotFoundException(String bucket, String key, Throwable cause) {
        super("Object not found: s3://" + bucket + "/" + key, cause);
    }
}
