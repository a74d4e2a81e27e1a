package com.starscape.imagepipeline.features.processimage.domain;

/**
 * Read access to stored image objects.
 */
public interface BlobStore {

    /**
     * @throws BlobNotFoundException if no object exists under the key
     */
    byte[] get(String bucket, String key);
}
