package com.starscape.imagepipeline.common.exception;

/**
 * A call to the blob store, metadata store or notification transport failed.
 */
public class DependencyException extends RuntimeException {

    public DependencyException(String message, Throwable cause) {
        super(message, cause);
    }
}
