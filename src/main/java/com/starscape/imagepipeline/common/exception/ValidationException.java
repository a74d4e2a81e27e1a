package com.starscape.imagepipeline.common.exception;

/**
 * Business-rule rejection, such as an unsupported file type or an update whose target is absent.
 * Propagates so the delivery transport retries and eventually dead-letters the event.
 */
public class ValidationException extends RuntimeException {

    public ValidationException(String message) {
        super(message);
    }
}
