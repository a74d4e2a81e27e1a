package com.starscape.imagepipeline.common.exception;

/**
 * Raised when an inbound envelope is malformed, lacks a required nested field,
 * or names an event type the pipeline does not recognize.
 * The offending event is quarantined; it is never retried.
 */
public class EnvelopeParseException extends RuntimeException {

    public EnvelopeParseException(String message) {
        super(message);
    }

    public EnvelopeParseException(String message, Throwable cause) {
        super(message, cause);
    }
}
