package com.starscape.imagepipeline.features.routing.domain;

/**
 * A record that could not be normalized, kept verbatim for quarantine.
 */
public record ParseFailure(String rawFragment, String reason) {}
