package com.starscape.imagepipeline.features.routing.domain;

public enum DeliveryMode {
    DIRECT_PUSH,
    BUFFERED_QUEUE
}
