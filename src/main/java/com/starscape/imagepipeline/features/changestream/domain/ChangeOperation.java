package com.starscape.imagepipeline.features.changestream.domain;

public enum ChangeOperation {
    INSERT,
    MODIFY,
    REMOVE
}
