package com.starscape.imagepipeline.features.imagemetadata.domain;

import java.util.Optional;

public interface ImageRecordRepository {
    ImageRecord save(ImageRecord record);
    Optional<ImageRecord> findByName(String name);
    void delete(ImageRecord record);
}
