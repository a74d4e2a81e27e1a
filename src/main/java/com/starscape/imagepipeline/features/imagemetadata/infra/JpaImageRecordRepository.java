package com.starscape.imagepipeline.features.imagemetadata.infra;

import com.starscape.imagepipeline.features.imagemetadata.domain.ImageRecord;
import com.starscape.imagepipeline.features.imagemetadata.domain.ImageRecordRepository;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

@Repository
public interface JpaImageRecordRepository extends JpaRepository<ImageRecord, String>, ImageRecordRepository {
}
