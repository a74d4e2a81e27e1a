package com.starscape.imagepipeline.features.imagemetadata.app;

import com.starscape.imagepipeline.common.exception.DependencyException;
import com.starscape.imagepipeline.common.exception.ValidationException;
import com.starscape.imagepipeline.features.changestream.app.ChangeLogService;
import com.starscape.imagepipeline.features.changestream.domain.ChangeOperation;
import com.starscape.imagepipeline.features.imagemetadata.domain.ImageRecord;
import com.starscape.imagepipeline.features.imagemetadata.domain.ImageRecordRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.Map;
import java.util.Optional;

/**
 * Metadata store client. Each mutation and the change record describing it commit together.
 * Storage failures surface as {@link DependencyException}.
 */
@Service
public class ImageMetadataStore {

    private static final Logger log = LoggerFactory.getLogger(ImageMetadataStore.class);

    private final ImageRecordRepository repository;
    private final ChangeLogService changeLog;

    public ImageMetadataStore(ImageRecordRepository repository, ChangeLogService changeLog) {
        this.repository = repository;
        this.changeLog = changeLog;
    }

    /**
     * Create the record for an image, or refresh its bucket if it already exists.
     * An existing description is kept. Replaying the same put changes nothing.
     */
    @Transactional
    public ImageRecord put(String name, String bucket) {
        try {
            Optional<ImageRecord> existing = repository.findByName(name);
            if (existing.isEmpty()) {
                ImageRecord created = repository.save(new ImageRecord(name, bucket));
                changeLog.append(ChangeOperation.INSERT, name, null, created.toImage());
                log.info("Created image record: name={}, bucket={}", name, bucket);
                return created;
            }

            ImageRecord record = existing.get();
            Map<String, String> oldImage = record.toImage();
            if (record.moveToBucket(bucket)) {
                repository.save(record);
                changeLog.append(ChangeOperation.MODIFY, name, oldImage, record.toImage());
                log.info("Updated bucket of image record: name={}, bucket={}", name, bucket);
            } else {
                log.debug("Image record already current: {}", name);
            }
            return record;
        } catch (DataAccessException e) {
            throw new DependencyException("Failed to store image record " + name, e);
        }
    }

    @Transactional(readOnly = true)
    public Optional<ImageRecord> get(String name) {
        try {
            return repository.findByName(name);
        } catch (DataAccessException e) {
            throw new DependencyException("Failed to read image record " + name, e);
        }
    }

    /**
     * Set the description of an existing record.
     * @throws ValidationException if no record exists for the name
     */
    @Transactional
    public ImageRecord updateDescription(String name, String description) {
        try {
            ImageRecord record = repository.findByName(name)
                    .orElseThrow(() -> new ValidationException(String.format("Image %s does not exist", name)));

            Map<String, String> oldImage = record.toImage();
            if (record.describe(description)) {
                repository.save(record);
                changeLog.append(ChangeOperation.MODIFY, name, oldImage, record.toImage());
                log.info("Updated description of image record: {}", name);
            }
            return record;
        } catch (DataAccessException e) {
            throw new DependencyException("Failed to update image record " + name, e);
        }
    }

    /**
     * Delete the record for an image. Deleting an absent record is a no-op.
     * @return true if a record was removed
     */
    @Transactional
    public boolean delete(String name) {
        try {
            Optional<ImageRecord> existing = repository.findByName(name);
            if (existing.isEmpty()) {
                log.debug("No image record to delete: {}", name);
                return false;
            }
            ImageRecord record = existing.get();
            repository.delete(record);
            changeLog.append(ChangeOperation.REMOVE, name, record.toImage(), null);
            log.info("Deleted image record: {}", name);
            return true;
        } catch (DataAccessException e) {
            throw new DependencyException("Failed to delete image record " + name, e);
        }
    }
}
