package com.starscape.imagepipeline.features.changestream.app;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.starscape.imagepipeline.features.changestream.domain.ChangeOperation;
import com.starscape.imagepipeline.features.changestream.domain.ChangeRecordPayload;
import com.starscape.imagepipeline.features.changestream.infra.ChangeLogEntry;
import com.starscape.imagepipeline.features.changestream.infra.ChangeLogEntryRepository;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.util.Map;

/**
 * Appends change records to the metadata change log.
 * Must run inside the transaction of the mutation it describes, so a record
 * is visible to the change-stream reader exactly when the mutation is.
 */
@Service
public class ChangeLogService {

    private final ChangeLogEntryRepository changeLogRepository;
    private final ObjectMapper objectMapper;

    public ChangeLogService(ChangeLogEntryRepository changeLogRepository, ObjectMapper objectMapper) {
        this.changeLogRepository = changeLogRepository;
        this.objectMapper = objectMapper;
    }

    @Transactional(propagation = Propagation.MANDATORY)
    public void append(ChangeOperation operation, String key,
                       Map<String, String> oldImage, Map<String, String> newImage) {
        ChangeRecordPayload payload = new ChangeRecordPayload(operation.name(), key, oldImage, newImage);
        try {
            changeLogRepository.save(new ChangeLogEntry(operation, key, objectMapper.writeValueAsString(payload)));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize change record for " + key, e);
        }
    }
}
