package com.starscape.imagepipeline.features.changestream.app;

import com.starscape.imagepipeline.common.config.PipelineProperties;
import com.starscape.imagepipeline.common.exception.EnvelopeParseException;
import com.starscape.imagepipeline.features.changestream.domain.ChangeRecord;
import com.starscape.imagepipeline.features.changestream.domain.ChangeStreamConsumer;
import com.starscape.imagepipeline.features.changestream.infra.ChangeLogEntry;
import com.starscape.imagepipeline.features.changestream.infra.ChangeLogEntryRepository;
import com.starscape.imagepipeline.features.changestream.infra.ChangeStreamCursor;
import com.starscape.imagepipeline.features.changestream.infra.ChangeStreamCursorRepository;
import com.starscape.imagepipeline.features.routing.infra.EnvelopeParser;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.data.domain.PageRequest;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Tails the metadata change log and delivers ordered batches to one consumer.
 *
 * The cursor only moves once every record of the batch has been delivered or given up on.
 * A failing batch is split in half and each half retried on its own, down to single records;
 * a single record that keeps failing is skipped after the configured number of attempts.
 * Records whose payload cannot be decoded are skipped without reaching the consumer.
 *
 * Sequence numbers are allocated at insert but become visible at commit, so a lower
 * sequence can appear after a higher one. The reader stops in front of a hole in the
 * sequence until the grace period has passed; only then is the hole taken to be a rollback.
 */
@Service
public class ChangeStreamReader {

    private static final Logger log = LoggerFactory.getLogger(ChangeStreamReader.class);

    private final ChangeLogEntryRepository changeLogRepository;
    private final ChangeStreamCursorRepository cursorRepository;
    private final EnvelopeParser envelopeParser;
    private final ChangeStreamConsumer consumer;
    private final String consumerName;
    private final int batchSize;
    private final int maxRecordAttempts;
    private final Duration gapGracePeriod;
    private final Clock clock;

    @Autowired
    public ChangeStreamReader(
            ChangeLogEntryRepository changeLogRepository,
            ChangeStreamCursorRepository cursorRepository,
            EnvelopeParser envelopeParser,
            ChangeStreamConsumer consumer,
            PipelineProperties properties) {
        this(changeLogRepository, cursorRepository, envelopeParser, consumer, properties, Clock.systemUTC());
    }

    ChangeStreamReader(
            ChangeLogEntryRepository changeLogRepository,
            ChangeStreamCursorRepository cursorRepository,
            EnvelopeParser envelopeParser,
            ChangeStreamConsumer consumer,
            PipelineProperties properties,
            Clock clock) {
        this.changeLogRepository = changeLogRepository;
        this.cursorRepository = cursorRepository;
        this.envelopeParser = envelopeParser;
        this.consumer = consumer;
        this.consumerName = properties.getChangeStream().getConsumerName();
        this.batchSize = properties.getChangeStream().getBatchSize();
        this.maxRecordAttempts = properties.getChangeStream().getMaxRecordAttempts();
        this.gapGracePeriod = properties.getChangeStream().getGapGracePeriod();
        this.clock = clock;
    }

    @Scheduled(fixedDelayString = "${app.pipeline.polling.change-stream-delay:2000}")
    public void scheduledPoll() {
        try {
            poll();
        } catch (Exception e) {
            log.error("Change-stream poll failed for {}", consumerName, e);
        }
    }

    /**
     * Read one batch after the cursor, deliver it and advance the cursor.
     * @return the number of change-log entries consumed
     */
    public int poll() {
        ChangeStreamCursor cursor = cursorRepository.findById(consumerName)
                .orElseGet(() -> new ChangeStreamCursor(consumerName));

        List<ChangeLogEntry> entries = settledPrefix(cursor.getLastSequence(),
                changeLogRepository.findEntriesAfter(cursor.getLastSequence(), PageRequest.of(0, batchSize)));
        if (entries.isEmpty()) {
            return 0;
        }

        List<ChangeRecord> records = new ArrayList<>(entries.size());
        for (ChangeLogEntry entry : entries) {
            try {
                records.add(envelopeParser.parseChangeRecord(entry.getSequence(), entry.getPayload()));
            } catch (EnvelopeParseException e) {
                log.error("Skipping undecodable change record {}: {}", entry.getSequence(), e.getMessage());
            }
        }

        if (!records.isEmpty()) {
            deliver(records);
        }

        cursor.advanceTo(entries.get(entries.size() - 1).getSequence());
        cursorRepository.save(cursor);
        log.debug("Cursor {} advanced to {}", consumerName, cursor.getLastSequence());
        return entries.size();
    }

    /**
     * Entries up to the first hole in the sequence that is younger than the grace period.
     * The entry after a hole was written after the missing one was allocated, so once that
     * entry is older than the grace period the missing write has had the full period to commit.
     */
    private List<ChangeLogEntry> settledPrefix(long lastSequence, List<ChangeLogEntry> entries) {
        Instant settledBefore = clock.instant().minus(gapGracePeriod);
        long expected = lastSequence + 1;
        int settled = 0;
        for (ChangeLogEntry entry : entries) {
            if (entry.getSequence() != expected) {
                if (entry.getCreatedAt().isAfter(settledBefore)) {
                    log.debug("Change stream {} waiting on sequence {} before {}",
                            consumerName, expected, entry.getSequence());
                    break;
                }
                log.warn("Change stream {} skipping sequences {} to {}: never committed",
                        consumerName, expected, entry.getSequence() - 1);
            }
            expected = entry.getSequence() + 1;
            settled++;
        }
        return entries.subList(0, settled);
    }

    private void deliver(List<ChangeRecord> batch) {
        if (batch.size() == 1) {
            deliverSingle(batch.get(0));
            return;
        }
        try {
            consumer.accept(batch);
        } catch (RuntimeException e) {
            int middle = batch.size() / 2;
            log.warn("Batch of {} change records failed, bisecting: {}", batch.size(), e.getMessage());
            deliver(batch.subList(0, middle));
            deliver(batch.subList(middle, batch.size()));
        }
    }

    private void deliverSingle(ChangeRecord record) {
        for (int attempt = 1; attempt <= maxRecordAttempts; attempt++) {
            try {
                consumer.accept(List.of(record));
                return;
            } catch (RuntimeException e) {
                if (attempt == maxRecordAttempts) {
                    log.error("Giving up on change record {} ({} {}) after {} attempt(s)",
                            record.sequence(), record.operation(), record.key(), attempt, e);
                } else {
                    log.warn("Change record {} failed on attempt {}: {}", record.sequence(), attempt, e.getMessage());
                }
            }
        }
    }
}
