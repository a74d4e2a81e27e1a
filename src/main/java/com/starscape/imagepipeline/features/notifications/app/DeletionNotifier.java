package com.starscape.imagepipeline.features.notifications.app;

import com.starscape.imagepipeline.features.changestream.domain.ChangeRecord;
import com.starscape.imagepipeline.features.changestream.domain.ChangeStreamConsumer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Confirms deletions observed on the metadata change stream.
 * Only REMOVE records produce an email; inserts and modifications are skipped.
 */
@Service
public class DeletionNotifier implements ChangeStreamConsumer {

    private static final Logger log = LoggerFactory.getLogger(DeletionNotifier.class);

    static final String SUBJECT = "Image has been deleted";
    static final String MESSAGE = "Image has been successfully deleted.";

    private final NotificationDispatcher dispatcher;

    public DeletionNotifier(NotificationDispatcher dispatcher) {
        this.dispatcher = dispatcher;
    }

    @Override
    public void accept(List<ChangeRecord> batch) {
        for (ChangeRecord record : batch) {
            if (!record.isRemove()) {
                log.debug("Skipping {} change for {}", record.operation(), record.key());
                continue;
            }
            dispatcher.dispatch(SUBJECT, dispatcher.fromAlbum(MESSAGE));
        }
    }
}
