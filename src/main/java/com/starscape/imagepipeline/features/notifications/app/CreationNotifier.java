package com.starscape.imagepipeline.features.notifications.app;

import com.starscape.imagepipeline.features.routing.domain.EventConsumer;
import com.starscape.imagepipeline.features.routing.domain.NormalizedEvent;
import org.springframework.stereotype.Service;

/**
 * Announces every new upload, whether or not the image-create path later accepts it.
 */
@Service
public class CreationNotifier implements EventConsumer {

    static final String SUBJECT = "New Image Upload";

    private final NotificationDispatcher dispatcher;

    public CreationNotifier(NotificationDispatcher dispatcher) {
        this.dispatcher = dispatcher;
    }

    @Override
    public void accept(NormalizedEvent event) {
        String url = "s3://" + event.containerId() + "/" + event.objectKey();
        dispatcher.dispatch(SUBJECT, dispatcher.fromAlbum("We received your Image. Its URL is " + url));
    }
}
