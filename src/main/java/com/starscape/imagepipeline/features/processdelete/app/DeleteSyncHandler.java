package com.starscape.imagepipeline.features.processdelete.app;

import com.starscape.imagepipeline.features.imagemetadata.app.ImageMetadataStore;
import com.starscape.imagepipeline.features.routing.domain.EventConsumer;
import com.starscape.imagepipeline.features.routing.domain.NormalizedEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Removes the metadata record of a deleted object. Repeated deletes are no-ops.
 */
@Service
public class DeleteSyncHandler implements EventConsumer {

    private static final Logger log = LoggerFactory.getLogger(DeleteSyncHandler.class);

    private final ImageMetadataStore metadataStore;

    public DeleteSyncHandler(ImageMetadataStore metadataStore) {
        this.metadataStore = metadataStore;
    }

    @Override
    public void accept(NormalizedEvent event) {
        if (!metadataStore.delete(event.objectKey())) {
            log.info("No metadata to remove for deleted object {}", event.objectKey());
        }
    }
}
