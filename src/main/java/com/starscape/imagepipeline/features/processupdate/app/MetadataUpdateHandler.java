package com.starscape.imagepipeline.features.processupdate.app;

import com.starscape.imagepipeline.common.exception.ValidationException;
import com.starscape.imagepipeline.features.imagemetadata.app.ImageMetadataStore;
import com.starscape.imagepipeline.features.routing.domain.EventConsumer;
import com.starscape.imagepipeline.features.routing.domain.NormalizedEvent;
import org.springframework.stereotype.Service;

/**
 * Applies description changes published as attribute messages.
 * The target record must already exist.
 */
@Service
public class MetadataUpdateHandler implements EventConsumer {

    static final String DESCRIPTION_FIELD = "description";

    private final ImageMetadataStore metadataStore;

    public MetadataUpdateHandler(ImageMetadataStore metadataStore) {
        this.metadataStore = metadataStore;
    }

    @Override
    public void accept(NormalizedEvent event) {
        String description = event.payloadValue(DESCRIPTION_FIELD)
                .orElseThrow(() -> new ValidationException(
                        "Update for image " + event.objectKey() + " has no " + DESCRIPTION_FIELD));
        metadataStore.updateDescription(event.objectKey(), description);
    }
}
