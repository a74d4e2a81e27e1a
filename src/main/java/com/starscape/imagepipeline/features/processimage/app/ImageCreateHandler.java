package com.starscape.imagepipeline.features.processimage.app;

import com.starscape.imagepipeline.common.config.PipelineProperties;
import com.starscape.imagepipeline.common.exception.ValidationException;
import com.starscape.imagepipeline.features.imagemetadata.app.ImageMetadataStore;
import com.starscape.imagepipeline.features.processimage.domain.BlobStore;
import com.starscape.imagepipeline.features.routing.domain.EventConsumer;
import com.starscape.imagepipeline.features.routing.domain.NormalizedEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Records newly created images.
 *
 * Runs behind the buffered image-process queue, so every failure here is retried and
 * eventually quarantined: an unsupported suffix, an object that cannot be read back,
 * or a metadata store error.
 */
@Service
public class ImageCreateHandler implements EventConsumer {

    private static final Logger log = LoggerFactory.getLogger(ImageCreateHandler.class);

    private final BlobStore blobStore;
    private final ImageMetadataStore metadataStore;
    private final PipelineProperties properties;

    public ImageCreateHandler(BlobStore blobStore, ImageMetadataStore metadataStore, PipelineProperties properties) {
        this.blobStore = blobStore;
        this.metadataStore = metadataStore;
        this.properties = properties;
    }

    @Override
    public void accept(NormalizedEvent event) {
        String key = event.objectKey();
        if (!properties.getImages().isAllowedImageKey(key)) {
            throw new ValidationException("Unsupported image type: " + key);
        }

        byte[] content = blobStore.get(event.containerId(), key);
        log.debug("Confirmed image {} is readable ({} bytes)", key, content.length);

        metadataStore.put(key, event.containerId());
    }
}
