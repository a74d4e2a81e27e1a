package com.starscape.imagepipeline.common.config;

import com.starscape.imagepipeline.features.delivery.domain.DeliveryQueue;
import com.starscape.imagepipeline.features.notifications.app.CreationNotifier;
import com.starscape.imagepipeline.features.processdelete.app.DeleteSyncHandler;
import com.starscape.imagepipeline.features.processupdate.app.MetadataUpdateHandler;
import com.starscape.imagepipeline.features.routing.app.TopicRouter;
import com.starscape.imagepipeline.features.routing.domain.AllowListMatch;
import com.starscape.imagepipeline.features.routing.domain.EventField;
import com.starscape.imagepipeline.features.routing.domain.PrefixMatch;
import com.starscape.imagepipeline.features.routing.domain.Subscription;
import com.starscape.imagepipeline.features.routing.infra.EventCodec;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.List;
import java.util.Set;

/**
 * The static subscription table. Subscriptions are fixed for the lifetime of the process.
 */
@Configuration
public class RoutingConfig {

    public static final String OBJECT_CREATED_PUT = "ObjectCreated:Put";
    public static final String OBJECT_REMOVED_DELETE = "ObjectRemoved:Delete";
    public static final String COMMENT_TYPE_ATTRIBUTE = "comment_type";
    public static final String DESCRIPTION_COMMENT = "Description";

    @Bean
    public TopicRouter topicRouter(
            @Qualifier("imageProcessQueue") DeliveryQueue imageProcessQueue,
            DeleteSyncHandler deleteSyncHandler,
            MetadataUpdateHandler metadataUpdateHandler,
            CreationNotifier creationNotifier,
            EventCodec codec) {
        List<Subscription> subscriptions = List.of(
                Subscription.buffered("image-process-queue",
                        new PrefixMatch(EventField.eventName(), List.of(OBJECT_CREATED_PUT)),
                        imageProcessQueue),
                Subscription.direct("process-delete",
                        new AllowListMatch(EventField.eventName(), Set.of(OBJECT_REMOVED_DELETE)),
                        deleteSyncHandler),
                Subscription.direct("process-update",
                        new AllowListMatch(EventField.attribute(COMMENT_TYPE_ATTRIBUTE), Set.of(DESCRIPTION_COMMENT)),
                        metadataUpdateHandler),
                Subscription.direct("creation-mailer",
                        new AllowListMatch(EventField.eventName(), Set.of(OBJECT_CREATED_PUT)),
                        creationNotifier));
        return new TopicRouter(subscriptions, codec);
    }
}
