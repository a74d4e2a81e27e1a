package com.starscape.imagepipeline.features.notifications.app;

import com.starscape.imagepipeline.common.config.PipelineProperties;
import com.starscape.imagepipeline.common.exception.DependencyException;
import com.starscape.imagepipeline.features.notifications.domain.ContactDetails;
import com.starscape.imagepipeline.features.notifications.domain.NotificationTransport;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

class NotificationDispatcherTest {

    private NotificationTransport transport;
    private NotificationDispatcher dispatcher;

    @BeforeEach
    void setUp() {
        transport = mock(NotificationTransport.class);
        dispatcher = new NotificationDispatcher(transport, NotificationTestSupport.properties());
    }

    @Test
    void shouldSendHtmlFromConfiguredSenderToRecipient() {
        boolean sent = dispatcher.dispatch("New Image Upload", dispatcher.fromAlbum("We received your Image."));

        assertTrue(sent);
        ArgumentCaptor<String> body = ArgumentCaptor.forClass(String.class);
        verify(transport).send(eq("album@example.com"), eq("owner@example.com"), eq("New Image Upload"), body.capture());
        assertTrue(body.getValue().contains("<b>The Photo Album</b>"));
        assertTrue(body.getValue().contains("<b>album@example.com</b>"));
        assertTrue(body.getValue().contains("We received your Image."));
    }

    @Test
    void shouldEscapeMessageContent() {
        String html = NotificationDispatcher.renderHtml(
            new ContactDetails("Tom & Jerry", "a@example.com", "<script>alert(1)</script>"));

        assertTrue(html.contains("Tom &amp; Jerry"));
        assertFalse(html.contains("<script>"));
    }

    @Test
    void shouldSwallowTransportFailure() {
        doThrow(new DependencyException("SES throttled", null))
            .when(transport).send(anyString(), anyString(), anyString(), anyString());

        assertFalse(dispatcher.dispatch("Image has been deleted", dispatcher.fromAlbum("gone")));
    }

    static final class NotificationTestSupport {
        static PipelineProperties properties() {
            PipelineProperties properties = new PipelineProperties();
            properties.getMail().setFrom("album@example.com");
            properties.getMail().setTo("owner@example.com");
            properties.getMail().setRegion("us-east-1");
            return properties;
        }
    }
}
