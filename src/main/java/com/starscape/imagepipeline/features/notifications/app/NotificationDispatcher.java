package com.starscape.imagepipeline.features.notifications.app;

import com.starscape.imagepipeline.common.config.PipelineProperties;
import com.starscape.imagepipeline.features.notifications.domain.ContactDetails;
import com.starscape.imagepipeline.features.notifications.domain.NotificationTransport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.web.util.HtmlUtils;

/**
 * Renders and sends notification emails from the configured sender to the configured recipient.
 *
 * Best-effort: a transport failure is logged and reported through the return value,
 * never thrown, so a mail outage cannot hold up the pipeline.
 */
@Service
public class NotificationDispatcher {

    private static final Logger log = LoggerFactory.getLogger(NotificationDispatcher.class);

    public static final String SENDER_NAME = "The Photo Album";

    private final NotificationTransport transport;
    private final String from;
    private final String to;

    public NotificationDispatcher(NotificationTransport transport, PipelineProperties properties) {
        this.transport = transport;
        this.from = properties.getMail().getFrom();
        this.to = properties.getMail().getTo();
    }

    /**
     * Contact card for messages sent on behalf of the album itself.
     */
    public ContactDetails fromAlbum(String message) {
        return new ContactDetails(SENDER_NAME, from, message);
    }

    /**
     * @return true if the transport accepted the message
     */
    public boolean dispatch(String subject, ContactDetails contact) {
        try {
            transport.send(from, to, subject, renderHtml(contact));
            return true;
        } catch (RuntimeException e) {
            log.error("Failed to send notification '{}' to {}", subject, to, e);
            return false;
        }
    }

    static String renderHtml(ContactDetails contact) {
        return "<html>\n"
                + "  <body>\n"
                + "    <h2>Sent from: </h2>\n"
                + "    <ul>\n"
                + "      <li style=\"font-size:18px\">&#128100; <b>" + HtmlUtils.htmlEscape(contact.name()) + "</b></li>\n"
                + "      <li style=\"font-size:18px\">&#9993;&#65039; <b>" + HtmlUtils.htmlEscape(contact.email()) + "</b></li>\n"
                + "    </ul>\n"
                + "    <p style=\"font-size:18px\">" + HtmlUtils.htmlEscape(contact.message()) + "</p>\n"
                + "  </body>\n"
                + "</html>\n";
    }
}
