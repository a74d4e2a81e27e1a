package com.starscape.imagepipeline.features.notifications.infra;

import com.starscape.imagepipeline.common.exception.DependencyException;
import com.starscape.imagepipeline.features.notifications.domain.NotificationTransport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import software.amazon.awssdk.core.exception.SdkException;
import software.amazon.awssdk.services.ses.SesClient;
import software.amazon.awssdk.services.ses.model.Body;
import software.amazon.awssdk.services.ses.model.Content;
import software.amazon.awssdk.services.ses.model.Destination;
import software.amazon.awssdk.services.ses.model.Message;
import software.amazon.awssdk.services.ses.model.SendEmailRequest;
import software.amazon.awssdk.services.ses.model.SendEmailResponse;

import java.nio.charset.StandardCharsets;

@Service
public class SesNotificationTransport implements NotificationTransport {

    private static final Logger log = LoggerFactory.getLogger(SesNotificationTransport.class);

    private static final String CHARSET = StandardCharsets.UTF_8.name();

    private final SesClient sesClient;

    public SesNotificationTransport(SesClient sesClient) {
        this.sesClient = sesClient;
    }

    @Override
    public void send(String from, String to, String subject, String htmlBody) {
        SendEmailRequest request = SendEmailRequest.builder()
                .source(from)
                .destination(Destination.builder().toAddresses(to).build())
                .message(Message.builder()
                        .subject(content(subject))
                        .body(Body.builder().html(content(htmlBody)).build())
                        .build())
                .build();

        try {
            SendEmailResponse response = sesClient.sendEmail(request);
            log.info("Sent email '{}' to {}: messageId={}", subject, to, response.messageId());
        } catch (SdkException e) {
            throw new DependencyException("Failed to send email '" + subject + "' to " + to, e);
        }
    }

    private static Content content(String data) {
        return Content.builder().charset(CHARSET).data(data).build();
    }
}
