package com.ukdataalerts.coronavirus.output;

import com.ukdataalerts.coronavirus.config.AlertsProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import software.amazon.awssdk.services.ses.SesClient;
import software.amazon.awssdk.services.ses.model.Body;
import software.amazon.awssdk.services.ses.model.Content;
import software.amazon.awssdk.services.ses.model.Destination;
import software.amazon.awssdk.services.ses.model.Message;
import software.amazon.awssdk.services.ses.model.SendEmailRequest;
import software.amazon.awssdk.services.ses.model.SendEmailResponse;

import java.util.List;

/**
 * E-mails alerts through Amazon SES. With no recipients configured the alert
 * is written to the log instead.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class SesAlertDispatcher implements AlertDispatcher {

    private final SesClient sesClient;
    private final AlertsProperties properties;

    @Override
    public void sendAlert(String subject, String bodyHtml) {
        List<String> recipients = properties.getNotify().recipients();
        if (recipients.isEmpty()) {
            log.info("No email addresses configured. Not sending an email but if I did it would look like this:");
            log.info("Subject: {}. Body: {}", subject, bodyHtml);
            return;
        }

        log.info("Email {}. Subject: {}", String.join(", ", recipients), subject);
        log.debug("Body: {}", bodyHtml);

        SendEmailResponse response = sesClient.sendEmail(SendEmailRequest.builder()
                .source(properties.getNotify().getSender())
                .destination(Destination.builder().toAddresses(recipients).build())
                .message(Message.builder()
                        .subject(Content.builder().data(subject).charset("UTF-8").build())
                        .body(Body.builder()
                                .html(Content.builder().data(bodyHtml).charset("UTF-8").build())
                                .build())
                        .build())
                .build());

        log.info("Email sent successfully (message id {})", response.messageId());
    }
}
