package com.dailycode.infrastructure.email;

import com.dailycode.config.DailyCodeProperties;
import com.dailycode.domain.delivery.exception.SendException;
import com.dailycode.domain.delivery.model.OutboundMessage;
import com.dailycode.domain.delivery.service.MessageSender;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Profile;
import org.springframework.stereotype.Service;
import software.amazon.awssdk.core.exception.SdkException;
import software.amazon.awssdk.services.ses.SesClient;
import software.amazon.awssdk.services.ses.model.Body;
import software.amazon.awssdk.services.ses.model.Content;
import software.amazon.awssdk.services.ses.model.Destination;
import software.amazon.awssdk.services.ses.model.Message;
import software.amazon.awssdk.services.ses.model.SendEmailRequest;

@Service
@Profile("prod")
@Slf4j
public class SesMessageSender implements MessageSender {

    private final SesClient sesClient;
    private final String senderEmail;

    public SesMessageSender(SesClient sesClient, DailyCodeProperties properties) {
        this.sesClient = sesClient;
        this.senderEmail = properties.mail().sender();
    }

    @Override
    public void send(OutboundMessage message) {
        SendEmailRequest request = SendEmailRequest.builder()
                .source(senderEmail)
                .destination(Destination.builder().toAddresses(message.to()).build())
                .message(Message.builder()
                        .subject(utf8(message.subject()))
                        .body(Body.builder()
                                .text(utf8(message.textBody()))
                                .html(utf8(message.htmlBody()))
                                .build())
                        .build())
                .build();

        try {
            sesClient.sendEmail(request);
            log.info("E-mail sent to {} via SES", message.to());
        } catch (SdkException e) {
            log.error("Failed to send e-mail to {} via SES: {}", message.to(), e.getMessage());
            throw new SendException("SES rejected message to " + message.to(), e);
        }
    }

    @Override
    public boolean isReachable() {
        try {
            sesClient.getSendQuota();
            return true;
        } catch (SdkException e) {
            log.warn("SES unreachable: {}", e.getMessage());
            return false;
        }
    }

    @Override
    public String transportName() {
        return "ses";
    }

    private static Content utf8(String data) {
        return Content.builder().data(data).charset("UTF-8").build();
    }
}
