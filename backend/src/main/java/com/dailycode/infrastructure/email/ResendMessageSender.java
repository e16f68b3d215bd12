package com.dailycode.infrastructure.email;

import com.dailycode.config.DailyCodeProperties;
import com.dailycode.domain.delivery.exception.SendException;
import com.dailycode.domain.delivery.model.OutboundMessage;
import com.dailycode.domain.delivery.service.MessageSender;
import com.resend.Resend;
import com.resend.core.exception.ResendException;
import com.resend.services.emails.model.CreateEmailOptions;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Profile;
import org.springframework.stereotype.Service;

@Service
@Profile("resend & !prod")
@Slf4j
public class ResendMessageSender implements MessageSender {

    private final Resend resend;
    private final String senderEmail;

    public ResendMessageSender(Resend resend, DailyCodeProperties properties) {
        this.resend = resend;
        this.senderEmail = properties.mail().sender();
    }

    @Override
    public void send(OutboundMessage message) {
        CreateEmailOptions options = CreateEmailOptions.builder()
                .from(senderEmail)
                .to(message.to())
                .subject(message.subject())
                .text(message.textBody())
                .html(message.htmlBody())
                .build();

        try {
            resend.emails().send(options);
            log.info("E-mail sent to {} via Resend", message.to());
        } catch (ResendException e) {
            log.error("Failed to send e-mail to {} via Resend: {}", message.to(), e.getMessage());
            throw new SendException("Resend rejected message to " + message.to(), e);
        }
    }

    @Override
    public boolean isReachable() {
        try {
            resend.domains().list();
            return true;
        } catch (ResendException e) {
            log.warn("Resend unreachable: {}", e.getMessage());
            return false;
        }
    }

    @Override
    public String transportName() {
        return "resend";
    }
}
