package com.dailycode.infrastructure.email;

import com.dailycode.domain.delivery.model.OutboundMessage;
import com.dailycode.domain.delivery.service.MessageSender;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Profile;
import org.springframework.stereotype.Service;

@Service
@Profile("!prod & !resend")
@Slf4j
public class ConsoleMessageSender implements MessageSender {

    @Override
    public void send(OutboundMessage message) {
        log.info("""
                ========================================
                [DEV] Outgoing e-mail
                To: {}
                Subject: {}
                ----------------------------------------
                {}
                ========================================""", message.to(), message.subject(), message.textBody());
    }

    @Override
    public boolean isReachable() {
        return true;
    }

    @Override
    public String transportName() {
        return "console";
    }
}
