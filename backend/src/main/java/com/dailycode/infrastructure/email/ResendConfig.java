package com.dailycode.infrastructure.email;

import com.dailycode.domain.common.exception.ConfigurationException;
import com.resend.Resend;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Profile;

/**
 * Resend transport, used when the {@code resend} profile is active outside production.
 */
@Configuration
@Profile("resend & !prod")
public class ResendConfig {

    @Bean
    public Resend resend(@Value("${resend.api-key:}") String apiKey) {
        if (apiKey.isBlank()) {
            throw new ConfigurationException("resend.api-key must be set when the resend profile is active");
        }
        return new Resend(apiKey);
    }
}
