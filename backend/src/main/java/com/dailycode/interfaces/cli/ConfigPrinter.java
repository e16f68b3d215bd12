package com.dailycode.interfaces.cli;

import com.dailycode.config.DailyCodeProperties;
import com.dailycode.domain.delivery.service.MessageSender;
import com.dailycode.domain.subscriber.model.Language;
import lombok.RequiredArgsConstructor;
import org.springframework.core.env.Environment;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Effective configuration as printable key/value pairs. Secrets never appear in clear text.
 */
@Component
@RequiredArgsConstructor
public class ConfigPrinter {

    private final DailyCodeProperties properties;
    private final Environment environment;
    private final MessageSender messageSender;

    public Map<String, String> effectiveConfig() {
        Map<String, String> config = new LinkedHashMap<>();
        config.put("profiles", String.join(",", environment.getActiveProfiles()));
        config.put("schedule", String.format("%02d:%02d %s", properties.schedule().hour(),
                properties.schedule().minute(), properties.schedule().zone()));
        config.put("schedule.catch-up", properties.schedule().catchUp().name());
        config.put("delivery.worker-pool-size", String.valueOf(properties.delivery().workerPoolSize()));
        config.put("delivery.run-timeout", properties.delivery().runTimeout().toString());
        config.put("delivery.shutdown-grace", properties.delivery().shutdownGrace().toString());
        config.put("delivery.selection-policy", properties.delivery().selectionPolicy().name());
        config.put("delivery.embellishment-failure-policy", properties.delivery().embellishmentFailurePolicy().name());
        config.put("catalog.location", properties.catalog().location());
        config.put("supported-languages", String.join(",",
                properties.supportedLanguages().stream().map(Language::code).sorted().toList()));
        config.put("mail.sender", properties.mail().sender());
        config.put("mail.transport", messageSender.transportName());
        config.put("datasource.url", environment.getProperty("spring.datasource.url", ""));
        config.put("datasource.password", redact(environment.getProperty("spring.datasource.password")));
        config.put("openai.base-url", environment.getProperty("openai.base-url", ""));
        config.put("openai.model", environment.getProperty("openai.model", ""));
        config.put("openai.api-key", redact(environment.getProperty("openai.api-key")));
        config.put("resend.api-key", redact(environment.getProperty("resend.api-key")));
        config.put("log-level", environment.getProperty("logging.level.com.dailycode", "INFO"));
        return config;
    }

    static String redact(String secret) {
        if (secret == null || secret.isBlank()) {
            return "(not set)";
        }
        if (secret.length() <= 8) {
            return "****";
        }
        return "****" + secret.substring(secret.length() - 4);
    }
}
