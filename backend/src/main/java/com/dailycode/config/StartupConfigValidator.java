package com.dailycode.config;

import com.dailycode.domain.common.exception.ConfigurationException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.env.Environment;
import org.springframework.core.env.Profiles;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Checks the settings the bound properties cannot check on their own, mostly collaborator credentials.
 * Commands that talk to collaborators call {@link #requireValid()} before doing any work.
 */
@Slf4j
@Component
public class StartupConfigValidator {

    private static final Pattern SENDER = Pattern.compile("^(.+<)?[^@\\s<>]+@[^@\\s<>]+\\.[^@\\s<>]+>?$");

    private final DailyCodeProperties properties;
    private final Environment environment;

    public StartupConfigValidator(DailyCodeProperties properties, Environment environment) {
        this.properties = properties;
        this.environment = environment;
    }

    /**
     * Every problem found, empty when the configuration is usable.
     */
    public List<String> problems() {
        List<String> problems = new ArrayList<>();

        if (isBlank(environment.getProperty("openai.api-key"))) {
            problems.add("openai.api-key is not set (OPENAI_API_KEY)");
        }
        if (isBlank(environment.getProperty("openai.base-url"))) {
            problems.add("openai.base-url is not set (OPENAI_BASE_URL)");
        }
        if (environment.acceptsProfiles(Profiles.of("resend & !prod"))
                && isBlank(environment.getProperty("resend.api-key"))) {
            problems.add("resend.api-key is not set (RESEND_API_KEY)");
        }
        if (!SENDER.matcher(properties.mail().sender()).matches()) {
            problems.add("dailycode.mail.sender is not an e-mail address: " + properties.mail().sender());
        }
        if (properties.delivery().runTimeout().isNegative() || properties.delivery().runTimeout().isZero()) {
            problems.add("dailycode.delivery.run-timeout must be positive");
        }
        if (properties.delivery().shutdownGrace().isNegative()) {
            problems.add("dailycode.delivery.shutdown-grace must not be negative");
        }
        return problems;
    }

    /**
     * @throws ConfigurationException listing every problem found
     */
    public void requireValid() {
        List<String> problems = problems();
        if (!problems.isEmpty()) {
            problems.forEach(p -> log.error("Invalid configuration: {}", p));
            throw new ConfigurationException("Invalid configuration:\n  - " + String.join("\n  - ", problems));
        }
        log.debug("Configuration validated");
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
