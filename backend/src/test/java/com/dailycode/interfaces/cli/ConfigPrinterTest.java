package com.dailycode.interfaces.cli;

import com.dailycode.domain.delivery.service.MessageSender;
import com.dailycode.support.TestProperties;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.mock.env.MockEnvironment;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class ConfigPrinterTest {

    @Mock
    private MessageSender messageSender;

    @Test
    @DisplayName("secrets are redacted and settings listed")
    void effectiveConfig() {
        MockEnvironment environment = new MockEnvironment()
                .withProperty("openai.api-key", "gsk_live_1234567890abcd")
                .withProperty("openai.base-url", "https://api.groq.com/openai/v1")
                .withProperty("spring.datasource.url", "jdbc:h2:mem:test");
        when(messageSender.transportName()).thenReturn("console");

        Map<String, String> config = new ConfigPrinter(TestProperties.defaults(), environment, messageSender)
                .effectiveConfig();

        assertThat(config)
                .containsEntry("openai.api-key", "****abcd")
                .containsEntry("resend.api-key", "(not set)")
                .containsEntry("schedule", "09:00 UTC")
                .containsEntry("mail.transport", "console")
                .containsEntry("datasource.url", "jdbc:h2:mem:test");
        assertThat(config.values()).noneMatch(v -> v.contains("gsk_live"));
    }

    @Test
    @DisplayName("short secrets are fully masked")
    void redact() {
        assertThat(ConfigPrinter.redact(null)).isEqualTo("(not set)");
        assertThat(ConfigPrinter.redact(" ")).isEqualTo("(not set)");
        assertThat(ConfigPrinter.redact("secret")).isEqualTo("****");
        assertThat(ConfigPrinter.redact("re_abcdefghij")).isEqualTo("****ghij");
    }
}
