package com.dailycode.config;

import com.dailycode.domain.common.exception.ConfigurationException;
import com.dailycode.infrastructure.scheduling.CatchUpPolicy;
import com.dailycode.support.TestProperties;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.mock.env.MockEnvironment;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class StartupConfigValidatorTest {

    private static MockEnvironment configured() {
        return new MockEnvironment()
                .withProperty("openai.api-key", "gsk_test")
                .withProperty("openai.base-url", "https://api.groq.com/openai/v1");
    }

    @Test
    @DisplayName("a complete configuration has no problems")
    void valid() {
        StartupConfigValidator validator = new StartupConfigValidator(TestProperties.defaults(), configured());

        assertThat(validator.problems()).isEmpty();
        assertThatCode(validator::requireValid).doesNotThrowAnyException();
    }

    @Test
    @DisplayName("missing credentials are all reported at once")
    void missingCredentials() {
        MockEnvironment environment = new MockEnvironment();
        environment.setActiveProfiles("resend");

        StartupConfigValidator validator = new StartupConfigValidator(TestProperties.defaults(), environment);

        assertThat(validator.problems()).hasSize(3);
        assertThatThrownBy(validator::requireValid)
                .isInstanceOf(ConfigurationException.class)
                .hasMessageContaining("openai.api-key")
                .hasMessageContaining("openai.base-url")
                .hasMessageContaining("resend.api-key");
    }

    @Test
    @DisplayName("the resend key is only required with the resend profile")
    void resendKeyOnlyForResendProfile() {
        MockEnvironment environment = configured();
        environment.setActiveProfiles("prod", "resend");

        assertThat(new StartupConfigValidator(TestProperties.defaults(), environment).problems()).isEmpty();
    }

    @Test
    @DisplayName("rejects a sender that is not an address and a non-positive timeout")
    void invalidValues() {
        DailyCodeProperties properties = TestProperties.builder()
                .sender("daily code")
                .runTimeout(Duration.ZERO)
                .build();

        assertThat(new StartupConfigValidator(properties, configured()).problems())
                .anyMatch(p -> p.contains("dailycode.mail.sender"))
                .anyMatch(p -> p.contains("run-timeout"));
    }

    @Test
    @DisplayName("accepts a display name in the sender")
    void senderWithDisplayName() {
        DailyCodeProperties properties = TestProperties.builder().sender("Daily Code <daily@dailycode.dev>").build();

        assertThat(new StartupConfigValidator(properties, configured()).problems()).isEmpty();
    }

    @Test
    @DisplayName("an unknown time zone fails when the properties are bound")
    void unknownZone() {
        assertThatThrownBy(() -> new DailyCodeProperties.Schedule(9, 0, "Mars/Olympus", CatchUpPolicy.SKIP))
                .isInstanceOf(ConfigurationException.class)
                .hasMessageContaining("Mars/Olympus");
    }
}
