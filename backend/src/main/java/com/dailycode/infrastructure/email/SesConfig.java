package com.dailycode.infrastructure.email;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Profile;
import software.amazon.awssdk.regions.Region;
import software.amazon.awssdk.services.ses.SesClient;
import software.amazon.awssdk.services.ses.SesClientBuilder;

import java.net.URI;
import java.time.Duration;

/**
 * SES transport for production. Credentials come from the default AWS provider chain.
 */
@Configuration
@Profile("prod")
public class SesConfig {

    /**
     * @param endpoint optional endpoint override, e.g. a local SES emulator
     */
    @Bean(destroyMethod = "close")
    public SesClient sesClient(@Value("${aws.ses.region:us-east-1}") String region,
                               @Value("${aws.ses.endpoint:}") String endpoint,
                               @Value("${aws.ses.api-call-timeout:10s}") Duration apiCallTimeout) {
        SesClientBuilder builder = SesClient.builder()
                .region(Region.of(region))
                .overrideConfiguration(o -> o.apiCallTimeout(apiCallTimeout));
        if (!endpoint.isBlank()) {
            builder.endpointOverride(URI.create(endpoint));
        }
        return builder.build();
    }
}
