package com.dailycode.config;

import com.dailycode.application.delivery.SelectionPolicy;
import com.dailycode.domain.common.exception.ConfigurationException;
import com.dailycode.domain.subscriber.model.Language;
import com.dailycode.infrastructure.pipeline.EmbellishmentFailurePolicy;
import com.dailycode.infrastructure.scheduling.CatchUpPolicy;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.validation.annotation.Validated;

import java.time.DateTimeException;
import java.time.Duration;
import java.time.ZoneId;
import java.util.Set;

/**
 * @param schedule           daily trigger time and missed-occurrence handling
 * @param delivery           coordinator run settings
 * @param catalog            where {@code init-data} reads the problem catalog from by default
 * @param mail               sender identity for outgoing messages
 * @param supportedLanguages languages subscribers may choose
 */
@ConfigurationProperties("dailycode")
@Validated
public record DailyCodeProperties(
        @DefaultValue @Valid
        Schedule schedule,

        @DefaultValue @Valid
        Delivery delivery,

        @DefaultValue @Valid
        Catalog catalog,

        @DefaultValue @Valid
        Mail mail,

        @DefaultValue({"python", "java", "cpp", "javascript", "go", "rust"}) @NotEmpty
        Set<Language> supportedLanguages
) {

    /**
     * @param hour    hour of day, 0-23
     * @param minute  minute of hour, 0-59
     * @param zone    region id the hour and minute are interpreted in
     * @param catchUp behaviour for an occurrence missed while the process was not running
     */
    public record Schedule(
            @DefaultValue("9") @Min(0) @Max(23)
            int hour,

            @DefaultValue("0") @Min(0) @Max(59)
            int minute,

            @DefaultValue("UTC") @NotBlank
            String zone,

            @DefaultValue("SKIP") @NotNull
            CatchUpPolicy catchUp
    ) {
        public Schedule {
            if (zone != null && !zone.isBlank()) {
                try {
                    ZoneId.of(zone);
                } catch (DateTimeException e) {
                    throw new ConfigurationException("Unknown time zone '" + zone + "' in dailycode.schedule.zone");
                }
            }
        }

        public ZoneId zoneId() {
            return ZoneId.of(zone);
        }
    }

    /**
     * @param workerPoolSize             concurrent subscriber pipelines per run
     * @param runTimeout                 wall-clock bound for one run
     * @param shutdownGrace              time interrupted pipelines get to record their outcome
     * @param selectionPolicy            tie-break among candidate problems
     * @param embellishmentFailurePolicy whether a commentary failure blocks the delivery
     * @param recentReportCapacity       number of run reports kept in memory
     */
    public record Delivery(
            @DefaultValue("4") @Min(1) @Max(64)
            int workerPoolSize,

            @DefaultValue("30m") @NotNull
            Duration runTimeout,

            @DefaultValue("10s") @NotNull
            Duration shutdownGrace,

            @DefaultValue("LOWEST_ID") @NotNull
            SelectionPolicy selectionPolicy,

            @DefaultValue("DEGRADE") @NotNull
            EmbellishmentFailurePolicy embellishmentFailurePolicy,

            @DefaultValue("20") @Min(1)
            int recentReportCapacity
    ) {
    }

    public record Catalog(
            @DefaultValue("data/problems.json") @NotBlank
            String location
    ) {
    }

    public record Mail(
            @DefaultValue("daily@dailycode.dev") @NotBlank
            String sender,

            @DefaultValue("[Daily Code]")
            String subjectPrefix
    ) {
    }
}
