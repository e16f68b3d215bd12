package com.dailycode.interfaces.cli;

import com.dailycode.application.catalog.CatalogImportService;
import com.dailycode.application.catalog.ImportResult;
import com.dailycode.application.delivery.EntryOutcome;
import com.dailycode.application.delivery.RunEntry;
import com.dailycode.application.delivery.RunReport;
import com.dailycode.application.health.ComponentHealth;
import com.dailycode.application.health.HealthReport;
import com.dailycode.application.health.SystemHealthService;
import com.dailycode.application.health.SystemStats;
import com.dailycode.config.StartupConfigValidator;
import com.dailycode.infrastructure.ai.TokenUsageTracker;
import com.dailycode.infrastructure.scheduling.DeliveryTriggerScheduler;
import com.dailycode.infrastructure.scheduling.TriggerResult;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.stereotype.Component;

import java.io.PrintStream;
import java.util.List;
import java.util.Optional;

/**
 * Executes the command named by the first program argument and remembers its exit status.
 */
@Slf4j
@Component
public class CommandRunner implements ApplicationRunner, ExitCodeGenerator {

    private final CatalogImportService catalogImportService;
    private final SystemHealthService healthService;
    private final DeliveryTriggerScheduler triggerScheduler;
    private final StartupConfigValidator configValidator;
    private final ConfigPrinter configPrinter;
    private final TokenUsageTracker usageTracker;
    private final PrintStream out;

    private volatile ExitStatus exitStatus = ExitStatus.OK;

    @Autowired
    public CommandRunner(CatalogImportService catalogImportService,
                         SystemHealthService healthService,
                         DeliveryTriggerScheduler triggerScheduler,
                         StartupConfigValidator configValidator,
                         ConfigPrinter configPrinter,
                         TokenUsageTracker usageTracker) {
        this(catalogImportService, healthService, triggerScheduler, configValidator, configPrinter, usageTracker,
                System.out);
    }

    CommandRunner(CatalogImportService catalogImportService,
                  SystemHealthService healthService,
                  DeliveryTriggerScheduler triggerScheduler,
                  StartupConfigValidator configValidator,
                  ConfigPrinter configPrinter,
                  TokenUsageTracker usageTracker,
                  PrintStream out) {
        this.catalogImportService = catalogImportService;
        this.healthService = healthService;
        this.triggerScheduler = triggerScheduler;
        this.configValidator = configValidator;
        this.configPrinter = configPrinter;
        this.usageTracker = usageTracker;
        this.out = out;
    }

    @Override
    public void run(ApplicationArguments args) {
        List<String> arguments = args.getNonOptionArgs();
        Optional<CliCommand> command = arguments.isEmpty()
                ? Optional.empty()
                : CliCommand.fromArgument(arguments.get(0));
        if (command.isEmpty()) {
            out.print(CliCommand.usage());
            exitStatus = ExitStatus.USAGE_ERROR;
            return;
        }

        try {
            exitStatus = switch (command.get()) {
                case INIT_DATA -> initData(arguments.size() > 1 ? arguments.get(1) : null);
                case RUN_ONCE -> runOnce();
                case SCHEDULER -> startScheduler();
                case TEST -> healthCheck();
                case SHOW_CONFIG -> showConfig();
            };
        } catch (RuntimeException e) {
            exitStatus = ExitStatus.of(e);
            log.error("Command {} failed", command.get().argument(), e);
            out.println("ERROR: " + e.getMessage());
        }
    }

    @Override
    public int getExitCode() {
        return exitStatus.code();
    }

    public ExitStatus getExitStatus() {
        return exitStatus;
    }

    private ExitStatus initData(String path) {
        ImportResult result = catalogImportService.importCatalog(path);
        out.printf("Imported %d of %d problems from %s (%d already present, %d rejected)%n",
                result.imported(), result.read(), result.source(), result.skipped().size(), result.rejected().size());
        result.rejected().forEach(r -> out.println("  rejected " + r));
        printStats(healthService.stats());
        return result.isEmpty() ? ExitStatus.COMMAND_FAILURE : ExitStatus.OK;
    }

    private ExitStatus runOnce() {
        configValidator.requireValid();
        TriggerResult result = triggerScheduler.triggerNow();
        return switch (result.status()) {
            case COMPLETED -> {
                printReport(result.report());
                out.println("LLM usage: " + usageTracker.snapshot().describe());
                yield ExitStatus.OK;
            }
            case SKIPPED -> {
                out.println("Skipped: a delivery run is already in progress");
                yield ExitStatus.COMMAND_FAILURE;
            }
            case FAILED -> {
                out.println("Delivery run aborted: " + result.error().getMessage());
                yield ExitStatus.of(result.error());
            }
        };
    }

    private ExitStatus startScheduler() {
        configValidator.requireValid();
        triggerScheduler.start();
        out.println("Scheduler started, next run at " + triggerScheduler.status().nextFireTime());
        return ExitStatus.OK;
    }

    private ExitStatus healthCheck() {
        configValidator.requireValid();
        HealthReport report = healthService.check();
        out.println("System health:");
        for (ComponentHealth component : report.components()) {
            out.printf("  %-20s %-4s %s%n", component.name(), component.healthy() ? "UP" : "DOWN", component.detail());
        }
        if (report.stats() != null) {
            printStats(report.stats());
        }
        out.println(report.isHealthy() ? "All systems healthy" : "Some components are unhealthy");
        return report.isHealthy() ? ExitStatus.OK : ExitStatus.COMMAND_FAILURE;
    }

    private ExitStatus showConfig() {
        out.println("Effective configuration:");
        configPrinter.effectiveConfig().forEach((key, value) -> out.printf("  %-40s %s%n", key, value));
        List<String> problems = configValidator.problems();
        if (problems.isEmpty()) {
            out.println("Configuration is valid");
        } else {
            out.println("Configuration problems:");
            problems.forEach(p -> out.println("  - " + p));
        }
        return ExitStatus.OK;
    }

    private void printReport(RunReport report) {
        out.println("Delivery " + report.summary());
        for (RunEntry entry : report.entries()) {
            StringBuilder line = new StringBuilder()
                    .append("  ").append(entry.subscriberId())
                    .append(" -> ").append(entry.problemId() == null ? "-" : entry.problemId())
                    .append(" [").append(entry.outcome()).append(']');
            if (entry.degraded()) {
                line.append(" degraded: ").append(entry.warning());
            }
            if (entry.outcome() != EntryOutcome.SUCCESS && entry.error() != null) {
                line.append(' ').append(entry.error());
            }
            out.println(line);
        }
    }

    private void printStats(SystemStats stats) {
        out.println("System statistics:");
        out.println("  active subscribers:   " + stats.activeSubscribers());
        out.println("  problems:             " + stats.totalProblems() + " " + stats.problemsByDifficulty());
        out.println("  delivery attempts:    " + stats.deliveryAttempts());
        out.println("  languages:            " + String.join(", ", stats.supportedLanguages()));
        out.println("  difficulties:         " + String.join(", ", stats.supportedDifficulties()));
    }
}
