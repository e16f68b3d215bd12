package com.dailycode.interfaces.cli;

import java.util.Arrays;
import java.util.Optional;

public enum CliCommand {
    INIT_DATA("init-data", "[path]", "load a problem catalog JSON document"),
    RUN_ONCE("run-once", "", "run one delivery pass now and print the report"),
    SCHEDULER("scheduler", "", "run the daily scheduler and the HTTP API until stopped"),
    TEST("test", "", "check stores and collaborators, print system statistics"),
    SHOW_CONFIG("show-config", "", "print the effective configuration, secrets redacted");

    private final String argument;
    private final String parameters;
    private final String description;

    CliCommand(String argument, String parameters, String description) {
        this.argument = argument;
        this.parameters = parameters;
        this.description = description;
    }

    public String argument() {
        return argument;
    }

    public static Optional<CliCommand> fromArgument(String argument) {
        return Arrays.stream(values())
                .filter(c -> c.argument.equals(argument))
                .findFirst();
    }

    public static String usage() {
        StringBuilder sb = new StringBuilder("Usage: dailycode <command> [options]\n\nCommands:\n");
        for (CliCommand command : values()) {
            sb.append(String.format("  %-24s %s%n", (command.argument + " " + command.parameters).trim(),
                    command.description));
        }
        return sb.toString();
    }
}
