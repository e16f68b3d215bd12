package com.dailycode;

import com.dailycode.interfaces.cli.CliCommand;
import com.dailycode.interfaces.cli.CommandRunner;
import com.dailycode.interfaces.cli.ExitStatus;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.WebApplicationType;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;
import org.springframework.context.ConfigurableApplicationContext;

import java.util.Optional;

/**
 * Daily Code - one coding problem and its solution per subscriber per day.
 * <p>
 * Only the {@code scheduler} command starts the web server and keeps the process alive;
 * every other command exits once it has finished.
 */
@SpringBootApplication
@ConfigurationPropertiesScan
public class DailyCodeApplication {

	public static void main(String[] args) {
		Optional<CliCommand> command = args.length == 0 ? Optional.empty() : CliCommand.fromArgument(args[0]);
		if (command.isEmpty()) {
			System.err.print(CliCommand.usage());
			System.exit(ExitStatus.USAGE_ERROR.code());
			return;
		}

		SpringApplication application = new SpringApplication(DailyCodeApplication.class);
		boolean longRunning = command.get() == CliCommand.SCHEDULER;
		application.setWebApplicationType(longRunning ? WebApplicationType.SERVLET : WebApplicationType.NONE);

		ConfigurableApplicationContext context;
		try {
			context = application.run(args);
		} catch (RuntimeException e) {
			System.exit(ExitStatus.of(e).code());
			return;
		}

		if (longRunning) {
			int exitCode = context.getBean(CommandRunner.class).getExitCode();
			if (exitCode != ExitStatus.OK.code()) {
				System.exit(SpringApplication.exit(context));
			}
			return;
		}
		System.exit(SpringApplication.exit(context));
	}

}
