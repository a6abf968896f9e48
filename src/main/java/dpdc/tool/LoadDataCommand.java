package dpdc.tool;

import java.util.concurrent.Callable;

import org.springframework.stereotype.Component;

import dpdc.tool.pipeline.MigrateCommand;
import dpdc.tool.validation.ValidateCommand;
import dpdc.tool.weather.FetchWeatherCommand;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Spec;

/**
 * The top-level command, grouping the tool commands.
 */
@Component
@Command(name = "dpdc-load-tool", description = "DPDC hourly load data tool.", subcommands = { MigrateCommand.class,
		ValidateCommand.class, FetchWeatherCommand.class })
public class LoadDataCommand implements Callable<Integer> {

	@Option(names = { "-h", "--help" }, usageHelp = true, description = "display this help message")
	boolean usageHelpRequested;

	@Spec
	CommandSpec spec;

	@Override
	public Integer call() throws Exception {
		spec.commandLine().usage(System.out);
		return 1;
	}

}
