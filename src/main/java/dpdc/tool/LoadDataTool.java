package dpdc.tool;

import org.springframework.boot.Banner.Mode;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.WebApplicationType;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.builder.SpringApplicationBuilder;

import picocli.CommandLine;
import picocli.CommandLine.IFactory;

/**
 * DPDC hourly load data command-line tool.
 *
 * <p>
 * Starts a non-web Spring context so the {@code migrate}, {@code validate} and
 * {@code fetch-weather} commands get their {@code dpdc.tool.*} properties,
 * HTTP client and table writer injected, then runs the command named on the
 * command line. The process exit code is the command's result: 0 when the
 * pipeline completed, the file validated or the weather data was saved, 1
 * otherwise.
 * </p>
 */
@SpringBootApplication
public class LoadDataTool implements CommandLineRunner, ExitCodeGenerator {

	private final IFactory factory;
	private final LoadDataCommand command;

	private int exitCode;

	/**
	 * Constructor.
	 * 
	 * @param factory the Spring-aware picocli factory that creates the
	 *                subcommands
	 * @param command the top-level {@code dpdc-load-tool} command
	 */
	public LoadDataTool(IFactory factory, LoadDataCommand command) {
		super();
		this.factory = factory;
		this.command = command;
	}

	@Override
	public void run(String... args) throws Exception {
		exitCode = new CommandLine(command, factory).execute(args);
	}

	@Override
	public int getExitCode() {
		return exitCode;
	}

	/**
	 * Main entry point.
	 * 
	 * @param args the subcommand and its options
	 */
	public static final void main(String[] args) {
		System.exit(SpringApplication.exit(new SpringApplicationBuilder().sources(LoadDataTool.class)
				.web(WebApplicationType.NONE).logStartupInfo(false).bannerMode(Mode.OFF).build().run(args)));
	}

}
