package dpdc.tool.pipeline;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.Callable;

import org.springframework.stereotype.Component;

import dpdc.tool.config.MigrationSettings;
import dpdc.tool.config.ToolProperties;
import dpdc.tool.domain.PipelineRunResult;
import dpdc.tool.domain.PreflightResult;
import dpdc.tool.domain.StageResult;
import dpdc.tool.domain.StageState;
import dpdc.tool.reconcile.DatasetReconciler;
import dpdc.tool.support.Verbosity;
import picocli.CommandLine.Command;
import picocli.CommandLine.Help.Ansi;
import picocli.CommandLine.Option;

/**
 * Migrate the raw load, holiday and weather data into the final table.
 */
@Component
@Command(name = "migrate", description = "Build the master load data table from the raw inputs.")
public class MigrateCommand implements Callable<Integer> {

	@Option(names = { "-v", "--verbose" }, description = "verbose output")
	boolean[] verbosity;

	@Option(names = { "-n", "--dry-run" }, description = "show what would be done without making any changes")
	boolean dryRun;

	@Option(names = { "-f", "--force" }, description = "rebuild outputs even if they already exist")
	boolean force;

	@Option(names = { "-h", "--help" }, usageHelp = true, description = "display this help message")
	boolean usageHelpRequested;

	@Option(names = { "-d", "--base-dir" }, description = "the directory default paths resolve against", defaultValue = ".")
	Path baseDir = Path.of(".");

	@Option(names = { "--workbook-dir" }, description = "the directory of load workbooks")
	Path workbookDir;

	@Option(names = { "--holiday-file" }, description = "the holiday list workbook")
	Path holidayFile;

	@Option(names = { "--weather-file" }, description = "the weather data CSV file")
	Path weatherFile;

	@Option(names = { "--master-file" }, description = "the merged load CSV file")
	Path masterDataFile;

	@Option(names = { "--enriched-file" }, description = "the holiday enriched CSV file")
	Path enrichedDataFile;

	@Option(names = { "--merged-file" }, description = "the weather merged CSV file")
	Path mergedDataFile;

	@Option(names = { "-o", "--output-dir" }, description = "the output directory")
	Path outputDir;

	@Option(names = { "--output-file-name" }, description = "the output file name")
	String outputFileName;

	private static final String DRY_RUN_PREFIX = "@|blue [Dry run]|@";

	private static final int MAX_WARNINGS = 20;

	private final ToolProperties properties;
	private final PipelineOrchestrator orchestrator;
	private final DatasetReconciler reconciler;

	/**
	 * Constructor.
	 *
	 * @param properties   the tool properties
	 * @param orchestrator the orchestrator
	 * @param reconciler   the reconciler
	 */
	public MigrateCommand(ToolProperties properties, PipelineOrchestrator orchestrator,
			DatasetReconciler reconciler) {
		super();
		this.properties = properties;
		this.orchestrator = orchestrator;
		this.reconciler = reconciler;
	}

	@Override
	public Integer call() throws Exception {
		Verbosity.apply(verbosity);
		final MigrationSettings settings = settings();

		if (dryRun) {
			System.out.println(Ansi.AUTO.string("%s No files will be changed.".formatted(DRY_RUN_PREFIX)));
		}

		final PipelineRunResult result = orchestrator.run(MigrationPipeline.preflightChecks(settings),
				MigrationPipeline.stages(settings, reconciler), settings.dryRun(), settings.force());

		printPreflight(result.preflight());
		if (!result.preflightPassed()) {
			System.out.println(Ansi.AUTO.string("@|red Pre-flight checks failed.|@ No stages were run."));
			return 1;
		}

		for (StageResult stage : result.stages()) {
			printStage(stage);
		}

		final StageResult failed = result.failedStage();
		if (failed != null) {
			// @formatter:off
			System.out.print(Ansi.AUTO.string("""
					@|red Pipeline failed|@ at stage %d (%s): %s
					""".formatted(
							  failed.descriptor().ordinal()
							, failed.descriptor().description()
							, failed.errorMessage()
						)
					));
			// @formatter:on
			return 1;
		}

		if (result.dryRun()) {
			System.out.println(Ansi.AUTO.string("%s @|green Pipeline plan complete.|@".formatted(DRY_RUN_PREFIX)));
		} else {
			System.out.println(Ansi.AUTO
					.string("@|green Pipeline complete.|@ Final output: @|bold %s|@".formatted(settings.outputFile())));
			for (Path p : List.of(settings.masterDataFile(), settings.enrichedDataFile(), settings.mergedDataFile(),
					settings.outputFile())) {
				printFileSize(p);
			}
		}
		return 0;
	}

	private MigrationSettings settings() {
		final MigrationSettings defaults = MigrationSettings.defaults(baseDir, properties);
		// @formatter:off
		return new MigrationSettings(
				  or(workbookDir, defaults.workbookDir())
				, or(holidayFile, defaults.holidayFile())
				, or(weatherFile, defaults.weatherFile())
				, or(masterDataFile, defaults.masterDataFile())
				, or(enrichedDataFile, defaults.enrichedDataFile())
				, or(mergedDataFile, defaults.mergedDataFile())
				, or(outputDir, defaults.outputDir())
				, or(outputFileName, defaults.outputFileName())
				, dryRun
				, force
				, defaults.zoneOffset()
				, defaults.gridStep()
				, defaults.holidaySheet()
				, defaults.excludedWorkbookFragment()
			);
		// @formatter:on
	}

	private static <T> T or(T value, T defaultValue) {
		return (value != null ? value : defaultValue);
	}

	private static void printPreflight(List<PreflightResult> results) {
		System.out.println(Ansi.AUTO.string("@|bold Pre-flight checks|@"));
		for (PreflightResult r : results) {
			if (r.passed()) {
				System.out.println(
						Ansi.AUTO.string("  [@|green OK|@]   %s: %s".formatted(r.description(), r.message())));
			} else {
				System.out.println(
						Ansi.AUTO.string("  [@|red FAIL|@] %s: %s".formatted(r.description(), r.message())));
				if (r.hint() != null) {
					System.out.println("         " + r.hint());
				}
			}
		}
	}

	private void printStage(StageResult stage) {
		final String state;
		if (stage.state() == StageState.Done) {
			state = "@|green Done|@";
		} else if (stage.state() == StageState.Skipped) {
			state = "@|yellow Skipped|@ (output exists)";
		} else if (stage.state() == StageState.Failed) {
			state = "@|red Failed|@";
		} else if (stage.state() == StageState.Pending && !stage.plan().isEmpty()) {
			state = "@|blue Would run|@";
		} else {
			state = stage.state().name();
		}
		System.out.println(Ansi.AUTO.string("@|bold %s|@: %s".formatted(stage.descriptor().label(), state)));
		for (String line : stage.plan()) {
			System.out.println(Ansi.AUTO.string("  %s %s".formatted(DRY_RUN_PREFIX, line)));
		}
		if (stage.outcome() != null) {
			for (String line : stage.outcome().details()) {
				System.out.println("  " + line);
			}
		}
		final List<String> warnings = stage.warnings();
		final int max = (verbosity != null ? warnings.size() : Math.min(MAX_WARNINGS, warnings.size()));
		for (int i = 0; i < max; i++) {
			System.out.println(Ansi.AUTO.string("  @|yellow Warning:|@ " + warnings.get(i)));
		}
		if (max < warnings.size()) {
			System.out.println(Ansi.AUTO.string(
					"  @|yellow %d more warnings|@ (use --verbose to show all)".formatted(warnings.size() - max)));
		}
	}

	private static void printFileSize(Path path) throws IOException {
		if (Files.isRegularFile(path)) {
			System.out.println("  %s: %,d bytes".formatted(path, Files.size(path)));
		}
	}

}
