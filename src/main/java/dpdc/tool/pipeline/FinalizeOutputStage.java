package dpdc.tool.pipeline;

import java.io.IOException;
import java.nio.file.Files;
import java.util.ArrayList;
import java.util.List;

import dpdc.tool.config.MigrationSettings;
import dpdc.tool.domain.StageDescriptor;
import dpdc.tool.domain.StageOutcome;
import dpdc.tool.support.AtomicTableWriter;

/**
 * Publish the merged table to the output directory.
 */
public class FinalizeOutputStage extends AbstractStage {

	/**
	 * Constructor.
	 *
	 * @param settings the run settings
	 */
	public FinalizeOutputStage(MigrationSettings settings) {
		super(settings, new StageDescriptor(4, "Copy to output directory", List.of(settings.mergedDataFile()),
				settings.outputFile()));
	}

	@Override
	public List<String> plan() {
		final List<String> plan = new ArrayList<>(2);
		if (!Files.isDirectory(settings.outputDir())) {
			plan.add("Would create directory %s".formatted(settings.outputDir()));
		}
		plan.add("Would copy %s to %s".formatted(settings.mergedDataFile(), descriptor().output()));
		return plan;
	}

	@Override
	public StageOutcome execute(AtomicTableWriter writer) throws IOException {
		Files.createDirectories(settings.outputDir());
		writer.copy(settings.mergedDataFile(), descriptor().output());
		return new StageOutcome(-1L,
				List.of("Copied %s to %s".formatted(settings.mergedDataFile(), descriptor().output())), null);
	}

}
