package dpdc.tool.pipeline;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

import dpdc.tool.config.MigrationSettings;
import dpdc.tool.domain.ReconciliationResult;
import dpdc.tool.domain.Schema;
import dpdc.tool.domain.StageDescriptor;
import dpdc.tool.domain.StageOutcome;
import dpdc.tool.domain.Table;
import dpdc.tool.reconcile.DatasetReconciler;
import dpdc.tool.support.AtomicTableWriter;
import dpdc.tool.support.CsvTables;

/**
 * Merge the holiday enriched load table with the weather table into the
 * canonical schema.
 */
public class MergeWeatherStage extends AbstractStage {

	private final DatasetReconciler reconciler;

	/**
	 * Constructor.
	 *
	 * @param settings   the run settings
	 * @param reconciler the reconciler
	 */
	public MergeWeatherStage(MigrationSettings settings, DatasetReconciler reconciler) {
		super(settings, new StageDescriptor(3, "Merge with weather data",
				List.of(settings.enrichedDataFile(), settings.weatherFile()), settings.mergedDataFile()));
		this.reconciler = reconciler;
	}

	@Override
	public List<String> plan() {
		// @formatter:off
		return List.of(
				  "Would read %s".formatted(settings.enrichedDataFile())
				, "Would read %s".formatted(settings.weatherFile())
				, "Would create %s with columns %s".formatted(descriptor().output(), Schema.CANONICAL.header())
			);
		// @formatter:on
	}

	@Override
	public StageOutcome execute(AtomicTableWriter writer) throws IOException {
		final List<String> warnings = new ArrayList<>();
		final Table load = canonicalTable(CsvTables.read(settings.enrichedDataFile()),
				name(settings.enrichedDataFile()), warnings);
		final Table weather = canonicalTable(CsvTables.read(settings.weatherFile()), name(settings.weatherFile()),
				warnings);

		final ReconciliationResult result = reconciler.reconcile(load, weather, Schema.CANONICAL);
		warnings.addAll(result.warnings());

		writer.write(descriptor().output(), result.table());

		int withoutWeather = 0;
		for (String key : load.keys()) {
			if (!weather.containsKey(key)) {
				withoutWeather++;
			}
		}
		int withoutLoad = 0;
		for (String key : weather.keys()) {
			if (!load.containsKey(key)) {
				withoutLoad++;
			}
		}

		// @formatter:off
		return new StageOutcome(result.table().size(), List.of(
				  "Load rows: %d".formatted(load.size())
				, "Weather rows: %d".formatted(weather.size())
				, "Merged rows: %d".formatted(result.table().size())
				, "Rows without weather data: %d".formatted(withoutWeather)
				, "Rows without load data: %d".formatted(withoutLoad)
			), warnings);
		// @formatter:on
	}

}
