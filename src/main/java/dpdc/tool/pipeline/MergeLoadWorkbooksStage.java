package dpdc.tool.pipeline;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import dpdc.tool.config.MigrationSettings;
import dpdc.tool.domain.KeyedRow;
import dpdc.tool.domain.SourceReadResult;
import dpdc.tool.domain.StageDescriptor;
import dpdc.tool.domain.StageOutcome;
import dpdc.tool.domain.Table;
import dpdc.tool.support.AtomicTableWriter;
import dpdc.tool.support.LoadWorkbookReader;

/**
 * Merge the hourly load workbooks into one table.
 */
public class MergeLoadWorkbooksStage extends AbstractStage {

	private static final Logger log = LoggerFactory.getLogger(MergeLoadWorkbooksStage.class);

	private static final int PROGRESS_INTERVAL = 50;

	/**
	 * Constructor.
	 *
	 * @param settings the run settings
	 */
	public MergeLoadWorkbooksStage(MigrationSettings settings) {
		super(settings, new StageDescriptor(1, "Merge load workbooks", List.of(settings.workbookDir()),
				settings.masterDataFile()));
	}

	@Override
	public List<String> plan() {
		final Path dir = settings.workbookDir();
		final List<String> plan = new ArrayList<>(2);
		try {
			int count = LoadWorkbookReader.listWorkbooks(dir, settings.excludedWorkbookFragment()).size();
			plan.add("Would process %d workbooks from %s".formatted(count, dir));
		} catch (IOException e) {
			plan.add("Would process workbooks from %s (cannot list: %s)".formatted(dir, e.getMessage()));
		}
		plan.add("Would create %s".formatted(descriptor().output()));
		return plan;
	}

	@Override
	public StageOutcome execute(AtomicTableWriter writer) throws IOException {
		final Path dir = settings.workbookDir();
		final List<Path> workbooks = LoadWorkbookReader.listWorkbooks(dir, settings.excludedWorkbookFragment());
		if (workbooks.isEmpty()) {
			throw new StageExecutionException("No %s files found in %s".formatted(LoadWorkbookReader.WORKBOOK_EXTENSION,
					dir));
		}
		log.info("Found {} workbooks in {}", workbooks.size(), dir);

		final LoadWorkbookReader reader = new LoadWorkbookReader(settings.zoneOffset(), settings.gridStep());
		final List<KeyedRow> rows = new ArrayList<>();
		final List<String> warnings = new ArrayList<>();
		int filtered = 0;
		for (int i = 0, len = workbooks.size(); i < len; i++) {
			SourceReadResult r = reader.read(workbooks.get(i));
			rows.addAll(r.rows());
			warnings.addAll(r.warnings());
			filtered += r.filtered();
			if ((i + 1) % PROGRESS_INTERVAL == 0) {
				log.info("Processed {}/{} workbooks", i + 1, len);
			}
		}
		if (rows.isEmpty()) {
			throw new StageExecutionException("No data extracted from %d workbooks".formatted(workbooks.size()));
		}

		rows.sort(Comparator.comparing(KeyedRow::key));
		final Table table = Table.fromRecords(LoadWorkbookReader.LOAD_SCHEMA, rows);
		final int dropped = rows.size() - table.size();
		if (dropped > 0) {
			log.info("Dropped {} duplicate timestamps", dropped);
		}

		writer.write(descriptor().output(), table);

		// @formatter:off
		return new StageOutcome(table.size(), List.of(
				  "Workbooks read: %d".formatted(workbooks.size())
				, "Total rows: %d".formatted(table.size())
				, "Date range: %s to %s".formatted(rows.get(0).key(), rows.get(rows.size() - 1).key())
				, "Duplicate timestamps dropped: %d".formatted(dropped)
				, "Off-grid rows filtered: %d".formatted(filtered)
			), warnings);
		// @formatter:on
	}

}
