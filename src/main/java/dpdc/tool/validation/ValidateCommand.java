package dpdc.tool.validation;

import static java.util.stream.Collectors.joining;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;

import org.springframework.stereotype.Component;

import dpdc.tool.config.ToolProperties;
import dpdc.tool.domain.DuplicateKey;
import dpdc.tool.domain.TimeSeriesValidationReport;
import dpdc.tool.support.AtomicTableWriter;
import dpdc.tool.support.CsvTables;
import dpdc.tool.support.Timestamps;
import dpdc.tool.support.Verbosity;
import picocli.CommandLine.Command;
import picocli.CommandLine.Help.Ansi;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

/**
 * Validate the temporal integrity of a keyed table file.
 */
@Component
@Command(name = "validate", description = "Check a table file for duplicate, missing and unexpected timestamps.")
public class ValidateCommand implements Callable<Integer> {

	/** The report file header. */
	public static final List<String> REPORT_HEADER = List.of("Type", "Timestamp", "Occurrences", "Rows");

	@Option(names = { "-v", "--verbose" }, description = "verbose output")
	boolean[] verbosity;

	@Option(names = { "-h", "--help" }, usageHelp = true, description = "display this help message")
	boolean usageHelpRequested;

	@Parameters(index = "0", description = "the CSV file to validate, with the timestamp in the first column")
	Path file;

	@Option(names = { "-g", "--grid-step" }, description = "the expected spacing between timestamps, e.g. PT1H")
	Duration gridStep;

	@Option(names = { "-s", "--start" }, description = "the first expected timestamp")
	String start;

	@Option(names = { "-e", "--end" }, description = "the last expected timestamp")
	String end;

	@Option(names = { "--align-to-midnight" }, description = "anchor the expected grid at local midnight")
	boolean alignToMidnight;

	@Option(names = { "-m",
			"--max-listed" }, description = "maximum number of timestamps to list per issue type, or 0 for unlimited", defaultValue = "50")
	int maxListed = 50;

	@Option(names = { "-r", "--report-file" }, description = "path to write CSV report data")
	Path reportFile;

	private final ToolProperties properties;
	private final AtomicTableWriter writer;

	/**
	 * Constructor.
	 *
	 * @param properties the tool properties
	 * @param writer     the writer to save reports with
	 */
	public ValidateCommand(ToolProperties properties, AtomicTableWriter writer) {
		super();
		this.properties = properties;
		this.writer = writer;
	}

	@Override
	public Integer call() throws Exception {
		Verbosity.apply(verbosity);
		final ZoneOffset offset = properties.offset();
		final TimeSeriesValidationReport report;
		try {
			final OffsetDateTime startDate = (start != null ? Timestamps.parseKey(start, offset) : null);
			final OffsetDateTime endDate = (end != null ? Timestamps.parseKey(end, offset) : null);
			final List<String> keys = CsvTables.readKeys(file);
			final TimeSeriesValidator validator = new TimeSeriesValidator(
					gridStep != null ? gridStep : properties.gridStep(), offset, alignToMidnight);
			report = validator.validate(keys, startDate, endDate);
		} catch (IOException e) {
			System.out.println(Ansi.AUTO.string("@|red Error reading|@ %s: %s".formatted(file, e.getMessage())));
			return 1;
		} catch (DateTimeParseException | IllegalArgumentException e) {
			System.out.println(Ansi.AUTO.string("@|red Invalid argument:|@ %s".formatted(e.getMessage())));
			return 1;
		}

		printReport(report, offset);

		if (reportFile != null) {
			writer.write(reportFile, REPORT_HEADER, reportRows(report));
			System.out.println("Report written to " + reportFile);
		}

		if (report.passed()) {
			System.out.println(Ansi.AUTO.string("@|green Validation passed|@"));
			return 0;
		}
		System.out.println(Ansi.AUTO.string("@|red Validation failed|@"));
		return 1;
	}

	private void printReport(TimeSeriesValidationReport report, ZoneOffset offset) throws IOException {
		// @formatter:off
		System.out.print(Ansi.AUTO.string("""
				@|bold File:|@       %s (%,d bytes)
				@|bold Rows:|@       %d
				@|bold Grid step:|@  %s
				""".formatted(
						  file
						, Files.size(file)
						, report.totalRows()
						, report.gridStep()
					)
				));
		if (report.range() != null) {
			System.out.print(Ansi.AUTO.string("""
					@|bold Range:|@      %s - %s (%d expected)
					""".formatted(
							  Timestamps.key(report.range().getStart().atOffset(offset))
							, Timestamps.key(report.range().getEnd().atOffset(offset))
							, report.expectedCount()
						)
					));
		}
		// @formatter:on

		printIssue("Duplicate timestamps", report.duplicateCount(), report.duplicates().stream()
				.map(d -> "%s (%d occurrences, rows %s)".formatted(d.key(), d.occurrences(),
						d.rowIndexes().stream().map(String::valueOf).collect(joining(", "))))
				.toList(), true);
		printIssue("Missing timestamps", report.missingCount(), report.missing(), true);
		printIssue("Off-grid timestamps", report.extraCount(), report.extra(), false);
		printIssue("Out of range timestamps", report.outOfRangeCount(), report.outOfRange(), false);
		printIssue("Unparseable timestamps", report.unparseable().size(), report.unparseable(),
				!report.hasValidKeys());
	}

	private void printIssue(String title, int count, List<String> items, boolean failing) {
		if (count < 1) {
			if (failing) {
				System.out.println(Ansi.AUTO.string("%s: @|green 0|@".formatted(title)));
			}
			return;
		}
		System.out.println(Ansi.AUTO.string("%s: @|%s %d|@".formatted(title, failing ? "red" : "yellow", count)));
		final int max = (maxListed > 0 ? Math.min(maxListed, items.size()) : items.size());
		for (int i = 0; i < max; i++) {
			System.out.println("  " + items.get(i));
		}
		if (max < items.size()) {
			System.out.println("  ... and %d more".formatted(items.size() - max));
		}
	}

	/**
	 * Get the report rows of every issue in a validation report.
	 *
	 * @param report the report
	 * @return the rows, matching {@link #REPORT_HEADER}
	 */
	public static List<List<String>> reportRows(TimeSeriesValidationReport report) {
		final List<List<String>> rows = new ArrayList<>();
		for (DuplicateKey d : report.duplicates()) {
			rows.add(List.of("Duplicate", d.key(), String.valueOf(d.occurrences()),
					d.rowIndexes().stream().map(String::valueOf).collect(joining(" "))));
		}
		for (String key : report.missing()) {
			rows.add(List.of("Missing", key, "0", ""));
		}
		for (String key : report.extra()) {
			rows.add(List.of("OffGrid", key, "", ""));
		}
		for (String key : report.outOfRange()) {
			rows.add(List.of("OutOfRange", key, "", ""));
		}
		for (String key : report.unparseable()) {
			rows.add(List.of("Unparseable", key, "", ""));
		}
		return rows;
	}

}
