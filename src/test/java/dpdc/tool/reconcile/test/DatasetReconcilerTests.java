package dpdc.tool.reconcile.test;

import static org.assertj.core.api.BDDAssertions.then;

import java.util.List;
import java.util.Map.Entry;

import org.junit.jupiter.api.Test;

import dpdc.tool.domain.ColumnSource;
import dpdc.tool.domain.KeyedRow;
import dpdc.tool.domain.ReconciliationResult;
import dpdc.tool.domain.Row;
import dpdc.tool.domain.Schema;
import dpdc.tool.domain.Table;
import dpdc.tool.reconcile.DatasetReconciler;

/**
 * Test cases for the {@link DatasetReconciler} class.
 */
public class DatasetReconcilerTests {

	private static final String T1 = "2024-01-01 00:00:00+06:00";
	private static final String T2 = "2024-01-01 01:00:00+06:00";
	private static final String T3 = "2024-01-01 02:00:00+06:00";

	private final DatasetReconciler reconciler = new DatasetReconciler();

	private static Table primary() {
		Schema schema = Schema.of("load", "is_holiday", "holiday_type", "national_event_type", "forecasted_load",
				"extra_p");
		// @formatter:off
		return Table.fromRecords(schema, List.of(
				  new KeyedRow(T3, List.of("103", "0", "0", "0", "113", "x"))
				, new KeyedRow(T1, List.of("101", "1", "2", "0", "111", "x"))
			));
		// @formatter:on
	}

	private static Table secondary() {
		Schema schema = Schema.of("temp", "dwpt", "rhum", "prcp", "wdir", "wspd", "pres", "load", "junk");
		// @formatter:off
		return Table.fromRecords(schema, List.of(
				  new KeyedRow(T2, List.of("22", "10", "80", "0", "180", "5", "1010", "999", "j"))
				, new KeyedRow(T3, List.of("23", "11", "81", "0", "190", "6", "1011", "999", "j"))
			));
		// @formatter:on
	}

	@Test
	public void reconcile_totality() {
		// WHEN
		ReconciliationResult result = reconciler.reconcile(primary(), secondary(), Schema.CANONICAL);

		// THEN
		then(result.table().schema()).isEqualTo(Schema.CANONICAL);
		then(result.table().keys()).as("Key union in sorted order").containsExactly(T1, T2, T3);
		for (Entry<String, Row> e : result.table().entries()) {
			then(e.getValue().values()).as("Every row has the canonical arity").hasSize(Schema.CANONICAL.size());
		}
	}

	@Test
	public void reconcile_precedence() {
		// WHEN
		ReconciliationResult result = reconciler.reconcile(primary(), secondary(), Schema.CANONICAL);

		// THEN
		then(result.columnSources()).containsEntry("load", ColumnSource.Primary)
				.containsEntry("temp", ColumnSource.Secondary).containsEntry("coco", ColumnSource.Unresolved);
		then(result.table().get(T2).get("load")).as("Primary column without primary row is empty, not secondary")
				.isEqualTo(Row.SENTINEL);
		then(result.table().get(T3).get("load")).isEqualTo("103");
		then(result.table().get(T3).get("temp")).isEqualTo("23");
		then(result.table().get(T1).get("temp")).as("Secondary column without secondary row").isEqualTo("");
	}

	@Test
	public void reconcile_schemaDrift() {
		// WHEN
		ReconciliationResult result = reconciler.reconcile(primary(), secondary(), Schema.CANONICAL);

		// THEN
		then(result.missingColumns()).containsExactly("coco");
		then(result.extraColumns()).containsExactly("extra_p", "junk");
		then(result.hasSchemaDrift()).isTrue();
		then(result.warnings()).containsExactly("Missing expected columns: coco", "Extra columns dropped: extra_p, junk");
		for (Entry<String, Row> e : result.table().entries()) {
			then(e.getValue().get("coco")).as("Unresolved column is empty").isEqualTo(Row.SENTINEL);
		}
	}

	@Test
	public void reconcile_rowValues() {
		// WHEN
		ReconciliationResult result = reconciler.reconcile(primary(), secondary(), Schema.CANONICAL);

		// THEN
		then(result.table().get(T3).values()).containsExactly("103", "0", "0", "0", "23", "11", "81", "0", "190", "6",
				"1011", "", "113");
	}

	@Test
	public void reconcile_empty() {
		// WHEN
		ReconciliationResult result = reconciler.reconcile(new Table(Schema.of("load")),
				new Table(Schema.of("temp")), Schema.CANONICAL);

		// THEN
		then(result.table().isEmpty()).isTrue();
		then(result.missingColumns()).hasSize(Schema.CANONICAL.size() - 2);
	}

}
