package dpdc.tool.domain;

import java.util.List;
import java.util.Map;
import java.util.SortedSet;

/**
 * The result of reconciling two keyed tables into a canonical schema.
 * 
 * @param table          the reconciled table
 * @param columnSources  the resolved source of each canonical column, in
 *                       canonical order
 * @param missingColumns canonical columns neither source declares
 * @param extraColumns   source columns not in the canonical schema (dropped)
 * @param warnings       the schema drift warnings
 */
public record ReconciliationResult(Table table, Map<String, ColumnSource> columnSources,
		SortedSet<String> missingColumns, SortedSet<String> extraColumns, List<String> warnings) {

	/**
	 * Test if the source schemas exactly cover the canonical schema.
	 * 
	 * @return {@code true} if no columns are missing or extra
	 */
	public boolean hasSchemaDrift() {
		return !(missingColumns.isEmpty() && extraColumns.isEmpty());
	}

}
