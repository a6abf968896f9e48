package dpdc.tool.reconcile;

import static java.util.stream.Collectors.joining;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.SortedSet;
import java.util.TreeSet;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import dpdc.tool.domain.ColumnSource;
import dpdc.tool.domain.ReconciliationResult;
import dpdc.tool.domain.Row;
import dpdc.tool.domain.Schema;
import dpdc.tool.domain.Table;

/**
 * Merge two independently keyed tables into one table with a canonical
 * schema.
 *
 * <p>
 * The output holds one row for every key present in either source, sorted by
 * key. Each canonical column takes its values from the primary source when the
 * primary schema declares it, otherwise from the secondary source when that
 * declares it. A source without a row for a key, or a column neither source
 * declares, produces {@link Row#SENTINEL} values. Source columns outside the
 * canonical schema are dropped. Missing and extra columns are reported as
 * warnings and never stop the merge.
 * </p>
 */
public class DatasetReconciler {

	private static final Logger log = LoggerFactory.getLogger(DatasetReconciler.class);

	/**
	 * Reconcile two tables.
	 *
	 * @param primary   the primary source, whose columns take precedence
	 * @param secondary the secondary source
	 * @param canonical the output schema
	 * @return the result
	 */
	public ReconciliationResult reconcile(Table primary, Table secondary, Schema canonical) {
		final Map<String, ColumnSource> sources = resolveSources(primary.schema(), secondary.schema(), canonical);

		final SortedSet<String> missing = new TreeSet<>();
		final SortedSet<String> extra = new TreeSet<>();
		for (String col : canonical.columns()) {
			if (sources.get(col) == ColumnSource.Unresolved) {
				missing.add(col);
			}
		}
		for (Schema s : List.of(primary.schema(), secondary.schema())) {
			for (String col : s.columns()) {
				if (!canonical.contains(col)) {
					extra.add(col);
				}
			}
		}

		final List<String> warnings = new ArrayList<>(2);
		if (!missing.isEmpty()) {
			warnings.add("Missing expected columns: " + missing.stream().collect(joining(", ")));
		}
		if (!extra.isEmpty()) {
			warnings.add("Extra columns dropped: " + extra.stream().collect(joining(", ")));
		}
		for (String w : warnings) {
			log.warn(w);
		}

		final SortedSet<String> keys = new TreeSet<>(primary.keys());
		keys.addAll(secondary.keys());

		final Table result = new Table(canonical);
		for (String key : keys) {
			final Row p = primary.get(key);
			final Row s = secondary.get(key);
			final List<String> values = new ArrayList<>(canonical.size());
			for (String col : canonical.columns()) {
				final ColumnSource src = sources.get(col);
				if (src == ColumnSource.Primary) {
					values.add(valueOf(p, col));
				} else if (src == ColumnSource.Secondary) {
					values.add(valueOf(s, col));
				} else {
					values.add(Row.SENTINEL);
				}
			}
			result.putIfAbsent(key, new Row(canonical, values));
		}

		log.info("Reconciled {} primary and {} secondary rows into {} rows", primary.size(), secondary.size(),
				result.size());
		return new ReconciliationResult(result, Collections.unmodifiableMap(sources),
				Collections.unmodifiableSortedSet(missing), Collections.unmodifiableSortedSet(extra),
				List.copyOf(warnings));
	}

	/**
	 * Resolve the source of every canonical column.
	 *
	 * @param primary   the primary schema
	 * @param secondary the secondary schema
	 * @param canonical the canonical schema
	 * @return the source of each canonical column, in canonical order
	 */
	public static Map<String, ColumnSource> resolveSources(Schema primary, Schema secondary, Schema canonical) {
		final Map<String, ColumnSource> result = new LinkedHashMap<>(canonical.size());
		for (String col : canonical.columns()) {
			final ColumnSource src;
			if (primary.contains(col)) {
				src = ColumnSource.Primary;
			} else if (secondary.contains(col)) {
				src = ColumnSource.Secondary;
			} else {
				src = ColumnSource.Unresolved;
			}
			result.put(col, src);
		}
		return result;
	}

	private static String valueOf(Row row, String column) {
		return (row != null ? row.get(column) : Row.SENTINEL);
	}

}
