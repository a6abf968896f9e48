package dpdc.tool.domain;

import java.util.List;

/**
 * A key that occurs more than once in a raw record stream.
 * 
 * @param key        the key
 * @param rowIndexes the 0-based data row indexes of every occurrence
 */
public record DuplicateKey(String key, List<Integer> rowIndexes) implements Comparable<DuplicateKey> {

	/**
	 * Get the number of occurrences.
	 * 
	 * @return the occurrence count
	 */
	public int occurrences() {
		return rowIndexes.size();
	}

	@Override
	public int compareTo(DuplicateKey o) {
		return key.compareTo(o.key);
	}

}
