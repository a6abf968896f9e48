package dpdc.tool.domain;

/**
 * Enumeration of where a reconciled column takes its values from.
 */
public enum ColumnSource {

	/** The primary source declares the column. */
	Primary,

	/** Only the secondary source declares the column. */
	Secondary,

	/** Neither source declares the column. */
	Unresolved,

	;

}
