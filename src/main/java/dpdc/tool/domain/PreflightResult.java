package dpdc.tool.domain;

/**
 * The result of a single pre-flight input check.
 * 
 * @param description the checked input description
 * @param passed      {@code true} if the input is available
 * @param message     a detail message
 * @param hint        an optional remedy hint for failures
 */
public record PreflightResult(String description, boolean passed, String message, String hint) {

	/**
	 * Create a passed result.
	 * 
	 * @param description the input description
	 * @param message     the detail message
	 * @return the result
	 */
	public static PreflightResult ok(String description, String message) {
		return new PreflightResult(description, true, message, null);
	}

	/**
	 * Create a failed result.
	 * 
	 * @param description the input description
	 * @param message     the detail message
	 * @param hint        the remedy hint, or {@code null}
	 * @return the result
	 */
	public static PreflightResult fail(String description, String message, String hint) {
		return new PreflightResult(description, false, message, hint);
	}

}
