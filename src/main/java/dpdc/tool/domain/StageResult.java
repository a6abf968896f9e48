package dpdc.tool.domain;

import java.util.List;

/**
 * The result of running (or not running) a single pipeline stage.
 * 
 * @param descriptor the stage descriptor
 * @param state      the final stage state
 * @param outcome    the transform outcome, or {@code null} if the stage did not
 *                   complete a transform
 * @param plan       the dry-run plan lines, or an empty list
 * @param error      the failure cause, or {@code null}
 */
public record StageResult(StageDescriptor descriptor, StageState state, StageOutcome outcome, List<String> plan,
		Throwable error) {

	/**
	 * Constructor.
	 * 
	 * @param descriptor the descriptor
	 * @param state      the state
	 * @param outcome    the outcome
	 * @param plan       the plan
	 * @param error      the error
	 */
	public StageResult {
		plan = (plan != null ? List.copyOf(plan) : List.of());
	}

	/**
	 * Get the warnings raised by the stage.
	 * 
	 * @return the warnings, never {@code null}
	 */
	public List<String> warnings() {
		return (outcome != null ? outcome.warnings() : List.of());
	}

	/**
	 * Get a message describing the failure.
	 * 
	 * @return the message, or {@code null} if the stage did not fail
	 */
	public String errorMessage() {
		if (error == null) {
			return null;
		}
		String msg = error.getMessage();
		return (msg != null ? msg : error.toString());
	}

}
