package dpdc.tool.domain;

import java.util.ArrayList;
import java.util.List;

/**
 * The result of a pipeline run.
 * 
 * @param preflight the pre-flight check results
 * @param stages    the stage results, in order; stages never reached are
 *                  reported as {@code Pending}
 * @param dryRun    {@code true} if the run made no changes
 */
public record PipelineRunResult(List<PreflightResult> preflight, List<StageResult> stages, boolean dryRun) {

	/**
	 * Constructor.
	 * 
	 * @param preflight the pre-flight results
	 * @param stages    the stage results
	 * @param dryRun    the dry run mode
	 */
	public PipelineRunResult {
		preflight = (preflight != null ? List.copyOf(preflight) : List.of());
		stages = (stages != null ? List.copyOf(stages) : List.of());
	}

	/**
	 * Test if all pre-flight checks passed.
	 * 
	 * @return {@code true} if every check passed
	 */
	public boolean preflightPassed() {
		return preflight.stream().allMatch(PreflightResult::passed);
	}

	/**
	 * Test if the run succeeded.
	 * 
	 * @return {@code true} if pre-flight passed and every stage was skipped or
	 *         done, or in dry-run mode was planned
	 */
	public boolean isSuccess() {
		return preflightPassed() && stages.stream()
				.allMatch(s -> s.state().isSuccessful() || (dryRun && s.state() == StageState.Pending));
	}

	/**
	 * Get the failed stage, if any.
	 * 
	 * @return the failed stage result, or {@code null}
	 */
	public StageResult failedStage() {
		for (StageResult r : stages) {
			if (r.state() == StageState.Failed) {
				return r;
			}
		}
		return null;
	}

	/**
	 * Get all warnings raised by all stages.
	 * 
	 * @return the warnings
	 */
	public List<String> warnings() {
		var result = new ArrayList<String>();
		for (StageResult r : stages) {
			result.addAll(r.warnings());
		}
		return result;
	}

}
