package dpdc.tool.domain;

/**
 * Enumeration of pipeline stage execution state.
 */
public enum StageState {

	/** The stage has not been considered yet. */
	Pending,

	/** The stage output already exists, so the stage was not executed. */
	Skipped,

	/** The stage is executing. */
	Running,

	/** The stage finished successfully. */
	Done,

	/** The stage failed, ending the run. */
	Failed,

	;

	/**
	 * Test if this state is terminal and successful.
	 * 
	 * @return {@code true} if the state is {@code Skipped} or {@code Done}
	 */
	public boolean isSuccessful() {
		return this == Skipped || this == Done;
	}

}
