package dpdc.tool.pipeline;

/**
 * Exception thrown when a stage cannot produce its output.
 */
public class StageExecutionException extends RuntimeException {

	private static final long serialVersionUID = -2417713409214565925L;

	/**
	 * Constructor.
	 * 
	 * @param message the message
	 */
	public StageExecutionException(String message) {
		super(message);
	}

	/**
	 * Constructor.
	 * 
	 * @param message the message
	 * @param cause   the cause
	 */
	public StageExecutionException(String message, Throwable cause) {
		super(message, cause);
	}

}
