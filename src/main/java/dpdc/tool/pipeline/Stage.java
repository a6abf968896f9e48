package dpdc.tool.pipeline;

import java.io.IOException;
import java.util.List;

import dpdc.tool.domain.StageDescriptor;
import dpdc.tool.domain.StageOutcome;
import dpdc.tool.support.AtomicTableWriter;

/**
 * API for a pipeline stage: a transform that produces one output artifact.
 * 
 * <p>
 * Stages hold no state between runs. A stage whose output artifact already
 * exists is considered complete and may be skipped.
 * </p>
 */
public interface Stage {

	/**
	 * Get the stage descriptor.
	 * 
	 * @return the descriptor
	 */
	StageDescriptor descriptor();

	/**
	 * Describe what the stage would do, without reading input content or making
	 * any changes.
	 * 
	 * @return the plan lines
	 */
	List<String> plan();

	/**
	 * Execute the stage transform.
	 * 
	 * @param writer the writer to persist the output with
	 * @return the outcome
	 * @throws IOException             if any IO error occurs
	 * @throws StageExecutionException if the stage cannot produce its output
	 */
	StageOutcome execute(AtomicTableWriter writer) throws IOException;

}
