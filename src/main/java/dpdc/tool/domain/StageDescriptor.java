package dpdc.tool.domain;

import java.nio.file.Path;
import java.util.List;

/**
 * The static description of a pipeline stage.
 * 
 * @param ordinal     the 1-based stage position in the pipeline
 * @param description a human description
 * @param inputs      the artifacts the stage reads
 * @param output      the artifact the stage produces; its existence licenses
 *                    skipping the stage
 */
public record StageDescriptor(int ordinal, String description, List<Path> inputs, Path output) {

	/**
	 * Constructor.
	 * 
	 * @param ordinal     the stage ordinal
	 * @param description the description
	 * @param inputs      the inputs
	 * @param output      the output
	 */
	public StageDescriptor {
		inputs = (inputs != null ? List.copyOf(inputs) : List.of());
		if (output == null) {
			throw new IllegalArgumentException("The output argument must not be null.");
		}
	}

	/**
	 * Get a display label, like {@code Stage 2 (Enrich with holiday information)}.
	 * 
	 * @return the label
	 */
	public String label() {
		return "Stage %d (%s)".formatted(ordinal, description);
	}

}
