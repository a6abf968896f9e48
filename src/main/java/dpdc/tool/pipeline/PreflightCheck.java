package dpdc.tool.pipeline;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import dpdc.tool.domain.PreflightResult;
import dpdc.tool.support.LoadWorkbookReader;

/**
 * API for verifying an externally supplied pipeline input before any stage
 * runs.
 */
@FunctionalInterface
public interface PreflightCheck {

	/**
	 * Perform the check.
	 * 
	 * @return the result
	 */
	PreflightResult check();

	/**
	 * Create a check that a regular file exists.
	 * 
	 * @param description the input description
	 * @param path        the file path
	 * @param hint        a remedy hint for when the file is missing, or
	 *                    {@code null}
	 * @return the check
	 */
	static PreflightCheck requiredFile(String description, Path path, String hint) {
		return () -> {
			if (Files.isRegularFile(path)) {
				return PreflightResult.ok(description, path.toString());
			}
			return PreflightResult.fail(description, "not found: " + path, hint);
		};
	}

	/**
	 * Create a check that a directory exists and contains at least one load
	 * workbook.
	 * 
	 * @param description      the input description
	 * @param dir              the directory path
	 * @param excludedFragment the excluded workbook name fragment
	 * @return the check
	 */
	static PreflightCheck requiredWorkbookDirectory(String description, Path dir, String excludedFragment) {
		return () -> {
			if (!Files.isDirectory(dir)) {
				return PreflightResult.fail(description, "not found: " + dir, null);
			}
			try {
				int count = LoadWorkbookReader.listWorkbooks(dir, excludedFragment).size();
				if (count < 1) {
					return PreflightResult.fail(description,
							"contains no %s files: %s".formatted(LoadWorkbookReader.WORKBOOK_EXTENSION, dir), null);
				}
				return PreflightResult.ok(description, "%s (%d files)".formatted(dir, count));
			} catch (IOException e) {
				return PreflightResult.fail(description, "cannot list %s: %s".formatted(dir, e.getMessage()), null);
			}
		};
	}

}
