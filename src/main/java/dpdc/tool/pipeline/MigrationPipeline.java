package dpdc.tool.pipeline;

import java.util.List;

import dpdc.tool.config.MigrationSettings;
import dpdc.tool.reconcile.DatasetReconciler;

/**
 * The load data migration pipeline definition.
 */
public final class MigrationPipeline {

	private MigrationPipeline() {
		// not available
	}

	/**
	 * Get the pre-flight checks of the externally supplied inputs.
	 *
	 * @param settings the run settings
	 * @return the checks
	 */
	public static List<PreflightCheck> preflightChecks(MigrationSettings settings) {
		// @formatter:off
		return List.of(
				  PreflightCheck.requiredWorkbookDirectory("Load workbooks", settings.workbookDir(),
						settings.excludedWorkbookFragment())
				, PreflightCheck.requiredFile("Holiday list", settings.holidayFile(), null)
				, PreflightCheck.requiredFile("Weather data", settings.weatherFile(),
						"Run the fetch-weather command first to download weather data.")
			);
		// @formatter:on
	}

	/**
	 * Get the pipeline stages, in execution order.
	 *
	 * @param settings   the run settings
	 * @param reconciler the reconciler
	 * @return the stages
	 */
	public static List<Stage> stages(MigrationSettings settings, DatasetReconciler reconciler) {
		// @formatter:off
		return List.of(
				  new MergeLoadWorkbooksStage(settings)
				, new EnrichHolidaysStage(settings)
				, new MergeWeatherStage(settings, reconciler)
				, new FinalizeOutputStage(settings)
			);
		// @formatter:on
	}

}
