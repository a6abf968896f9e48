package dpdc.tool.pipeline;

import static dpdc.tool.domain.StageState.Done;
import static dpdc.tool.domain.StageState.Failed;
import static dpdc.tool.domain.StageState.Pending;
import static dpdc.tool.domain.StageState.Running;
import static dpdc.tool.domain.StageState.Skipped;

import java.io.IOException;
import java.nio.file.Files;
import java.util.ArrayList;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import dpdc.tool.domain.PipelineRunResult;
import dpdc.tool.domain.PreflightResult;
import dpdc.tool.domain.StageDescriptor;
import dpdc.tool.domain.StageOutcome;
import dpdc.tool.domain.StageResult;
import dpdc.tool.domain.StageState;
import dpdc.tool.support.AtomicTableWriter;

/**
 * Run an ordered list of stages, one at a time.
 *
 * <p>
 * Every pre-flight check runs first; if any fails no stage runs. Each stage is
 * then skipped if its output already exists (unless forced), otherwise
 * executed. The first failing stage ends the run; outputs committed by earlier
 * stages are left in place. In dry-run mode no stage is executed: each stage
 * that would run stays pending and reports its plan instead.
 * </p>
 */
public class PipelineOrchestrator {

	private static final Logger log = LoggerFactory.getLogger(PipelineOrchestrator.class);

	private final AtomicTableWriter writer;

	/**
	 * Constructor.
	 *
	 * @param writer the writer stages persist their output with
	 */
	public PipelineOrchestrator(AtomicTableWriter writer) {
		super();
		this.writer = writer;
	}

	/**
	 * Run a pipeline.
	 *
	 * @param checks the pre-flight checks
	 * @param stages the stages, in execution order
	 * @param dryRun {@code true} to only report what would be done
	 * @param force  {@code true} to execute stages whose output already exists
	 * @return the result
	 */
	public PipelineRunResult run(List<PreflightCheck> checks, List<Stage> stages, boolean dryRun, boolean force) {
		final List<PreflightResult> preflight = new ArrayList<>(checks.size());
		for (PreflightCheck check : checks) {
			PreflightResult r = check.check();
			if (r.passed()) {
				log.info("[OK] {}: {}", r.description(), r.message());
			} else {
				log.error("[FAIL] {}: {}", r.description(), r.message());
				if (r.hint() != null) {
					log.error("       {}", r.hint());
				}
			}
			preflight.add(r);
		}

		final List<StageResult> results = new ArrayList<>(stages.size());
		if (!preflight.stream().allMatch(PreflightResult::passed)) {
			log.error("Pre-flight checks failed. Aborting.");
			for (Stage stage : stages) {
				results.add(new StageResult(stage.descriptor(), Pending, null, null, null));
			}
			return new PipelineRunResult(preflight, results, dryRun);
		}

		boolean failed = false;
		for (Stage stage : stages) {
			final StageDescriptor desc = stage.descriptor();
			if (failed) {
				results.add(new StageResult(desc, Pending, null, null, null));
				continue;
			}
			log.info("STEP {}/{}: {}", desc.ordinal(), stages.size(), desc.description());
			StageResult result = runStage(stage, dryRun, force);
			results.add(result);
			if (result.state() == Failed) {
				log.error("{} failed: {}. Aborting pipeline.", desc.label(), result.errorMessage());
				failed = true;
			}
		}
		return new PipelineRunResult(preflight, results, dryRun);
	}

	private StageResult runStage(Stage stage, boolean dryRun, boolean force) {
		final StageDescriptor desc = stage.descriptor();
		if (!force && Files.exists(desc.output())) {
			log.info("Output file {} already exists. Skipping step. (use --force to rebuild)", desc.output());
			return new StageResult(desc, Skipped, null, null, null);
		}
		if (dryRun) {
			List<String> plan = stage.plan();
			for (String line : plan) {
				log.info("[DRY RUN] {}", line);
			}
			return new StageResult(desc, Pending, null, plan, null);
		}
		StageState state = Running;
		log.debug("{} is {}", desc.label(), state);
		try {
			StageOutcome outcome = stage.execute(writer);
			for (String line : outcome.details()) {
				log.info("  {}", line);
			}
			for (String warning : outcome.warnings()) {
				log.warn(warning);
			}
			state = Done;
			return new StageResult(desc, state, outcome, null, null);
		} catch (IOException | RuntimeException e) {
			log.debug("{} exception", desc.label(), e);
			return new StageResult(desc, Failed, null, null, e);
		}
	}

}
