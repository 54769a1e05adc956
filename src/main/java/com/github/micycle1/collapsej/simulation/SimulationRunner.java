package com.github.micycle1.collapsej.simulation;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.github.micycle1.collapsej.collapse.CollapseDetector;
import com.github.micycle1.collapsej.collapse.CollapseDetectors;
import com.github.micycle1.collapsej.collapse.DetectorParams;
import com.github.micycle1.collapsej.entropy.EntropyEvaluator;
import com.github.micycle1.collapsej.entropy.EntropyMetrics;
import com.github.micycle1.collapsej.model.FrameData;
import com.github.micycle1.collapsej.solver.EnergyField;
import com.github.micycle1.collapsej.solver.EnergyRedistributor;
import com.github.micycle1.collapsej.solver.EquilibriumSolution;
import com.github.micycle1.collapsej.solver.EquilibriumSolver;
import com.github.micycle1.collapsej.solver.FailureDetector;
import com.github.micycle1.collapsej.solver.FailureEvent;
import com.github.micycle1.collapsej.solver.StructureCollapsedException;
import com.github.micycle1.collapsej.stiffness.GlobalStiffness;
import com.github.micycle1.collapsej.stiffness.StiffnessAssembler;

/**
 * Drives a progressive collapse analysis: at each step the load factor is
 * raised, the damaged frame is re-solved, at most one overstressed member is
 * removed and its energy handed to its neighbours, and the entropy rate of the
 * surviving members is fed to the collapse detector.
 * <p>
 * The run stops at the first of: a singular stiffness matrix, all members
 * failed, a detector flag, or {@code maxSteps} steps. The caller's frame is not
 * modified; the run works on a copy. A run is deterministic: equal inputs give
 * equal results.
 */
public class SimulationRunner {

	private static final Logger LOGGER = LoggerFactory.getLogger(SimulationRunner.class);

	private final StiffnessAssembler assembler;
	private final FailureDetector failureDetector;
	private final EntropyEvaluator entropyEvaluator;

	public SimulationRunner() {
		this(new StiffnessAssembler(), new FailureDetector(), new EntropyEvaluator());
	}

	public SimulationRunner(StiffnessAssembler assembler, FailureDetector failureDetector, EntropyEvaluator entropyEvaluator) {
		this.assembler = Objects.requireNonNull(assembler);
		this.failureDetector = Objects.requireNonNull(failureDetector);
		this.entropyEvaluator = Objects.requireNonNull(entropyEvaluator);
	}

	/**
	 * Runs with the method named as in configuration files ("zscore" or
	 * "threshold").
	 */
	public SimulationResult run(FrameData frame, String collapseMethod, DetectorParams detectorParams, int maxSteps, double loadStep) {
		SimulationParams params = new SimulationParams().setCollapseMethod(collapseMethod).setDetectorParams(detectorParams)
				.setMaxSteps(maxSteps).setLoadStep(loadStep);
		return run(frame, params);
	}

	public SimulationResult run(FrameData frame, SimulationParams params) {
		Objects.requireNonNull(params).validate();
		return run(frame, params, CollapseDetectors.create(params.getCollapseMethod(), params.getDetectorParams()));
	}

	/**
	 * @param detector fresh detector for this run; it must not have seen any
	 *                 other series
	 */
	public SimulationResult run(FrameData frame, SimulationParams params, CollapseDetector detector) {
		Objects.requireNonNull(frame);
		Objects.requireNonNull(params).validate();
		Objects.requireNonNull(detector);

		FrameData working = frame.copy();
		EquilibriumSolver solver = new EquilibriumSolver(params.getPivotTolerance());
		EnergyRedistributor redistributor = new EnergyRedistributor(params.getDissipation());
		SimulationState state = new SimulationState();
		List<StepRecord> records = new ArrayList<>();

		LOGGER.info("Starting collapse analysis of '{}' ({} nodes, {} members) with {}", working.getName(), working.getNodes().size(),
				working.getMembers().size(), params);

		SimulationOutcome outcome = null;
		for (int step = 0; step < params.getMaxSteps() && outcome == null; step++) {
			double loadFactor = params.loadFactorAt(step);
			state.setLoadFactor(loadFactor);
			state.setActiveMemberIds(working.getActiveMemberIds());

			if (working.allMembersFailed()) {
				LOGGER.info("Step {}: no members remain", step);
				state.markCollapsed(step);
				outcome = SimulationOutcome.collapsed(step, CollapseCause.ALL_MEMBERS_FAILED, loadFactor, Set.of());
				break;
			}

			EquilibriumSolution solution;
			try {
				GlobalStiffness system = assembler.assemble(working, loadFactor);
				solution = solver.solve(system, working);
			} catch (StructureCollapsedException e) {
				LOGGER.info("Step {}: structure collapsed ({})", step, e.getMessage());
				state.markCollapsed(step);
				outcome = SimulationOutcome.singular(step, e);
				break;
			}
			state.addNumericAnomalies(solution.getClampedEnergyCount());

			EnergyField energy = solution.energyField(working);
			List<FailureEvent> failures = failureDetector.evaluate(working, solution, step);
			List<Integer> failedIds = new ArrayList<>(failures.size());
			for (FailureEvent e : failures) {
				failedIds.add(e.getMemberId());
			}
			if (!failedIds.isEmpty()) {
				energy = redistributor.redistribute(energy, failedIds, working);
			}

			Set<Integer> survivors = working.getActiveMemberIds();
			state.setActiveMemberIds(survivors);
			EntropyMetrics metrics = entropyEvaluator.evaluate(energy.restrictTo(survivors), step, state.lastEntropy());
			state.record(energy, metrics, failures);
			records.add(new StepRecord(step, loadFactor, solution.getDisplacements(), energy, metrics, failedIds));
			LOGGER.debug("Step {}: λ={}, S={}, dS/dt={}, Gini={}", step, loadFactor, metrics.getEntropy(), metrics.getEntropyRate(),
					metrics.getGini());

			if (detector.update(step, metrics.getEntropyRate())) {
				state.markCollapsed(step);
				outcome = SimulationOutcome.detected(step, detector.getMethod(), loadFactor, survivors);
			}
		}

		if (outcome == null) {
			int finalStep = params.getMaxSteps() - 1;
			outcome = SimulationOutcome.completed(finalStep, params.loadFactorAt(finalStep), working.getActiveMemberIds());
		}
		SimulationResult result = new SimulationResult(working.getName(), records, outcome, state);
		LOGGER.info("Finished '{}': {} after {} steps, failure sequence {}", working.getName(), outcome, records.size(),
				result.getFailureSequence());
		if (state.getNumericAnomalyCount() > 0) {
			LOGGER.warn("{} negative member energies were clamped to zero during the run", state.getNumericAnomalyCount());
		}
		return result;
	}
}
