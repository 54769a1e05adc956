package com.github.micycle1.collapsej.simulation;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

import com.github.micycle1.collapsej.solver.FailureEvent;

/**
 * Everything a completed run produced: the per-step records, the ordered
 * failure log and the terminal outcome.
 */
public final class SimulationResult {

	private final String frameName;
	private final List<StepRecord> steps;
	private final List<FailureEvent> failureLog;
	private final SimulationOutcome outcome;
	private final SimulationState state;

	SimulationResult(String frameName, List<StepRecord> steps, SimulationOutcome outcome, SimulationState state) {
		this.frameName = frameName;
		this.steps = List.copyOf(steps);
		this.failureLog = List.copyOf(state.getFailureLog());
		this.outcome = Objects.requireNonNull(outcome);
		this.state = state;
	}

	public String getFrameName() {
		return frameName;
	}

	public List<StepRecord> getSteps() {
		return steps;
	}

	public List<FailureEvent> getFailureLog() {
		return failureLog;
	}

	/**
	 * @return failed member ids in failure order
	 */
	public List<Integer> getFailureSequence() {
		List<Integer> ids = new ArrayList<>(failureLog.size());
		for (FailureEvent e : failureLog) {
			ids.add(e.getMemberId());
		}
		return ids;
	}

	public SimulationOutcome getOutcome() {
		return outcome;
	}

	public SimulationState getState() {
		return state;
	}

	public StepRecord getLastStep() {
		return steps.isEmpty() ? null : steps.get(steps.size() - 1);
	}

	/**
	 * Same trajectory and outcome; state is derived from these and not compared.
	 */
	@Override
	public boolean equals(Object o) {
		if (this == o) {
			return true;
		}
		if (!(o instanceof SimulationResult)) {
			return false;
		}
		SimulationResult other = (SimulationResult) o;
		return frameName.equals(other.frameName) && steps.equals(other.steps) && failureLog.equals(other.failureLog)
				&& outcome.equals(other.outcome);
	}

	@Override
	public int hashCode() {
		return Objects.hash(frameName, steps, failureLog, outcome);
	}

	@Override
	public String toString() {
		return "SimulationResult{" + frameName + ", steps=" + steps.size() + ", failures=" + getFailureSequence() + ", " + outcome + "}";
	}
}
