package com.github.micycle1.collapsej.solver;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.github.micycle1.collapsej.CollapseConstants;
import com.github.micycle1.collapsej.model.FrameData;
import com.github.micycle1.collapsej.model.Member;

/**
 * Combined axial + bending stress check. At most one member fails per step:
 * the one with the highest σ_max/σ_lim above 1, ties going to the lowest member
 * id. This gives a reproducible failure sequence.
 */
public class FailureDetector {

	private static final Logger LOGGER = LoggerFactory.getLogger(FailureDetector.class);

	/**
	 * σ_max = |N|/A + |M_max|·c/I for one member.
	 */
	public static double combinedStress(Member member, MemberResponse response) {
		double axial = Math.abs(response.getAxialForce()) / member.getArea();
		double bending = response.getMaxMoment() * member.getExtremeFiber() / member.getInertia();
		return axial + bending;
	}

	public static double stressRatio(Member member, MemberResponse response) {
		return combinedStress(member, response) / member.getMaterial().getStressLimit();
	}

	/**
	 * Finds the most overstressed active member, deactivates it in {@code frame}
	 * and returns its failure record.
	 *
	 * @param frame    working frame; the failing member's active flag is cleared
	 * @param solution equilibrium state of the current step
	 * @param step     current step index, recorded in the event
	 * @return the newly failed member's event, or an empty list when no member
	 *         exceeds its capacity
	 */
	public List<FailureEvent> evaluate(FrameData frame, EquilibriumSolution solution, int step) {
		Objects.requireNonNull(frame);
		Objects.requireNonNull(solution);

		Member worst = null;
		double worstRatio = 1.0;
		for (Member m : frame.getMembers()) {
			MemberResponse r = solution.getResponse(m.getId());
			if (!m.isActive() || r == null) {
				continue;
			}
			double ratio = stressRatio(m, r);
			if (ratio <= 1.0) {
				continue;
			}
			if (worst == null || exceeds(ratio, worstRatio) || (ties(ratio, worstRatio) && m.getId() < worst.getId())) {
				worst = m;
				worstRatio = ratio;
			}
		}
		if (worst == null) {
			return Collections.emptyList();
		}

		int order = frame.getMembers().size() - frame.getActiveMemberIds().size();
		worst.deactivate(order);
		FailureEvent event = new FailureEvent(worst.getId(), step, worstRatio, solution.getLoadFactor(), order);
		LOGGER.info("Step {}: member {} failed (σ/σlim = {}, λ = {})", step, worst.getId(), String.format("%.4f", worstRatio),
				solution.getLoadFactor());
		List<FailureEvent> events = new ArrayList<>(1);
		events.add(event);
		return events;
	}

	private static boolean exceeds(double a, double b) {
		return a - b > CollapseConstants.STRESS_RATIO_TIE_TOL * Math.max(Math.abs(a), Math.abs(b));
	}

	private static boolean ties(double a, double b) {
		return !exceeds(a, b) && !exceeds(b, a);
	}
}
