package com.github.micycle1.collapsej.solver;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.TreeSet;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.github.micycle1.collapsej.CollapseConstants;
import com.github.micycle1.collapsej.model.FrameData;
import com.github.micycle1.collapsej.model.Member;

/**
 * Phenomenological post-failure energy transfer. It approximates the
 * re-equilibrated energy field without solving equilibrium again.
 * <p>
 * The energy held by a failed member is a source term for the surviving
 * members sharing one of its end nodes, split in proportion to their own
 * current energy. One explicit relaxation step of {@code dU_i/dt = source_i}
 * moves the whole amount (less the dissipated fraction), and the failed member
 * is left at zero. When the failed member has no surviving neighbour, every
 * surviving member receives a share; with no survivors the energy is
 * dissipated.
 */
public class EnergyRedistributor {

	private static final Logger LOGGER = LoggerFactory.getLogger(EnergyRedistributor.class);

	private final double dissipation;
	private double lastDissipated;

	/** Fully conservative redistributor. */
	public EnergyRedistributor() {
		this(0);
	}

	/**
	 * @param dissipation fraction in [0, 1] of each failed member's energy lost at
	 *                    failure
	 */
	public EnergyRedistributor(double dissipation) {
		if (!(dissipation >= 0 && dissipation <= 1)) {
			throw new IllegalArgumentException("dissipation must be in [0, 1], got " + dissipation);
		}
		this.dissipation = dissipation;
	}

	public double getDissipation() {
		return dissipation;
	}

	/**
	 * @return energy removed from the structure by the most recent call
	 */
	public double getLastDissipated() {
		return lastDissipated;
	}

	/**
	 * @param previous       energy field of the step in which the failures occurred
	 * @param newlyFailedIds members that failed in that step
	 * @param frame          working frame; the failed members are already inactive
	 * @return adjusted field over the same members
	 * @throws IllegalStateException if the result does not conserve energy
	 */
	public EnergyField redistribute(EnergyField previous, Collection<Integer> newlyFailedIds, FrameData frame) {
		Objects.requireNonNull(previous);
		Objects.requireNonNull(newlyFailedIds);
		Objects.requireNonNull(frame);

		Map<Integer, Double> energy = new LinkedHashMap<>(previous.asMap());
		Set<Integer> failed = new TreeSet<>(newlyFailedIds);
		Set<Integer> survivors = new LinkedHashSet<>(frame.getActiveMemberIds());
		survivors.removeAll(failed);
		survivors.retainAll(energy.keySet());

		double dissipated = 0;
		for (int id : failed) {
			double released = energy.getOrDefault(id, 0.0);
			energy.put(id, 0.0);
			if (released == 0) {
				continue;
			}
			double lost = released * dissipation;
			double transferable = released - lost;
			dissipated += lost;

			List<Integer> receivers = ids(frame.adjacentMembers(id, survivors));
			if (receivers.isEmpty()) {
				receivers = new ArrayList<>(survivors);
				LOGGER.debug("Member {} has no surviving neighbour; spreading {} J over {} survivors", id, transferable, receivers.size());
			}
			if (receivers.isEmpty()) {
				LOGGER.warn("No surviving member can take the {} J released by member {}; energy dissipated", transferable, id);
				dissipated += transferable;
				continue;
			}
			relax(energy, receivers, transferable);
		}

		EnergyField result = new EnergyField(energy);
		checkConservation(previous.total(), result.total(), dissipated);
		lastDissipated = dissipated;
		return result;
	}

	/**
	 * Single explicit step of dU_i/dt = w_i·Q with unit step length; weights w_i
	 * are the receivers' energy shares, or equal when all receivers are unloaded.
	 */
	private static void relax(Map<Integer, Double> energy, List<Integer> receivers, double source) {
		double pool = 0;
		for (int r : receivers) {
			pool += energy.get(r);
		}
		for (int r : receivers) {
			double w = pool > 0 ? energy.get(r) / pool : 1.0 / receivers.size();
			energy.put(r, energy.get(r) + w * source);
		}
	}

	private static void checkConservation(double before, double after, double dissipated) {
		double expected = before - dissipated;
		if (Math.abs(after - expected) > CollapseConstants.CONSERVATION_TOL * Math.max(1.0, before)) {
			throw new IllegalStateException("Energy not conserved by redistribution: before=" + before + ", after=" + after + ", dissipated="
					+ dissipated);
		}
	}

	private static List<Integer> ids(List<Member> members) {
		List<Integer> ids = new ArrayList<>(members.size());
		for (Member m : members) {
			ids.add(m.getId());
		}
		return ids;
	}
}
