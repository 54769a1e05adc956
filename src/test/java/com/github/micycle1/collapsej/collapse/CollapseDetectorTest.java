package com.github.micycle1.collapsej.collapse;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.OptionalInt;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import com.github.micycle1.collapsej.model.ConfigurationException;

class CollapseDetectorTest {

	@Nested
	@DisplayName("Z-score detector")
	class ZScore {

		@Test
		void testSteadyDecayThenSpike_FlagsAtSpike() {
			CollapseDetector detector = new ZScoreCollapseDetector(new DetectorParams());
			for (int step = 0; step < 10; step++) {
				double rate = -0.01 + (step % 2 == 0 ? 1e-4 : -1e-4);
				assertFalse(detector.update(step, rate), "No flag expected at step " + step);
			}
			assertTrue(detector.update(10, -5.0));
			assertEquals(OptionalInt.of(10), detector.getCollapseStep());
		}

		@Test
		void testNoFlagBeforeWindowFull() {
			CollapseDetector detector = new ZScoreCollapseDetector(5, 3, 1e-9);
			for (int step = 0; step < 4; step++) {
				assertFalse(detector.update(step, 0));
			}
			assertFalse(detector.update(4, -100), "Window of 5 previous values is not yet full");
			assertFalse(detector.isCollapsed());
			assertTrue(detector.update(5, -1000));
		}

		@Test
		void testConstantSeries_NeverFlags() {
			CollapseDetector detector = new ZScoreCollapseDetector(new DetectorParams());
			for (int step = 0; step < 50; step++) {
				assertFalse(detector.update(step, -0.02));
			}
			assertEquals(OptionalInt.empty(), detector.getCollapseStep());
		}

		@Test
		void testPositiveSpike_NotACollapse() {
			CollapseDetector detector = new ZScoreCollapseDetector(new DetectorParams().setWindowSize(3));
			detector.update(0, 0);
			detector.update(1, 0.01);
			detector.update(2, -0.01);
			assertFalse(detector.update(3, 10));
		}

		@Test
		void testInvalidParameters() {
			assertThrows(ConfigurationException.class, () -> new ZScoreCollapseDetector(1, 3, 1e-9));
			assertThrows(ConfigurationException.class, () -> new ZScoreCollapseDetector(10, 0, 1e-9));
			assertThrows(ConfigurationException.class, () -> new ZScoreCollapseDetector(10, 3, -1));
		}
	}

	@Nested
	@DisplayName("Threshold detector")
	class Threshold {

		@Test
		void testFlagsBelowNegativeThreshold() {
			CollapseDetector detector = new ThresholdCollapseDetector(0.5);
			assertFalse(detector.update(0, -0.4));
			assertFalse(detector.update(1, -0.5), "Boundary value is not below the threshold");
			assertTrue(detector.update(2, -0.6));
			assertEquals(OptionalInt.of(2), detector.getCollapseStep());
		}

		@Test
		void testIsTerminal() {
			CollapseDetector detector = new ThresholdCollapseDetector(0.5);
			assertTrue(detector.update(0, -1));
			assertTrue(detector.update(1, 0.3), "Detection never re-arms");
			assertEquals(OptionalInt.of(0), detector.getCollapseStep());
		}

		@Test
		void testNegativeThresholdRejected() {
			assertThrows(ConfigurationException.class, () -> new ThresholdCollapseDetector(-0.1));
		}
	}

	@Test
	void testUpdate_RejectsNonIncreasingStepsAndNonFiniteRates() {
		CollapseDetector detector = new ThresholdCollapseDetector(0.5);
		detector.update(3, 0);
		assertThrows(IllegalArgumentException.class, () -> detector.update(3, 0));
		assertThrows(IllegalArgumentException.class, () -> detector.update(4, Double.NaN));
	}

	@Test
	void testFactory_ByName() {
		assertInstanceOf(ZScoreCollapseDetector.class, CollapseDetectors.create("zscore", new DetectorParams()));
		CollapseDetector threshold = CollapseDetectors.create(" Threshold ", new DetectorParams().setThreshold(0.2));
		assertEquals(CollapseMethod.THRESHOLD, threshold.getMethod());
		assertEquals(0.2, ((ThresholdCollapseDetector) threshold).getThreshold(), 0.0);
	}

	@Test
	void testFactory_UnknownMethodHasNoFallback() {
		ConfigurationException e = assertThrows(ConfigurationException.class, () -> CollapseDetectors.create("lyapunov", new DetectorParams()));
		assertTrue(e.getMessage().contains("zscore"));
		assertThrows(ConfigurationException.class, () -> CollapseMethod.fromName(null));
	}
}
