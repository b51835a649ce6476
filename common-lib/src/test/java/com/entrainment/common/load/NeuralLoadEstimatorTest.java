package com.entrainment.common.load;

import com.entrainment.common.model.SessionConfiguration;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class NeuralLoadEstimatorTest {

    @Nested
    @DisplayName("formula")
    class Formula {

        @Test
        @DisplayName("30 min, 0.5 intensity, no gamma, 3 states → 0.15 + 0.15 + 0 + 0.09 = 0.39")
        void weightedSum() {
            double load = NeuralLoadEstimator.estimate(new LoadInput(30, 0.5, 0, 3));
            assertEquals(0.39, load, 1e-9);
        }

        @Test
        @DisplayName("every factor saturated → 1.0")
        void saturated() {
            assertEquals(1.0, NeuralLoadEstimator.estimate(new LoadInput(600, 1.0, 300, 50)), 1e-9);
        }

        @Test
        @DisplayName("empty input → 0.0")
        void zero() {
            assertEquals(0.0, NeuralLoadEstimator.estimate(new LoadInput(0, 0, 0, 0)));
        }

        @Test
        @DisplayName("out-of-range and NaN sub-factors are clamped before weighting")
        void clamped() {
            double load = NeuralLoadEstimator.estimate(new LoadInput(-10, Double.NaN, 15, 0));
            assertEquals(0.125, load, 1e-9);
        }

        @Test
        @DisplayName("configuration with missing fields counts them as zero")
        void missingFields() {
            SessionConfiguration config = new SessionConfiguration("x", null, null, List.of(), null, null, null);
            assertEquals(0.0, NeuralLoadEstimator.estimate(config));
        }
    }

    @Nested
    @DisplayName("determinism and monotonicity")
    class Properties {

        @Test
        @DisplayName("identical input → bit-identical output")
        void deterministic() {
            LoadInput input = new LoadInput(47, 0.63, 12, 4);
            double first = NeuralLoadEstimator.estimate(input);
            double second = NeuralLoadEstimator.estimate(input);
            assertEquals(Double.doubleToRawLongBits(first), Double.doubleToRawLongBits(second));
        }

        @Test
        @DisplayName("raising only duration never lowers the load")
        void monotoneInDuration() {
            double previous = -1.0;
            for (int minutes = 0; minutes <= 180; minutes += 5) {
                double load = NeuralLoadEstimator.estimate(new LoadInput(minutes, 0.6, 10, 3));
                assertTrue(load >= previous, "load dropped at " + minutes + " min");
                assertTrue(load >= 0.0 && load <= 1.0);
                previous = load;
            }
        }
    }
}
