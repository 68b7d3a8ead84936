package com.profitrate.reconciliation.metrics;

import com.profitrate.reconciliation.identity.Classification;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("MetricsService Tests")
class MetricsServiceTest {

    @Nested
    @DisplayName("NoOpMetricsService")
    class NoOpTests {

        @Test
        @DisplayName("All methods should be callable without error")
        void allMethodsCallableWithoutError() {
            NoOpMetricsService noOp = new NoOpMetricsService();

            assertDoesNotThrow(() -> {
                noOp.recordStageDuration("load", Duration.ofMillis(10));
                noOp.incrementMergeConflicts("K", 3);
                noOp.incrementGapFills("u", "bounded-linear-interpolation", 2);
                noOp.incrementClassification("rate-of-profit", Classification.FLAGGED);
                noOp.incrementFailedSource("load");
                noOp.recordSystematicBias("rate-of-profit");
            });
        }
    }

    @Nested
    @DisplayName("MicrometerMetricsService")
    class MicrometerTests {

        private final SimpleMeterRegistry registry = new SimpleMeterRegistry();
        private final MicrometerMetricsService metrics = new MicrometerMetricsService(registry);

        @Test
        @DisplayName("Should record stage durations as timers")
        void recordStageDuration() {
            metrics.recordStageDuration("validate", Duration.ofMillis(150));
            metrics.recordStageDuration("validate", Duration.ofMillis(250));

            Timer timer = registry.find("reconciliation.stage.duration").tag("stage", "validate").timer();

            assertNotNull(timer);
            assertEquals(2, timer.count());
        }

        @Test
        @DisplayName("Should count merge conflicts per variable and ignore zero counts")
        void mergeConflicts() {
            metrics.incrementMergeConflicts("K", 2);
            metrics.incrementMergeConflicts("K", 1);
            metrics.incrementMergeConflicts("u", 0);

            Counter counter = registry.find("reconciliation.merge.conflicts").tag("variable", "K").counter();
            assertNotNull(counter);
            assertEquals(3.0, counter.count());
            assertNull(registry.find("reconciliation.merge.conflicts").tag("variable", "u").counter());
        }

        @Test
        @DisplayName("Should count gap fills per variable and policy")
        void gapFills() {
            metrics.incrementGapFills("u", "manual-override", 1);
            metrics.incrementGapFills("u", "bounded-linear-interpolation", 4);

            Counter linear = registry.find("reconciliation.gap.fills")
                    .tag("variable", "u")
                    .tag("policy", "bounded-linear-interpolation")
                    .counter();
            assertNotNull(linear);
            assertEquals(4.0, linear.count());
        }

        @Test
        @DisplayName("Should count identity results by classification label")
        void classifications() {
            metrics.incrementClassification("rate-of-profit", Classification.MATCH);
            metrics.incrementClassification("rate-of-profit", Classification.WITHIN_TOLERANCE);
            metrics.incrementClassification("rate-of-profit", Classification.WITHIN_TOLERANCE);

            Counter within = registry.find("reconciliation.identity.results")
                    .tag("identity", "rate-of-profit")
                    .tag("classification", "within-tolerance")
                    .counter();
            assertNotNull(within);
            assertEquals(2.0, within.count());
        }

        @Test
        @DisplayName("Should count failed sources and bias findings")
        void failuresAndBias() {
            metrics.incrementFailedSource("load");
            metrics.recordSystematicBias("rate-of-profit");

            assertEquals(1.0, registry.find("reconciliation.sources.failed").tag("stage", "load").counter().count());
            assertEquals(1.0, registry.find("reconciliation.identity.bias").tag("identity", "rate-of-profit")
                    .counter().count());
        }
    }
}
