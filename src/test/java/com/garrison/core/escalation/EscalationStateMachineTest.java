package com.garrison.core.escalation;

import com.garrison.core.config.GarrisonProperties;
import com.garrison.core.metrics.GarrisonMetrics;
import com.garrison.core.model.UnitGroupSpec;
import com.garrison.core.model.WaveSpec;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class EscalationStateMachineTest {

    private static final Instant T0 = Instant.parse("2026-01-01T00:00:00Z");

    private SimpleMeterRegistry registry;
    private EscalationStateMachine machine;

    @BeforeEach
    void setUp() {
        registry = new SimpleMeterRegistry();
        var table = WaveTable.of(new GarrisonProperties().waveSpecs());
        machine = new EscalationStateMachine("Outpost Kilo", table, Duration.ofSeconds(10),
                new GarrisonMetrics(registry));
    }

    private Optional<Integer> evaluateAt(boolean combat, long secondsAfterStart) {
        return machine.evaluate(combat, T0.plusSeconds(secondsAfterStart)).map(WaveSpec::waveNumber);
    }

    @Nested
    @DisplayName("Engagement tracking")
    class Engagement {

        @Test
        @DisplayName("first combat tick starts tracking without a wave")
        void engageStartsTimer() {
            assertEquals(Optional.empty(), evaluateAt(true, 0));
            var state = machine.state();
            assertTrue(state.isActive());
            assertEquals(Optional.of(T0), state.combatStartTime());
            assertEquals(0, state.currentWave());
        }

        @Test
        @DisplayName("quiet ticks while idle change nothing")
        void idleStaysIdle() {
            assertEquals(Optional.empty(), evaluateAt(false, 0));
            assertFalse(machine.state().isActive());
            assertTrue(machine.state().combatStartTime().isEmpty());
            assertNull(registry.find("garrison.combat.engagements").counter());
        }

        @Test
        @DisplayName("disengage is a full reset and records the duration")
        void disengageResets() {
            evaluateAt(true, 0);
            evaluateAt(true, 300);
            assertEquals(1, machine.state().currentWave());

            assertEquals(Optional.empty(), evaluateAt(false, 320));
            var state = machine.state();
            assertFalse(state.isActive());
            assertEquals(0, state.currentWave());
            assertTrue(state.combatStartTime().isEmpty());
            assertEquals(1, registry.find("garrison.combat.duration").timer().count());
        }

        @Test
        @DisplayName("re-engagement restarts the timeline from wave one")
        void reEngageRestarts() {
            evaluateAt(true, 0);
            evaluateAt(true, 610);
            evaluateAt(false, 620);

            evaluateAt(true, 1000);
            assertEquals(Optional.empty(), evaluateAt(true, 1290));
            assertEquals(Optional.of(1), evaluateAt(true, 1300));
        }
    }

    @Nested
    @DisplayName("Wave selection")
    class WaveSelection {

        @Test
        @DisplayName("waves fire at their thresholds in order")
        void fireInOrder() {
            evaluateAt(true, 0);
            assertEquals(Optional.empty(), evaluateAt(true, 290));
            assertEquals(Optional.of(1), evaluateAt(true, 300));
            assertEquals(Optional.empty(), evaluateAt(true, 310));
            assertEquals(Optional.of(2), evaluateAt(true, 600));
            assertEquals(Optional.of(3), evaluateAt(true, 900));
            assertEquals(Optional.of(4), evaluateAt(true, 1200));
        }

        @Test
        @DisplayName("a late first check jumps straight to the highest eligible wave")
        void skipsLowerTiers() {
            evaluateAt(true, 0);
            assertEquals(Optional.of(2), evaluateAt(true, 625));
            assertEquals(2, machine.state().currentWave());
            assertEquals(Optional.empty(), evaluateAt(true, 635));
        }

        @Test
        @DisplayName("a gap in ticks can skip several tiers at once")
        void skipsSeveralTiers() {
            evaluateAt(true, 0);
            evaluateAt(true, 300);
            assertEquals(Optional.of(4), evaluateAt(true, 1250));
        }

        @Test
        @DisplayName("the highest wave is terminal while engaged")
        void maxWaveTerminal() {
            evaluateAt(true, 0);
            evaluateAt(true, 1200);
            assertTrue(machine.isAtMaxWave());
            assertEquals(Optional.empty(), evaluateAt(true, 5000));
            assertEquals(4, machine.state().currentWave());
        }

        @Test
        @DisplayName("elapsed time counts whole seconds")
        void wholeSeconds() {
            machine.evaluate(true, T0);
            assertTrue(machine.evaluate(true, T0.plusMillis(299_999)).isEmpty());
            assertTrue(machine.evaluate(true, T0.plusMillis(300_000)).isPresent());
        }

        @Test
        @DisplayName("triggered waves are counted by number")
        void metrics() {
            evaluateAt(true, 0);
            evaluateAt(true, 300);
            evaluateAt(true, 600);
            assertEquals(1.0, registry.find("garrison.waves.triggered").tag("wave", "1").counter().count());
            assertEquals(1.0, registry.find("garrison.waves.triggered").tag("wave", "2").counter().count());
            assertEquals(1.0, registry.find("garrison.combat.engagements").counter().count());
        }
    }

    @Nested
    @DisplayName("Cooldown")
    class Cooldown {

        private EscalationStateMachine fast;

        @BeforeEach
        void setUp() {
            var group = List.of(UnitGroupSpec.ground("Group_FireTeam", 4));
            var table = WaveTable.of(List.of(
                    new WaveSpec(1, group, null, 100, 300, 0),
                    new WaveSpec(2, group, null, 100, 300, 5),
                    new WaveSpec(3, group, null, 100, 300, 30)));
            fast = new EscalationStateMachine("Outpost Kilo", table, Duration.ofSeconds(10), null);
        }

        @Test
        @DisplayName("no wave within the cooldown of the previous one")
        void blocksWithinCooldown() {
            assertEquals(1, fast.evaluate(true, T0).orElseThrow().waveNumber());
            assertTrue(fast.evaluate(true, T0.plusSeconds(5)).isEmpty());
            assertTrue(fast.evaluate(true, T0.plusSeconds(9)).isEmpty());
            assertEquals(2, fast.evaluate(true, T0.plusSeconds(10)).orElseThrow().waveNumber());
        }

        @Test
        @DisplayName("cooldown also spans a quick re-engagement")
        void spansReEngagement() {
            fast.evaluate(true, T0);
            fast.evaluate(false, T0.plusSeconds(2));
            assertTrue(fast.evaluate(true, T0.plusSeconds(4)).isEmpty());
            assertTrue(fast.state().isActive());
            // six seconds into the new engagement, past wave 2's threshold
            assertEquals(2, fast.evaluate(true, T0.plusSeconds(10)).orElseThrow().waveNumber());
        }

        @Test
        @DisplayName("works without metrics")
        void nullMetrics() {
            fast.evaluate(true, T0);
            assertDoesNotThrow(() -> fast.evaluate(false, T0.plusSeconds(1)));
        }
    }
}
