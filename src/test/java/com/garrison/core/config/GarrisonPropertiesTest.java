package com.garrison.core.config;

import com.garrison.core.escalation.WaveConfigurationException;
import com.garrison.core.escalation.WaveTable;
import com.garrison.core.metrics.GarrisonMetrics;
import com.garrison.core.model.WaveDeliveryStrategy;
import com.garrison.core.scheduler.TickScheduler;
import com.garrison.core.spawnpoint.GarrisonRuntimeFactory;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;

import static org.junit.jupiter.api.Assertions.*;

class GarrisonPropertiesTest {

    @Nested
    @DisplayName("Defaults")
    class Defaults {

        private final GarrisonProperties props = new GarrisonProperties();

        @Test
        @DisplayName("timing defaults")
        void timing() {
            assertEquals(5000, props.getSettlingDelayMs());
            assertEquals(10, props.getCheckIntervalSeconds());
            assertEquals(10, props.getWaveCooldownSeconds());
            assertEquals(600, props.getGracePeriodSeconds());
            assertEquals(30, props.getLifecycle().getCheckIntervalSeconds());
        }

        @Test
        @DisplayName("distance defaults")
        void distances() {
            assertEquals(300.0, props.getDetectionRadius());
            assertEquals(2000.0, props.getFrontlineRadius());
        }

        @Test
        @DisplayName("failover off and direct spawning by default")
        void behaviour() {
            assertFalse(props.isFailoverEnabled());
            assertEquals(WaveDeliveryStrategy.DIRECT_SPAWN, props.getDelivery());
        }

        @Test
        @DisplayName("default waves build a valid table")
        void waves() {
            var specs = props.waveSpecs();
            assertEquals(4, specs.size());
            assertEquals(3, specs.get(2).groups().size());
            assertEquals("Helicopter_Transport", specs.get(3).aerial().orElseThrow().prefab());
            assertDoesNotThrow(() -> WaveTable.of(specs));
        }
    }

    @Nested
    @DisplayName("Spring wiring")
    class Wiring {

        private final ApplicationContextRunner runner = new ApplicationContextRunner()
                .withUserConfiguration(GarrisonConfiguration.class);

        @Test
        @DisplayName("context exposes the core beans")
        void beans() {
            runner.run(ctx -> {
                assertNotNull(ctx.getBean(WaveTable.class));
                assertNotNull(ctx.getBean(GarrisonMetrics.class));
                assertNotNull(ctx.getBean(TickScheduler.class));
                assertNotNull(ctx.getBean(GarrisonRuntimeFactory.class));
            });
        }

        @Test
        @DisplayName("properties bind from relaxed names")
        void binding() {
            runner.withPropertyValues(
                    "garrison.election.failover-enabled=true",
                    "garrison.combat.detection-radius=450",
                    "garrison.spawn.delivery=RESPAWN_CYCLE",
                    "garrison.spawn.defender.group-count=3",
                    "garrison.waves[0].number=1",
                    "garrison.waves[0].threshold-seconds=120",
                    "garrison.waves[0].groups[0].prefab=Group_Sentry",
                    "garrison.waves[0].groups[0].members=2"
            ).run(ctx -> {
                var props = ctx.getBean(GarrisonProperties.class);
                assertTrue(props.isFailoverEnabled());
                assertEquals(450.0, props.getDetectionRadius());
                assertEquals(WaveDeliveryStrategy.RESPAWN_CYCLE, props.getDelivery());
                assertEquals(3, props.getSpawn().getDefender().getGroupCount());
                assertEquals(180, props.getSpawn().getDefender().getRespawnSeconds());

                var table = ctx.getBean(WaveTable.class);
                assertEquals(1, table.maxWave());
                assertEquals(120, table.find(1).orElseThrow().thresholdSeconds());
            });
        }

        @Test
        @DisplayName("an inconsistent wave table fails startup")
        void invalidWaves() {
            runner.withPropertyValues(
                    "garrison.waves[0].number=1",
                    "garrison.waves[0].threshold-seconds=600",
                    "garrison.waves[0].groups[0].prefab=Group_FireTeam",
                    "garrison.waves[0].groups[0].members=4",
                    "garrison.waves[1].number=2",
                    "garrison.waves[1].threshold-seconds=300",
                    "garrison.waves[1].groups[0].prefab=Group_FireTeam",
                    "garrison.waves[1].groups[0].members=4"
            ).run(ctx -> {
                assertNotNull(ctx.getStartupFailure());
                Throwable cause = ctx.getStartupFailure();
                while (cause.getCause() != null && !(cause instanceof WaveConfigurationException)) {
                    cause = cause.getCause();
                }
                assertInstanceOf(WaveConfigurationException.class, cause);
            });
        }
    }
}
