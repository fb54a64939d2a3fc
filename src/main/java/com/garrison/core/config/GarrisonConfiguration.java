package com.garrison.core.config;

import com.garrison.core.escalation.WaveTable;
import com.garrison.core.metrics.GarrisonMetrics;
import com.garrison.core.scheduler.ExecutorTickScheduler;
import com.garrison.core.scheduler.TickScheduler;
import com.garrison.core.spawnpoint.GarrisonRuntimeFactory;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Wires the reinforcement core. The world façade and notification sink are
 * host-specific and are handed to {@link GarrisonRuntimeFactory#create} directly.
 */
@Configuration
@EnableConfigurationProperties(GarrisonProperties.class)
public class GarrisonConfiguration {

    private static final Logger log = LoggerFactory.getLogger(GarrisonConfiguration.class);

    @Bean
    public WaveTable waveTable(GarrisonProperties properties) {
        var table = WaveTable.of(properties.waveSpecs());
        log.info("Loaded {} reinforcement waves (max wave {})", table.ascending().size(), table.maxWave());
        return table;
    }

    @Bean
    public GarrisonMetrics garrisonMetrics(ObjectProvider<MeterRegistry> registry) {
        return new GarrisonMetrics(registry.getIfAvailable(SimpleMeterRegistry::new));
    }

    @Bean
    @ConditionalOnMissingBean(TickScheduler.class)
    public TickScheduler tickScheduler(GarrisonMetrics metrics) {
        return new ExecutorTickScheduler(metrics::recordTickFailure);
    }

    @Bean
    public GarrisonRuntimeFactory garrisonRuntimeFactory(GarrisonProperties properties, WaveTable waveTable,
                                                         GarrisonMetrics metrics) {
        return new GarrisonRuntimeFactory(properties, waveTable, metrics);
    }
}
