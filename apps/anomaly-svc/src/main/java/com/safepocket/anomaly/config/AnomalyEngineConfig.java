package com.safepocket.anomaly.config;

import com.safepocket.anomaly.analytics.MetricSelector;
import com.safepocket.anomaly.detector.DetectorRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class AnomalyEngineConfig {

    private static final Logger log = LoggerFactory.getLogger(AnomalyEngineConfig.class);

    @Bean
    public DetectorRegistry detectorRegistry(AnomalyProperties properties) {
        DetectorRegistry registry = DetectorRegistry.fromProperties(properties);
        log.info("Anomaly engine: {} detectors registered, ensemble={} confidenceThreshold={}",
                registry.size(), properties.detectors().enabled(), properties.confidenceThreshold());
        return registry;
    }

    @Bean
    public MetricSelector metricSelector(AnomalyProperties properties) {
        return new MetricSelector(properties.metrics());
    }
}
