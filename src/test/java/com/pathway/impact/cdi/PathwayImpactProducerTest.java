package com.pathway.impact.cdi;

import com.pathway.impact.api.AnalysisParams;
import com.pathway.impact.api.PathwayImpactEngine;
import com.pathway.impact.cache.CacheConfig;
import com.pathway.impact.error.ConfigurationException;
import com.pathway.impact.fixtures.Fixtures;
import com.pathway.impact.health.HealthStatus;
import com.pathway.impact.hierarchy.PathwaySource;
import com.pathway.impact.identity.StructureStandardizer;
import com.pathway.impact.upstream.RetryPolicy;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import io.opentelemetry.api.trace.Tracer;
import jakarta.enterprise.inject.Instance;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

@DisplayName("PathwayImpactProducer Tests")
class PathwayImpactProducerTest {

    private PathwayImpactProducer producer;

    @BeforeEach
    void setUp() {
        producer = new PathwayImpactProducer();
        producer.potencyThreshold = 6.0;
        producer.minAssays = 3;
        producer.includeLowConfidence = true;
        producer.topPathways = 10;
        producer.minDepth = 2;
        producer.maxDepth = 4;
        producer.maxTargets = 25;
        producer.cacheEnabled = true;
        producer.cacheMaxSize = 500;
        producer.cacheTtlSeconds = 600;
        producer.retryMaxAttempts = 4;
        producer.retryInitialDelayMillis = 100;
        producer.retryMultiplier = 3.0;
        producer.retryMaxDelayMillis = 1000;
        producer.jobWorkerThreads = 2;
        producer.jobTimeoutSeconds = 30;
        producer.jobRetentionMinutes = 15;
    }

    @SuppressWarnings("unchecked")
    private static <T> Instance<T> instance(T bean) {
        Instance<T> instance = mock(Instance.class);
        when(instance.isResolvable()).thenReturn(bean != null);
        if (bean != null) {
            when(instance.get()).thenReturn(bean);
        }
        return instance;
    }

    @Test
    @DisplayName("Analysis defaults come from config properties")
    void analysisParams() {
        AnalysisParams params = producer.defaultAnalysisParams();

        assertEquals(new AnalysisParams(6.0, 3, true, 10, 2, 4, 25), params);
    }

    @Test
    @DisplayName("Cache, retry and job settings come from config properties")
    void settings() {
        assertEquals(new CacheConfig(500, 600, true), producer.cacheConfig());
        assertEquals(new RetryPolicy(4, Duration.ofMillis(100), 3.0, Duration.ofMillis(1000)),
                producer.retryPolicy());
        assertEquals(2, producer.jobConfig().workerThreads());
        assertEquals(Duration.ofSeconds(30), producer.jobConfig().timeout());
        assertEquals(Duration.ofMinutes(15), producer.jobConfig().retention());
    }

    @Test
    @DisplayName("Out-of-range properties fail fast")
    void invalidProperties() {
        producer.potencyThreshold = 11.0;
        assertThrows(ConfigurationException.class, producer::defaultAnalysisParams);

        producer.jobWorkerThreads = 0;
        assertThrows(ConfigurationException.class, producer::jobConfig);
    }

    @Test
    @DisplayName("Engine is produced with the optional beans that are present")
    void producesEngine() {
        MeterRegistry registry = new SimpleMeterRegistry();
        PathwayImpactEngine engine = producer.pathwayImpactEngine(
                Fixtures.identityProvider(),
                Fixtures.activityProvider(),
                PathwayImpactProducerTest.<PathwaySource>instance(null),
                PathwayImpactProducerTest.<StructureStandardizer>instance(null),
                instance(registry),
                PathwayImpactProducerTest.<Tracer>instance(null));
        try {
            engine.publishHierarchy(Fixtures.hierarchy());
            engine.analyze("erlotinib", producer.defaultAnalysisParams());

            assertEquals(HealthStatus.Status.UP, engine.health().status());
            assertNotNull(registry.find("analysis.duration").timer());
            assertEquals(1, registry.find("analysis.duration").timer().count());
        } finally {
            producer.closeEngine(engine);
        }
    }
}
