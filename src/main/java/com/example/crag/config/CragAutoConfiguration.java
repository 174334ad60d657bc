package com.example.crag.config;

import com.example.crag.infra.resilience.CircuitBreakerRegistry;
import com.example.crag.infra.resilience.ResilientExecutor;
import com.example.crag.infra.resilience.RetryPolicy;
import com.example.crag.probe.CircuitBreakerHealthIndicator;
import com.example.crag.probe.CircuitBreakerProbeController;
import com.example.crag.service.rag.fusion.ReciprocalRankFuser;
import com.example.crag.service.rag.orchestrator.CorrectiveRetrievalOrchestrator;
import com.example.crag.service.rag.orchestrator.CorrectiveRetrievalService;
import com.example.crag.service.rag.orchestrator.CragGateFacade;
import com.example.crag.telemetry.AuditTrailLogger;
import com.example.crag.telemetry.CragMetrics;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.autoconfigure.condition.ConditionalOnWebApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Wires the corrective retrieval loop for host applications.
 * Every bean backs off when the host defines its own.
 */
@AutoConfiguration
@EnableConfigurationProperties(CragProperties.class)
@ConditionalOnProperty(name = "crag.enabled", havingValue = "true", matchIfMissing = true)
public class CragAutoConfiguration {

    @Bean
    @ConditionalOnMissingBean
    public GateConfig cragGateConfig(CragProperties props) {
        return props.getGate().toGateConfig();
    }

    @Bean
    @ConditionalOnMissingBean
    public CragMetrics cragMetrics(ObjectProvider<MeterRegistry> registryProvider) {
        return new CragMetrics(registryProvider.getIfAvailable());
    }

    @Bean
    @ConditionalOnMissingBean
    public CircuitBreakerRegistry cragCircuitBreakerRegistry(CragProperties props) {
        return new CircuitBreakerRegistry(props.getBreaker().toCircuitBreakerConfig());
    }

    @Bean
    @ConditionalOnMissingBean
    public RetryPolicy cragRetryPolicy(CragProperties props) {
        return props.getRetry().toRetryPolicy();
    }

    @Bean
    @ConditionalOnMissingBean
    public ResilientExecutor cragResilientExecutor(CircuitBreakerRegistry registry,
                                                   RetryPolicy retryPolicy,
                                                   CragMetrics metrics,
                                                   CragProperties props) {
        return new ResilientExecutor(registry, retryPolicy, props.getRetry().getCallTimeout(), metrics);
    }

    @Bean
    @ConditionalOnMissingBean
    public ReciprocalRankFuser cragReciprocalRankFuser(CragProperties props) {
        return new ReciprocalRankFuser(props.getFusion().getRrfK());
    }

    @Bean
    @ConditionalOnMissingBean
    public CorrectiveRetrievalOrchestrator cragOrchestrator(GateConfig gateConfig, CragMetrics metrics) {
        return new CorrectiveRetrievalOrchestrator(gateConfig, metrics);
    }

    @Bean
    @ConditionalOnMissingBean
    public AuditTrailLogger cragAuditTrailLogger(ObjectProvider<ObjectMapper> objectMapper, CragProperties props) {
        return new AuditTrailLogger(objectMapper.getIfAvailable(ObjectMapper::new),
                props.getAudit().isLogJson(), props.getAudit().getMaxQueryChars());
    }

    @Bean
    @ConditionalOnMissingBean
    public CorrectiveRetrievalService cragCorrectiveRetrievalService(CorrectiveRetrievalOrchestrator orchestrator,
                                                                     ResilientExecutor resilience,
                                                                     ReciprocalRankFuser fuser,
                                                                     AuditTrailLogger auditLogger,
                                                                     CragMetrics metrics,
                                                                     CragProperties props) {
        return new CorrectiveRetrievalService(orchestrator, resilience, fuser, auditLogger, metrics,
                props.getLoop().getTimeBudget(), props.getLoop().isSearchFallbackEmpty());
    }

    @Bean
    @ConditionalOnMissingBean
    public CragGateFacade cragGateFacade(GateConfig gateConfig, CragMetrics metrics) {
        return new CragGateFacade(gateConfig, metrics);
    }

    @Configuration(proxyBeanMethods = false)
    @ConditionalOnClass(HealthIndicator.class)
    static class HealthConfiguration {

        @Bean
        @ConditionalOnMissingBean(name = "cragCircuitBreakerHealthIndicator")
        public CircuitBreakerHealthIndicator cragCircuitBreakerHealthIndicator(CircuitBreakerRegistry registry) {
            return new CircuitBreakerHealthIndicator(registry);
        }
    }

    @Configuration(proxyBeanMethods = false)
    @ConditionalOnWebApplication(type = ConditionalOnWebApplication.Type.SERVLET)
    @ConditionalOnProperty(name = "crag.probe.enabled", havingValue = "true")
    static class ProbeConfiguration {

        @Bean
        @ConditionalOnMissingBean
        public CircuitBreakerProbeController cragCircuitBreakerProbeController(CircuitBreakerRegistry registry,
                                                                               CragProperties props) {
            return new CircuitBreakerProbeController(registry, props.getProbe().getKey());
        }
    }
}
