package com.platform.scaffold.observability;

import com.platform.scaffold.config.EnvResolver;
import io.opentelemetry.api.GlobalOpenTelemetry;
import io.opentelemetry.api.OpenTelemetry;
import io.opentelemetry.api.common.Attributes;
import io.opentelemetry.api.metrics.Meter;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.api.trace.propagation.W3CTraceContextPropagator;
import io.opentelemetry.context.propagation.ContextPropagators;
import io.opentelemetry.exporter.otlp.metrics.OtlpGrpcMetricExporter;
import io.opentelemetry.exporter.otlp.trace.OtlpGrpcSpanExporter;
import io.opentelemetry.sdk.OpenTelemetrySdk;
import io.opentelemetry.sdk.metrics.SdkMeterProvider;
import io.opentelemetry.sdk.metrics.export.PeriodicMetricReader;
import io.opentelemetry.sdk.resources.Resource;
import io.opentelemetry.sdk.trace.SdkTracerProvider;
import io.opentelemetry.sdk.trace.export.BatchSpanProcessor;
import io.opentelemetry.semconv.ResourceAttributes;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;
import java.util.UUID;
import java.util.concurrent.TimeUnit;

/**
 * OpenTelemetry SDK configuration.
 * 
 * Enabled with OTEL_ENABLED=true and OTEL_EXPORTER_OTLP_ENDPOINT. Provides:
 * - Tracer and Meter with resource attributes
 * - OTLP gRPC exporters for traces and metrics
 * - Context propagation (W3C)
 * 
 * Without an endpoint nothing is exported and a no-op SDK is used.
 */
@Slf4j
@Configuration
public class OpenTelemetryConfig {
    
    public static final String OTEL_ENABLED = "OTEL_ENABLED";
    public static final String OTEL_SERVICE_NAME = "OTEL_SERVICE_NAME";
    public static final String OTEL_EXPORTER_OTLP_ENDPOINT = "OTEL_EXPORTER_OTLP_ENDPOINT";
    
    private final TelemetrySettings settings;
    private final String instanceId = UUID.randomUUID().toString().substring(0, 8);
    
    private SdkTracerProvider tracerProvider;
    private SdkMeterProvider meterProvider;
    
    public OpenTelemetryConfig(EnvResolver env,
                               @Value("${scaffold.name:service-scaffold}") String projectName,
                               @Value("${scaffold.version:1.0.0}") String serviceVersion) {
        this.settings = TelemetrySettings.resolve(env, projectName, serviceVersion);
    }
    
    @Bean
    public TelemetrySettings telemetrySettings() {
        return settings;
    }
    
    @Bean
    public OpenTelemetry openTelemetry() {
        if (!settings.enabled()) {
            log.info("OpenTelemetry is disabled");
            return OpenTelemetry.noop();
        }
        if (!settings.exporting()) {
            log.warn("{} is true but {} is not set, OpenTelemetry will not export data",
                OTEL_ENABLED, OTEL_EXPORTER_OTLP_ENDPOINT);
            return OpenTelemetry.noop();
        }
        
        log.info("Initializing OpenTelemetry for service: {} (version={}, instance={})",
            settings.serviceName(), settings.serviceVersion(), instanceId);
        
        Resource resource = Resource.getDefault()
            .merge(Resource.create(Attributes.builder()
                .put(ResourceAttributes.SERVICE_NAME, settings.serviceName())
                .put(ResourceAttributes.SERVICE_VERSION, settings.serviceVersion())
                .put("instance_id", instanceId)
                .build()));
        
        OtlpGrpcSpanExporter spanExporter = OtlpGrpcSpanExporter.builder()
            .setEndpoint(settings.endpoint())
            .setTimeout(10, TimeUnit.SECONDS)
            .build();
        
        tracerProvider = SdkTracerProvider.builder()
            .addSpanProcessor(BatchSpanProcessor.builder(spanExporter)
                .setMaxQueueSize(2048)
                .setScheduleDelay(5, TimeUnit.SECONDS)
                .build())
            .setResource(resource)
            .build();
        
        OtlpGrpcMetricExporter metricExporter = OtlpGrpcMetricExporter.builder()
            .setEndpoint(settings.endpoint())
            .build();
        
        meterProvider = SdkMeterProvider.builder()
            .registerMetricReader(PeriodicMetricReader.builder(metricExporter)
                .setInterval(Duration.ofSeconds(60))
                .build())
            .setResource(resource)
            .build();
        
        OpenTelemetrySdk openTelemetry = OpenTelemetrySdk.builder()
            .setTracerProvider(tracerProvider)
            .setMeterProvider(meterProvider)
            .setPropagators(ContextPropagators.create(W3CTraceContextPropagator.getInstance()))
            .build();
        
        // Register as global
        GlobalOpenTelemetry.resetForTest();
        GlobalOpenTelemetry.set(openTelemetry);
        
        log.info("OpenTelemetry initialized with endpoint: {}", settings.endpoint());
        
        return openTelemetry;
    }
    
    @Bean
    public Tracer tracer(OpenTelemetry openTelemetry) {
        return openTelemetry.getTracer(settings.serviceName(), settings.serviceVersion());
    }
    
    @Bean
    public Meter meter(OpenTelemetry openTelemetry) {
        return openTelemetry.getMeter(settings.serviceName());
    }
    
    @PreDestroy
    public void shutdown() {
        if (tracerProvider != null) {
            log.info("Shutting down OpenTelemetry SDK");
            tracerProvider.shutdown();
        }
        if (meterProvider != null) {
            meterProvider.shutdown();
        }
    }
    
    /**
     * Telemetry settings resolved from the environment.
     */
    public record TelemetrySettings(boolean enabled, String serviceName, String serviceVersion, String endpoint) {
        
        public static TelemetrySettings resolve(EnvResolver env, String defaultServiceName, String serviceVersion) {
            return new TelemetrySettings(
                env.resolveBool(OTEL_ENABLED),
                env.resolveString(OTEL_SERVICE_NAME, defaultServiceName),
                serviceVersion,
                env.resolveString(OTEL_EXPORTER_OTLP_ENDPOINT)
            );
        }
        
        /**
         * True only when enabled and an endpoint is configured.
         */
        public boolean exporting() {
            return enabled && !endpoint.isEmpty();
        }
    }
}
