/*
 * Copyright (c) 2025 Argus Validation
 * Licensed under the Apache License, Version 2.0
 */
package com.argus.validation.core.telemetry;

import com.argus.validation.core.config.ValidationConfig;
import io.opentelemetry.api.OpenTelemetry;
import io.opentelemetry.api.common.AttributeKey;
import io.opentelemetry.api.common.Attributes;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.api.trace.propagation.W3CTraceContextPropagator;
import io.opentelemetry.context.propagation.ContextPropagators;
import io.opentelemetry.exporter.logging.LoggingSpanExporter;
import io.opentelemetry.exporter.otlp.trace.OtlpGrpcSpanExporter;
import io.opentelemetry.sdk.OpenTelemetrySdk;
import io.opentelemetry.sdk.resources.Resource;
import io.opentelemetry.sdk.trace.SdkTracerProvider;
import io.opentelemetry.sdk.trace.export.BatchSpanProcessor;
import io.opentelemetry.sdk.trace.export.SpanExporter;
import io.opentelemetry.sdk.trace.samplers.Sampler;

import java.time.Duration;
import java.util.concurrent.TimeUnit;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * OpenTelemetry tracer for data-store lookups made by the persistence-backed rules.
 *
 * Configuration via environment variables (or system properties):
 * - OTEL_DISABLED: Disable tracing entirely (default: false)
 * - OTEL_EXPORTER_TYPE: otlp|logging (default: logging)
 * - OTEL_EXPORTER_OTLP_ENDPOINT: OTLP endpoint (default: http://localhost:4317)
 * - OTEL_TRACE_SAMPLING_RATIO: 0.0-1.0 (default: 1.0 in dev, 0.1 in prod)
 * - SERVICE_NAME: Service identifier (default: argus-validation)
 * - DEPLOYMENT_ENVIRONMENT: prod|staging|dev (default: dev)
 */
public class TracingService {
    private static final Logger logger = Logger.getLogger(TracingService.class.getName());

    private static final String INSTRUMENTATION_NAME = "com.argus.validation";
    private static final String DEFAULT_SERVICE_NAME = "argus-validation";

    private static final AttributeKey<String> SERVICE_NAME = AttributeKey.stringKey("service.name");
    private static final AttributeKey<String> DEPLOYMENT_ENVIRONMENT = AttributeKey.stringKey("deployment.environment");

    private static volatile TracingService INSTANCE;
    private static final Object LOCK = new Object();

    private static final Tracer NOOP_TRACER = OpenTelemetry.noop().getTracer(INSTRUMENTATION_NAME);

    private final Tracer tracer;
    private final SdkTracerProvider tracerProvider;
    private final boolean isNoop;

    private TracingService(Tracer tracer, SdkTracerProvider tracerProvider, boolean isNoop) {
        this.tracer = tracer;
        this.tracerProvider = tracerProvider;
        this.isNoop = isNoop;

        if (!isNoop) {
            registerShutdownHook();
        }
    }

    /**
     * Get singleton instance with double-checked locking.
     */
    public static TracingService getInstance() {
        TracingService instance = INSTANCE;
        if (instance == null) {
            synchronized (LOCK) {
                instance = INSTANCE;
                if (instance == null) {
                    instance = initialize();
                    INSTANCE = instance;
                }
            }
        }
        return instance;
    }

    /**
     * Tracer honouring {@link ValidationConfig#tracingEnabled()}; a disabled config never
     * starts the SDK.
     */
    public static Tracer tracerFor(ValidationConfig config) {
        return config.tracingEnabled() ? getInstance().getTracer() : NOOP_TRACER;
    }

    public static Tracer noopTracer() {
        return NOOP_TRACER;
    }

    private static TracingService initialize() {
        try {
            if (Boolean.parseBoolean(getEnvOrProperty("OTEL_DISABLED", "false"))) {
                logger.info("OpenTelemetry tracing is DISABLED (OTEL_DISABLED=true)");
                return new TracingService(NOOP_TRACER, null, true);
            }

            logger.info("Initializing OpenTelemetry tracing...");

            Resource resource = Resource.getDefault().merge(
                    Resource.create(Attributes.builder()
                            .put(SERVICE_NAME, getEnvOrProperty("SERVICE_NAME", DEFAULT_SERVICE_NAME))
                            .put(DEPLOYMENT_ENVIRONMENT, getEnvironment())
                            .build()));

            Sampler sampler = configureSampler();

            SdkTracerProvider tracerProvider = SdkTracerProvider.builder()
                    .setResource(resource)
                    .setSampler(sampler)
                    .addSpanProcessor(
                            BatchSpanProcessor.builder(configureExporter())
                                    .setMaxQueueSize(2048)
                                    .setMaxExportBatchSize(256)
                                    .setScheduleDelay(Duration.ofSeconds(5))
                                    .setExporterTimeout(Duration.ofSeconds(30))
                                    .build())
                    .build();

            OpenTelemetrySdk sdk = OpenTelemetrySdk.builder()
                    .setTracerProvider(tracerProvider)
                    .setPropagators(ContextPropagators.create(W3CTraceContextPropagator.getInstance()))
                    .build();

            logger.info("OpenTelemetry initialized: sampler=" + sampler.getDescription());
            return new TracingService(sdk.getTracer(INSTRUMENTATION_NAME), tracerProvider, false);

        } catch (Exception e) {
            logger.log(Level.SEVERE, "Failed to initialize OpenTelemetry - falling back to noop", e);
            return new TracingService(NOOP_TRACER, null, true);
        }
    }

    private static Sampler configureSampler() {
        String defaultRatio = switch (getEnvironment().toLowerCase()) {
            case "prod", "production" -> "0.1";
            case "staging" -> "0.5";
            default -> "1.0";
        };

        double samplingRatio;
        try {
            samplingRatio = Double.parseDouble(getEnvOrProperty("OTEL_TRACE_SAMPLING_RATIO", defaultRatio));
            samplingRatio = Math.max(0.0, Math.min(1.0, samplingRatio));
        } catch (NumberFormatException e) {
            logger.warning("Invalid OTEL_TRACE_SAMPLING_RATIO, using default");
            samplingRatio = Double.parseDouble(defaultRatio);
        }

        return Sampler.parentBasedBuilder(Sampler.traceIdRatioBased(samplingRatio)).build();
    }

    private static SpanExporter configureExporter() {
        String exporterType = getEnvOrProperty("OTEL_EXPORTER_TYPE", "logging").toLowerCase();

        if ("otlp".equals(exporterType)) {
            String endpoint = getEnvOrProperty("OTEL_EXPORTER_OTLP_ENDPOINT", "http://localhost:4317");
            logger.info("Using OTLP exporter: " + endpoint);
            return OtlpGrpcSpanExporter.builder()
                    .setEndpoint(endpoint)
                    .setTimeout(30, TimeUnit.SECONDS)
                    .build();
        }
        if (!"logging".equals(exporterType)) {
            logger.warning("Unknown exporter type: " + exporterType + ", using logging");
        }
        return LoggingSpanExporter.create();
    }

    private void registerShutdownHook() {
        Runtime.getRuntime().addShutdownHook(new Thread(this::shutdown, "otel-shutdown-hook"));
    }

    /**
     * Graceful shutdown with timeout.
     */
    public void shutdown() {
        if (isNoop || tracerProvider == null) {
            return;
        }

        try {
            tracerProvider.shutdown().join(30, TimeUnit.SECONDS);
            logger.info("OpenTelemetry shutdown complete");
        } catch (Exception e) {
            logger.log(Level.WARNING, "Error during OpenTelemetry shutdown", e);
        }
    }

    public Tracer getTracer() {
        return tracer;
    }

    public boolean isEnabled() {
        return !isNoop;
    }

    private static String getEnvironment() {
        return getEnvOrProperty("DEPLOYMENT_ENVIRONMENT", "dev");
    }

    /**
     * Get value from environment variable, falling back to system property.
     */
    private static String getEnvOrProperty(String key, String defaultValue) {
        String value = System.getenv(key);
        if (value == null || value.isEmpty()) {
            value = System.getProperty(key, defaultValue);
        }
        return value;
    }
}
