package com.themis.refinery.core.telemetry;

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
import java.util.Locale;
import java.util.concurrent.TimeUnit;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Process-wide OpenTelemetry tracer.
 *
 * <p>Configured from environment variables, falling back to system
 * properties of the same name:
 * <ul>
 *   <li>{@code OTEL_DISABLED} - disable tracing entirely (default {@code true})</li>
 *   <li>{@code OTEL_EXPORTER_TYPE} - {@code otlp} or {@code logging} (default {@code logging})</li>
 *   <li>{@code OTEL_EXPORTER_OTLP_ENDPOINT} - default {@code http://localhost:4317}</li>
 *   <li>{@code OTEL_TRACE_SAMPLING_RATIO} - 0.0 to 1.0 (default 1.0)</li>
 *   <li>{@code SERVICE_NAME}, {@code DEPLOYMENT_ENVIRONMENT}</li>
 * </ul>
 * Any initialization failure degrades to a no-op tracer.
 */
public final class TracingService {
    private static final Logger logger = Logger.getLogger(TracingService.class.getName());

    private static final String INSTRUMENTATION_NAME = "com.themis.refinery";
    private static final String DEFAULT_SERVICE_NAME = "themis-refinery";

    private static final AttributeKey<String> SERVICE_NAME = AttributeKey.stringKey("service.name");
    private static final AttributeKey<String> DEPLOYMENT_ENVIRONMENT = AttributeKey.stringKey("deployment.environment");

    private static volatile TracingService instance;
    private static final Object LOCK = new Object();

    private final Tracer tracer;
    private final SdkTracerProvider tracerProvider;

    private TracingService(Tracer tracer, SdkTracerProvider tracerProvider) {
        this.tracer = tracer;
        this.tracerProvider = tracerProvider;
        if (tracerProvider != null) {
            Runtime.getRuntime().addShutdownHook(new Thread(this::shutdown, "otel-shutdown-hook"));
        }
    }

    public static TracingService getInstance() {
        TracingService current = instance;
        if (current == null) {
            synchronized (LOCK) {
                current = instance;
                if (current == null) {
                    current = initialize();
                    instance = current;
                }
            }
        }
        return current;
    }

    private static TracingService initialize() {
        if (Boolean.parseBoolean(getEnvOrProperty("OTEL_DISABLED", "true"))) {
            logger.info("OpenTelemetry tracing is disabled");
            return noop();
        }
        try {
            Resource resource = Resource.getDefault().merge(Resource.create(Attributes.builder()
                    .put(SERVICE_NAME, getEnvOrProperty("SERVICE_NAME", DEFAULT_SERVICE_NAME))
                    .put(DEPLOYMENT_ENVIRONMENT, getEnvOrProperty("DEPLOYMENT_ENVIRONMENT", "dev"))
                    .build()));

            SdkTracerProvider tracerProvider = SdkTracerProvider.builder()
                    .setResource(resource)
                    .setSampler(Sampler.parentBasedBuilder(Sampler.traceIdRatioBased(samplingRatio())).build())
                    .addSpanProcessor(BatchSpanProcessor.builder(exporter())
                            .setScheduleDelay(Duration.ofSeconds(5))
                            .setExporterTimeout(Duration.ofSeconds(30))
                            .build())
                    .build();

            OpenTelemetrySdk sdk = OpenTelemetrySdk.builder()
                    .setTracerProvider(tracerProvider)
                    .setPropagators(ContextPropagators.create(W3CTraceContextPropagator.getInstance()))
                    .build();

            logger.info("OpenTelemetry tracing initialized");
            return new TracingService(sdk.getTracer(INSTRUMENTATION_NAME), tracerProvider);
        } catch (RuntimeException e) {
            logger.log(Level.SEVERE, "Failed to initialize OpenTelemetry - falling back to noop", e);
            return noop();
        }
    }

    private static TracingService noop() {
        return new TracingService(OpenTelemetry.noop().getTracer(INSTRUMENTATION_NAME), null);
    }

    private static double samplingRatio() {
        String raw = getEnvOrProperty("OTEL_TRACE_SAMPLING_RATIO", "1.0");
        try {
            return Math.max(0.0, Math.min(1.0, Double.parseDouble(raw)));
        } catch (NumberFormatException e) {
            logger.warning("Invalid OTEL_TRACE_SAMPLING_RATIO '" + raw + "', sampling everything");
            return 1.0;
        }
    }

    private static SpanExporter exporter() {
        String type = getEnvOrProperty("OTEL_EXPORTER_TYPE", "logging").toLowerCase(Locale.ROOT);
        if ("otlp".equals(type)) {
            String endpoint = getEnvOrProperty("OTEL_EXPORTER_OTLP_ENDPOINT", "http://localhost:4317");
            logger.info("Using OTLP exporter: " + endpoint);
            return OtlpGrpcSpanExporter.builder()
                    .setEndpoint(endpoint)
                    .setTimeout(30, TimeUnit.SECONDS)
                    .build();
        }
        if (!"logging".equals(type)) {
            logger.warning("Unknown exporter type: " + type + ", using logging");
        }
        return LoggingSpanExporter.create();
    }

    public void shutdown() {
        if (tracerProvider == null) {
            return;
        }
        try {
            tracerProvider.shutdown().join(30, TimeUnit.SECONDS);
        } catch (RuntimeException e) {
            logger.log(Level.WARNING, "Error during OpenTelemetry shutdown", e);
        }
    }

    public Tracer getTracer() {
        return tracer;
    }

    public boolean isEnabled() {
        return tracerProvider != null;
    }

    static String getEnvOrProperty(String key, String defaultValue) {
        String value = System.getenv(key);
        if (value == null || value.isEmpty()) {
            value = System.getProperty(key, defaultValue);
        }
        return value;
    }
}
