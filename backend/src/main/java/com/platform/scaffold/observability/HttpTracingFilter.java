package com.platform.scaffold.observability;

import com.platform.scaffold.observability.OpenTelemetryConfig.TelemetrySettings;
import com.platform.scaffold.security.ClientAddress;
import io.opentelemetry.api.OpenTelemetry;
import io.opentelemetry.api.common.AttributeKey;
import io.opentelemetry.api.common.Attributes;
import io.opentelemetry.api.metrics.LongCounter;
import io.opentelemetry.api.metrics.Meter;
import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.SpanKind;
import io.opentelemetry.api.trace.StatusCode;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.context.Context;
import io.opentelemetry.context.Scope;
import io.opentelemetry.context.propagation.TextMapGetter;
import jakarta.servlet.*;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.util.Collections;
import java.util.UUID;

/**
 * HTTP tracing filter.
 * 
 * Creates a server span for every request with method, path, status and request_id,
 * continues W3C trace context from incoming headers and correlates logs through MDC.
 * Passes requests straight through when telemetry is not exporting.
 */
@Slf4j
@Component
@Order(Ordered.HIGHEST_PRECEDENCE + 1)  // After correlation id
public class HttpTracingFilter implements Filter {
    
    private static final AttributeKey<String> METHOD = AttributeKey.stringKey("http.method");
    private static final AttributeKey<Long> STATUS = AttributeKey.longKey("http.status_code");
    
    private final Tracer tracer;
    private final OpenTelemetry openTelemetry;
    private final LongCounter requestCounter;
    private final boolean enabled;
    
    // Extract context from HTTP headers
    private static final TextMapGetter<HttpServletRequest> GETTER = new TextMapGetter<>() {
        @Override
        public Iterable<String> keys(HttpServletRequest carrier) {
            return Collections.list(carrier.getHeaderNames());
        }
        
        @Override
        public String get(HttpServletRequest carrier, String key) {
            return carrier.getHeader(key);
        }
    };
    
    public HttpTracingFilter(Tracer tracer, Meter meter, OpenTelemetry openTelemetry, TelemetrySettings settings) {
        this.tracer = tracer;
        this.openTelemetry = openTelemetry;
        this.enabled = settings.exporting();
        this.requestCounter = meter.counterBuilder("http.server.requests")
            .setDescription("HTTP requests handled")
            .build();
    }
    
    @Override
    public void doFilter(ServletRequest request, ServletResponse response, FilterChain chain)
            throws IOException, ServletException {
        
        if (!enabled || !(request instanceof HttpServletRequest httpRequest)) {
            chain.doFilter(request, response);
            return;
        }
        
        HttpServletResponse httpResponse = (HttpServletResponse) response;
        
        // Extract parent context from headers
        Context extractedContext = openTelemetry.getPropagators()
            .getTextMapPropagator()
            .extract(Context.current(), httpRequest, GETTER);
        
        String requestId = httpRequest.getHeader("X-Request-ID");
        if (requestId == null || requestId.isEmpty()) {
            requestId = UUID.randomUUID().toString().substring(0, 8);
        }
        
        String method = httpRequest.getMethod();
        String path = httpRequest.getRequestURI();
        String spanName = method + " " + getSpanName(path);
        
        Span span = tracer.spanBuilder(spanName)
            .setParent(extractedContext)
            .setSpanKind(SpanKind.SERVER)
            .setAttribute("http.method", method)
            .setAttribute("http.url", httpRequest.getRequestURL().toString())
            .setAttribute("http.path", path)
            .setAttribute("http.client_ip", ClientAddress.of(httpRequest))
            .setAttribute("request_id", requestId)
            .startSpan();
        
        String traceId = span.getSpanContext().getTraceId();
        
        MDC.put("trace_id", traceId);
        MDC.put("span_id", span.getSpanContext().getSpanId());
        MDC.put("request_id", requestId);
        
        httpResponse.setHeader("X-Trace-ID", traceId);
        httpResponse.setHeader("X-Request-ID", requestId);
        
        try (Scope scope = span.makeCurrent()) {
            chain.doFilter(request, response);
            
            int statusCode = httpResponse.getStatus();
            span.setAttribute("http.status_code", statusCode);
            
            if (statusCode >= 400 && statusCode < 500) {
                span.setStatus(StatusCode.ERROR, "Client error: " + statusCode);
            } else if (statusCode >= 500) {
                span.setStatus(StatusCode.ERROR, "Server error: " + statusCode);
            } else {
                span.setStatus(StatusCode.OK);
            }
            
        } catch (Exception e) {
            span.setStatus(StatusCode.ERROR, e.getMessage());
            span.recordException(e);
            throw e;
        } finally {
            span.end();
            requestCounter.add(1, Attributes.of(METHOD, method, STATUS, (long) httpResponse.getStatus()));
            MDC.remove("trace_id");
            MDC.remove("span_id");
            MDC.remove("request_id");
        }
    }
    
    static String getSpanName(String path) {
        // Normalize path for span names (remove IDs)
        return path
            .replaceAll("/[0-9a-f]{8}-[0-9a-f-]{27}", "/{id}")
            .replaceAll("/\\d+", "/{id}");
    }
}
