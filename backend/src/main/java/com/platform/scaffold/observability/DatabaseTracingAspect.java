package com.platform.scaffold.observability;

import com.platform.scaffold.persistence.DatabaseUrl;
import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.SpanKind;
import io.opentelemetry.api.trace.StatusCode;
import io.opentelemetry.api.trace.Tracer;
import lombok.extern.slf4j.Slf4j;
import org.aspectj.lang.ProceedingJoinPoint;
import org.aspectj.lang.annotation.Around;
import org.aspectj.lang.annotation.Aspect;
import org.aspectj.lang.reflect.MethodSignature;
import org.slf4j.MDC;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.stereotype.Component;

/**
 * Database operation tracing aspect.
 * 
 * Creates spans for all Spring Data repository operations with:
 * - db.system (from the configured DATABASE_URL)
 * - db.operation (method name)
 * - db.repository
 */
@Slf4j
@Aspect
@Component
public class DatabaseTracingAspect {
    
    private final Tracer tracer;
    private final MetricsRegistry metricsRegistry;
    private final ObjectProvider<DatabaseUrl> databaseUrl;
    
    public DatabaseTracingAspect(Tracer tracer, MetricsRegistry metricsRegistry, ObjectProvider<DatabaseUrl> databaseUrl) {
        this.tracer = tracer;
        this.metricsRegistry = metricsRegistry;
        this.databaseUrl = databaseUrl;
    }
    
    @Around("execution(* org.springframework.data.repository.Repository+.*(..))")
    public Object traceRepositoryMethods(ProceedingJoinPoint joinPoint) throws Throwable {
        MethodSignature signature = (MethodSignature) joinPoint.getSignature();
        String className = signature.getDeclaringType().getSimpleName();
        String methodName = signature.getName();
        String spanName = "db." + className + "." + methodName;
        String system = dbSystem();
        
        Span span = tracer.spanBuilder(spanName)
            .setSpanKind(SpanKind.CLIENT)
            .setAttribute("db.system", system)
            .setAttribute("db.operation", methodName)
            .setAttribute("db.repository", className)
            .startSpan();
        
        String requestId = MDC.get("request_id");
        if (requestId != null) {
            span.setAttribute("request_id", requestId);
        }
        
        long start = System.currentTimeMillis();
        try {
            Object result = joinPoint.proceed();
            span.setStatus(StatusCode.OK);
            return result;
        } catch (Exception e) {
            span.setStatus(StatusCode.ERROR, e.getMessage());
            span.recordException(e);
            throw e;
        } finally {
            span.end();
            metricsRegistry.recordLatency(system, methodName, System.currentTimeMillis() - start);
        }
    }
    
    private String dbSystem() {
        DatabaseUrl url = databaseUrl.getIfAvailable();
        return url != null ? url.system() : "unknown";
    }
}
