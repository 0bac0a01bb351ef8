package com.platform.scaffold.observability;

import ch.qos.logback.classic.LoggerContext;
import jakarta.annotation.PostConstruct;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.web.servlet.FilterRegistrationBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.Ordered;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;
import java.util.UUID;

/**
 * Logging configuration for structured JSON logs with correlation IDs.
 * 
 * The JSON layout itself lives in logback-spring.xml; LOG_LEVEL is applied through
 * the logging.level.* entries of application.yml.
 */
@Slf4j
@Configuration
public class LoggingConfig {
    
    @Value("${spring.application.name:service-scaffold}")
    private String applicationName;
    
    @Value("${logging.level.root:INFO}")
    private String rootLevel;
    
    @PostConstruct
    public void init() {
        LoggerContext context = (LoggerContext) LoggerFactory.getILoggerFactory();
        context.putProperty("application", applicationName);
        
        log.info("Logging configuration initialized for application: {} (level={})", applicationName, rootLevel);
    }
    
    /**
     * Filter to add correlation ID to all requests.
     */
    @Bean
    public FilterRegistrationBean<CorrelationIdFilter> correlationIdFilter() {
        FilterRegistrationBean<CorrelationIdFilter> registration = new FilterRegistrationBean<>(new CorrelationIdFilter());
        registration.setOrder(Ordered.HIGHEST_PRECEDENCE);
        return registration;
    }
    
    public static class CorrelationIdFilter extends OncePerRequestFilter {
        
        public static final String CORRELATION_ID_HEADER = "X-Correlation-ID";
        private static final String MDC_CORRELATION_ID = "correlationId";
        private static final String MDC_REQUEST_PATH = "requestPath";
        private static final String MDC_REQUEST_METHOD = "requestMethod";
        
        @Override
        protected void doFilterInternal(
                HttpServletRequest request,
                HttpServletResponse response,
                FilterChain filterChain) throws ServletException, IOException {
            
            try {
                // Get or generate correlation ID
                String correlationId = request.getHeader(CORRELATION_ID_HEADER);
                if (correlationId == null || correlationId.isBlank()) {
                    correlationId = UUID.randomUUID().toString();
                }
                
                MDC.put(MDC_CORRELATION_ID, correlationId);
                MDC.put(MDC_REQUEST_PATH, request.getRequestURI());
                MDC.put(MDC_REQUEST_METHOD, request.getMethod());
                
                response.setHeader(CORRELATION_ID_HEADER, correlationId);
                
                filterChain.doFilter(request, response);
                
            } finally {
                MDC.remove(MDC_CORRELATION_ID);
                MDC.remove(MDC_REQUEST_PATH);
                MDC.remove(MDC_REQUEST_METHOD);
            }
        }
    }
}
