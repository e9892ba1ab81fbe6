package com.example.presence.shared.aspect;

import com.example.presence.shared.config.MonitoringConfig;
import com.example.presence.shared.util.Constants;
import io.opentelemetry.api.trace.Span;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.aspectj.lang.ProceedingJoinPoint;
import org.aspectj.lang.annotation.Around;
import org.aspectj.lang.annotation.Aspect;
import org.aspectj.lang.reflect.MethodSignature;
import org.slf4j.MDC;
import org.springframework.stereotype.Component;

import java.lang.reflect.Method;

@Aspect
@Component
@RequiredArgsConstructor
@Slf4j
public class MonitoringAspect {

    private final MonitoringConfig.PresenceMetricsCollector metricsCollector;

    @Around("@within(com.example.presence.shared.aspect.Monitored) || @annotation(com.example.presence.shared.aspect.Monitored)")
    public Object monitorMethod(ProceedingJoinPoint joinPoint) throws Throwable {
        MethodSignature signature = (MethodSignature) joinPoint.getSignature();
        Method method = signature.getMethod();

        // Method-level annotation overrides the class-level one
        Monitored monitored = method.getAnnotation(Monitored.class);
        if (monitored == null) {
            monitored = method.getDeclaringClass().getAnnotation(Monitored.class);
        }
        if (monitored == null) {
            return joinPoint.proceed();
        }

        String operationType = monitored.value();
        String className = joinPoint.getTarget().getClass().getSimpleName();
        String methodName = signature.getName();
        long startTime = System.currentTimeMillis();

        Span currentSpan = Span.current();
        String correlationId = MDC.get(Constants.CORRELATION_ID_KEY);
        if (currentSpan.getSpanContext().isValid() && correlationId != null) {
            currentSpan.setAttribute("app.correlation_id", correlationId);
        }

        try {
            Object result = joinPoint.proceed();
            long duration = System.currentTimeMillis() - startTime;
            metricsCollector.recordTimer("presence." + operationType + ".latency", duration, "class", className, "method", methodName, "status", "success");
            metricsCollector.incrementCounter("presence." + operationType + ".calls", "class", className, "method", methodName, "status", "success");
            log.debug("{}.{} ({}) completed in {}ms", className, methodName, operationType, duration);
            return result;
        } catch (Exception e) {
            long duration = System.currentTimeMillis() - startTime;
            metricsCollector.recordTimer("presence." + operationType + ".latency", duration, "class", className, "method", methodName, "status", "error");
            metricsCollector.incrementCounter("presence." + operationType + ".calls", "class", className, "method", methodName, "status", "error");
            metricsCollector.incrementCounter("presence.errors", "type", operationType, "class", className, "method", methodName);
            if (currentSpan.getSpanContext().isValid()) {
                currentSpan.recordException(e);
            }
            log.error("{}.{} ({}) failed after {}ms: {}", className, methodName, operationType, duration, e.getMessage());
            throw e;
        }
    }
}
