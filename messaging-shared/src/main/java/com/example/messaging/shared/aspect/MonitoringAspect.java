package com.example.messaging.shared.aspect;

import com.example.messaging.shared.config.MonitoringConfig;
import com.example.messaging.shared.exception.MessagingException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.aspectj.lang.ProceedingJoinPoint;
import org.aspectj.lang.annotation.Around;
import org.aspectj.lang.annotation.Aspect;
import org.aspectj.lang.reflect.MethodSignature;
import org.springframework.stereotype.Component;

import java.lang.reflect.Method;

@Aspect
@Component
@RequiredArgsConstructor
@Slf4j
public class MonitoringAspect {

    private final MonitoringConfig.MessagingMetricsCollector metricsCollector;

    @Around("@within(com.example.messaging.shared.aspect.Monitored) || @annotation(com.example.messaging.shared.aspect.Monitored)")
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

        try {
            Object result = joinPoint.proceed();
            long duration = System.currentTimeMillis() - startTime;

            metricsCollector.recordTimer("messaging." + operationType + ".latency", duration, "class", className, "method", methodName, "status", "success");
            metricsCollector.incrementCounter("messaging." + operationType + ".calls", "class", className, "method", methodName, "status", "success");

            log.debug("{}.{} ({}) completed in {}ms", className, methodName, operationType, duration);
            return result;
        } catch (Exception e) {
            long duration = System.currentTimeMillis() - startTime;
            String outcome = e instanceof MessagingException me ? me.getErrorCode().name() : "error";

            metricsCollector.recordTimer("messaging." + operationType + ".latency", duration, "class", className, "method", methodName, "status", outcome);
            metricsCollector.incrementCounter("messaging." + operationType + ".calls", "class", className, "method", methodName, "status", outcome);

            if (e instanceof MessagingException) {
                // Caller-facing domain errors, already reported by the caller
                log.debug("{}.{} ({}) rejected after {}ms: {}", className, methodName, operationType, duration, e.getMessage());
            } else {
                metricsCollector.incrementCounter("messaging.errors", "type", operationType, "class", className, "method", methodName);
                log.error("{}.{} ({}) failed after {}ms: {}", className, methodName, operationType, duration, e.getMessage());
            }
            throw e;
        }
    }
}
