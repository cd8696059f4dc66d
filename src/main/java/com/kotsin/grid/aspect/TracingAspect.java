package com.kotsin.grid.aspect;

import lombok.extern.slf4j.Slf4j;
import org.aspectj.lang.ProceedingJoinPoint;
import org.aspectj.lang.annotation.Around;
import org.aspectj.lang.annotation.Aspect;
import org.springframework.stereotype.Component;

import java.util.Arrays;

/**
 * 🔍 Tracing Aspect for exchange order traffic
 *
 * Logs entry/exit with timing around every gateway order placement and cancel.
 */
@Aspect
@Component
@Slf4j
public class TracingAspect {

    private static final long SLOW_CALL_MS = 500;

    @Around("execution(* com.kotsin.grid.broker.MarketGateway+.placeOrder(..)) || "
            + "execution(* com.kotsin.grid.broker.MarketGateway+.cancelOrder(..))")
    public Object traceOrderTraffic(ProceedingJoinPoint joinPoint) throws Throwable {
        long start = System.currentTimeMillis();
        String method = joinPoint.getSignature().getName();

        log.debug("🔍 [TRACE_ORDER_START] method={} args={}", method, Arrays.toString(joinPoint.getArgs()));

        try {
            Object result = joinPoint.proceed();
            long duration = System.currentTimeMillis() - start;

            log.info("🔍 [TRACE_ORDER_END] method={} duration={}ms result={}", method, duration, result);
            if (duration > SLOW_CALL_MS) {
                log.warn("⚠️ [TRACE_ORDER_SLOW] method={} took {}ms (threshold: {}ms)", method, duration, SLOW_CALL_MS);
            }
            return result;
        } catch (Exception e) {
            long duration = System.currentTimeMillis() - start;
            log.error("🔍 [TRACE_ORDER_ERROR] method={} duration={}ms error={}", method, duration, e.getMessage());
            throw e;
        }
    }
}
