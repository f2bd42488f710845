package com.agentbox.backend.common;

import jakarta.servlet.http.HttpServletRequest;
import lombok.extern.slf4j.Slf4j;
import org.aspectj.lang.ProceedingJoinPoint;
import org.aspectj.lang.annotation.Around;
import org.aspectj.lang.annotation.Aspect;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Component;
import org.springframework.web.context.request.RequestContextHolder;
import org.springframework.web.context.request.ServletRequestAttributes;
import com.agentbox.backend.exception.AppException;

import java.util.Set;

/**
 * One log line per annotated endpoint call. Request bodies are not logged since they carry
 * callback secrets and channel tokens; credential headers are reduced to their presence.
 */
@Aspect
@Component
@Slf4j
public class LogApiAspect {
    private static final Set<String> SENSITIVE_HEADERS = Set.of("authorization", "x-callback-token");

    @Around("@annotation(com.agentbox.backend.common.LogApi)")
    public Object logApiCall(ProceedingJoinPoint joinPoint) throws Throwable {
        long start = System.nanoTime();

        ServletRequestAttributes attributes = (ServletRequestAttributes) RequestContextHolder.getRequestAttributes();
        HttpServletRequest httpServletRequest = attributes == null ? null : attributes.getRequest();

        String endpoint = httpServletRequest == null ? joinPoint.getSignature().toShortString() : httpServletRequest.getRequestURI();
        String httpMethod = httpServletRequest == null ? "-" : httpServletRequest.getMethod();
        String credentials = httpServletRequest == null ? "" : describeCredentials(httpServletRequest);

        int responseStatus = HttpStatus.OK.value();
        try {
            return joinPoint.proceed();
        } catch (AppException e) {
            responseStatus = e.getErrorCode().getStatusCode().value();
            throw e;
        } catch (Exception e) {
            responseStatus = HttpStatus.INTERNAL_SERVER_ERROR.value();
            throw e;
        } finally {
            long tookMs = (System.nanoTime() - start) / 1_000_000;
            log.info("API {} {} -> {} in {}ms ip={}{}", httpMethod, endpoint, responseStatus, tookMs,
                    httpServletRequest == null ? "-" : getClientIp(httpServletRequest), credentials);
        }
    }

    private String describeCredentials(HttpServletRequest request) {
        StringBuilder sb = new StringBuilder();
        for (String header : SENSITIVE_HEADERS) {
            if (request.getHeader(header) != null) sb.append(' ').append(header).append("=***");
        }
        return sb.toString();
    }

    private String getClientIp(HttpServletRequest request) {
        String ip = request.getHeader("X-Forwarded-For");
        if (ip == null || ip.isEmpty() || "unknown".equalsIgnoreCase(ip)) {
            ip = request.getHeader("X-Real-IP");
        }
        if (ip == null || ip.isEmpty() || "unknown".equalsIgnoreCase(ip)) {
            ip = request.getRemoteAddr();
        }
        return ip;
    }
}
