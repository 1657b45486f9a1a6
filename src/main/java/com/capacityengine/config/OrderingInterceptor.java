package com.capacityengine.config;

import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.stereotype.Component;
import org.springframework.web.servlet.HandlerInterceptor;

import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Serializes state-changing requests so that operations are applied one at a time,
 * in the order they arrive.
 *
 * Read-only requests pass through without taking the lock.
 */
@Slf4j
@Component
public class OrderingInterceptor implements HandlerInterceptor {

    public static final String ACCOUNT_HEADER = "X-Account-Id";

    static final String SEQUENCE_KEY = "op_seq";
    static final String ACCOUNT_KEY = "account_id";
    private static final String LOCKED_ATTRIBUTE = OrderingInterceptor.class.getName() + ".locked";

    private final ReentrantLock lock = new ReentrantLock(true);
    private final AtomicLong sequence = new AtomicLong();

    @Override
    public boolean preHandle(HttpServletRequest request, HttpServletResponse response, Object handler) {
        String account = request.getHeader(ACCOUNT_HEADER);
        if (account != null && !account.isBlank()) {
            MDC.put(ACCOUNT_KEY, account);
        }
        if (isMutating(request.getMethod())) {
            lock.lock();
            request.setAttribute(LOCKED_ATTRIBUTE, Boolean.TRUE);
            long seq = sequence.incrementAndGet();
            MDC.put(SEQUENCE_KEY, Long.toString(seq));
            log.debug("Sequenced {} {} as #{}", request.getMethod(), request.getRequestURI(), seq);
        }
        return true;
    }

    @Override
    public void afterCompletion(HttpServletRequest request, HttpServletResponse response, Object handler,
                                Exception ex) {
        try {
            if (Boolean.TRUE.equals(request.getAttribute(LOCKED_ATTRIBUTE))) {
                request.removeAttribute(LOCKED_ATTRIBUTE);
                lock.unlock();
            }
        } finally {
            MDC.remove(SEQUENCE_KEY);
            MDC.remove(ACCOUNT_KEY);
        }
    }

    public long lastSequence() {
        return sequence.get();
    }

    private boolean isMutating(String method) {
        return "POST".equals(method) || "PUT".equals(method)
            || "DELETE".equals(method) || "PATCH".equals(method);
    }
}
