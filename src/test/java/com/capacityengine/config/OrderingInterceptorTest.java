package com.capacityengine.config;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;
import org.springframework.mock.web.MockHttpServletRequest;
import org.springframework.mock.web.MockHttpServletResponse;

import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

import static org.junit.jupiter.api.Assertions.*;

class OrderingInterceptorTest {

    private final OrderingInterceptor interceptor = new OrderingInterceptor();
    private final MockHttpServletResponse response = new MockHttpServletResponse();

    @AfterEach
    void clearMdc() {
        MDC.clear();
    }

    @Test
    void testMutatingRequestsAreSequenced() {
        MockHttpServletRequest request = new MockHttpServletRequest("POST", "/api/v1/auctions/0/bids");
        request.addHeader(OrderingInterceptor.ACCOUNT_HEADER, "alice");

        assertTrue(interceptor.preHandle(request, response, new Object()));
        assertEquals("1", MDC.get(OrderingInterceptor.SEQUENCE_KEY));
        assertEquals("alice", MDC.get(OrderingInterceptor.ACCOUNT_KEY));

        interceptor.afterCompletion(request, response, new Object(), null);
        assertNull(MDC.get(OrderingInterceptor.SEQUENCE_KEY));
        assertNull(MDC.get(OrderingInterceptor.ACCOUNT_KEY));
        assertEquals(1, interceptor.lastSequence());
    }

    @Test
    void testReadsAreNotSequenced() {
        MockHttpServletRequest request = new MockHttpServletRequest("GET", "/api/v1/auctions");

        interceptor.preHandle(request, response, new Object());
        interceptor.afterCompletion(request, response, new Object(), null);

        assertEquals(0, interceptor.lastSequence());
    }

    @Test
    void testSecondWriterWaitsForFirst() throws Exception {
        MockHttpServletRequest first = new MockHttpServletRequest("POST", "/api/v1/lifetime");
        interceptor.preHandle(first, response, new Object());

        CountDownLatch entered = new CountDownLatch(1);
        AtomicBoolean secondRan = new AtomicBoolean();
        Thread writer = new Thread(() -> {
            MockHttpServletRequest second = new MockHttpServletRequest("DELETE", "/api/v1/lifetime/0");
            interceptor.preHandle(second, new MockHttpServletResponse(), new Object());
            secondRan.set(true);
            entered.countDown();
            interceptor.afterCompletion(second, new MockHttpServletResponse(), new Object(), null);
        });
        writer.start();

        assertFalse(entered.await(200, TimeUnit.MILLISECONDS));
        assertFalse(secondRan.get());

        interceptor.afterCompletion(first, response, new Object(), null);

        assertTrue(entered.await(5, TimeUnit.SECONDS));
        writer.join(5_000);
        assertEquals(2, interceptor.lastSequence());
    }
}
