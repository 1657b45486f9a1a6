package com.capacityengine.api.controller;

import com.capacityengine.support.MutableClock;
import com.capacityengine.support.TestClockConfig;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.context.annotation.Import;
import org.springframework.http.MediaType;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.transaction.annotation.Transactional;

import java.time.Duration;

import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

/**
 * End-to-end tests through the REST API.
 */
@SpringBootTest
@AutoConfigureMockMvc
@ActiveProfiles("test")
@Transactional
@Import(TestClockConfig.class)
class CapacityApiIntegrationTest {

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private MutableClock clock;

    @BeforeEach
    void setUp() throws Exception {
        clock.set(TestClockConfig.START);
        mockMvc.perform(post("/api/v1/wallets")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"accountId\":\"alice\",\"initialBalance\":1000}"))
            .andExpect(status().isCreated());
    }

    @Test
    void testLockCallAndUnlock() throws Exception {
        mockMvc.perform(post("/api/v1/lifetime")
                .header("X-Account-Id", "alice")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"amount\":500}"))
            .andExpect(status().isCreated())
            .andExpect(jsonPath("$.localId").value(0))
            .andExpect(jsonPath("$.mode.parameter").value(50000))
            .andExpect(jsonPath("$.lockBacked").value(true));

        clock.advance(Duration.ofSeconds(20));

        mockMvc.perform(get("/api/v1/subscriptions/alice/0/status"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.active").value(true))
            .andExpect(jsonPath("$.freeWeight").value(35476));

        mockMvc.perform(post("/api/v1/subscriptions/alice/0/call")
                .header("X-Account-Id", "alice")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"operation\":\"remark\",\"payload\":\"hi\"}"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.status").value("EXEMPT"))
            .andExpect(jsonPath("$.success").value(true));

        mockMvc.perform(post("/api/v1/subscriptions/alice/0/call")
                .header("X-Account-Id", "alice")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"operation\":\"remark\",\"payload\":\"again\"}"))
            .andExpect(status().isTooManyRequests())
            .andExpect(jsonPath("$.code").value("QUOTA_EXHAUSTED"));

        mockMvc.perform(delete("/api/v1/lifetime/0").header("X-Account-Id", "alice"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.refunded").value(500));

        mockMvc.perform(get("/api/v1/wallets/alice"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.freeBalance").value(1000));
    }

    @Test
    void testAmbientDispatchFallsBackToFee() throws Exception {
        mockMvc.perform(post("/api/v1/lifetime")
                .header("X-Account-Id", "alice")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"amount\":500}"))
            .andExpect(status().isCreated());

        mockMvc.perform(post("/api/v1/dispatch")
                .header("X-Account-Id", "alice")
                .header("X-Subscription-Owner", "alice")
                .header("X-Subscription-Id", "0")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"operation\":\"remark\",\"payload\":\"hi\"}"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.status").value("REJECTED"))
            .andExpect(jsonPath("$.executed").value(false))
            .andExpect(jsonPath("$.rejectionCode").value("QUOTA_EXHAUSTED"));

        mockMvc.perform(post("/api/v1/dispatch")
                .header("X-Account-Id", "alice")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"operation\":\"remark\",\"payload\":\"hi\"}"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.status").value("CHARGED"))
            .andExpect(jsonPath("$.executed").value(true));
    }

    @Test
    void testHalfSpecifiedSubscriptionHeadersAreRejected() throws Exception {
        mockMvc.perform(post("/api/v1/dispatch")
                .header("X-Account-Id", "alice")
                .header("X-Subscription-Owner", "alice")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"operation\":\"remark\"}"))
            .andExpect(status().isBadRequest());
    }

    @Test
    void testUnsignedLockIsForbidden() throws Exception {
        mockMvc.perform(post("/api/v1/lifetime")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"amount\":500}"))
            .andExpect(status().isForbidden())
            .andExpect(jsonPath("$.code").value("BAD_ORIGIN"));
    }

    @Test
    void testGrantAndListDelegates() throws Exception {
        mockMvc.perform(post("/api/v1/lifetime")
                .header("X-Account-Id", "alice")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"amount\":500}"))
            .andExpect(status().isCreated());

        mockMvc.perform(post("/api/v1/subscriptions/0/grants")
                .header("X-Account-Id", "alice")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"delegate\":\"bob\"}"))
            .andExpect(status().isCreated())
            .andExpect(jsonPath("$.delegate").value("bob"));

        mockMvc.perform(get("/api/v1/subscriptions/alice/0/grants"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.length()").value(1));

        mockMvc.perform(post("/api/v1/subscriptions/0/grants")
                .header("X-Account-Id", "bob")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"delegate\":\"mallory\"}"))
            .andExpect(status().isNotFound());
    }
}
