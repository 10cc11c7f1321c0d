package com.tally.controller.rest;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.tally.service.core.counter.CounterIngestService;
import com.tally.service.core.counter.CounterStore;
import com.tally.service.core.counter.CounterType;
import com.tally.service.core.support.IntegrityViolationException;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

class CounterControllerTest {

    private static final Instant NOW = Instant.parse("2024-05-10T12:00:00Z");

    private CounterStore counterStore;
    private CounterIngestService ingestService;
    private MockMvc mvc;

    @BeforeEach
    void setUp() {
        counterStore = mock(CounterStore.class);
        ingestService = mock(CounterIngestService.class);
        CounterController controller =
                new CounterController(counterStore, ingestService, Clock.fixed(NOW, ZoneOffset.UTC));
        mvc = MockMvcBuilders.standaloneSetup(controller)
                .setControllerAdvice(new RestErrorHandler())
                .build();
    }

    @Test
    void incrementWritesThroughWithDefaults() throws Exception {
        mvc.perform(post("/api/counters/increment")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"subjectId\":7,\"scopeId\":9,\"type\":\"hunt\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.type").value("HUNT"));

        verify(counterStore).increment(7L, 9L, CounterType.HUNT, NOW, 1L);
    }

    @Test
    void incrementAcceptsLegacyCodesAndExplicitDelta() throws Exception {
        mvc.perform(post("/api/counters/increment")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"subjectId\":7,\"scopeId\":9,\"type\":\"3\","
                                + "\"timestamp\":\"2024-05-01T09:00:00Z\",\"delta\":5}"))
                .andExpect(status().isOk());

        verify(counterStore).increment(7L, 9L, CounterType.BATTLE, Instant.parse("2024-05-01T09:00:00Z"), 5L);
    }

    @Test
    void unknownCounterTypeIsBadRequest() throws Exception {
        mvc.perform(post("/api/counters/increment")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"subjectId\":7,\"scopeId\":9,\"type\":\"fishing\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.status").value(400))
                .andExpect(jsonPath("$.path").value("/api/counters/increment"));

        verifyNoInteractions(counterStore);
    }

    @Test
    void missingSubjectIsBadRequest() throws Exception {
        mvc.perform(post("/api/counters/increment")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"scopeId\":9,\"type\":\"count\"}"))
                .andExpect(status().isBadRequest());
    }

    @Test
    void zeroOrNegativeDeltaIsBadRequest() throws Exception {
        for (String delta : new String[] {"0", "-3"}) {
            mvc.perform(post("/api/counters/increment")
                            .contentType(MediaType.APPLICATION_JSON)
                            .content("{\"subjectId\":7,\"scopeId\":9,\"type\":\"count\",\"delta\":" + delta + "}"))
                    .andExpect(status().isBadRequest());
            mvc.perform(post("/api/counters/record")
                            .contentType(MediaType.APPLICATION_JSON)
                            .content("{\"subjectId\":7,\"scopeId\":9,\"type\":\"count\",\"delta\":" + delta + "}"))
                    .andExpect(status().isBadRequest());
        }

        verifyNoInteractions(counterStore, ingestService);
    }

    @Test
    void unknownSubjectIsConflict() throws Exception {
        doThrow(new IntegrityViolationException("Counter increment violated a store constraint", null))
                .when(counterStore)
                .increment(anyLong(), anyLong(), any(), any(), anyLong());

        mvc.perform(post("/api/counters/increment")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"subjectId\":404,\"scopeId\":9,\"type\":\"count\"}"))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.error").value("Conflict"));
    }

    @Test
    void recordIsBuffered() throws Exception {
        mvc.perform(post("/api/counters/record")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"subjectId\":1,\"scopeId\":2,\"type\":\"message\"}"))
                .andExpect(status().isAccepted());

        verify(ingestService).record(1L, 2L, CounterType.MESSAGE, null, 1L);
        verifyNoInteractions(counterStore);
    }
}
