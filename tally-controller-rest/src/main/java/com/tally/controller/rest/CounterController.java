package com.tally.controller.rest;

import com.tally.api.dto.IncrementRequest;
import com.tally.service.core.counter.CounterIngestService;
import com.tally.service.core.counter.CounterStore;
import com.tally.service.core.counter.CounterType;
import jakarta.validation.Valid;
import java.time.Clock;
import java.time.Instant;
import java.util.Map;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/counters")
public class CounterController {

    private final CounterStore counterStore;
    private final CounterIngestService ingestService;
    private final Clock clock;

    public CounterController(CounterStore counterStore, CounterIngestService ingestService, Clock clock) {
        this.counterStore = counterStore;
        this.ingestService = ingestService;
        this.clock = clock;
    }

    /** Writes straight through to the daily tier. */
    @PostMapping("/increment")
    public Map<String, Object> increment(@Valid @RequestBody IncrementRequest request) {
        CounterType type = CounterType.fromValue(request.type());
        Instant at = request.timestamp() != null ? request.timestamp() : Instant.now(clock);
        counterStore.increment(request.subjectId(), request.scopeId(), type, at, request.effectiveDelta());
        return Map.of("status", "ok", "type", type.name());
    }

    /** Buffers the event; it reaches the store on the next flush. */
    @PostMapping("/record")
    @ResponseStatus(HttpStatus.ACCEPTED)
    public Map<String, Object> record(@Valid @RequestBody IncrementRequest request) {
        CounterType type = CounterType.fromValue(request.type());
        ingestService.record(
                request.subjectId(), request.scopeId(), type, request.timestamp(), request.effectiveDelta());
        return Map.of("status", "accepted", "type", type.name());
    }
}
