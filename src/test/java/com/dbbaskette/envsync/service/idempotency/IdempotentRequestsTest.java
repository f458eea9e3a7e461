package com.dbbaskette.envsync.service.idempotency;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class IdempotentRequestsTest {

    record Outcome(String projectId, int written) {}

    private IdempotentRequests requests;

    @BeforeEach
    void setUp() {
        requests = new IdempotentRequests(
                new IdempotencyGate(new InMemoryIdempotencyStore(Clock.systemUTC()), true), new ObjectMapper());
    }

    @Test
    void checksumIgnoresMapOrder() {
        Map<String, Object> a = new LinkedHashMap<>();
        a.put("projectId", "demo");
        a.put("secretNames", List.of("API_KEY"));
        Map<String, Object> b = new LinkedHashMap<>();
        b.put("secretNames", List.of("API_KEY"));
        b.put("projectId", "demo");

        assertEquals(IdempotentRequests.checksumOf(a), IdempotentRequests.checksumOf(b));
        assertNotEquals(IdempotentRequests.checksumOf(a), IdempotentRequests.checksumOf(Map.of("projectId", "other")));
    }

    @Test
    void replayReturnsIdenticalJson() {
        AtomicInteger calls = new AtomicInteger();

        String first = requests.execute("k", Map.of("projectId", "demo"),
                () -> new Outcome("demo", calls.incrementAndGet()));
        String second = requests.execute("k", Map.of("projectId", "demo"),
                () -> new Outcome("demo", calls.incrementAndGet()));

        assertEquals(1, calls.get());
        assertEquals(first, second);
    }

    @Test
    void typedExecuteReadsStoredResult() {
        Outcome outcome = requests.execute("k", Map.of("projectId", "demo"), () -> new Outcome("demo", 3), Outcome.class);
        Outcome replay = requests.execute("k", Map.of("projectId", "demo"), () -> new Outcome("demo", 9), Outcome.class);

        assertEquals(new Outcome("demo", 3), outcome);
        assertEquals(outcome, replay);
    }
}
