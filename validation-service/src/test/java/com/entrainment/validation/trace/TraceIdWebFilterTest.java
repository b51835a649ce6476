package com.entrainment.validation.trace;

import com.entrainment.common.trace.TraceContextUtil;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.mock.http.server.reactive.MockServerHttpRequest;
import org.springframework.mock.web.server.MockServerWebExchange;
import org.springframework.web.server.WebFilterChain;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.*;

class TraceIdWebFilterTest {

    private final TraceIdWebFilter filter = new TraceIdWebFilter();

    @Test
    @DisplayName("caller's header → kept as the exchange id, echoed and put in context")
    void headerPropagated() {
        MockServerWebExchange exchange = MockServerWebExchange.from(
            MockServerHttpRequest.post("/api/v1/validate/session").header(TraceContextUtil.TRACE_HEADER, " trace-7 "));
        AtomicReference<String> seen = new AtomicReference<>();
        WebFilterChain chain = ex -> Mono.deferContextual(ctx -> {
            seen.set(TraceContextUtil.getTraceId(ctx));
            return Mono.empty();
        });

        StepVerifier.create(filter.filter(exchange, chain)).verifyComplete();

        assertEquals("trace-7", seen.get());
        assertEquals("trace-7", TraceIdWebFilter.traceId(exchange));
        assertEquals("trace-7", exchange.getResponse().getHeaders().getFirst(TraceContextUtil.TRACE_HEADER));
    }

    @Test
    @DisplayName("no header → one generated id for the whole exchange")
    void generatedOnce() {
        MockServerWebExchange exchange = MockServerWebExchange.from(MockServerHttpRequest.get("/api/v1/validate/health"));

        String first = TraceIdWebFilter.traceId(exchange);

        assertNotEquals(TraceContextUtil.UNKNOWN, first);
        assertEquals(first, TraceIdWebFilter.traceId(exchange));
    }
}
