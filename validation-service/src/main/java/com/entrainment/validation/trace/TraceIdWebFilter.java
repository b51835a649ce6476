package com.entrainment.validation.trace;

import com.entrainment.common.trace.TraceContextUtil;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;
import org.springframework.web.server.ServerWebExchange;
import org.springframework.web.server.WebFilter;
import org.springframework.web.server.WebFilterChain;
import reactor.core.publisher.Mono;

/**
 * Resolves the request trace id once per exchange.
 *
 * <p>The id is taken from {@code X-Trace-Id} or generated, stored as an exchange
 * attribute, echoed on the response and written into the Reactor Context. Controllers
 * and the exception handler read it back through {@link #traceId(ServerWebExchange)}.
 */
@Component
@Order(Ordered.HIGHEST_PRECEDENCE)
public class TraceIdWebFilter implements WebFilter {

    public static final String TRACE_ID_ATTRIBUTE = TraceIdWebFilter.class.getName() + ".traceId";

    @Override
    public Mono<Void> filter(ServerWebExchange exchange, WebFilterChain chain) {
        String traceId = traceId(exchange);
        exchange.getResponse().getHeaders().set(TraceContextUtil.TRACE_HEADER, traceId);
        return chain.filter(exchange)
            .contextWrite(ctx -> ctx.put(TraceContextUtil.TRACE_ID_KEY, traceId));
    }

    /** @return the exchange's trace id, resolving and storing it on first access */
    public static String traceId(ServerWebExchange exchange) {
        Object stored = exchange.getAttributes().computeIfAbsent(TRACE_ID_ATTRIBUTE, key ->
            TraceContextUtil.resolve(exchange.getRequest().getHeaders().getFirst(TraceContextUtil.TRACE_HEADER)));
        return (String) stored;
    }
}
