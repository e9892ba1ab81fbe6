package com.example.presence.shared.config;

import com.example.presence.shared.util.Constants;
import org.slf4j.MDC;
import org.springframework.stereotype.Component;
import org.springframework.web.server.ServerWebExchange;
import org.springframework.web.server.WebFilter;
import org.springframework.web.server.WebFilterChain;
import reactor.core.publisher.Mono;

import java.util.UUID;

/**
 * Puts a correlation id on every inbound request (HTTP and the WebSocket upgrade),
 * echoes it back and exposes it to the Reactor context so it follows the pipeline.
 */
@Component
public class CorrelationIdFilter implements WebFilter {

    private static final String CORRELATION_ID_HEADER = "X-Correlation-ID";

    @Override
    public Mono<Void> filter(ServerWebExchange exchange, WebFilterChain chain) {
        String correlationId = exchange.getRequest().getHeaders().getFirst(CORRELATION_ID_HEADER);
        if (correlationId == null || correlationId.isBlank()) {
            correlationId = UUID.randomUUID().toString();
        }
        exchange.getResponse().getHeaders().set(CORRELATION_ID_HEADER, correlationId);

        final String id = correlationId;
        MDC.put(Constants.CORRELATION_ID_KEY, id);
        return chain.filter(exchange)
                .contextWrite(ctx -> ctx.put(Constants.CORRELATION_ID_KEY, id))
                .doFinally(signalType -> MDC.remove(Constants.CORRELATION_ID_KEY));
    }
}
