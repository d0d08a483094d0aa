package io.devdash.dashboard.api;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.http.server.reactive.ServerHttpResponse;
import org.springframework.stereotype.Component;
import org.springframework.web.server.ServerWebExchange;
import reactor.core.publisher.Mono;

/**
 * Writes the error envelope. Every failure served to a client goes through here and is logged
 * with its code and message.
 */
@Component
public class ErrorResponses {
    private static final Logger log = LoggerFactory.getLogger(ErrorResponses.class);

    private final ObjectMapper objectMapper;

    public ErrorResponses(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public ResponseEntity<ErrorResponse> entity(HttpStatusCode status, String message) {
        ErrorResponse body = envelope(status, message);
        return ResponseEntity.status(status)
                .contentType(MediaType.APPLICATION_JSON)
                .body(body);
    }

    /**
     * Writes the envelope straight to the exchange, for callers running before any handler.
     */
    public Mono<Void> write(ServerWebExchange exchange, HttpStatusCode status, String message) {
        ErrorResponse body = envelope(status, message);
        ServerHttpResponse response = exchange.getResponse();
        response.setStatusCode(status);
        response.getHeaders().setContentType(MediaType.APPLICATION_JSON);

        byte[] bytes;
        try {
            bytes = objectMapper.writeValueAsBytes(body);
        } catch (JsonProcessingException e) {
            log.error("Encoding JSON error response failed", e);
            return response.setComplete();
        }
        return response.writeWith(Mono.just(response.bufferFactory().wrap(bytes)))
                .doOnError(e -> log.error("Writing JSON error response failed: {}", e.toString()));
    }

    private static ErrorResponse envelope(HttpStatusCode status, String message) {
        log.info("Unable to serve: code={} message={}", status.value(), message);
        return ErrorResponse.of(status.value(), message);
    }
}
