package com.pmsuite.orchestrator.exception;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.pmsuite.orchestrator.security.HeaderConstants;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.web.reactive.error.ErrorWebExceptionHandler;
import org.springframework.core.annotation.Order;
import org.springframework.core.io.buffer.DataBuffer;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.bind.support.WebExchangeBindException;
import org.springframework.web.server.ResponseStatusException;
import org.springframework.web.server.ServerWebExchange;
import reactor.core.publisher.Mono;

import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Global Exception Handler for the Orchestrator
 *
 * Provides consistent error response format across all orchestrator errors:
 * {timestamp, status, error, code, message, path}.
 *
 * Backend errors are the exception: a non-2xx answer from a backend is
 * passed through with the backend's own status and body.
 */
@Slf4j
@Component
@Order(-2)
public class GlobalExceptionHandler implements ErrorWebExceptionHandler {

    private final ObjectMapper objectMapper;

    public GlobalExceptionHandler(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    @Override
    public Mono<Void> handle(ServerWebExchange exchange, Throwable ex) {
        if (exchange.getResponse().isCommitted()) {
            return Mono.error(ex);
        }

        if (ex instanceof ProxyException proxyException
                && proxyException.getType() == ProxyException.ProxyErrorType.BACKEND_ERROR) {
            return passThrough(exchange, proxyException);
        }

        HttpStatusCode status;
        String code;
        String message;

        if (ex instanceof AuthException authException) {
            status = HttpStatus.UNAUTHORIZED;
            code = authException.getType().name();
            message = ex.getMessage();
            exchange.getResponse().getHeaders().add(HeaderConstants.AUTH_ERROR, message);
        } else if (ex instanceof UnauthorizedException) {
            status = HttpStatus.UNAUTHORIZED;
            code = "UNAUTHORIZED";
            message = ex.getMessage();
            exchange.getResponse().getHeaders().add(HeaderConstants.AUTH_ERROR, message);
        } else if (ex instanceof AuthorizationException authorizationException) {
            status = HttpStatus.FORBIDDEN;
            code = authorizationException.getType().name();
            message = ex.getMessage();
        } else if (ex instanceof ProxyException proxyException) {
            status = proxyException.getType() == ProxyException.ProxyErrorType.TIMEOUT
                    ? HttpStatus.GATEWAY_TIMEOUT
                    : HttpStatus.BAD_GATEWAY;
            code = proxyException.getType().name();
            message = proxyException.getType() == ProxyException.ProxyErrorType.TRUST_REJECTED
                    ? "Backend service rejected the gateway"
                    : ex.getMessage();
        } else if (ex instanceof AggregateUnavailableException) {
            status = HttpStatus.SERVICE_UNAVAILABLE;
            code = "AGGREGATE_UNAVAILABLE";
            message = ex.getMessage();
        } else if (ex instanceof InvalidStateException) {
            status = HttpStatus.CONFLICT;
            code = "INVALID_STATE";
            message = ex.getMessage();
        } else if (ex instanceof ConflictException) {
            status = HttpStatus.CONFLICT;
            code = "CONFLICT";
            message = ex.getMessage();
        } else if (ex instanceof NotFoundException) {
            status = HttpStatus.NOT_FOUND;
            code = "NOT_FOUND";
            message = ex.getMessage();
        } else if (ex instanceof TooManyRequestsException tooManyRequests) {
            status = HttpStatus.TOO_MANY_REQUESTS;
            code = "TOO_MANY_REQUESTS";
            message = ex.getMessage();
            exchange.getResponse().getHeaders()
                    .add(HttpHeaders.RETRY_AFTER, String.valueOf(tooManyRequests.getRetryAfter().getSeconds()));
        } else if (ex instanceof WebExchangeBindException bindException) {
            status = HttpStatus.BAD_REQUEST;
            code = "VALIDATION_FAILED";
            message = bindException.getFieldErrors().stream()
                    .map(error -> error.getField() + ": " + error.getDefaultMessage())
                    .collect(Collectors.joining("; "));
        } else if (ex instanceof ResponseStatusException rse) {
            status = rse.getStatusCode();
            code = statusName(status);
            message = rse.getReason();
        } else {
            status = HttpStatus.INTERNAL_SERVER_ERROR;
            code = "INTERNAL_ERROR";
            message = "An unexpected error occurred";
            log.error("Unhandled exception in orchestrator", ex);
        }

        exchange.getResponse().setStatusCode(status);
        exchange.getResponse().getHeaders().setContentType(MediaType.APPLICATION_JSON);

        Map<String, Object> errorResponse = new LinkedHashMap<>();
        errorResponse.put("timestamp", Instant.now().toString());
        errorResponse.put("status", status.value());
        errorResponse.put("error", reasonPhrase(status));
        errorResponse.put("code", code);
        errorResponse.put("message", message);
        errorResponse.put("path", exchange.getRequest().getURI().getPath());

        try {
            byte[] bytes = objectMapper.writeValueAsBytes(errorResponse);
            DataBuffer buffer = exchange.getResponse().bufferFactory().wrap(bytes);
            return exchange.getResponse().writeWith(Mono.just(buffer));
        } catch (JsonProcessingException e) {
            log.error("Error serializing error response", e);
            return exchange.getResponse().setComplete();
        }
    }

    private Mono<Void> passThrough(ServerWebExchange exchange, ProxyException ex) {
        String body = ex.getResponseBody() == null ? "" : ex.getResponseBody();
        exchange.getResponse().setStatusCode(HttpStatusCode.valueOf(ex.getStatusCode()));
        exchange.getResponse().getHeaders().setContentType(looksLikeJson(body)
                ? MediaType.APPLICATION_JSON
                : MediaType.TEXT_PLAIN);

        DataBuffer buffer = exchange.getResponse().bufferFactory().wrap(body.getBytes(StandardCharsets.UTF_8));
        return exchange.getResponse().writeWith(Mono.just(buffer));
    }

    private static boolean looksLikeJson(String body) {
        String trimmed = body.trim();
        return trimmed.startsWith("{") || trimmed.startsWith("[");
    }

    private static String reasonPhrase(HttpStatusCode status) {
        HttpStatus known = HttpStatus.resolve(status.value());
        return known != null ? known.getReasonPhrase() : String.valueOf(status.value());
    }

    private static String statusName(HttpStatusCode status) {
        HttpStatus known = HttpStatus.resolve(status.value());
        return known != null ? known.name() : "HTTP_" + status.value();
    }
}
