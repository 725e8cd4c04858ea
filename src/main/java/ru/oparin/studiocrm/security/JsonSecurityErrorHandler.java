package ru.oparin.studiocrm.security;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.io.buffer.DataBuffer;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.server.reactive.ServerHttpResponse;
import org.springframework.security.access.AccessDeniedException;
import org.springframework.security.core.AuthenticationException;
import org.springframework.security.web.server.ServerAuthenticationEntryPoint;
import org.springframework.security.web.server.authorization.ServerAccessDeniedHandler;
import org.springframework.web.server.ServerWebExchange;
import reactor.core.publisher.Mono;

import java.util.Map;

/**
 * JSON-ответы 401 и 403 для отказов на уровне Spring Security,
 * в том же формате, что и у {@link ru.oparin.studiocrm.exception.GlobalExceptionHandler}.
 */
@Slf4j
@RequiredArgsConstructor
public class JsonSecurityErrorHandler implements ServerAuthenticationEntryPoint, ServerAccessDeniedHandler {

    private final ObjectMapper objectMapper;

    @Override
    public Mono<Void> commence(ServerWebExchange exchange, AuthenticationException ex) {
        AuthFailure failure = exchange.getAttributeOrDefault(
                JwtAuthenticationFilter.AUTH_FAILURE_ATTRIBUTE, AuthFailure.MISSING_TOKEN);
        log.warn("Отказ в доступе без аутентификации: {} {}", exchange.getRequest().getPath(), failure);
        return write(exchange, HttpStatus.UNAUTHORIZED, failure.getMessage());
    }

    @Override
    public Mono<Void> handle(ServerWebExchange exchange, AccessDeniedException denied) {
        log.warn("Недостаточно прав: {}", exchange.getRequest().getPath());
        return write(exchange, HttpStatus.FORBIDDEN, "Недостаточно прав");
    }

    private Mono<Void> write(ServerWebExchange exchange, HttpStatus status, String message) {
        ServerHttpResponse response = exchange.getResponse();
        response.setStatusCode(status);
        response.getHeaders().setContentType(MediaType.APPLICATION_JSON);
        byte[] body;
        try {
            body = objectMapper.writeValueAsBytes(Map.of("error", message, "status", status.value()));
        } catch (JsonProcessingException e) {
            return Mono.error(e);
        }
        DataBuffer buffer = response.bufferFactory().wrap(body);
        return response.writeWith(Mono.just(buffer));
    }
}
