package ru.oparin.studiocrm.security;

import lombok.extern.slf4j.Slf4j;
import org.springframework.security.authentication.UsernamePasswordAuthenticationToken;
import org.springframework.security.core.authority.SimpleGrantedAuthority;
import org.springframework.security.core.context.ReactiveSecurityContextHolder;
import org.springframework.web.server.ServerWebExchange;
import org.springframework.web.server.WebFilter;
import org.springframework.web.server.WebFilterChain;
import reactor.core.publisher.Mono;
import ru.oparin.studiocrm.service.JwtService;
import ru.oparin.studiocrm.util.SessionTokenExtractor;

import java.util.List;
import java.util.Optional;

/**
 * Аутентификация запроса по сессионному токену.
 * Токен не продлевается: срок действия абсолютный.
 * Без валидного токена запрос идет дальше анонимным, а причина сохраняется в атрибуте
 * {@link #AUTH_FAILURE_ATTRIBUTE} для ответа 401.
 */
@Slf4j
public class JwtAuthenticationFilter implements WebFilter {

    public static final String AUTH_FAILURE_ATTRIBUTE = JwtAuthenticationFilter.class.getName() + ".FAILURE";

    private final JwtService jwtService;
    private final String cookieName;

    public JwtAuthenticationFilter(JwtService jwtService, String cookieName) {
        this.jwtService = jwtService;
        this.cookieName = cookieName;
    }

    @Override
    public Mono<Void> filter(ServerWebExchange exchange, WebFilterChain chain) {
        String token = SessionTokenExtractor.extractToken(exchange.getRequest(), cookieName);
        if (token == null) {
            exchange.getAttributes().put(AUTH_FAILURE_ATTRIBUTE, AuthFailure.MISSING_TOKEN);
            return chain.filter(exchange);
        }

        Optional<SessionClaim> claim = jwtService.verifyToken(token);
        if (claim.isEmpty()) {
            log.debug("Недействительный токен в запросе {}", exchange.getRequest().getPath());
            exchange.getAttributes().put(AUTH_FAILURE_ATTRIBUTE, AuthFailure.INVALID_OR_EXPIRED);
            return chain.filter(exchange);
        }

        SessionClaim session = claim.get();
        UsernamePasswordAuthenticationToken authentication = new UsernamePasswordAuthenticationToken(
                session, null, List.of(new SimpleGrantedAuthority("ROLE_" + session.getRole().name())));

        return chain.filter(exchange)
                .contextWrite(ReactiveSecurityContextHolder.withAuthentication(authentication));
    }
}
