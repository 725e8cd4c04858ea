package ru.oparin.studiocrm.util;

import lombok.experimental.UtilityClass;
import org.springframework.http.HttpCookie;
import org.springframework.http.HttpHeaders;
import org.springframework.http.server.reactive.ServerHttpRequest;

/**
 * Извлечение сессионного токена из запроса.
 * Cookie имеет приоритет над заголовком Authorization.
 */
@UtilityClass
public class SessionTokenExtractor {

    private static final String BEARER_PREFIX = "Bearer ";

    /**
     * @param request входящий запрос
     * @param cookieName имя сессионной cookie
     * @return токен или null, если его нет ни в cookie, ни в заголовке
     */
    public static String extractToken(ServerHttpRequest request, String cookieName) {
        HttpCookie cookie = request.getCookies().getFirst(cookieName);
        if (cookie != null && !cookie.getValue().isBlank()) {
            return cookie.getValue();
        }

        String authHeader = request.getHeaders().getFirst(HttpHeaders.AUTHORIZATION);
        if (authHeader != null && authHeader.startsWith(BEARER_PREFIX)) {
            String token = authHeader.substring(BEARER_PREFIX.length()).trim();
            return token.isEmpty() ? null : token;
        }
        return null;
    }
}
