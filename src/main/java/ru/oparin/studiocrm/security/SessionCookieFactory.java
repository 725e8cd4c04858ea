package ru.oparin.studiocrm.security;

import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseCookie;
import org.springframework.stereotype.Component;
import ru.oparin.studiocrm.config.properties.JwtProperties;

import java.time.Duration;

/**
 * Сессионная cookie: HttpOnly, SameSite=Lax, живет столько же, сколько токен.
 */
@Component
@RequiredArgsConstructor
public class SessionCookieFactory {

    private final JwtProperties jwtProperties;

    public ResponseCookie create(String token) {
        return base(token)
                .maxAge(jwtProperties.getExpiration())
                .build();
    }

    /**
     * Cookie, удаляющая сессию в браузере. На сервере удалять нечего.
     */
    public ResponseCookie clear() {
        return base("")
                .maxAge(Duration.ZERO)
                .build();
    }

    private ResponseCookie.ResponseCookieBuilder base(String value) {
        return ResponseCookie.from(jwtProperties.getCookieName(), value)
                .httpOnly(true)
                .secure(jwtProperties.isSecureCookie())
                .sameSite("Lax")
                .path("/");
    }
}
