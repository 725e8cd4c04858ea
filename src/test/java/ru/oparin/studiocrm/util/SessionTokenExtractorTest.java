package ru.oparin.studiocrm.util;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpCookie;
import org.springframework.http.HttpHeaders;
import org.springframework.mock.http.server.reactive.MockServerHttpRequest;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("SessionTokenExtractor")
class SessionTokenExtractorTest {

    @Test
    @DisplayName("берет токен из cookie")
    void fromCookie() {
        MockServerHttpRequest request = MockServerHttpRequest.get("/auth/me")
                .cookie(new HttpCookie("token", "cookie-token"))
                .build();

        assertThat(SessionTokenExtractor.extractToken(request, "token")).isEqualTo("cookie-token");
    }

    @Test
    @DisplayName("берет токен из заголовка Bearer")
    void fromBearerHeader() {
        MockServerHttpRequest request = MockServerHttpRequest.get("/auth/me")
                .header(HttpHeaders.AUTHORIZATION, "Bearer header-token")
                .build();

        assertThat(SessionTokenExtractor.extractToken(request, "token")).isEqualTo("header-token");
    }

    @Test
    @DisplayName("cookie важнее заголовка")
    void cookieWins() {
        MockServerHttpRequest request = MockServerHttpRequest.get("/auth/me")
                .cookie(new HttpCookie("token", "cookie-token"))
                .header(HttpHeaders.AUTHORIZATION, "Bearer header-token")
                .build();

        assertThat(SessionTokenExtractor.extractToken(request, "token")).isEqualTo("cookie-token");
    }

    @Test
    @DisplayName("другие схемы и пустые значения не считаются токеном")
    void nothingUsable() {
        assertThat(SessionTokenExtractor.extractToken(MockServerHttpRequest.get("/").build(), "token")).isNull();
        assertThat(SessionTokenExtractor.extractToken(MockServerHttpRequest.get("/")
                .header(HttpHeaders.AUTHORIZATION, "Basic dXNlcjpwYXNz").build(), "token")).isNull();
        assertThat(SessionTokenExtractor.extractToken(MockServerHttpRequest.get("/")
                .header(HttpHeaders.AUTHORIZATION, "Bearer   ").build(), "token")).isNull();
        assertThat(SessionTokenExtractor.extractToken(MockServerHttpRequest.get("/")
                .cookie(new HttpCookie("session", "other")).build(), "token")).isNull();
    }
}
