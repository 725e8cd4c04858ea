package ru.oparin.studiocrm.exception;

import lombok.Getter;
import org.springframework.http.HttpStatus;

/**
 * Отказ в аутентификации или авторизации: 401, 403, 404, 409.
 */
public class AuthException extends RuntimeException {
    @Getter
    private final HttpStatus status;

    public AuthException(HttpStatus status, String message) {
        super(message);
        this.status = status;
    }

    public static AuthException unauthenticated() {
        return new AuthException(HttpStatus.UNAUTHORIZED, "Требуется аутентификация");
    }
}
