package ru.oparin.studiocrm.security;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * Причина, по которой запрос остался неаутентифицированным.
 * Обе причины дают клиенту один и тот же статус 401.
 */
@Getter
@RequiredArgsConstructor
public enum AuthFailure {

    MISSING_TOKEN("Требуется токен доступа"),
    INVALID_OR_EXPIRED("Недействительный или просроченный токен");

    private final String message;
}
