package ru.oparin.studiocrm.model.enums;

import java.util.Arrays;
import java.util.Optional;

/**
 * Роли пользователей системы.
 */
public enum Role {

    /**
     * Владелец студии (арендатор).
     */
    PHOTOGRAPHER,

    /**
     * Клиент конкретного фотографа. Всегда привязан к арендатору.
     */
    CLIENT,

    /**
     * Администратор платформы. Не привязан ни к одному арендатору.
     */
    ADMIN;

    /**
     * Разбирает строковое значение роли без исключений.
     *
     * @param value строка из запроса или токена
     * @return роль, либо пустой Optional для неизвестного значения
     */
    public static Optional<Role> fromValue(String value) {
        if (value == null) {
            return Optional.empty();
        }
        return Arrays.stream(values())
                .filter(role -> role.name().equals(value))
                .findFirst();
    }
}
