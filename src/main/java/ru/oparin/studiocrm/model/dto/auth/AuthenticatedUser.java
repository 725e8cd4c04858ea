package ru.oparin.studiocrm.model.dto.auth;

import lombok.Value;
import ru.oparin.studiocrm.model.entity.User;

/**
 * Результат успешного входа: найденный пользователь и выпущенный для него токен.
 */
@Value
public class AuthenticatedUser {

    User user;
    String token;
}
