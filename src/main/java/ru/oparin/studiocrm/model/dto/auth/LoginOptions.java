package ru.oparin.studiocrm.model.dto.auth;

import lombok.Value;

/**
 * Параметры диспетчеризации входа: роль обязательна всегда, студия - для клиентов.
 */
@Value
public class LoginOptions {

    String role;
    String photographerId;
}
