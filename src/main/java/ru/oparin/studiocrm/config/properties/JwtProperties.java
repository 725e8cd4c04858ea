package ru.oparin.studiocrm.config.properties;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

@Getter
@Setter
@Configuration
@ConfigurationProperties(prefix = "app.jwt")
public class JwtProperties {

    /**
     * Секрет подписи HMAC. Не короче 32 байт.
     */
    private String secret;

    /**
     * Срок действия токена. Продления нет, поэтому срок должен быть ограничен.
     */
    private Duration expiration = Duration.ofDays(7);

    /**
     * Имя cookie с сессионным токеном.
     */
    private String cookieName = "token";

    /**
     * Выставлять ли cookie только для HTTPS.
     */
    private boolean secureCookie = true;
}
