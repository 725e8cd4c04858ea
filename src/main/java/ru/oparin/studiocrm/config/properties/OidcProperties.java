package ru.oparin.studiocrm.config.properties;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

@Getter
@Setter
@Configuration
@ConfigurationProperties(prefix = "app.oidc")
public class OidcProperties {

    /**
     * Issuer провайдера OAuth/OIDC, по нему строится адрес discovery-документа.
     */
    private String issuer = "https://accounts.google.com";

    /**
     * Время жизни закэшированного discovery-документа.
     */
    private Duration cacheTtl = Duration.ofHours(1);
}
