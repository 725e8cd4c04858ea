package ru.oparin.studiocrm.config;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import ru.oparin.studiocrm.config.properties.OidcProperties;
import ru.oparin.studiocrm.model.dto.auth.OidcProviderMetadata;

/**
 * Конфигурация кеширования для приложения.
 */
@Configuration
public class CacheConfig {

    /**
     * Кеш discovery-документов OIDC, ключ - issuer.
     */
    @Bean
    public Cache<String, OidcProviderMetadata> oidcDiscoveryCache(OidcProperties oidcProperties) {
        return Caffeine.newBuilder()
                .maximumSize(10)
                .expireAfterWrite(oidcProperties.getCacheTtl())
                .build();
    }
}
