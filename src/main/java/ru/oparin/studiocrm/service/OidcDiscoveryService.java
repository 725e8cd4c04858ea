package ru.oparin.studiocrm.service;

import com.github.benmanes.caffeine.cache.Cache;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;
import ru.oparin.studiocrm.config.properties.OidcProperties;
import ru.oparin.studiocrm.model.dto.auth.OidcProviderMetadata;

/**
 * Discovery-документ провайдера OIDC с кешированием.
 * Документ живет в кеше {@code app.oidc.cache-ttl}; {@link #refresh()} сбрасывает его принудительно.
 */
@Slf4j
@Service
public class OidcDiscoveryService {

    static final String DISCOVERY_PATH = "/.well-known/openid-configuration";

    private final WebClient webClient;
    private final OidcProperties properties;
    private final Cache<String, OidcProviderMetadata> cache;

    public OidcDiscoveryService(WebClient.Builder webClientBuilder,
                                OidcProperties properties,
                                Cache<String, OidcProviderMetadata> oidcDiscoveryCache) {
        this.webClient = webClientBuilder.build();
        this.properties = properties;
        this.cache = oidcDiscoveryCache;
    }

    /**
     * Получить discovery-документ: из кеша, либо с сервера провайдера.
     */
    public Mono<OidcProviderMetadata> getConfiguration() {
        String issuer = properties.getIssuer();
        OidcProviderMetadata cached = cache.getIfPresent(issuer);
        if (cached != null) {
            return Mono.just(cached);
        }
        return fetch(issuer)
                .doOnNext(metadata -> cache.put(issuer, metadata));
    }

    /**
     * Сбросить кеш и загрузить документ заново.
     */
    public Mono<OidcProviderMetadata> refresh() {
        cache.invalidate(properties.getIssuer());
        return getConfiguration();
    }

    private Mono<OidcProviderMetadata> fetch(String issuer) {
        String url = (issuer.endsWith("/") ? issuer.substring(0, issuer.length() - 1) : issuer) + DISCOVERY_PATH;
        return webClient.get()
                .uri(url)
                .retrieve()
                .bodyToMono(OidcProviderMetadata.class)
                .flatMap(metadata -> {
                    if (!issuer.equals(metadata.getIssuer())) {
                        return Mono.error(new IllegalStateException(
                                "Issuer в discovery-документе (" + metadata.getIssuer() + ") не совпадает с " + issuer));
                    }
                    log.info("Загружен discovery-документ OIDC для {}", issuer);
                    return Mono.just(metadata);
                })
                .doOnError(e -> log.error("Ошибка загрузки discovery-документа OIDC для {}: {}", issuer, e.getMessage()));
    }
}
