package ru.oparin.studiocrm.controller;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.HttpHeaders;
import org.springframework.test.web.reactive.server.WebTestClient;
import reactor.core.publisher.Mono;
import ru.oparin.studiocrm.config.properties.JwtProperties;
import ru.oparin.studiocrm.exception.GlobalExceptionHandler;
import ru.oparin.studiocrm.model.entity.Photographer;
import ru.oparin.studiocrm.model.enums.Role;
import ru.oparin.studiocrm.repository.PhotographerRepository;
import ru.oparin.studiocrm.security.JwtAuthenticationFilter;
import ru.oparin.studiocrm.security.NormalSession;
import ru.oparin.studiocrm.security.SessionClaim;
import ru.oparin.studiocrm.service.FeatureGateService;
import ru.oparin.studiocrm.service.JwtService;
import ru.oparin.studiocrm.service.PhotographerService;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;

import static org.mockito.Mockito.when;

/**
 * Полная цепочка для ресурсов студии: токен, роль, тариф, данные.
 */
@ExtendWith(MockitoExtension.class)
@DisplayName("PhotographerController")
class PhotographerControllerTest {

    private static final Instant NOW = Instant.parse("2026-03-01T10:00:00Z");

    @Mock
    private PhotographerRepository photographerRepository;

    private JwtService jwtService;
    private WebTestClient client;

    @BeforeEach
    void setUp() {
        Clock clock = Clock.fixed(NOW, ZoneOffset.UTC);
        JwtProperties properties = new JwtProperties();
        properties.setSecret("studio-crm-test-secret-0123456789abcdef");
        jwtService = new JwtService(properties, clock);

        PhotographerController controller = new PhotographerController(
                new PhotographerService(photographerRepository),
                new FeatureGateService(photographerRepository, clock));

        client = WebTestClient.bindToController(controller)
                .controllerAdvice(new GlobalExceptionHandler())
                .webFilter(new JwtAuthenticationFilter(jwtService, "token"))
                .build();
    }

    private void givenStudio(String status, String galleryPlanId) {
        when(photographerRepository.findById("studio-1")).thenReturn(Mono.just(Photographer.builder()
                .id("studio-1")
                .businessName("Anna Light Photography")
                .timezone("Europe/Moscow")
                .subscriptionStatus(status)
                .trialEndsAt(LocalDateTime.ofInstant(NOW, ZoneOffset.UTC).minusDays(1))
                .galleryPlanId(galleryPlanId)
                .build()));
    }

    private String bearer(SessionClaim claim) {
        return "Bearer " + jwtService.generateToken(claim);
    }

    @Test
    @DisplayName("фотограф с активной подпиской получает профиль")
    void activeSubscription() {
        givenStudio("active", null);

        client.get().uri("/photographer")
                .header(HttpHeaders.AUTHORIZATION, bearer(NormalSession.of("user-1", Role.PHOTOGRAPHER, "studio-1")))
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.id").isEqualTo("studio-1")
                .jsonPath("$.subscriptionStatus").isEqualTo("active");
    }

    @Test
    @DisplayName("отмененная подписка - 402 с деталями")
    void canceledSubscription() {
        givenStudio("canceled", null);

        client.get().uri("/photographer")
                .header(HttpHeaders.AUTHORIZATION, bearer(NormalSession.of("user-1", Role.PHOTOGRAPHER, "studio-1")))
                .exchange()
                .expectStatus().isEqualTo(402)
                .expectBody()
                .jsonPath("$.status").isEqualTo(402)
                .jsonPath("$.subscriptionStatus").isEqualTo("canceled")
                .jsonPath("$.trialEnded").isEqualTo(true);
    }

    @Test
    @DisplayName("имперсонирующий администратор видит студию с отмененной подпиской")
    void impersonationBypassesGate() {
        givenStudio("canceled", null);
        SessionClaim impersonation = NormalSession.of("admin-1", Role.ADMIN, null).impersonate("owner-1", "studio-1");

        client.get().uri("/photographer")
                .header(HttpHeaders.AUTHORIZATION, bearer(impersonation))
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.id").isEqualTo("studio-1");
    }

    @Test
    @DisplayName("клиент - 403")
    void clientForbidden() {
        client.get().uri("/photographer")
                .header(HttpHeaders.AUTHORIZATION, bearer(NormalSession.of("client-1", Role.CLIENT, "studio-1")))
                .exchange()
                .expectStatus().isForbidden();
    }

    @Test
    @DisplayName("без токена - 401")
    void anonymous() {
        client.get().uri("/photographer")
                .exchange()
                .expectStatus().isUnauthorized()
                .expectBody()
                .jsonPath("$.status").isEqualTo(401);
    }

    @Test
    @DisplayName("без тарифа галерей - 402 с признаком апгрейда")
    void galleryPlanRequired() {
        givenStudio("active", null);

        client.get().uri("/photographer/gallery-plan")
                .header(HttpHeaders.AUTHORIZATION, bearer(NormalSession.of("user-1", Role.PHOTOGRAPHER, "studio-1")))
                .exchange()
                .expectStatus().isEqualTo(402)
                .expectBody()
                .jsonPath("$.galleryPlanRequired").isEqualTo(true)
                .jsonPath("$.upgradeRequired").isEqualTo(true);
    }

    @Test
    @DisplayName("имперсонирующий администратор видит студию без тарифа галерей")
    void galleryPlanImpersonationWithoutPlan() {
        givenStudio("active", null);
        SessionClaim impersonation = NormalSession.of("admin-1", Role.ADMIN, null).impersonate("owner-1", "studio-1");

        client.get().uri("/photographer/gallery-plan")
                .header(HttpHeaders.AUTHORIZATION, bearer(impersonation))
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.photographerId").isEqualTo("studio-1")
                .jsonPath("$.galleryPlanId").doesNotExist();
    }

    @Test
    @DisplayName("фотограф с тарифом галерей получает его идентификатор")
    void galleryPlanPresent() {
        givenStudio("active", "gallery-pro");

        client.get().uri("/photographer/gallery-plan")
                .header(HttpHeaders.AUTHORIZATION, bearer(NormalSession.of("user-1", Role.PHOTOGRAPHER, "studio-1")))
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.galleryPlanId").isEqualTo("gallery-pro");
    }
}
