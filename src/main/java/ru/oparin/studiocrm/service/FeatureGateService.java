package ru.oparin.studiocrm.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;
import ru.oparin.studiocrm.exception.AuthException;
import ru.oparin.studiocrm.exception.PaymentRequiredException;
import ru.oparin.studiocrm.model.entity.Photographer;
import ru.oparin.studiocrm.model.enums.Role;
import ru.oparin.studiocrm.repository.PhotographerRepository;
import ru.oparin.studiocrm.security.AccessGuards;
import ru.oparin.studiocrm.security.SessionClaim;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.Set;

/**
 * Ограничения доступа по тарифу студии. Применяются после аутентификации и проверки роли.
 * Администраторы (в том числе при имперсонации) проходят без проверки,
 * остальные роли кроме фотографа - тоже: тарифы относятся только к ресурсам студии.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class FeatureGateService {

    /**
     * Закрытый список статусов с доступом. Любой другой статус, включая новые, доступ закрывает.
     */
    static final Set<String> ACTIVE_SUBSCRIPTION_STATUSES = Set.of("trialing", "active", "unlimited");

    private final PhotographerRepository photographerRepository;
    private final Clock clock;

    /**
     * Требует активную подписку студии.
     *
     * @param claim сессия текущего запроса
     * @return та же сессия, если доступ разрешен; иначе 402 с полями subscriptionStatus и trialEnded
     */
    public Mono<SessionClaim> requireActiveSubscription(SessionClaim claim) {
        if (claim == null) {
            return Mono.error(AuthException.unauthenticated());
        }
        if (isExempt(claim)) {
            return Mono.just(claim);
        }

        return loadPhotographer(claim.getPhotographerId())
                .flatMap(photographer -> {
                    String status = photographer.getSubscriptionStatus();
                    if (status == null || !ACTIVE_SUBSCRIPTION_STATUSES.contains(status)) {
                        log.warn("Студия {} без активной подписки, статус {}", photographer.getId(), status);
                        return Mono.error(PaymentRequiredException.subscriptionRequired(status, isTrialEnded(photographer)));
                    }
                    return Mono.just(claim);
                });
    }

    /**
     * Требует подключенный тариф галерей.
     *
     * @param claim сессия текущего запроса
     * @return та же сессия, если доступ разрешен; иначе 402 с galleryPlanRequired и upgradeRequired
     */
    public Mono<SessionClaim> requireGalleryPlan(SessionClaim claim) {
        if (claim == null) {
            return Mono.error(AuthException.unauthenticated());
        }
        if (isExempt(claim)) {
            return Mono.just(claim);
        }

        return loadPhotographer(claim.getPhotographerId())
                .flatMap(photographer -> {
                    if (photographer.getGalleryPlanId() == null) {
                        log.warn("Студия {} без тарифа галерей", photographer.getId());
                        return Mono.error(PaymentRequiredException.galleryPlanRequired());
                    }
                    return Mono.just(claim);
                });
    }

    private boolean isExempt(SessionClaim claim) {
        return AccessGuards.isAdmin(claim)
                || claim.getRole() != Role.PHOTOGRAPHER
                || claim.getPhotographerId() == null;
    }

    private Mono<Photographer> loadPhotographer(String photographerId) {
        return photographerRepository.findById(photographerId)
                .doOnError(e -> log.error("Ошибка загрузки студии {} при проверке тарифа", photographerId, e))
                .switchIfEmpty(Mono.defer(() -> {
                    log.error("Студия {} из токена не найдена", photographerId);
                    return Mono.<Photographer>error(new AuthException(HttpStatus.NOT_FOUND, "Фотограф не найден"));
                }));
    }

    private boolean isTrialEnded(Photographer photographer) {
        return photographer.getTrialEndsAt() != null
                && photographer.getTrialEndsAt().isBefore(LocalDateTime.now(clock));
    }
}
