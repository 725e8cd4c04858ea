package ru.oparin.studiocrm.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import ru.oparin.studiocrm.exception.AuthException;
import ru.oparin.studiocrm.model.dto.admin.AdminPhotographerDTO;
import ru.oparin.studiocrm.repository.PhotographerRepository;

/**
 * Сервис для админ-панели.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class AdminService {

    private final PhotographerRepository photographerRepository;

    /**
     * Получить все студии, новые первыми.
     */
    public Flux<AdminPhotographerDTO> getAllPhotographers() {
        return photographerRepository.findAllByOrderByCreatedAtDesc()
                .map(AdminPhotographerDTO::fromEntity);
    }

    /**
     * Ручная смена статуса подписки студии администратором.
     *
     * @param photographerId ID студии
     * @param subscriptionStatus новый статус
     * @param adminUserId администратор, выполняющий изменение
     */
    public Mono<AdminPhotographerDTO> updateSubscriptionStatus(String photographerId, String subscriptionStatus, String adminUserId) {
        return photographerRepository.findById(photographerId)
                .switchIfEmpty(Mono.error(new AuthException(HttpStatus.NOT_FOUND, "Фотограф не найден")))
                .flatMap(photographer -> {
                    String previous = photographer.getSubscriptionStatus();
                    photographer.setSubscriptionStatus(subscriptionStatus);
                    return photographerRepository.save(photographer)
                            .doOnNext(saved -> log.info("Администратор {} сменил статус подписки студии {}: {} -> {}",
                                    adminUserId, photographerId, previous, subscriptionStatus));
                })
                .map(AdminPhotographerDTO::fromEntity);
    }
}
