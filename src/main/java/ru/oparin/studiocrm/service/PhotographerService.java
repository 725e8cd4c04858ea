package ru.oparin.studiocrm.service;

import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;
import ru.oparin.studiocrm.exception.AuthException;
import ru.oparin.studiocrm.model.dto.PhotographerProfileDTO;
import ru.oparin.studiocrm.model.dto.PortalStudioDTO;
import ru.oparin.studiocrm.model.entity.Photographer;
import ru.oparin.studiocrm.repository.PhotographerRepository;
import ru.oparin.studiocrm.security.SessionClaim;

/**
 * Данные студии. Студия всегда берется из сессии, а не из параметров запроса.
 */
@RequiredArgsConstructor
@Service
public class PhotographerService {

    private final PhotographerRepository photographerRepository;

    public Mono<PhotographerProfileDTO> getProfile(SessionClaim claim) {
        return findOrThrow(claim.getPhotographerId())
                .map(PhotographerProfileDTO::fromEntity);
    }

    public Mono<PortalStudioDTO> getPortalStudio(SessionClaim claim) {
        return findOrThrow(claim.getPhotographerId())
                .map(photographer -> new PortalStudioDTO(photographer.getId(), photographer.getBusinessName()));
    }

    private Mono<Photographer> findOrThrow(String photographerId) {
        if (photographerId == null) {
            return Mono.error(new AuthException(HttpStatus.FORBIDDEN, "Сессия не привязана к студии"));
        }
        return photographerRepository.findById(photographerId)
                .switchIfEmpty(Mono.error(new AuthException(HttpStatus.NOT_FOUND, "Фотограф не найден")));
    }
}
