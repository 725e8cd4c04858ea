package ru.oparin.studiocrm.controller;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.security.SecurityRequirement;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;
import ru.oparin.studiocrm.model.dto.PhotographerProfileDTO;
import ru.oparin.studiocrm.service.FeatureGateService;
import ru.oparin.studiocrm.service.PhotographerService;
import ru.oparin.studiocrm.util.SecurityUtil;

import java.util.LinkedHashMap;
import java.util.Map;

@RestController
@RequestMapping("/photographer")
@RequiredArgsConstructor
@SecurityRequirement(name = "bearerAuth")
@Tag(name = "Студия", description = "API студии фотографа")
public class PhotographerController {

    private final PhotographerService photographerService;
    private final FeatureGateService featureGateService;

    @Operation(summary = "Профиль студии",
            description = "Требуется роль PHOTOGRAPHER и активная подписка")
    @GetMapping
    public Mono<ResponseEntity<PhotographerProfileDTO>> getProfile() {
        return SecurityUtil.requirePhotographer()
                .flatMap(featureGateService::requireActiveSubscription)
                .flatMap(photographerService::getProfile)
                .map(ResponseEntity::ok);
    }

    @Operation(summary = "Тариф галерей студии",
            description = "Требуется роль PHOTOGRAPHER и подключенный тариф галерей")
    @GetMapping("/gallery-plan")
    public Mono<ResponseEntity<Map<String, Object>>> getGalleryPlan() {
        return SecurityUtil.requirePhotographer()
                .flatMap(featureGateService::requireGalleryPlan)
                .flatMap(photographerService::getProfile)
                .map(profile -> {
                    // при имперсонации тариф может отсутствовать
                    Map<String, Object> body = new LinkedHashMap<>();
                    body.put("photographerId", profile.getId());
                    body.put("galleryPlanId", profile.getGalleryPlanId());
                    return ResponseEntity.ok(body);
                });
    }
}
