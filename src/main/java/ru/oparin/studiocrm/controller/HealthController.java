package ru.oparin.studiocrm.controller;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;
import ru.oparin.studiocrm.service.HealthService;

import java.util.Map;

@RestController
@RequestMapping("/health")
@RequiredArgsConstructor
@Tag(name = "Состояние", description = "Публичные проверки доступности")
public class HealthController {

    private final HealthService healthService;

    @Operation(summary = "Проверка доступности сервиса")
    @GetMapping
    public Mono<ResponseEntity<Map<String, Object>>> health() {
        return Mono.just(ResponseEntity.ok(healthService.getBasicHealth()));
    }

    @Operation(summary = "Проверка доступности хранилища", description = "503, если хранилище не отвечает")
    @GetMapping("/database")
    public Mono<ResponseEntity<Map<String, Object>>> database() {
        return healthService.getDatabaseHealth()
                .map(health -> healthService.isDown(health)
                        ? ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE).body(health)
                        : ResponseEntity.ok(health));
    }
}
