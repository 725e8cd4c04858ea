package ru.oparin.studiocrm.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.r2dbc.core.DatabaseClient;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Duration;
import java.time.LocalDateTime;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Состояние сервиса для балансировщика и мониторинга.
 * Ответы публичные, поэтому текст ошибок хранилища пишется только в лог.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class HealthService {

    static final String STATUS_UP = "UP";
    static final String STATUS_DOWN = "DOWN";

    private static final Duration DATABASE_TIMEOUT = Duration.ofSeconds(3);

    private final DatabaseClient databaseClient;
    private final Clock clock;

    public Map<String, Object> getBasicHealth() {
        Map<String, Object> health = new LinkedHashMap<>();
        health.put("status", STATUS_UP);
        health.put("service", "studio-crm-backend");
        health.put("timestamp", LocalDateTime.now(clock));
        return health;
    }

    /**
     * Проверка хранилища арендаторов: без него не работают ни вход, ни тарифные ограничения.
     */
    public Mono<Map<String, Object>> getDatabaseHealth() {
        return databaseClient.sql("SELECT COUNT(*) AS studios FROM photographers")
                .map(row -> row.get("studios", Long.class))
                .one()
                .timeout(DATABASE_TIMEOUT)
                .map(studios -> {
                    Map<String, Object> health = new LinkedHashMap<>();
                    health.put("status", STATUS_UP);
                    health.put("database", "PostgreSQL");
                    health.put("studios", studios);
                    return health;
                })
                .onErrorResume(e -> {
                    log.error("Хранилище недоступно при проверке состояния", e);
                    Map<String, Object> health = new LinkedHashMap<>();
                    health.put("status", STATUS_DOWN);
                    health.put("database", "PostgreSQL");
                    return Mono.just(health);
                });
    }

    public boolean isDown(Map<String, Object> health) {
        return STATUS_DOWN.equals(health.get("status"));
    }
}
