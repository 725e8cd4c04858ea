package ru.oparin.studiocrm.security;

import lombok.experimental.UtilityClass;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import reactor.core.publisher.Mono;
import ru.oparin.studiocrm.exception.AuthException;
import ru.oparin.studiocrm.model.enums.Role;

import java.util.Set;

/**
 * Проверки роли по сессии. Работают только с содержимым токена, без обращения к БД.
 * Отсутствие сессии - всегда 401, а не пропуск.
 */
@Slf4j
@UtilityClass
public class AccessGuards {

    /**
     * Пропускает сессию, если ее роль входит в список разрешенных.
     */
    public static Mono<SessionClaim> requireRole(SessionClaim claim, Set<Role> allowedRoles) {
        if (claim == null) {
            return Mono.error(AuthException.unauthenticated());
        }
        if (!allowedRoles.contains(claim.getRole())) {
            log.warn("Роль {} пользователя {} не входит в {}", claim.getRole(), claim.getUserId(), allowedRoles);
            return Mono.error(new AuthException(HttpStatus.FORBIDDEN, "Недостаточно прав"));
        }
        return Mono.just(claim);
    }

    /**
     * Фотограф с привязанной студией. Администратор в режиме имперсонации тоже проходит.
     */
    public static Mono<SessionClaim> requirePhotographer(SessionClaim claim) {
        if (claim == null) {
            return Mono.error(AuthException.unauthenticated());
        }
        if (claim.getRole() != Role.PHOTOGRAPHER || claim.getPhotographerId() == null) {
            log.warn("Пользователь {} с ролью {} запросил ресурс фотографа", claim.getUserId(), claim.getRole());
            return Mono.error(new AuthException(HttpStatus.FORBIDDEN, "Требуется доступ фотографа"));
        }
        return Mono.just(claim);
    }

    /**
     * Администратор, в том числе действующий от имени фотографа.
     */
    public static Mono<SessionClaim> requireAdmin(SessionClaim claim) {
        if (claim == null) {
            return Mono.error(AuthException.unauthenticated());
        }
        if (!isAdmin(claim)) {
            log.warn("Пользователь {} с ролью {} запросил админ-ресурс", claim.getUserId(), claim.getRole());
            return Mono.error(new AuthException(HttpStatus.FORBIDDEN, "Требуется роль администратора"));
        }
        return Mono.just(claim);
    }

    /**
     * Настоящий администратор: по действующей роли или по исходной роли при имперсонации.
     */
    public static boolean isAdmin(SessionClaim claim) {
        return claim.getRole() == Role.ADMIN || claim.getOriginalRole() == Role.ADMIN;
    }
}
