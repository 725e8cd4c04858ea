package ru.oparin.studiocrm.util;

import lombok.experimental.UtilityClass;
import org.springframework.security.core.Authentication;
import org.springframework.security.core.context.ReactiveSecurityContextHolder;
import reactor.core.publisher.Mono;
import ru.oparin.studiocrm.exception.AuthException;
import ru.oparin.studiocrm.model.enums.Role;
import ru.oparin.studiocrm.security.AccessGuards;
import ru.oparin.studiocrm.security.SessionClaim;

import java.util.Set;

/**
 * Доступ к сессии текущего запроса и проверки ролей поверх нее.
 */
@UtilityClass
public class SecurityUtil {

    /**
     * Получить сессию текущего запроса.
     *
     * @return Mono с сессией, либо ошибка 401, если запрос не аутентифицирован
     */
    public static Mono<SessionClaim> getCurrentClaim() {
        return ReactiveSecurityContextHolder.getContext()
                .flatMap(context -> Mono.justOrEmpty(context.getAuthentication()))
                .map(Authentication::getPrincipal)
                .filter(SessionClaim.class::isInstance)
                .cast(SessionClaim.class)
                .switchIfEmpty(Mono.error(AuthException.unauthenticated()));
    }

    public static Mono<SessionClaim> requireRole(Role... roles) {
        return getCurrentClaim()
                .flatMap(claim -> AccessGuards.requireRole(claim, Set.of(roles)));
    }

    public static Mono<SessionClaim> requirePhotographer() {
        return getCurrentClaim()
                .flatMap(AccessGuards::requirePhotographer);
    }

    public static Mono<SessionClaim> requireAdmin() {
        return getCurrentClaim()
                .flatMap(AccessGuards::requireAdmin);
    }
}
