package ru.oparin.studiocrm.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;
import ru.oparin.studiocrm.exception.AuthException;
import ru.oparin.studiocrm.model.dto.auth.AuthResponse;
import ru.oparin.studiocrm.model.enums.Role;
import ru.oparin.studiocrm.repository.PhotographerRepository;
import ru.oparin.studiocrm.repository.UserRepository;
import ru.oparin.studiocrm.security.AccessGuards;
import ru.oparin.studiocrm.security.ImpersonationSession;
import ru.oparin.studiocrm.security.NormalSession;
import ru.oparin.studiocrm.security.SessionClaim;

/**
 * Вход администратора в студию фотографа и выход из нее.
 * Допустимы только переходы Normal(ADMIN) -> Impersonating -> Normal(ADMIN);
 * каждый переход выпускает новый токен, старый клиент просто заменяет.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ImpersonationService {

    private final PhotographerRepository photographerRepository;
    private final UserRepository userRepository;
    private final JwtService jwtService;

    /**
     * Начать имперсонацию студии.
     *
     * @param current сессия администратора
     * @param photographerId студия, от имени которой он будет работать
     * @return токен сессии имперсонации; 403, если имперсонация уже активна; 404 для неизвестной студии
     */
    public Mono<AuthResponse> startImpersonation(SessionClaim current, String photographerId) {
        return AccessGuards.requireAdmin(current)
                .flatMap(claim -> {
                    if (!(claim instanceof NormalSession)) {
                        log.warn("Администратор {} попытался начать вложенную имперсонацию", claim.getAdminUserId());
                        return Mono.error(new AuthException(
                                HttpStatus.FORBIDDEN,
                                "Сначала завершите текущую имперсонацию"
                        ));
                    }
                    NormalSession adminSession = (NormalSession) claim;

                    return photographerRepository.findById(photographerId)
                            .switchIfEmpty(Mono.error(new AuthException(HttpStatus.NOT_FOUND, "Фотограф не найден")))
                            .flatMap(photographer -> userRepository.findFirstByPhotographerIdAndRole(photographer.getId(), Role.PHOTOGRAPHER))
                            .switchIfEmpty(Mono.error(new AuthException(
                                    HttpStatus.NOT_FOUND,
                                    "У студии нет учетной записи владельца"
                            )))
                            .map(owner -> {
                                ImpersonationSession session = adminSession.impersonate(owner.getId(), photographerId);
                                log.info("Администратор {} начал имперсонацию студии {}", adminSession.getUserId(), photographerId);
                                return AuthResponse.of(jwtService.generateToken(session), session, owner, jwtService.expiresAtFromNow());
                            });
                });
    }

    /**
     * Завершить имперсонацию и вернуть администратору его собственную сессию.
     *
     * @param current сессия имперсонации
     * @return токен обычной сессии администратора; 403, если имперсонация не активна
     */
    public Mono<AuthResponse> exitImpersonation(SessionClaim current) {
        return AccessGuards.requireAdmin(current)
                .flatMap(claim -> {
                    if (!(claim instanceof ImpersonationSession)) {
                        log.warn("Пользователь {} вызвал выход из имперсонации без активной имперсонации", claim.getUserId());
                        return Mono.error(new AuthException(HttpStatus.FORBIDDEN, "Имперсонация не активна"));
                    }
                    NormalSession adminSession = ((ImpersonationSession) claim).exit();

                    return userRepository.findById(adminSession.getUserId())
                            .filter(admin -> admin.getRole() == Role.ADMIN)
                            .switchIfEmpty(Mono.error(new AuthException(HttpStatus.FORBIDDEN, "Учетная запись администратора недоступна")))
                            .map(admin -> {
                                log.info("Администратор {} завершил имперсонацию студии {}", admin.getId(), claim.getPhotographerId());
                                return AuthResponse.of(jwtService.generateToken(adminSession), adminSession, admin, jwtService.expiresAtFromNow());
                            });
                });
    }
}
