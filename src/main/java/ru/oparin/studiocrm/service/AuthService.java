package ru.oparin.studiocrm.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import reactor.core.publisher.Mono;
import ru.oparin.studiocrm.config.properties.SubscriptionProperties;
import ru.oparin.studiocrm.exception.AuthException;
import ru.oparin.studiocrm.model.dto.auth.*;
import ru.oparin.studiocrm.model.entity.Photographer;
import ru.oparin.studiocrm.model.entity.User;
import ru.oparin.studiocrm.model.enums.Role;
import ru.oparin.studiocrm.repository.PhotographerRepository;
import ru.oparin.studiocrm.repository.UserRepository;
import ru.oparin.studiocrm.security.NormalSession;
import ru.oparin.studiocrm.security.SessionClaim;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.Optional;

@RequiredArgsConstructor
@Service
@Slf4j
public class AuthService {

    static final String TRIALING_STATUS = "trialing";
    private static final String DUPLICATE_PHOTOGRAPHER_MESSAGE = "Фотограф с таким email уже существует";

    private final UserRepository userRepository;
    private final PhotographerRepository photographerRepository;
    private final PasswordService passwordService;
    private final JwtService jwtService;
    private final SubscriptionProperties subscriptionProperties;
    private final Clock clock;

    /**
     * Вход с явным указанием роли.
     * Поиск пользователя всегда ограничен ролью, а для клиентов еще и студией:
     * один email может принадлежать разным пользователям в разных ролях и студиях.
     * Все отказы (нет роли, нет студии у клиента, нет пользователя, неверный пароль)
     * выглядят одинаково - пустой Mono.
     *
     * @param email email пользователя
     * @param password пароль в открытом виде
     * @param options роль и студия
     * @return пользователь с токеном, либо пустой Mono
     */
    public Mono<AuthenticatedUser> authenticateUser(String email, String password, LoginOptions options) {
        if (options == null || options.getRole() == null) {
            log.warn("Попытка входа без указания роли отклонена");
            return Mono.empty();
        }

        Optional<Role> role = Role.fromValue(options.getRole());
        if (role.isEmpty()) {
            log.warn("Попытка входа с неизвестной ролью {} отклонена", options.getRole());
            return Mono.empty();
        }

        return findUserForLogin(email, role.get(), options.getPhotographerId())
                .flatMap(user -> passwordService.verifyPassword(password, user.getPasswordHash())
                        .filter(Boolean::booleanValue)
                        .map(valid -> issueToken(user)));
    }

    public Mono<AuthResponse> login(LoginRequest request) {
        LoginOptions options = new LoginOptions(request.getRole(), request.getPhotographerId());
        return authenticateUser(request.getEmail(), request.getPassword(), options)
                .switchIfEmpty(Mono.defer(() -> {
                    log.warn("Неудачная попытка входа с ролью {}", request.getRole());
                    return Mono.<AuthenticatedUser>error(new AuthException(HttpStatus.UNAUTHORIZED, "Неверные учетные данные"));
                }))
                .map(authenticated -> {
                    User user = authenticated.getUser();
                    log.info("Пользователь {} вошел с ролью {}", user.getId(), user.getRole());
                    return AuthResponse.of(authenticated.getToken(), toClaim(user), user, jwtService.expiresAtFromNow());
                });
    }

    /**
     * Регистрация студии и ее владельца. Студия стартует с пробным периодом.
     */
    @Transactional
    public Mono<RegisterResponse> register(RegisterRequest request) {
        return userRepository.existsByEmailAndRole(request.getEmail(), Role.PHOTOGRAPHER)
                .flatMap(exists -> {
                    if (exists) {
                        return Mono.<Void>error(new AuthException(HttpStatus.CONFLICT, DUPLICATE_PHOTOGRAPHER_MESSAGE));
                    }
                    return Mono.<Void>empty();
                })
                .then(Mono.defer(() -> {
                    Photographer photographer = Photographer.builder()
                            .businessName(request.getBusinessName())
                            .subscriptionStatus(TRIALING_STATUS)
                            .trialEndsAt(LocalDateTime.now(clock).plusDays(subscriptionProperties.getTrialDays()))
                            .build();
                    return photographerRepository.save(photographer);
                }))
                .flatMap(photographer -> passwordService.hashPassword(request.getPassword())
                        .map(hash -> User.builder()
                                .email(request.getEmail())
                                .passwordHash(hash)
                                .role(Role.PHOTOGRAPHER)
                                .photographerId(photographer.getId())
                                .build()))
                .flatMap(userRepository::save)
                // гонка двух регистраций: вторую отклоняет уникальный индекс
                .onErrorMap(DuplicateKeyException.class, e -> {
                    log.warn("Повторная регистрация фотографа отклонена уникальным индексом");
                    return new AuthException(HttpStatus.CONFLICT, DUPLICATE_PHOTOGRAPHER_MESSAGE);
                })
                .map(savedUser -> {
                    log.info("Зарегистрирована студия {} владельца {}", savedUser.getPhotographerId(), savedUser.getId());
                    return new RegisterResponse("Пользователь создан", savedUser.getId());
                });
    }

    public Mono<CurrentUserDTO> getCurrentUser(SessionClaim claim) {
        return userRepository.findById(claim.getUserId())
                .switchIfEmpty(Mono.error(new AuthException(HttpStatus.NOT_FOUND, "Пользователь не найден")))
                .map(user -> CurrentUserDTO.fromUser(user, claim));
    }

    private Mono<User> findUserForLogin(String email, Role role, String photographerId) {
        return switch (role) {
            case CLIENT -> {
                // граница арендатора: без студии клиента не ищем вовсе
                if (photographerId == null || photographerId.isBlank()) {
                    log.warn("Вход клиента без photographerId отклонен");
                    yield Mono.<User>empty();
                }
                yield userRepository.findByEmailAndRoleAndPhotographerId(email, Role.CLIENT, photographerId);
            }
            case PHOTOGRAPHER, ADMIN -> userRepository.findByEmailAndRole(email, role);
        };
    }

    private AuthenticatedUser issueToken(User user) {
        return new AuthenticatedUser(user, jwtService.generateToken(toClaim(user)));
    }

    private SessionClaim toClaim(User user) {
        return NormalSession.of(user.getId(), user.getRole(), user.getPhotographerId());
    }
}
