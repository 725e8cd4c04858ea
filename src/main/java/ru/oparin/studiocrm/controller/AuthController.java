package ru.oparin.studiocrm.controller;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.security.SecurityRequirement;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import reactor.core.publisher.Mono;
import ru.oparin.studiocrm.model.dto.auth.*;
import ru.oparin.studiocrm.security.SessionCookieFactory;
import ru.oparin.studiocrm.service.AuthService;
import ru.oparin.studiocrm.util.SecurityUtil;

@Slf4j
@RequiredArgsConstructor
@RestController
@RequestMapping("/auth")
@Tag(name = "Аутентификация", description = "API для регистрации, входа и выхода")
public class AuthController {

    private final AuthService authService;
    private final SessionCookieFactory sessionCookieFactory;

    @Operation(summary = "Регистрация студии",
            description = "Создает студию с пробным периодом и учетную запись ее владельца")
    @PostMapping("/register")
    public Mono<ResponseEntity<RegisterResponse>> register(@Valid @RequestBody RegisterRequest request) {
        log.info("Получен запрос на регистрацию студии: {}", request);
        return authService.register(request)
                .map(response -> ResponseEntity.status(HttpStatus.CREATED).body(response));
    }

    @Operation(summary = "Вход в систему",
            description = "Вход под указанной ролью; для клиента обязательна студия. Токен выдается в cookie и в теле ответа")
    @PostMapping("/login")
    public Mono<ResponseEntity<AuthResponse>> login(@Valid @RequestBody LoginRequest request) {
        log.info("Получен запрос на вход с ролью {}", request.getRole());
        return authService.login(request)
                .map(response -> ResponseEntity.ok()
                        .header(HttpHeaders.SET_COOKIE, sessionCookieFactory.create(response.getToken()).toString())
                        .body(response));
    }

    @Operation(summary = "Выход из системы", description = "Удаляет сессионную cookie")
    @PostMapping("/logout")
    public Mono<ResponseEntity<MessageResponse>> logout() {
        return Mono.just(ResponseEntity.ok()
                .header(HttpHeaders.SET_COOKIE, sessionCookieFactory.clear().toString())
                .body(new MessageResponse("Выход выполнен")));
    }

    @Operation(summary = "Текущий пользователь",
            description = "Данные пользователя текущей сессии и признак имперсонации")
    @SecurityRequirement(name = "bearerAuth")
    @GetMapping("/me")
    public Mono<ResponseEntity<CurrentUserDTO>> me() {
        return SecurityUtil.getCurrentClaim()
                .flatMap(authService::getCurrentUser)
                .map(ResponseEntity::ok);
    }
}
