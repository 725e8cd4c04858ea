package ru.oparin.studiocrm.controller;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.security.SecurityRequirement;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import reactor.core.publisher.Mono;
import ru.oparin.studiocrm.model.dto.admin.AdminPhotographerDTO;
import ru.oparin.studiocrm.model.dto.admin.UpdateSubscriptionRequest;
import ru.oparin.studiocrm.model.dto.auth.AuthResponse;
import ru.oparin.studiocrm.security.SessionCookieFactory;
import ru.oparin.studiocrm.service.AdminService;
import ru.oparin.studiocrm.service.ImpersonationService;
import ru.oparin.studiocrm.util.SecurityUtil;

import java.util.List;

/**
 * Контроллер для админ-панели.
 */
@RestController
@RequestMapping("/admin")
@RequiredArgsConstructor
@Slf4j
@SecurityRequirement(name = "bearerAuth")
@Tag(name = "Админ-панель", description = "API для администраторов платформы")
public class AdminController {

    private final AdminService adminService;
    private final ImpersonationService impersonationService;
    private final SessionCookieFactory sessionCookieFactory;

    @Operation(summary = "Получить все студии",
            description = "Возвращает список студий со статусами подписок. Требуется роль ADMIN.")
    @GetMapping("/photographers")
    public Mono<ResponseEntity<List<AdminPhotographerDTO>>> getAllPhotographers() {
        return SecurityUtil.requireAdmin()
                .flatMapMany(admin -> adminService.getAllPhotographers())
                .collectList()
                .map(ResponseEntity::ok);
    }

    @Operation(summary = "Изменить статус подписки студии",
            description = "Ручная смена статуса подписки. Требуется роль ADMIN.")
    @PatchMapping("/photographers/{photographerId}/subscription")
    public Mono<ResponseEntity<AdminPhotographerDTO>> updateSubscription(
            @PathVariable String photographerId,
            @Valid @RequestBody UpdateSubscriptionRequest request) {
        return SecurityUtil.requireAdmin()
                .flatMap(admin -> adminService.updateSubscriptionStatus(
                        photographerId,
                        request.getSubscriptionStatus(),
                        admin.isImpersonating() ? admin.getAdminUserId() : admin.getUserId()))
                .map(ResponseEntity::ok);
    }

    @Operation(summary = "Войти в студию фотографа",
            description = "Выдает токен имперсонации: роль PHOTOGRAPHER с сохранением личности администратора.")
    @PostMapping("/impersonate/{photographerId}")
    public Mono<ResponseEntity<AuthResponse>> impersonate(@PathVariable String photographerId) {
        return SecurityUtil.getCurrentClaim()
                .flatMap(claim -> impersonationService.startImpersonation(claim, photographerId))
                .map(this::withSessionCookie);
    }

    @Operation(summary = "Выйти из студии фотографа",
            description = "Возвращает администратору его собственную сессию.")
    @PostMapping("/exit-impersonation")
    public Mono<ResponseEntity<AuthResponse>> exitImpersonation() {
        return SecurityUtil.getCurrentClaim()
                .flatMap(impersonationService::exitImpersonation)
                .map(this::withSessionCookie);
    }

    private ResponseEntity<AuthResponse> withSessionCookie(AuthResponse response) {
        return ResponseEntity.ok()
                .header(HttpHeaders.SET_COOKIE, sessionCookieFactory.create(response.getToken()).toString())
                .body(response);
    }
}
