package ru.oparin.studiocrm.model.dto.auth;

import com.fasterxml.jackson.annotation.JsonProperty;
import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import ru.oparin.studiocrm.model.entity.User;
import ru.oparin.studiocrm.security.SessionClaim;

import java.time.LocalDateTime;

@Data
@Builder
@AllArgsConstructor
@NoArgsConstructor
public class AuthResponse {

    @Schema(description = "JWT токен для аутентификации", example = "eyJhbGciOiJIUzI1NiJ9...")
    private String token;

    @Schema(description = "Идентификатор пользователя, от имени которого действует сессия")
    private String userId;

    @Schema(description = "Email", example = "anna@studio.com")
    private String email;

    @Schema(description = "Действующая роль", example = "PHOTOGRAPHER")
    private String role;

    @Schema(description = "Студия, в рамках которой действует сессия")
    private String photographerId;

    @JsonProperty("isImpersonating")
    @Schema(description = "Признак имперсонации")
    private boolean impersonating;

    @Schema(description = "Время истечения действия токена", example = "2026-01-01T12:00:00")
    private LocalDateTime expiresAt;

    public static AuthResponse of(String token, SessionClaim claim, User user, LocalDateTime expiresAt) {
        return AuthResponse.builder()
                .token(token)
                .userId(claim.getUserId())
                .email(user.getEmail())
                .role(claim.getRole().name())
                .photographerId(claim.getPhotographerId())
                .impersonating(claim.isImpersonating())
                .expiresAt(expiresAt)
                .build();
    }
}
