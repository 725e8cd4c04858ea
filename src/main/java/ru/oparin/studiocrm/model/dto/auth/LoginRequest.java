package ru.oparin.studiocrm.model.dto.auth;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.ToString;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class LoginRequest {

    @NotBlank(message = "Email обязателен")
    @Schema(description = "Email", example = "anna@studio.com")
    private String email;

    @ToString.Exclude
    @NotBlank(message = "Пароль обязателен")
    @Schema(description = "Пароль")
    private String password;

    @Schema(description = "Роль, под которой выполняется вход", example = "PHOTOGRAPHER",
            allowableValues = {"PHOTOGRAPHER", "CLIENT", "ADMIN"})
    private String role;

    @Schema(description = "Студия, к которой относится клиент. Обязательна для роли CLIENT")
    private String photographerId;
}
