package ru.oparin.studiocrm.model.dto.auth;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import lombok.Data;
import lombok.ToString;
import ru.oparin.studiocrm.validation.StrongPassword;

@ToString
@Data
public class RegisterRequest {

    @NotBlank
    @Email
    @Schema(description = "Email владельца студии", example = "anna@studio.com")
    private String email;

    @ToString.Exclude
    @NotBlank(message = "Пароль обязателен")
    @StrongPassword
    @Schema(description = "Пароль (минимум 8 символов, буквы и цифры)", example = "Shutter2024")
    private String password;

    @NotBlank(message = "Название студии обязательно")
    @Size(max = 200, message = "Название студии не длиннее 200 символов")
    @Schema(description = "Название студии", example = "Anna Light Photography")
    private String businessName;
}
