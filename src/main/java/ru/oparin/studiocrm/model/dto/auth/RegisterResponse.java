package ru.oparin.studiocrm.model.dto.auth;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@AllArgsConstructor
@NoArgsConstructor
public class RegisterResponse {

    @Schema(description = "Сообщение", example = "Пользователь создан")
    private String message;

    @Schema(description = "Идентификатор созданного пользователя")
    private String userId;
}
