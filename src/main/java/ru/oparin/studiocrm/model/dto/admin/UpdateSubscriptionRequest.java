package ru.oparin.studiocrm.model.dto.admin;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.NotBlank;
import lombok.Data;

@Data
public class UpdateSubscriptionRequest {

    @NotBlank(message = "Статус подписки обязателен")
    @Schema(description = "Новый статус подписки", example = "unlimited")
    private String subscriptionStatus;
}
