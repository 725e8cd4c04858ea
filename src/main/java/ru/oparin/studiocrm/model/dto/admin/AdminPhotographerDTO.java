package ru.oparin.studiocrm.model.dto.admin;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import ru.oparin.studiocrm.model.entity.Photographer;

import java.time.LocalDateTime;

/**
 * Студия в списке админ-панели.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Информация о студии для админ-панели")
public class AdminPhotographerDTO {

    @Schema(description = "ID студии")
    private String id;

    @Schema(description = "Название студии")
    private String businessName;

    @Schema(description = "Часовой пояс")
    private String timezone;

    @Schema(description = "Статус подписки", example = "active")
    private String subscriptionStatus;

    @Schema(description = "Окончание пробного периода")
    private LocalDateTime trialEndsAt;

    @Schema(description = "Тариф галерей")
    private String galleryPlanId;

    @Schema(description = "Дата регистрации")
    private LocalDateTime createdAt;

    public static AdminPhotographerDTO fromEntity(Photographer photographer) {
        return AdminPhotographerDTO.builder()
                .id(photographer.getId())
                .businessName(photographer.getBusinessName())
                .timezone(photographer.getTimezone())
                .subscriptionStatus(photographer.getSubscriptionStatus())
                .trialEndsAt(photographer.getTrialEndsAt())
                .galleryPlanId(photographer.getGalleryPlanId())
                .createdAt(photographer.getCreatedAt())
                .build();
    }
}
