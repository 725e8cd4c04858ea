package ru.oparin.studiocrm.model.dto;

import lombok.*;
import ru.oparin.studiocrm.model.entity.Photographer;

import java.time.LocalDateTime;

@Getter
@Setter
@ToString
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PhotographerProfileDTO {

    private String id;
    private String businessName;
    private String timezone;
    private String subscriptionStatus;
    private LocalDateTime trialEndsAt;
    private String galleryPlanId;

    public static PhotographerProfileDTO fromEntity(Photographer photographer) {
        return PhotographerProfileDTO.builder()
                .id(photographer.getId())
                .businessName(photographer.getBusinessName())
                .timezone(photographer.getTimezone())
                .subscriptionStatus(photographer.getSubscriptionStatus())
                .trialEndsAt(photographer.getTrialEndsAt())
                .galleryPlanId(photographer.getGalleryPlanId())
                .build();
    }
}
