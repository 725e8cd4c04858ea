package ru.oparin.studiocrm.model.entity;

import lombok.*;
import org.springframework.data.annotation.CreatedDate;
import org.springframework.data.annotation.Id;
import org.springframework.data.relational.core.mapping.Column;
import org.springframework.data.relational.core.mapping.Table;

import java.time.LocalDateTime;

/**
 * Студия фотографа - арендатор системы.
 * Поля подписки изменяются биллингом и администраторами, для цепочки авторизации они только читаются.
 */
@Table(value = "photographers")
@Getter
@Setter
@EqualsAndHashCode
@ToString
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Photographer {

    @Id
    private String id;

    @Column("business_name")
    private String businessName;

    @Builder.Default
    private String timezone = "America/New_York";

    /**
     * Статус подписки: trialing, active, unlimited, canceled, past_due и т.д.
     */
    @Column("subscription_status")
    private String subscriptionStatus;

    /**
     * Окончание пробного периода (UTC).
     */
    @Column("trial_ends_at")
    private LocalDateTime trialEndsAt;

    /**
     * Тариф галерей. Пусто, если тариф не подключен.
     */
    @Column("gallery_plan_id")
    private String galleryPlanId;

    @CreatedDate
    @Column("created_at")
    private LocalDateTime createdAt;
}
