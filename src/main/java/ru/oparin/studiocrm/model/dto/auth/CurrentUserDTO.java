package ru.oparin.studiocrm.model.dto.auth;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.*;
import ru.oparin.studiocrm.model.entity.User;
import ru.oparin.studiocrm.security.SessionClaim;

/**
 * Текущий пользователь вместе с состоянием имперсонации, чтобы интерфейс мог показать баннер.
 */
@Getter
@Setter
@ToString
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CurrentUserDTO {

    private String id;
    private String email;
    private String role;
    private String photographerId;
    @JsonProperty("isImpersonating")
    private boolean impersonating;
    private String adminUserId;

    public static CurrentUserDTO fromUser(User user, SessionClaim claim) {
        return CurrentUserDTO.builder()
                .id(user.getId())
                .email(user.getEmail())
                .role(claim.getRole().name())
                .photographerId(claim.getPhotographerId())
                .impersonating(claim.isImpersonating())
                .adminUserId(claim.getAdminUserId())
                .build();
    }
}
