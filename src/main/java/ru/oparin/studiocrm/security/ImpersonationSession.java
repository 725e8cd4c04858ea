package ru.oparin.studiocrm.security;

import lombok.EqualsAndHashCode;
import lombok.ToString;
import ru.oparin.studiocrm.model.enums.Role;

/**
 * Сессия администратора, действующего от имени фотографа.
 * Хранит обе личности: действующую (фотограф) и настоящую (администратор).
 */
@ToString(callSuper = true)
@EqualsAndHashCode(callSuper = true)
public final class ImpersonationSession extends SessionClaim {

    private final String adminUserId;

    ImpersonationSession(String userId, String photographerId, String adminUserId) {
        super(userId, Role.PHOTOGRAPHER, photographerId);
        if (photographerId == null || adminUserId == null) {
            throw new IllegalArgumentException("photographerId и adminUserId обязательны при имперсонации");
        }
        this.adminUserId = adminUserId;
    }

    /**
     * Возврат к обычной сессии администратора.
     */
    public NormalSession exit() {
        return NormalSession.of(adminUserId, Role.ADMIN, null);
    }

    @Override
    public boolean isImpersonating() {
        return true;
    }

    @Override
    public String getAdminUserId() {
        return adminUserId;
    }

    @Override
    public Role getOriginalRole() {
        return Role.ADMIN;
    }
}
