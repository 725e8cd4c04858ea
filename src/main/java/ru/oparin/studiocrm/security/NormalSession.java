package ru.oparin.studiocrm.security;

import lombok.EqualsAndHashCode;
import lombok.ToString;
import ru.oparin.studiocrm.model.enums.Role;

/**
 * Обычная сессия, выданная при входе в систему.
 */
@ToString(callSuper = true)
@EqualsAndHashCode(callSuper = true)
public final class NormalSession extends SessionClaim {

    private NormalSession(String userId, Role role, String photographerId) {
        super(userId, role, photographerId);
    }

    public static NormalSession of(String userId, Role role, String photographerId) {
        return new NormalSession(userId, role, role == Role.ADMIN ? null : photographerId);
    }

    /**
     * Переход администратора в режим имперсонации фотографа.
     * Метод есть только у обычной сессии, поэтому вложенная имперсонация невозможна.
     *
     * @param targetUserId учетная запись владельца студии
     * @param targetPhotographerId студия, от имени которой будет работать администратор
     * @throws IllegalStateException если сессия принадлежит не администратору
     */
    public ImpersonationSession impersonate(String targetUserId, String targetPhotographerId) {
        if (getRole() != Role.ADMIN) {
            throw new IllegalStateException("Имперсонация доступна только администратору");
        }
        return new ImpersonationSession(targetUserId, targetPhotographerId, getUserId());
    }

    @Override
    public boolean isImpersonating() {
        return false;
    }

    @Override
    public String getAdminUserId() {
        return null;
    }

    @Override
    public Role getOriginalRole() {
        return null;
    }
}
