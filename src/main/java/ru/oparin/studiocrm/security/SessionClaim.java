package ru.oparin.studiocrm.security;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;
import ru.oparin.studiocrm.model.enums.Role;

/**
 * Содержимое сессионного токена.
 * Возможны ровно два варианта: {@link NormalSession} и {@link ImpersonationSession}.
 * Конструктор закрыт для пакета, поэтому других вариантов не бывает.
 */
@Getter
@ToString
@EqualsAndHashCode
public abstract class SessionClaim {

    /**
     * Пользователь, от имени которого выполняется запрос.
     */
    private final String userId;

    /**
     * Действующая роль. При имперсонации всегда PHOTOGRAPHER.
     */
    private final Role role;

    /**
     * Арендатор, в рамках которого действует сессия. Для ADMIN отсутствует.
     */
    private final String photographerId;

    SessionClaim(String userId, Role role, String photographerId) {
        if (userId == null || role == null) {
            throw new IllegalArgumentException("userId и role обязательны");
        }
        this.userId = userId;
        this.role = role;
        this.photographerId = photographerId;
    }

    public abstract boolean isImpersonating();

    /**
     * Реальный администратор за сессией имперсонации, иначе null.
     */
    public abstract String getAdminUserId();

    /**
     * Настоящая роль администратора за сессией имперсонации, иначе null.
     */
    public abstract Role getOriginalRole();
}
