package ru.oparin.studiocrm.model.entity;

import lombok.*;
import org.springframework.data.annotation.CreatedDate;
import org.springframework.data.annotation.Id;
import org.springframework.data.relational.core.mapping.Column;
import org.springframework.data.relational.core.mapping.Table;
import ru.oparin.studiocrm.model.enums.Role;

import java.time.LocalDateTime;

/**
 * Учетная запись пользователя.
 * Один и тот же email может встречаться у нескольких записей: уникальна пара (email, роль),
 * а для клиентов - тройка (email, роль, фотограф).
 */
@Table(value = "users")
@Getter
@Setter
@EqualsAndHashCode
@ToString
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class User {

    /**
     * Идентификатор (UUID), генерируется базой данных.
     */
    @Id
    private String id;

    private String email;

    /**
     * Хэш пароля bcrypt.
     */
    @ToString.Exclude
    @Column("password_hash")
    private String passwordHash;

    private Role role;

    /**
     * Арендатор, к которому относится пользователь.
     * Заполнен для PHOTOGRAPHER и CLIENT, пуст для ADMIN.
     */
    @Column("photographer_id")
    private String photographerId;

    @CreatedDate
    @Column("created_at")
    private LocalDateTime createdAt;
}
