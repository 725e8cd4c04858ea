package ru.oparin.studiocrm.service;

import io.jsonwebtoken.Claims;
import io.jsonwebtoken.JwtBuilder;
import io.jsonwebtoken.JwtException;
import io.jsonwebtoken.Jwts;
import io.jsonwebtoken.SignatureAlgorithm;
import io.jsonwebtoken.security.Keys;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import ru.oparin.studiocrm.config.properties.JwtProperties;
import ru.oparin.studiocrm.model.enums.Role;
import ru.oparin.studiocrm.security.NormalSession;
import ru.oparin.studiocrm.security.SessionClaim;

import javax.crypto.SecretKey;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDateTime;
import java.util.Date;
import java.util.Optional;

/**
 * Выпуск и проверка сессионных JWT токенов (HS256).
 * Сервер не хранит токены: единственное ограничение жизни токена - срок действия.
 */
@Slf4j
@Service
public class JwtService {

    static final String CLAIM_ROLE = "role";
    static final String CLAIM_PHOTOGRAPHER_ID = "photographerId";
    static final String CLAIM_IMPERSONATING = "isImpersonating";
    static final String CLAIM_ADMIN_USER_ID = "adminUserId";
    static final String CLAIM_ORIGINAL_ROLE = "originalRole";

    private static final int MIN_SECRET_BYTES = 32;

    private final SecretKey signingKey;
    private final Clock clock;

    @Getter
    private final Duration expiration;

    public JwtService(JwtProperties properties, Clock clock) {
        String secret = properties.getSecret();
        if (secret == null || secret.getBytes(StandardCharsets.UTF_8).length < MIN_SECRET_BYTES) {
            throw new IllegalStateException("app.jwt.secret должен быть задан и содержать не менее " + MIN_SECRET_BYTES + " байт");
        }
        this.signingKey = Keys.hmacShaKeyFor(secret.getBytes(StandardCharsets.UTF_8));
        this.expiration = properties.getExpiration();
        this.clock = clock;
    }

    /**
     * Подписывает сессию и выпускает токен со сроком действия {@link #getExpiration()}.
     *
     * @param claim содержимое сессии
     * @return компактный JWT
     */
    public String generateToken(SessionClaim claim) {
        Instant now = clock.instant();
        JwtBuilder builder = Jwts.builder()
                .setSubject(claim.getUserId())
                .claim(CLAIM_ROLE, claim.getRole().name())
                .setIssuedAt(Date.from(now))
                .setExpiration(Date.from(now.plus(expiration)));

        if (claim.getPhotographerId() != null) {
            builder.claim(CLAIM_PHOTOGRAPHER_ID, claim.getPhotographerId());
        }
        if (claim.isImpersonating()) {
            builder.claim(CLAIM_IMPERSONATING, true)
                    .claim(CLAIM_ADMIN_USER_ID, claim.getAdminUserId())
                    .claim(CLAIM_ORIGINAL_ROLE, claim.getOriginalRole().name());
        }

        return builder.signWith(signingKey, SignatureAlgorithm.HS256).compact();
    }

    /**
     * Проверяет подпись и срок действия токена.
     * Любая ошибка (битый токен, чужая подпись, истекший срок, несогласованные поля)
     * дает пустой результат: вызывающий код не должен различать причины.
     *
     * @param token компактный JWT
     * @return сессия, либо пустой Optional
     */
    public Optional<SessionClaim> verifyToken(String token) {
        if (token == null || token.isBlank()) {
            return Optional.empty();
        }
        try {
            Claims claims = Jwts.parserBuilder()
                    .setSigningKey(signingKey)
                    .setClock(() -> Date.from(clock.instant()))
                    .build()
                    .parseClaimsJws(token)
                    .getBody();
            return toSessionClaim(claims);
        } catch (JwtException | IllegalArgumentException e) {
            log.debug("Токен отклонен: {}", e.getMessage());
            return Optional.empty();
        }
    }

    /**
     * Момент истечения токена, выпущенного сейчас.
     */
    public LocalDateTime expiresAtFromNow() {
        return LocalDateTime.now(clock).plus(expiration);
    }

    private Optional<SessionClaim> toSessionClaim(Claims claims) {
        String userId = claims.getSubject();
        Optional<Role> role = Role.fromValue(claims.get(CLAIM_ROLE, String.class));
        if (userId == null || role.isEmpty()) {
            log.debug("Токен без subject или с неизвестной ролью");
            return Optional.empty();
        }

        String photographerId = claims.get(CLAIM_PHOTOGRAPHER_ID, String.class);
        boolean impersonating = Boolean.TRUE.equals(claims.get(CLAIM_IMPERSONATING, Boolean.class));
        String adminUserId = claims.get(CLAIM_ADMIN_USER_ID, String.class);
        String originalRole = claims.get(CLAIM_ORIGINAL_ROLE, String.class);

        if (!impersonating) {
            if (adminUserId != null || originalRole != null) {
                log.debug("Обычная сессия содержит поля имперсонации");
                return Optional.empty();
            }
            return Optional.of(NormalSession.of(userId, role.get(), photographerId));
        }

        // имперсонация: только фотограф от имени администратора
        if (adminUserId == null || !Role.ADMIN.name().equals(originalRole)
                || role.get() != Role.PHOTOGRAPHER || photographerId == null) {
            log.debug("Несогласованные поля имперсонации");
            return Optional.empty();
        }
        return Optional.of(NormalSession.of(adminUserId, Role.ADMIN, null)
                .impersonate(userId, photographerId));
    }
}
