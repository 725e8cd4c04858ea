package ru.oparin.studiocrm.service;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.HttpStatus;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;
import ru.oparin.studiocrm.exception.AuthException;
import ru.oparin.studiocrm.model.entity.Photographer;
import ru.oparin.studiocrm.model.entity.User;
import ru.oparin.studiocrm.model.enums.Role;
import ru.oparin.studiocrm.repository.PhotographerRepository;
import ru.oparin.studiocrm.repository.UserRepository;
import ru.oparin.studiocrm.security.ImpersonationSession;
import ru.oparin.studiocrm.security.NormalSession;
import ru.oparin.studiocrm.security.SessionClaim;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@DisplayName("ImpersonationService")
class ImpersonationServiceTest {

    private static final NormalSession ADMIN = NormalSession.of("admin-1", Role.ADMIN, null);

    @Mock
    private PhotographerRepository photographerRepository;

    @Mock
    private UserRepository userRepository;

    private JwtService jwtService;
    private ImpersonationService impersonationService;

    @BeforeEach
    void setUp() {
        jwtService = JwtServiceTest.jwtServiceAt(JwtServiceTest.NOW);
        impersonationService = new ImpersonationService(photographerRepository, userRepository, jwtService);
    }

    private static void assertStatus(Throwable error, HttpStatus status) {
        assertThat(error).isInstanceOf(AuthException.class);
        assertThat(((AuthException) error).getStatus()).isEqualTo(status);
    }

    @Nested
    @DisplayName("startImpersonation()")
    class Start {

        @Test
        @DisplayName("выдает токен сессии от имени владельца студии")
        void success() {
            when(photographerRepository.findById("studio-1"))
                    .thenReturn(Mono.just(Photographer.builder().id("studio-1").subscriptionStatus("active").build()));
            when(userRepository.findFirstByPhotographerIdAndRole("studio-1", Role.PHOTOGRAPHER))
                    .thenReturn(Mono.just(User.builder().id("owner-1").email("anna@studio.com")
                            .role(Role.PHOTOGRAPHER).photographerId("studio-1").build()));

            StepVerifier.create(impersonationService.startImpersonation(ADMIN, "studio-1"))
                    .assertNext(response -> {
                        assertThat(response.isImpersonating()).isTrue();
                        assertThat(response.getUserId()).isEqualTo("owner-1");
                        assertThat(response.getRole()).isEqualTo("PHOTOGRAPHER");

                        SessionClaim claim = jwtService.verifyToken(response.getToken()).orElseThrow();
                        assertThat(claim).isInstanceOf(ImpersonationSession.class);
                        assertThat(claim.getPhotographerId()).isEqualTo("studio-1");
                        assertThat(claim.getAdminUserId()).isEqualTo("admin-1");
                        assertThat(claim.getOriginalRole()).isEqualTo(Role.ADMIN);
                    })
                    .verifyComplete();
        }

        @Test
        @DisplayName("вложенная имперсонация запрещена")
        void nested() {
            StepVerifier.create(impersonationService.startImpersonation(ADMIN.impersonate("owner-1", "studio-1"), "studio-2"))
                    .expectErrorSatisfies(error -> assertStatus(error, HttpStatus.FORBIDDEN))
                    .verify();

            verifyNoInteractions(photographerRepository, userRepository);
        }

        @Test
        @DisplayName("фотограф не может начать имперсонацию")
        void notAdmin() {
            StepVerifier.create(impersonationService.startImpersonation(
                            NormalSession.of("user-1", Role.PHOTOGRAPHER, "studio-1"), "studio-2"))
                    .expectErrorSatisfies(error -> assertStatus(error, HttpStatus.FORBIDDEN))
                    .verify();

            verifyNoInteractions(photographerRepository, userRepository);
        }

        @Test
        @DisplayName("без сессии - 401")
        void unauthenticated() {
            StepVerifier.create(impersonationService.startImpersonation(null, "studio-1"))
                    .expectErrorSatisfies(error -> assertStatus(error, HttpStatus.UNAUTHORIZED))
                    .verify();
        }

        @Test
        @DisplayName("неизвестная студия - 404")
        void unknownStudio() {
            when(photographerRepository.findById("missing")).thenReturn(Mono.empty());

            StepVerifier.create(impersonationService.startImpersonation(ADMIN, "missing"))
                    .expectErrorSatisfies(error -> {
                        assertStatus(error, HttpStatus.NOT_FOUND);
                        assertThat(error).hasMessage("Фотограф не найден");
                    })
                    .verify();
        }

        @Test
        @DisplayName("студия без владельца - 404")
        void studioWithoutOwner() {
            when(photographerRepository.findById("studio-1"))
                    .thenReturn(Mono.just(Photographer.builder().id("studio-1").build()));
            when(userRepository.findFirstByPhotographerIdAndRole("studio-1", Role.PHOTOGRAPHER))
                    .thenReturn(Mono.empty());

            StepVerifier.create(impersonationService.startImpersonation(ADMIN, "studio-1"))
                    .expectErrorSatisfies(error -> assertStatus(error, HttpStatus.NOT_FOUND))
                    .verify();
        }
    }

    @Nested
    @DisplayName("exitImpersonation()")
    class Exit {

        @Test
        @DisplayName("возвращает обычную сессию администратора")
        void success() {
            when(userRepository.findById("admin-1")).thenReturn(Mono.just(
                    User.builder().id("admin-1").email("ops@studiocrm.app").role(Role.ADMIN).build()));

            StepVerifier.create(impersonationService.exitImpersonation(ADMIN.impersonate("owner-1", "studio-1")))
                    .assertNext(response -> {
                        assertThat(response.isImpersonating()).isFalse();
                        assertThat(response.getUserId()).isEqualTo("admin-1");
                        assertThat(jwtService.verifyToken(response.getToken())).contains(ADMIN);
                    })
                    .verifyComplete();
        }

        @Test
        @DisplayName("без активной имперсонации - 403")
        void notImpersonating() {
            StepVerifier.create(impersonationService.exitImpersonation(ADMIN))
                    .expectErrorSatisfies(error -> assertStatus(error, HttpStatus.FORBIDDEN))
                    .verify();

            verifyNoInteractions(userRepository);
        }

        @Test
        @DisplayName("обычный фотограф - 403")
        void photographer() {
            StepVerifier.create(impersonationService.exitImpersonation(NormalSession.of("user-1", Role.PHOTOGRAPHER, "studio-1")))
                    .expectErrorSatisfies(error -> assertStatus(error, HttpStatus.FORBIDDEN))
                    .verify();
        }

        @Test
        @DisplayName("администратор лишен роли за время имперсонации - 403")
        void adminDemoted() {
            when(userRepository.findById("admin-1")).thenReturn(Mono.just(
                    User.builder().id("admin-1").role(Role.PHOTOGRAPHER).photographerId("studio-9").build()));

            StepVerifier.create(impersonationService.exitImpersonation(ADMIN.impersonate("owner-1", "studio-1")))
                    .expectErrorSatisfies(error -> assertStatus(error, HttpStatus.FORBIDDEN))
                    .verify();
        }
    }
}
