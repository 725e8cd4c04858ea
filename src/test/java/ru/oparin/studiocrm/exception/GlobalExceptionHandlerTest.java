package ru.oparin.studiocrm.exception;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpStatus;
import reactor.test.StepVerifier;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("GlobalExceptionHandler")
class GlobalExceptionHandlerTest {

    private final GlobalExceptionHandler handler = new GlobalExceptionHandler();

    @Test
    @DisplayName("AuthException сохраняет свой статус")
    void authException() {
        StepVerifier.create(handler.handleAuthException(new AuthException(HttpStatus.FORBIDDEN, "Недостаточно прав")))
                .assertNext(response -> {
                    assertThat(response.getStatusCode()).isEqualTo(HttpStatus.FORBIDDEN);
                    assertThat(response.getBody())
                            .containsEntry("error", "Недостаточно прав")
                            .containsEntry("status", 403);
                })
                .verifyComplete();
    }

    @Test
    @DisplayName("отказ по подписке - 402 с полями, включая пустой статус")
    void subscriptionRequired() {
        StepVerifier.create(handler.handlePaymentRequiredException(PaymentRequiredException.subscriptionRequired(null, true)))
                .assertNext(response -> {
                    assertThat(response.getStatusCode()).isEqualTo(HttpStatus.PAYMENT_REQUIRED);
                    assertThat(response.getBody())
                            .containsEntry("status", 402)
                            .containsEntry("subscriptionStatus", null)
                            .containsEntry("trialEnded", true);
                })
                .verifyComplete();
    }

    @Test
    @DisplayName("непредвиденная ошибка не раскрывает детали")
    void unexpected() {
        StepVerifier.create(handler.handleAllExceptions(new IllegalStateException("password_hash column missing")))
                .assertNext(response -> {
                    assertThat(response.getStatusCode()).isEqualTo(HttpStatus.INTERNAL_SERVER_ERROR);
                    assertThat(response.getBody().get("error")).isEqualTo("Внутренняя ошибка сервера");
                    assertThat(response.getBody().toString()).doesNotContain("password_hash");
                })
                .verifyComplete();
    }
}
