package ru.oparin.studiocrm.exception;

import lombok.Getter;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Доступ закрыт тарифом (HTTP 402).
 * Несет структурированные поля, чтобы клиент мог показать нужное сообщение без разбора текста ошибки.
 */
@Getter
public class PaymentRequiredException extends RuntimeException {

    private final Map<String, Object> details;

    private PaymentRequiredException(String message, Map<String, Object> details) {
        super(message);
        this.details = Collections.unmodifiableMap(details);
    }

    /**
     * @param subscriptionStatus текущий статус подписки (может быть null)
     * @param trialEnded истек ли пробный период
     */
    public static PaymentRequiredException subscriptionRequired(String subscriptionStatus, boolean trialEnded) {
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("subscriptionStatus", subscriptionStatus);
        details.put("trialEnded", trialEnded);
        return new PaymentRequiredException("Требуется активная подписка", details);
    }

    public static PaymentRequiredException galleryPlanRequired() {
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("galleryPlanRequired", true);
        details.put("upgradeRequired", true);
        return new PaymentRequiredException("Требуется тариф галерей", details);
    }
}
