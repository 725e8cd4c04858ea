package ru.oparin.studiocrm.service;

import lombok.RequiredArgsConstructor;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

/**
 * Хэширование и проверка паролей.
 * bcrypt намеренно медленный, поэтому вычисления вынесены с event loop на boundedElastic.
 */
@RequiredArgsConstructor
@Service
public class PasswordService {

    private final PasswordEncoder passwordEncoder;

    public Mono<String> hashPassword(String plaintext) {
        return Mono.fromCallable(() -> passwordEncoder.encode(plaintext))
                .subscribeOn(Schedulers.boundedElastic());
    }

    /**
     * Сравнение выполняет сам bcrypt, без посимвольного сравнения строк.
     */
    public Mono<Boolean> verifyPassword(String plaintext, String hash) {
        if (plaintext == null || hash == null) {
            return Mono.just(false);
        }
        return Mono.fromCallable(() -> passwordEncoder.matches(plaintext, hash))
                .subscribeOn(Schedulers.boundedElastic());
    }
}
