package ru.oparin.studiocrm.validation;

import jakarta.validation.ConstraintValidator;
import jakarta.validation.ConstraintValidatorContext;

public class StrongPasswordValidator implements ConstraintValidator<StrongPassword, String> {

    private static final int MIN_LENGTH = 8;
    private static final int MAX_LENGTH = 72; // дальше bcrypt обрезает пароль

    @Override
    public boolean isValid(String password, ConstraintValidatorContext context) {
        if (password == null) {
            return false;
        }

        if (password.length() < MIN_LENGTH) {
            return reject(context, "Пароль должен содержать минимум 8 символов");
        }

        if (password.length() > MAX_LENGTH) {
            return reject(context, "Пароль должен содержать не более 72 символов");
        }

        if (!password.matches(".*[A-Za-zА-Яа-я].*")) {
            return reject(context, "Пароль должен содержать буквы");
        }

        if (!password.matches(".*\\d.*")) {
            return reject(context, "Пароль должен содержать цифры");
        }

        return true;
    }

    private boolean reject(ConstraintValidatorContext context, String message) {
        context.disableDefaultConstraintViolation();
        context.buildConstraintViolationWithTemplate(message)
                .addConstraintViolation();
        return false;
    }
}
