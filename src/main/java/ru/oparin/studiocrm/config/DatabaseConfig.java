package ru.oparin.studiocrm.config;

import org.springframework.context.annotation.Configuration;
import org.springframework.data.r2dbc.config.EnableR2dbcAuditing;

/**
 * Аудит R2DBC заполняет поля {@code @CreatedDate}.
 * Повторов запросов при сбоях БД нет: ошибка хранилища завершает запрос с 500.
 */
@Configuration
@EnableR2dbcAuditing
public class DatabaseConfig {
}
