package ru.oparin.studiocrm;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.autoconfigure.security.reactive.ReactiveUserDetailsServiceAutoConfiguration;
import org.springframework.data.r2dbc.repository.config.EnableR2dbcRepositories;

@EnableR2dbcRepositories(basePackages = "ru.oparin.studiocrm.repository")
@SpringBootApplication(exclude = ReactiveUserDetailsServiceAutoConfiguration.class)
public class StudioCrmApplication {

    public static void main(String[] args) {
        SpringApplication.run(StudioCrmApplication.class, args);
    }
}
