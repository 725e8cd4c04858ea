package ru.oparin.studiocrm.config.properties;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

@Getter
@Setter
@Configuration
@ConfigurationProperties(prefix = "app.subscription")
public class SubscriptionProperties {

    /**
     * Длительность пробного периода для новой студии, в днях.
     */
    private Integer trialDays = 14;
}
