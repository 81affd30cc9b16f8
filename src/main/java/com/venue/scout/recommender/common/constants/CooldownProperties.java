package com.venue.scout.recommender.common.constants;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

@Data
@ConfigurationProperties(prefix = "scout.cooldown")
public class CooldownProperties {

    private Duration declined = Duration.ofDays(3);
    private Duration viewedOrExpired = Duration.ofDays(7);
    private Duration freshnessWindow = Duration.ofHours(24);
    private Duration recordLifetime = Duration.ofDays(7);
    private Duration recencyLookback = Duration.ofHours(72);
    private int loadLimit = 10;
}
