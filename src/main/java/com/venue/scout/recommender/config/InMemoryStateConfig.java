package com.venue.scout.recommender.config;

import com.venue.scout.recommender.core.InMemoryTtlStateStore;
import com.venue.scout.recommender.core.TtlStateStore;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

@Configuration
@ConditionalOnProperty(name = "scout.redis.enabled", havingValue = "false", matchIfMissing = true)
public class InMemoryStateConfig {

    @Bean
    public TtlStateStore ttlStateStore(Clock clock) {
        return new InMemoryTtlStateStore("scout:", clock);
    }
}
