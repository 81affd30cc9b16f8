package com.venue.scout.recommender.config;

import com.venue.scout.recommender.core.RedisTtlStateStore;
import com.venue.scout.recommender.core.TtlStateStore;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.redis.connection.RedisConnectionFactory;
import org.springframework.data.redis.core.StringRedisTemplate;

@Configuration
@ConditionalOnProperty(name = "scout.redis.enabled", havingValue = "true")
public class RedisConfig {

    // connection factory comes from spring.data.redis.* auto-configuration
    @Bean
    public StringRedisTemplate stringRedisTemplate(RedisConnectionFactory cf) {
        return new StringRedisTemplate(cf);
    }

    @Bean
    public TtlStateStore ttlStateStore(StringRedisTemplate template) {
        return new RedisTtlStateStore(template, "scout:");
    }
}
