package com.venue.scout.recommender.service.fallback;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Optional;

/**
 * Evaluates an ordered list of strategies and returns the first non-empty result. A step that
 * throws is logged and treated as empty.
 */
@Component
@Slf4j
public class FallbackResolver {

    public <T> Optional<Resolution<T>> resolve(String what, List<FallbackStrategy<T>> chain) {
        for (FallbackStrategy<T> step : chain) {
            Optional<T> value;
            try {
                value = step.attempt();
            } catch (RuntimeException e) {
                log.warn("fallback.{}: step {} failed: {}", what, step.name(), e.toString());
                continue;
            }
            if (value != null && value.isPresent()) {
                log.debug("fallback.{}: resolved by {}", what, step.name());
                return Optional.of(new Resolution<>(value.get(), step.name()));
            }
        }
        log.debug("fallback.{}: no step produced a value", what);
        return Optional.empty();
    }
}
