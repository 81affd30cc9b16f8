package com.venue.scout.recommender.service.fallback;

import java.util.Optional;
import java.util.function.Supplier;

/**
 * One step of an ordered fallback chain. An empty result hands over to the next step.
 */
public interface FallbackStrategy<T> {

    String name();

    Optional<T> attempt();

    static <T> FallbackStrategy<T> of(String name, Supplier<Optional<T>> attempt) {
        return new FallbackStrategy<>() {
            @Override
            public String name() {
                return name;
            }

            @Override
            public Optional<T> attempt() {
                return attempt.get();
            }
        };
    }
}
