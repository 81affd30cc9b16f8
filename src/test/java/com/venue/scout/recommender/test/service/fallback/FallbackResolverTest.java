package com.venue.scout.recommender.test.service.fallback;

import com.venue.scout.recommender.service.fallback.FallbackResolver;
import com.venue.scout.recommender.service.fallback.FallbackStrategy;
import com.venue.scout.recommender.service.fallback.Resolution;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;

import static org.assertj.core.api.Assertions.assertThat;

class FallbackResolverTest {

    private final FallbackResolver resolver = new FallbackResolver();

    @Test
    void firstNonEmptyStepWinsAndLaterStepsAreSkipped() {
        AtomicBoolean reachedLast = new AtomicBoolean();
        List<FallbackStrategy<String>> chain = List.of(
                FallbackStrategy.of("cached", Optional::empty),
                FallbackStrategy.of("live", () -> Optional.of("fresh")),
                FallbackStrategy.of("stale", () -> {
                    reachedLast.set(true);
                    return Optional.of("old");
                }));

        Optional<Resolution<String>> r = resolver.resolve("pool", chain);

        assertThat(r).contains(new Resolution<>("fresh", "live"));
        assertThat(reachedLast).isFalse();
    }

    @Test
    void throwingStepIsSkipped() {
        List<FallbackStrategy<String>> chain = List.of(
                FallbackStrategy.of("live", () -> {
                    throw new IllegalStateException("provider down");
                }),
                FallbackStrategy.of("stale", () -> Optional.of("old")));

        assertThat(resolver.resolve("pool", chain)).map(Resolution::strategy).contains("stale");
    }

    @Test
    void exhaustedChainIsEmpty() {
        List<FallbackStrategy<String>> chain = List.of(
                FallbackStrategy.of("a", Optional::empty),
                FallbackStrategy.of("b", () -> null));

        assertThat(resolver.resolve("pool", chain)).isEmpty();
    }
}
