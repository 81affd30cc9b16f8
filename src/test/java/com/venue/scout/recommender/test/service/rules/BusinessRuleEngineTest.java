package com.venue.scout.recommender.test.service.rules;

import com.venue.scout.recommender.common.constants.RankingProperties;
import com.venue.scout.recommender.model.scoring.ScoredCandidate;
import com.venue.scout.recommender.service.rules.BusinessRuleEngine;
import com.venue.scout.recommender.service.rules.CategoryDiversityRule;
import com.venue.scout.recommender.service.rules.ConsecutiveDuplicateRule;
import com.venue.scout.recommender.service.rules.EventBalanceRule;
import com.venue.scout.recommender.service.rules.EventDedupRule;
import com.venue.scout.recommender.service.rules.IdentityDedupRule;
import com.venue.scout.recommender.service.rules.SponsorshipCapRule;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

import static com.venue.scout.recommender.test.Candidates.scoredEvent;
import static com.venue.scout.recommender.test.Candidates.scoredEventIn;
import static com.venue.scout.recommender.test.Candidates.scoredPlace;
import static com.venue.scout.recommender.test.Candidates.scoredSponsored;
import static org.assertj.core.api.Assertions.assertThat;

public class BusinessRuleEngineTest {

    private static final Instant TONIGHT = Instant.parse("2026-10-17T20:00:00Z");

    public static BusinessRuleEngine engine(RankingProperties props) {
        return new BusinessRuleEngine(new IdentityDedupRule(), new EventDedupRule(), new ConsecutiveDuplicateRule(),
                new CategoryDiversityRule(props), new EventBalanceRule(props), new SponsorshipCapRule(props));
    }

    @Test
    void emptyOrNullInputGivesEmptyList() {
        BusinessRuleEngine engine = engine(new RankingProperties());

        assertThat(engine.apply(List.of(), 10)).isEmpty();
        assertThat(engine.apply(null, 10)).isEmpty();
        assertThat(engine.apply(List.of(scoredPlace("gp-1", "coffee", 50)), 0)).isEmpty();
    }

    @Test
    void rulesRunInFixedOrder() {
        assertThat(engine(new RankingProperties()).ruleNames()).containsExactly(
                "identity-dedup", "event-dedup", "consecutive-duplicate",
                "category-diversity", "event-balance", "sponsorship-cap", "category-diversity");
    }

    @Test
    void sameEventFromTwoFeedsKeepsHigherScoredCopy() {
        List<ScoredCandidate> in = List.of(
                scoredEvent("tm-1", "Jazz Night!", TONIGHT, 80),
                scoredEvent("tm-2", "jazz  night", TONIGHT.plusSeconds(1800), 90),
                scoredPlace("gp-1", "coffee", 70));

        List<ScoredCandidate> out = engine(new RankingProperties()).apply(in, 10);

        assertThat(out).extracting(ScoredCandidate::getId).containsExactly("tm-2", "gp-1");
    }

    @Test
    void sameEventIsMatchedOnTheUsersCalendarDay() {
        // 18:00 and 21:30 in New York on the 17th, two different UTC dates
        List<ScoredCandidate> in = List.of(
                scoredEvent("tm-1", "Jazz Night", Instant.parse("2026-10-17T22:00:00Z"), 90),
                scoredEvent("tm-2", "Jazz Night", Instant.parse("2026-10-18T01:30:00Z"), 80),
                scoredPlace("gp-1", "coffee", 70));

        List<ScoredCandidate> local = engine(new RankingProperties()).apply(in, 10, ZoneId.of("America/New_York"));
        List<ScoredCandidate> utc = engine(new RankingProperties()).apply(in, 10);

        assertThat(local).extracting(ScoredCandidate::getId).containsExactly("tm-1", "gp-1");
        assertThat(utc).extracting(ScoredCandidate::getId).containsExactly("tm-1", "tm-2", "gp-1");
    }

    @Test
    void noTwoAdjacentEntriesShareAnId() {
        List<ScoredCandidate> in = new ArrayList<>();
        for (int i = 0; i < 12; i++) {
            in.add(scoredPlace("gp-" + (i % 4), "cat" + (i % 4), 100 - i));
        }

        List<ScoredCandidate> out = engine(new RankingProperties()).apply(in, 10);

        assertThat(out).hasSize(4);
        for (int i = 1; i < out.size(); i++) {
            assertThat(out.get(i).getId()).isNotEqualTo(out.get(i - 1).getId());
        }
    }

    @Test
    void topTenReachesSevenCategoriesWhenTenAreAvailable() {
        List<ScoredCandidate> in = new ArrayList<>();
        for (int i = 0; i < 10; i++) in.add(scoredPlace("gp-c" + i, "coffee", 100 - i));
        String[] others = {"dining", "bars", "outdoor", "culture", "arts", "fitness", "shopping", "wellness", "family"};
        for (int i = 0; i < others.length; i++) in.add(scoredPlace("gp-o" + i, others[i], 80 - i));

        List<ScoredCandidate> out = engine(new RankingProperties()).apply(in, 10);

        Set<String> categories = new HashSet<>();
        for (ScoredCandidate sc : out) categories.add(sc.getCategory());
        assertThat(out).hasSize(10);
        assertThat(categories).hasSizeGreaterThanOrEqualTo(7);
        assertThat(out.get(0).getId()).isEqualTo("gp-c0");
    }

    @Test
    void eventCapDoesNotCostTopTenDiversity() {
        List<ScoredCandidate> in = new ArrayList<>();
        String[] eventCategories = {"live music", "arts", "sports", "comedy", "theatre"};
        for (int i = 0; i < 5; i++) in.add(scoredEventIn("tm-" + i, eventCategories[i], TONIGHT.plusSeconds(i * 86400L), 100 - i));
        for (int i = 0; i < 5; i++) in.add(scoredPlace("gp-c" + i, "coffee", 95 - i));
        String[] others = {"dining", "bars", "outdoor", "culture", "fitness"};
        for (int i = 0; i < others.length; i++) in.add(scoredPlace("gp-o" + i, others[i], 90 - i));

        List<ScoredCandidate> out = engine(new RankingProperties()).apply(in, 10);

        assertThat(out).hasSize(10);
        assertThat(categoriesOf(out)).hasSizeGreaterThanOrEqualTo(7);
        assertThat(out.stream().filter(ScoredCandidate::isTimeBound).count()).isEqualTo(4);
    }

    @Test
    void eventAndSponsorshipCapsKeepSevenCategories() {
        List<ScoredCandidate> in = new ArrayList<>();
        in.add(scoredSponsored("sp-1", "dining", 110));
        in.add(scoredSponsored("sp-2", "dining", 109));
        in.add(scoredSponsored("sp-3", "dining", 108));
        String[] eventCategories = {"live music", "arts", "sports", "comedy", "theatre"};
        for (int i = 0; i < 5; i++) in.add(scoredEventIn("tm-" + i, eventCategories[i], TONIGHT.plusSeconds(i * 86400L), 100 - i));
        for (int i = 0; i < 5; i++) in.add(scoredPlace("gp-c" + i, "coffee", 95 - i));
        in.add(scoredSponsored("sp-4", "bars", 90));
        String[] others = {"outdoor", "culture", "fitness", "family"};
        for (int i = 0; i < others.length; i++) in.add(scoredPlace("gp-o" + i, others[i], 85 - i));

        List<ScoredCandidate> out = engine(new RankingProperties()).apply(in, 10);

        assertThat(out).hasSize(10);
        assertThat(categoriesOf(out)).hasSizeGreaterThanOrEqualTo(7);
        assertThat(out.stream().filter(ScoredCandidate::isTimeBound).count()).isLessThanOrEqualTo(4);
        assertThat(out.subList(0, 5).stream().filter(ScoredCandidate::isSponsored).count()).isLessThanOrEqualTo(2);
    }

    private static Set<String> categoriesOf(List<ScoredCandidate> list) {
        Set<String> categories = new HashSet<>();
        for (ScoredCandidate sc : list) categories.add(sc.getCategory());
        return categories;
    }

    @Test
    void resultIsTruncatedToRequestedCount() {
        List<ScoredCandidate> in = new ArrayList<>();
        for (int i = 0; i < 30; i++) in.add(scoredPlace("gp-" + i, "cat" + i, 100 - i));

        assertThat(engine(new RankingProperties()).apply(in, 5)).hasSize(5);
    }
}
