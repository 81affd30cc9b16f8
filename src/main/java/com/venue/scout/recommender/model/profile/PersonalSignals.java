package com.venue.scout.recommender.model.profile;

import lombok.Builder;
import lombok.Value;

import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Cross-referenced personal data sources. Every part is optional; an empty collection means the
 * source is not connected for this user.
 */
@Value
@Builder
public class PersonalSignals {
    @Builder.Default
    Map<String, Integer> visitCounts = Map.of();       // candidateId -> prior visits
    @Builder.Default
    Map<String, Integer> personalRatings = Map.of();   // candidateId -> stars 1..5
    @Builder.Default
    Set<String> externalLikedCategories = Set.of();    // from linked music/social accounts
    @Builder.Default
    List<SchedulePattern> schedulePatterns = List.of();

    public static PersonalSignals empty() {
        return PersonalSignals.builder().build();
    }
}
