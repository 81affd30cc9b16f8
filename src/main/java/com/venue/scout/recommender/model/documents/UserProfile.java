package com.venue.scout.recommender.model.documents;

import com.venue.scout.recommender.enums.SubscriptionTier;
import com.venue.scout.recommender.model.candidate.GeoPoint;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.mapping.Document;

import java.util.ArrayList;
import java.util.List;

/**
 * Read model of the user's preferences. Owned and written by the profile service.
 */
@Document("user_profiles")
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class UserProfile {
    @Id
    private String id;
    @Builder.Default
    private List<String> interests = new ArrayList<>();          // ordered, strongest first
    @Builder.Default
    private List<String> favoriteCategories = new ArrayList<>();
    @Builder.Default
    private List<String> dislikedCategories = new ArrayList<>();
    private Integer budgetLevel;      // 1..4
    private Double maxDistanceMiles;
    @Builder.Default
    private List<String> preferredTimes = new ArrayList<>();     // morning/afternoon/evening/night
    @Builder.Default
    private SubscriptionTier subscriptionTier = SubscriptionTier.FREE;
    private GeoPoint home;
    private GeoPoint work;

    /** Favorite categories when known, otherwise the first three interests. */
    public List<String> topInterests() {
        if (favoriteCategories != null && !favoriteCategories.isEmpty()) return favoriteCategories;
        if (interests == null) return List.of();
        return interests.subList(0, Math.min(3, interests.size()));
    }
}
