package com.venue.scout.recommender.model.documents;

import com.venue.scout.recommender.enums.RecommendationStatus;
import com.venue.scout.recommender.enums.SourceKind;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.CompoundIndex;
import org.springframework.data.mongodb.core.index.CompoundIndexes;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;

/**
 * A candidate surfaced to a user, with its lifecycle state. One document per (userId, candidateId).
 */
@Document("recommendation_records")
@CompoundIndexes({
        @CompoundIndex(name = "user_candidate_uq", def = "{'userId': 1, 'candidateId': 1}", unique = true),
        @CompoundIndex(name = "user_status_shown", def = "{'userId': 1, 'status': 1, 'lastShownAt': 1}")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RecommendationRecord {
    @Id
    private String id;

    private String userId;
    private String candidateId;
    private SourceKind source;
    private String category;
    private String candidateName; // display
    private String address;       // display
    private String explanation;   // display

    private RecommendationStatus status;
    private Double confidenceScore; // 0..1

    // Lifecycle timestamps
    private Instant createdAt;     // last (re)generation by a cycle
    private Instant lastShownAt;
    private Instant viewedAt;
    private Instant respondedAt;
    private Instant expiresAt;
    private Instant updatedAt;

    private String declineReason;
    private String blockReason;
    private String scheduleRef; // downstream entity created on accept

    @Builder.Default
    private Integer displayCount = 0;
    @Builder.Default
    private Integer resurfacedCount = 0;

    public boolean isExpiredAt(Instant now) {
        return expiresAt != null && !now.isBefore(expiresAt);
    }
}
