package com.venue.scout.recommender.model.documents;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.CompoundIndex;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;

/**
 * Permanent opt-out of a user from one candidate ("never show again").
 */
@Document("blocked_candidates")
@CompoundIndex(name = "user_candidate_uq", def = "{'userId': 1, 'candidateId': 1}", unique = true)
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class BlockedCandidate {
    @Id
    private String id;
    private String userId;
    private String candidateId;
    private String candidateName;
    private String reason;
    private Instant blockedAt;
}
