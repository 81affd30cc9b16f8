package com.venue.scout.recommender.repo.documents;

import com.venue.scout.recommender.enums.RecommendationStatus;
import com.venue.scout.recommender.model.documents.RecommendationRecord;
import org.springframework.data.mongodb.repository.MongoRepository;
import org.springframework.data.mongodb.repository.Query;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

@Repository
public interface RecommendationRecordRepo extends MongoRepository<RecommendationRecord, String> {

    Optional<RecommendationRecord> findByUserIdAndCandidateId(String userId, String candidateId);

    List<RecommendationRecord> findByUserIdAndStatus(String userId, RecommendationStatus status);

    long countByUserIdAndStatus(String userId, RecommendationStatus status);

    long countByUserId(String userId);

    // Load pre-filter: status, lifetime and freshness. Cooldown is decided by the policy.
    @Query("{'userId': ?0, 'status': {$nin: ['NOT_INTERESTED', 'ACCEPTED']}, " +
            "'expiresAt': {$gte: ?1}, 'createdAt': {$gte: ?2}}")
    List<RecommendationRecord> findLoadCandidates(String userId, Instant now, Instant freshSince);

    List<RecommendationRecord> findByUserIdAndLastShownAtAfter(String userId, Instant since);

    // Expiry management
    @Query("{'expiresAt': {$lt: ?0}, 'status': {$in: ['PENDING', 'VIEWED']}}")
    List<RecommendationRecord> findExpiredOpenRecords(Instant now);

}
