package com.venue.scout.recommender.repo.documents;

import com.venue.scout.recommender.model.documents.BlockedCandidate;
import org.springframework.data.mongodb.repository.MongoRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface BlockedCandidateRepo extends MongoRepository<BlockedCandidate, String> {

    List<BlockedCandidate> findByUserIdOrderByBlockedAtDesc(String userId);

    boolean existsByUserIdAndCandidateId(String userId, String candidateId);

    long deleteByUserIdAndCandidateId(String userId, String candidateId);
}
