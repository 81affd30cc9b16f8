package com.venue.scout.recommender.repo.documents;

import com.venue.scout.recommender.model.documents.FeedbackRecord;
import org.springframework.data.mongodb.repository.MongoRepository;
import org.springframework.stereotype.Repository;

import java.util.Collection;
import java.util.List;

@Repository
public interface FeedbackRecordRepo extends MongoRepository<FeedbackRecord, String> {

    List<FeedbackRecord> findTop100ByUserIdOrderByCreatedAtDesc(String userId);

    List<FeedbackRecord> findByCandidateIdInAndUserIdNot(Collection<String> candidateIds, String userId);
}
