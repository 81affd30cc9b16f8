package com.venue.scout.recommender.repo.documents;

import com.venue.scout.recommender.model.documents.UserProfile;
import org.springframework.data.mongodb.repository.MongoRepository;
import org.springframework.stereotype.Repository;

@Repository
public interface UserProfileRepo extends MongoRepository<UserProfile, String> {
}
