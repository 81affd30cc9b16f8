package com.venue.scout.recommender.service.collab;

import com.venue.scout.recommender.model.documents.UserProfile;
import com.venue.scout.recommender.repo.documents.UserProfileRepo;
import lombok.RequiredArgsConstructor;

import java.util.Optional;

/**
 * Reads the {@code user_profiles} read model.
 */
@RequiredArgsConstructor
public class MongoUserProfileProvider implements UserProfileProvider {

    private final UserProfileRepo repo;

    @Override
    public Optional<UserProfile> find(String userId) {
        if (userId == null || userId.isBlank()) return Optional.empty();
        return repo.findById(userId);
    }
}
