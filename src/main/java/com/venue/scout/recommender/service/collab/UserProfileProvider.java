package com.venue.scout.recommender.service.collab;

import com.venue.scout.recommender.model.documents.UserProfile;

import java.util.Optional;

/**
 * Read access to user preferences owned by the profile service.
 */
public interface UserProfileProvider {

    Optional<UserProfile> find(String userId);
}
