package com.venue.scout.recommender.service.collab;

import com.venue.scout.recommender.model.profile.PersonalSignals;

/**
 * Cross-referenced personal data (visit history, ratings, linked accounts, habits).
 */
public interface PersonalSignalsProvider {

    PersonalSignals signalsFor(String userId);
}
