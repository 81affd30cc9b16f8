package com.venue.scout.recommender.repo.documents;

import com.venue.scout.recommender.model.documents.SponsoredListing;
import org.springframework.data.domain.Pageable;
import org.springframework.data.geo.Distance;
import org.springframework.data.geo.Point;
import org.springframework.data.mongodb.repository.MongoRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface SponsoredListingRepo extends MongoRepository<SponsoredListing, String> {

    List<SponsoredListing> findByLocationNear(Point point, Distance maxDistance, Pageable page);
}
