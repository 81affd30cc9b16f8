package com.venue.scout.recommender.service.collab;

import com.google.gson.JsonObject;
import com.venue.scout.recommender.bus.EventBusConfig;
import com.venue.scout.recommender.bus.EventPublisher;
import com.venue.scout.recommender.model.documents.RecommendationRecord;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.util.Optional;

/**
 * Publishes a {@code schedule.link} event; the scheduling service creates its entity
 * asynchronously, so no reference is returned.
 */
@RequiredArgsConstructor
@Slf4j
public class EventBusScheduleLinker implements ScheduleLinker {

    private final EventPublisher publisher;

    @Override
    public Optional<String> link(RecommendationRecord accepted) {
        JsonObject o = new JsonObject();
        o.addProperty("recordId", accepted.getId());
        o.addProperty("userId", accepted.getUserId());
        o.addProperty("candidateId", accepted.getCandidateId());
        o.addProperty("name", accepted.getCandidateName());
        o.addProperty("address", accepted.getAddress());
        if (accepted.getScheduleRef() != null) o.addProperty("scheduleRef", accepted.getScheduleRef());
        publisher.publishEvent(EventBusConfig.TOPIC_SCHEDULE, accepted.getUserId(), "schedule.link", o);
        log.debug("schedule.link published for record {}", accepted.getId());
        return Optional.empty();
    }
}
