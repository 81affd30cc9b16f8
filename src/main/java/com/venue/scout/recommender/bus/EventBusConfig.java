package com.venue.scout.recommender.bus;

public final class EventBusConfig {

    private EventBusConfig() {
    }

    public static final String TOPIC_RECOMMENDATION = "recommendation";

    public static final String TOPIC_SCHEDULE = "schedule";

    public static final String TOPIC_AUDIT = "audit";
}
