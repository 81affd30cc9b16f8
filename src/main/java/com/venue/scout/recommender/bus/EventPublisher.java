package com.venue.scout.recommender.bus;

import com.google.gson.JsonObject;
import lombok.extern.slf4j.Slf4j;
import org.apache.kafka.clients.producer.Producer;
import org.apache.kafka.clients.producer.ProducerRecord;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.core.env.Environment;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.Properties;

/**
 * Best-effort JSON event publishing to Kafka. Failures are logged and never reach the caller.
 */
@Service
@Slf4j
public class EventPublisher {

    private final Producer<String, String> producer;

    @Autowired
    public EventPublisher(Environment env, @Value("${scout.events.enabled:true}") boolean enabled) {
        if (enabled) {
            Properties p = KafkaPropertiesHelper.loadProducerProps(env);
            this.producer = KafkaProducerFactory.get(p);
            log.info("Kafka producer bootstrap.servers={}", p.getProperty("bootstrap.servers"));
        } else {
            this.producer = null;
            log.info("Event publishing disabled (scout.events.enabled=false)");
        }
    }

    /** For tests and callers that already hold a producer. */
    public EventPublisher(Producer<String, String> producer) {
        this.producer = producer;
    }

    public boolean isEnabled() {
        return producer != null;
    }

    public void publish(String topic, String key, String json) {
        if (producer == null) return;
        if (json == null) json = "{}";
        try {
            producer.send(new ProducerRecord<>(topic, key, json), (m, e) -> {
                if (e == null) {
                    log.debug("kafka sent topic={} partition={} offset={}", m.topic(), m.partition(), m.offset());
                } else {
                    log.warn("kafka send failed topic={} key={} cause={}", topic, key, e.toString());
                }
            });
        } catch (RuntimeException e) {
            log.warn("kafka send rejected topic={} key={} cause={}", topic, key, e.toString());
        }
    }

    /**
     * Standard envelope: ts, ts_iso, event, source plus caller supplied fields.
     */
    public void publishEvent(String topic, String key, String event, JsonObject fields) {
        Instant now = Instant.now();
        JsonObject o = new JsonObject();
        o.addProperty("ts", now.toEpochMilli());
        o.addProperty("ts_iso", now.toString());
        o.addProperty("event", event);
        o.addProperty("source", "scout-recommender");
        if (fields != null) {
            fields.entrySet().forEach(en -> o.add(en.getKey(), en.getValue()));
        }
        publish(topic, key, o.toString());
    }
}
