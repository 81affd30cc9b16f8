package com.venue.scout.recommender.bus;

import org.apache.kafka.clients.producer.KafkaProducer;
import org.apache.kafka.clients.producer.Producer;

import java.util.Properties;

/**
 * One producer per JVM; KafkaProducer is thread-safe and expensive to create.
 */
public final class KafkaProducerFactory {

    private static volatile Producer<String, String> instance;

    private KafkaProducerFactory() {
    }

    public static Producer<String, String> get(Properties props) {
        if (instance == null) {
            synchronized (KafkaProducerFactory.class) {
                if (instance == null) instance = new KafkaProducer<>(props);
            }
        }
        return instance;
    }
}
