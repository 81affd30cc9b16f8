package com.venue.scout.recommender.bus;

import org.springframework.core.env.Environment;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.util.Properties;

/**
 * Builds producer Properties from {@code producer.properties} on the classpath plus a single
 * resolved bootstrap.servers value.
 *
 * Resolution precedence for bootstrap.servers:
 *  1) Env: KAFKA_BOOTSTRAP_SERVERS
 *  2) Sys Prop: kafka.bootstrap.servers
 *  3) Spring property scout.kafka.bootstrap-servers
 *  4) producer.properties bootstrap.servers (as-is)
 */
public final class KafkaPropertiesHelper {

    private static final String PRODUCER_PROPS = "/producer.properties";
    private static final String SCOUT_BOOTSTRAP_KEY = "scout.kafka.bootstrap-servers";
    private static final String BOOTSTRAP_KEY = "bootstrap.servers";

    private KafkaPropertiesHelper() {
    }

    public static Properties loadProducerProps(Environment env) {
        Properties base = readProps(PRODUCER_PROPS);
        String bs = resolveBootstrapServers(env);
        if (notBlank(bs)) {
            base.setProperty(BOOTSTRAP_KEY, bs.trim());
        }
        putIfAbsent(base, BOOTSTRAP_KEY, "localhost:9092");
        putIfAbsent(base, "key.serializer", "org.apache.kafka.common.serialization.StringSerializer");
        putIfAbsent(base, "value.serializer", "org.apache.kafka.common.serialization.StringSerializer");
        putIfAbsent(base, "acks", "all");
        putIfAbsent(base, "enable.idempotence", "true");
        putIfAbsent(base, "delivery.timeout.ms", "120000");
        putIfAbsent(base, "request.timeout.ms", "30000");
        // publishing must not stall a request thread when the broker is away
        putIfAbsent(base, "max.block.ms", "2000");
        putIfAbsent(base, "compression.type", "snappy");
        putIfAbsent(base, "client.id", "scout-recommender");
        return base;
    }

    static String resolveBootstrapServers(Environment env) {
        String fromEnv = System.getenv("KAFKA_BOOTSTRAP_SERVERS");
        if (notBlank(fromEnv)) return fromEnv.trim();

        String sys = System.getProperty("kafka.bootstrap.servers");
        if (notBlank(sys)) return sys.trim();

        if (env != null) {
            String scout = env.getProperty(SCOUT_BOOTSTRAP_KEY);
            if (notBlank(scout)) return scout.trim();
        }
        return null;
    }

    private static Properties readProps(String classpathResource) {
        Properties p = new Properties();
        try (InputStream in = KafkaPropertiesHelper.class.getResourceAsStream(classpathResource)) {
            if (in != null) p.load(in);
            return p;
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot read " + classpathResource, e);
        }
    }

    private static void putIfAbsent(Properties p, String key, String value) {
        if (!notBlank(p.getProperty(key))) {
            p.setProperty(key, value);
        }
    }

    private static boolean notBlank(String s) {
        return s != null && !s.trim().isEmpty();
    }
}
