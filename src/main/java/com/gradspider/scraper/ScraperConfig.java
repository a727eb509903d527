package com.gradspider.scraper;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.MapperFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.json.JsonMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.time.Duration;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Properties;
import java.util.function.UnaryOperator;

/**
 * Loads {@link HarvestSettings} from {@code scraper.properties} and {@link UniversityProfile}s from
 * {@code universities.json}, both on the classpath.
 * <p>
 * Every property can be overridden by an environment variable or system property named
 * {@code SCRAPER_<KEY>}, e.g. {@code SCRAPER_POOL_CAPACITY=8} for {@code pool.capacity}.
 *
 * @author Grad Program Scraper Team
 * @since 1.0
 */
public final class ScraperConfig {
    private static final Logger logger = LoggerFactory.getLogger(ScraperConfig.class);

    public static final String SETTINGS_RESOURCE = "scraper.properties";
    public static final String UNIVERSITIES_RESOURCE = "universities.json";

    private static final ObjectMapper MAPPER = JsonMapper.builder()
        .enable(MapperFeature.ACCEPT_CASE_INSENSITIVE_ENUMS)
        .build();

    private ScraperConfig() {}

    public static HarvestSettings loadSettings() {
        return loadSettings(SETTINGS_RESOURCE, ScraperConfig::envOrProp);
    }

    /**
     * @param resource classpath resource holding the defaults
     * @param overrides lookup of {@code SCRAPER_*} overrides, returning null when unset
     */
    public static HarvestSettings loadSettings(String resource, UnaryOperator<String> overrides) {
        Properties props = new Properties();
        try (InputStream in = ScraperConfig.class.getClassLoader().getResourceAsStream(resource)) {
            if (in == null) {
                logger.warn("No {} on the classpath; using built-in defaults.", resource);
            } else {
                props.load(in);
            }
        } catch (IOException e) {
            throw new IllegalStateException("Failed to read " + resource + ": " + e.getMessage(), e);
        }
        return fromProperties(props, overrides);
    }

    static HarvestSettings fromProperties(Properties props, UnaryOperator<String> overrides) {
        HarvestSettings d = HarvestSettings.defaults();
        Lookup l = new Lookup(props, overrides);
        return new HarvestSettings(
            l.integer("pool.capacity", d.poolCapacity()),
            Duration.ofSeconds(l.integer("operation.timeout.seconds", (int) d.operationTimeout().toSeconds())),
            VisibilityMode.parse(l.string("visibility", d.visibility().name())),
            Duration.ofSeconds(l.integer("acquire.timeout.seconds", (int) d.acquireTimeout().toSeconds())),
            l.integer("acquire.max.attempts", d.maxAcquireAttempts()),
            Duration.ofMillis(l.integer("acquire.backoff.millis", (int) d.acquireBackoff().toMillis())),
            l.integer("max.concurrency", d.maxConcurrency()),
            Boolean.parseBoolean(l.string("warm.start", Boolean.toString(d.warmStart()))),
            Duration.ofSeconds(l.integer("drain.timeout.seconds", (int) d.drainTimeout().toSeconds())),
            l.integer("pool.max.creation.failures", d.maxCreationFailures()),
            l.string("output.dir", d.outputDir())
        );
    }

    public static List<UniversityProfile> loadUniversities() {
        return loadUniversities(UNIVERSITIES_RESOURCE);
    }

    public static List<UniversityProfile> loadUniversities(String resource) {
        try (InputStream in = ScraperConfig.class.getClassLoader().getResourceAsStream(resource)) {
            if (in == null) throw new IllegalStateException("Missing university configuration " + resource);
            List<UniversityProfile> profiles = MAPPER.readValue(in, new TypeReference<List<UniversityProfile>>() {});
            logger.debug("Loaded {} university profiles from {}", profiles.size(), resource);
            return List.copyOf(profiles);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to parse " + resource + ": " + e.getMessage(), e);
        }
    }

    public static Optional<UniversityProfile> findUniversity(List<UniversityProfile> profiles, String key) {
        if (key == null) return Optional.empty();
        String wanted = key.trim().toLowerCase(Locale.ROOT);
        return profiles.stream().filter(p -> p.key().equalsIgnoreCase(wanted)).findFirst();
    }

    /**
     * Environment variable first, then system property, else null.
     */
    static String envOrProp(String key) {
        try {
            String ev = System.getenv(key);
            if (ev != null) return ev;
        } catch (SecurityException e) {
            logger.debug("Environment not readable for {}: {}", key, e.getMessage());
        }
        return System.getProperty(key);
    }

    static String overrideName(String propertyKey) {
        return "SCRAPER_" + propertyKey.toUpperCase(Locale.ROOT).replace('.', '_');
    }

    private record Lookup(Properties props, UnaryOperator<String> overrides) {
        String string(String key, String defaultVal) {
            String override = overrides.apply(overrideName(key));
            if (override != null && !override.isBlank()) return override.trim();
            String v = props.getProperty(key);
            return v == null || v.isBlank() ? defaultVal : v.trim();
        }

        int integer(String key, int defaultVal) {
            String v = string(key, Integer.toString(defaultVal));
            try {
                return Integer.parseInt(v);
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("Property " + key + " is not an integer: " + v, e);
            }
        }
    }
}
