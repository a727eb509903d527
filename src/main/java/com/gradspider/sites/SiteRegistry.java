package com.gradspider.sites;

import com.gradspider.scraper.UniversityProfile;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Chooses the {@link UniversitySite} for a profile. Universities without a registered adapter
 * are handled by {@link SelectorDrivenSite} from their configured selectors.
 */
public final class SiteRegistry {
    private static final Logger logger = LoggerFactory.getLogger(SiteRegistry.class);

    /**
     * Builds a site adapter for a profile and the per-operation timeout.
     */
    @FunctionalInterface
    public interface SiteFactory {
        UniversitySite create(UniversityProfile profile, Duration operationTimeout);
    }

    private static final Map<String, SiteFactory> ADAPTERS = new ConcurrentHashMap<>();

    private SiteRegistry() {}

    /**
     * Registers a dedicated adapter for the university {@code key}, replacing any earlier one.
     */
    public static void register(String key, SiteFactory factory) {
        ADAPTERS.put(key.toLowerCase(Locale.ROOT), factory);
    }

    public static void unregister(String key) {
        ADAPTERS.remove(key.toLowerCase(Locale.ROOT));
    }

    public static UniversitySite forProfile(UniversityProfile profile, Duration operationTimeout) {
        SiteFactory custom = ADAPTERS.get(profile.key().toLowerCase(Locale.ROOT));
        if (custom != null) {
            logger.debug("Using registered site adapter for {}", profile.key());
            return custom.create(profile, operationTimeout);
        }
        return new SelectorDrivenSite(profile, operationTimeout);
    }
}
