package com.gradspider.scraper;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.Locale;

/**
 * Static configuration of one target university, loaded from {@code universities.json}.
 * <p>
 * {@code visibility}, {@code poolCapacity} and {@code timeoutSeconds} are optional; when present they
 * override the global {@link HarvestSettings} for this university only (some sites only work headful).
 *
 * @author Grad Program Scraper Team
 * @since 1.0
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record UniversityProfile(
    String key,
    String code,
    String name,
    String localName,
    String baseUrl,
    String listUrl,
    VisibilityMode visibility,
    Integer poolCapacity,
    Integer timeoutSeconds,
    LocatorKind locatorKind,
    SiteSelectors selectors
) {
    public UniversityProfile {
        if (key == null || key.isBlank()) throw new IllegalArgumentException("University key cannot be empty");
        if (listUrl == null || listUrl.isBlank()) throw new IllegalArgumentException("List URL missing for " + key);
        if (selectors == null || !SiteSelectors.isSet(selectors.listItem())) {
            throw new IllegalArgumentException("List item selector missing for " + key);
        }
        code = code == null ? key.toUpperCase(Locale.ROOT) : code;
        name = name == null ? key : name;
        localName = localName == null ? "" : localName;
        baseUrl = baseUrl == null || baseUrl.isBlank() ? listUrl : baseUrl;
        locatorKind = locatorKind == null ? LocatorKind.URL : locatorKind;
    }

    public UniversityProfile withVisibility(VisibilityMode mode) {
        return new UniversityProfile(key, code, name, localName, baseUrl, listUrl, mode, poolCapacity,
            timeoutSeconds, locatorKind, selectors);
    }
}
