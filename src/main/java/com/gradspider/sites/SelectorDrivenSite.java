package com.gradspider.sites;

import com.gradspider.scraper.DiscoveryTask;
import com.gradspider.scraper.ErrorClassifier;
import com.gradspider.scraper.ExtractionErrorKind;
import com.gradspider.scraper.ExtractionException;
import com.gradspider.scraper.FieldMissingException;
import com.gradspider.scraper.LinkSnapshot;
import com.gradspider.scraper.LocatorKind;
import com.gradspider.scraper.ProgramFieldRegistry;
import com.gradspider.scraper.RawRecord;
import com.gradspider.scraper.SessionCrashedException;
import com.gradspider.scraper.SessionHandle;
import com.gradspider.scraper.SiteSelectors;
import com.gradspider.scraper.UniversityProfile;
import com.gradspider.scraper.Utils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URI;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Generic site adapter driven entirely by a profile's {@link SiteSelectors}.
 * <p>
 * The list scan collects links matching {@code listItem}, page by page through {@code nextPage}.
 * How a link becomes a task depends on the profile's {@link LocatorKind}: a detail-page URL, a
 * hash route on the list page, or a click target on the list page itself.
 * <p>
 * Detail extraction reads the program name and URL (required) plus faculty, apply link, deadline and
 * open date (optional, empty when absent). Dates without a dedicated element are searched for in
 * the page text by {@link DeadlineParser}.
 *
 * @author Grad Program Scraper Team
 * @since 1.0
 */
public class SelectorDrivenSite implements UniversitySite {
    private static final Logger logger = LoggerFactory.getLogger(SelectorDrivenSite.class);

    static final int LIST_LOAD_ATTEMPTS = 3;
    static final long LIST_RETRY_BACKOFF_MILLIS = 1000L;

    private final UniversityProfile profile;
    private final SiteSelectors selectors;
    private final Duration timeout;

    public SelectorDrivenSite(UniversityProfile profile, Duration operationTimeout) {
        this.profile = profile;
        this.selectors = profile.selectors();
        this.timeout = operationTimeout;
    }

    @Override
    public UniversityProfile profile() {
        return profile;
    }

    @Override
    public List<DiscoveryTask> scan(SessionHandle session, UniversityProfile target) throws ExtractionException {
        String listUrl = target.listUrl();
        loadListPage(session, listUrl);

        Map<String, DiscoveryTask> found = new LinkedHashMap<>();
        for (int page = 1; ; page++) {
            session.waitFor(selectors.listItem(), timeout);
            String pageUrl = session.currentUrl().isBlank() ? listUrl : session.currentUrl();
            List<LinkSnapshot> links = session.readLinks(selectors.listItem());
            int before = found.size();
            for (int i = 0; i < links.size(); i++) {
                DiscoveryTask task = toTask(target, pageUrl, links.get(i), i);
                if (task != null) found.putIfAbsent(task.locator(), task);
            }
            logger.debug("List page {} of {}: {} links, {} new", page, target.key(), links.size(), found.size() - before);

            // click targets are positional, so they only make sense on the first page
            if (target.locatorKind() == LocatorKind.CLICK_TARGET) break;
            if (!SiteSelectors.isSet(selectors.nextPage()) || page >= selectors.pageLimit()) break;
            if (found.size() == before || !session.exists(selectors.nextPage())) break;
            session.click(selectors.nextPage(), timeout);
        }

        if (found.isEmpty() && ErrorClassifier.looksBlocked(session.pageText())) {
            throw new SessionCrashedException("List page of " + target.key() + " looks like a bot check");
        }
        if (found.isEmpty()) logger.warn("No programs matched '{}' on {}", selectors.listItem(), listUrl);
        return new ArrayList<>(found.values());
    }

    @Override
    public RawRecord extract(SessionHandle session, DiscoveryTask task) throws ExtractionException {
        String detailUrl = reach(session, task);
        if (SiteSelectors.isSet(selectors.detailReady())) {
            session.waitFor(selectors.detailReady(), timeout);
        }

        String title = firstText(session, selectors.title(), ProgramFieldRegistry.defaultSelectors("programName"));
        if (title.isEmpty()) title = Utils.cleanText(task.displayTitle());
        if (title.isEmpty()) {
            if (ErrorClassifier.looksBlocked(session.pageText())) {
                throw new SessionCrashedException("Detail page " + task.locator() + " looks like a bot check");
            }
            throw new FieldMissingException("programName", task.locator());
        }
        if (detailUrl.isBlank()) throw new FieldMissingException("detailUrl", task.locator());

        String faculty = firstText(session, selectors.faculty(), List.of());
        String applyLink = readApplyLink(session, detailUrl);

        PageText text = new PageText(session);
        String deadline = SiteSelectors.isSet(selectors.deadline())
            ? session.readText(selectors.deadline()).replaceAll("\\s*\\R\\s*", " | ").trim()
            : "";
        if (deadline.isEmpty()) deadline = DeadlineParser.findDeadline(text.get()).orElse("");
        String openDate = firstText(session, selectors.openDate(), List.of());
        if (openDate.isEmpty()) openDate = DeadlineParser.findOpenDate(text.get()).orElse("");

        return new RawRecord(title, detailUrl, applyLink, deadline, openDate, faculty, profile.code());
    }

    /**
     * Brings the detail content of {@code task} on screen.
     * @return canonical URL of the detail content
     */
    private String reach(SessionHandle session, DiscoveryTask task) throws ExtractionException {
        switch (task.kind()) {
            case URL -> {
                session.navigate(task.locator(), timeout);
                String current = session.currentUrl();
                return current.isBlank() ? task.locator() : current;
            }
            case HASH_ROUTE -> {
                int hash = task.locator().indexOf('#');
                String base = hash < 0 ? task.sourcePage() : task.locator().substring(0, hash);
                String fragment = hash < 0 ? task.locator() : task.locator().substring(hash);
                session.openHashRoute(base, fragment, timeout);
                return task.locator();
            }
            case CLICK_TARGET -> {
                session.navigate(task.sourcePage(), timeout);
                session.click(task.locator(), timeout);
                String current = session.currentUrl();
                return current.isBlank() ? task.sourcePage() : current;
            }
            default -> throw new IllegalStateException("Unhandled locator kind " + task.kind());
        }
    }

    private String readApplyLink(SessionHandle session, String detailUrl) throws ExtractionException {
        if (SiteSelectors.isSet(selectors.applyLink())) {
            String href = session.readAttribute(selectors.applyLink(), "href");
            if (!href.isEmpty()) return resolve(detailUrl, href).orElse(href);
        }
        if (SiteSelectors.isSet(selectors.applyPopup()) && session.exists(selectors.applyPopup())) {
            try {
                return session.clickForPopupUrl(selectors.applyPopup(), timeout);
            } catch (ExtractionException e) {
                // the apply link is optional; only a dead browser fails the task
                if (e.kind() == ExtractionErrorKind.SESSION_CRASHED) throw e;
                logger.debug("No application window from '{}' on {}: {}", selectors.applyPopup(), detailUrl, e.getMessage());
            }
        }
        if (!SiteSelectors.isSet(selectors.applyLink())) {
            for (String fallback : ProgramFieldRegistry.defaultSelectors("applyLink")) {
                String href = session.readAttribute(fallback, "href");
                if (!href.isEmpty()) return resolve(detailUrl, href).orElse(href);
            }
        }
        return "";
    }

    private DiscoveryTask toTask(UniversityProfile target, String pageUrl, LinkSnapshot link, int index) {
        String href = link.href();
        String title = Utils.cleanText(link.text());
        switch (target.locatorKind()) {
            case CLICK_TARGET -> {
                return new DiscoveryTask(selectors.listItem() + " >> nth=" + index, LocatorKind.CLICK_TARGET, pageUrl, title);
            }
            case HASH_ROUTE -> {
                int hash = href.indexOf('#');
                if (hash < 0 || hash == href.length() - 1) return null;
                return new DiscoveryTask(stripHash(pageUrl) + href.substring(hash), LocatorKind.HASH_ROUTE, stripHash(pageUrl), title);
            }
            default -> {
                if (href.isEmpty() || isNonNavigable(href)) return null;
                return resolve(target.baseUrl(), href)
                    .map(url -> new DiscoveryTask(url, LocatorKind.URL, pageUrl, title))
                    .orElse(null);
            }
        }
    }

    private void loadListPage(SessionHandle session, String listUrl) throws ExtractionException {
        try {
            Utils.<Boolean, ExtractionException>retryWithBackoff(() -> {
                session.navigate(listUrl, timeout);
                return Boolean.TRUE;
            }, LIST_LOAD_ATTEMPTS, LIST_RETRY_BACKOFF_MILLIS,
                e -> e.kind() == ExtractionErrorKind.TIMEOUT, "loading " + listUrl);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ExtractionException(ExtractionErrorKind.CANCELLED, "Interrupted while loading " + listUrl, e);
        }
    }

    private String firstText(SessionHandle session, String configured, List<String> fallbacks) throws ExtractionException {
        if (SiteSelectors.isSet(configured)) {
            String v = Utils.cleanText(session.readText(configured));
            if (!v.isEmpty()) return v;
        }
        for (String selector : fallbacks) {
            String v = Utils.cleanText(session.readText(selector));
            if (!v.isEmpty()) return v;
        }
        return "";
    }

    static Optional<String> resolve(String base, String href) {
        try {
            return Optional.of(URI.create(base).resolve(href.trim()).toString());
        } catch (IllegalArgumentException e) {
            logger.debug("Skipping unresolvable link '{}' against {}: {}", href, base, e.getMessage());
            return Optional.empty();
        }
    }

    private static boolean isNonNavigable(String href) {
        String h = href.trim().toLowerCase(Locale.ROOT);
        return h.startsWith("#") || h.startsWith("javascript:") || h.startsWith("mailto:") || h.startsWith("tel:");
    }

    static String stripHash(String url) {
        int idx = url.indexOf('#');
        return idx < 0 ? url : url.substring(0, idx);
    }

    /**
     * Page text read at most once per extraction.
     */
    private static final class PageText {
        private final SessionHandle session;
        private String text;

        PageText(SessionHandle session) {
            this.session = session;
        }

        String get() throws ExtractionException {
            if (text == null) text = session.pageText();
            return text;
        }
    }
}
