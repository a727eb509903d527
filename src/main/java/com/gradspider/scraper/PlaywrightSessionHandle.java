package com.gradspider.scraper;

import com.microsoft.playwright.Browser;
import com.microsoft.playwright.BrowserContext;
import com.microsoft.playwright.Locator;
import com.microsoft.playwright.Page;
import com.microsoft.playwright.Playwright;
import com.microsoft.playwright.PlaywrightException;
import com.microsoft.playwright.options.LoadState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * {@link SessionHandle} backed by its own Playwright instance, Chromium browser, context and page.
 * <p>
 * Playwright objects are not thread-safe. Each handle owns a private {@link Playwright} and is only
 * ever driven by the Harvester currently holding it, so no two threads call into it concurrently.
 *
 * @author Grad Program Scraper Team
 * @since 1.0
 */
public class PlaywrightSessionHandle extends AbstractSessionHandle {
    private static final Logger logger = LoggerFactory.getLogger(PlaywrightSessionHandle.class);

    private final Playwright playwright;
    private final Browser browser;
    private final BrowserContext context;
    private final Page page;

    PlaywrightSessionHandle(String id, VisibilityMode visibility, Playwright playwright, Browser browser,
                            BrowserContext context, Page page) {
        super(id, visibility);
        this.playwright = playwright;
        this.browser = browser;
        this.context = context;
        this.page = page;
    }

    @Override
    public void navigate(String url, Duration timeout) throws ExtractionException {
        try {
            page.navigate(url, new Page.NavigateOptions().setTimeout(timeout.toMillis()));
            page.waitForLoadState(LoadState.DOMCONTENTLOADED, new Page.WaitForLoadStateOptions().setTimeout(timeout.toMillis()));
        } catch (PlaywrightException e) {
            throw ErrorClassifier.toExtractionException(e, "Navigation to " + url);
        }
    }

    @Override
    public void openHashRoute(String basePage, String fragment, Duration timeout) throws ExtractionException {
        String hash = fragment.startsWith("#") ? fragment.substring(1) : fragment;
        if (!stripHash(currentUrl()).equals(stripHash(basePage))) {
            navigate(basePage, timeout);
        }
        try {
            page.evaluate("h => { window.location.hash = h; }", hash);
        } catch (PlaywrightException e) {
            throw ErrorClassifier.toExtractionException(e, "Hash route #" + hash);
        }
    }

    @Override
    public void waitFor(String selector, Duration timeout) throws ExtractionException {
        try {
            page.waitForSelector(selector, new Page.WaitForSelectorOptions().setTimeout(timeout.toMillis()));
        } catch (PlaywrightException e) {
            throw ErrorClassifier.toExtractionException(e, "Waiting for '" + selector + "'");
        }
    }

    @Override
    public boolean exists(String selector) throws ExtractionException {
        try {
            return page.locator(selector).count() > 0;
        } catch (PlaywrightException e) {
            rethrowIfCrashed(e, "Counting '" + selector + "'");
            return false;
        }
    }

    @Override
    public String readText(String selector) throws ExtractionException {
        try {
            Locator l = page.locator(selector);
            if (l.count() > 0) {
                String s = l.first().innerText();
                return s == null ? "" : s.trim();
            }
        } catch (PlaywrightException e) {
            rethrowIfCrashed(e, "Reading text of '" + selector + "'");
            logger.debug("Failed to get inner text of '{}': {}", selector, e.getMessage());
        }
        return "";
    }

    @Override
    public String readAttribute(String selector, String attribute) throws ExtractionException {
        try {
            Locator l = page.locator(selector);
            if (l.count() > 0) {
                String s = l.first().getAttribute(attribute);
                return s == null ? "" : s.trim();
            }
        } catch (PlaywrightException e) {
            rethrowIfCrashed(e, "Reading attribute '" + attribute + "' of '" + selector + "'");
            logger.debug("Failed to get attribute '{}' of '{}': {}", attribute, selector, e.getMessage());
        }
        return "";
    }

    @Override
    public List<LinkSnapshot> readLinks(String selector) throws ExtractionException {
        List<LinkSnapshot> links = new ArrayList<>();
        try {
            Locator matches = page.locator(selector);
            int count = matches.count();
            for (int i = 0; i < count; i++) {
                Locator el = matches.nth(i);
                try {
                    links.add(new LinkSnapshot(el.innerText(), el.getAttribute("href")));
                } catch (PlaywrightException e) {
                    rethrowIfCrashed(e, "Reading link " + i + " of '" + selector + "'");
                    logger.debug("Error reading link {} of '{}' (ignored): {}", i, selector, e.getMessage());
                }
            }
        } catch (PlaywrightException e) {
            throw ErrorClassifier.toExtractionException(e, "Reading links '" + selector + "'");
        }
        return links;
    }

    @Override
    public void click(String selector, Duration timeout) throws ExtractionException {
        try {
            Locator target = page.locator(selector).first();
            target.scrollIntoViewIfNeeded(new Locator.ScrollIntoViewIfNeededOptions().setTimeout(timeout.toMillis()));
            target.click(new Locator.ClickOptions().setTimeout(timeout.toMillis()));
        } catch (PlaywrightException e) {
            throw ErrorClassifier.toExtractionException(e, "Clicking '" + selector + "'");
        }
    }

    @Override
    public String clickForPopupUrl(String selector, Duration timeout) throws ExtractionException {
        Page popup = null;
        try {
            popup = page.waitForPopup(new Page.WaitForPopupOptions().setTimeout(timeout.toMillis()),
                () -> page.locator(selector).first().click(new Locator.ClickOptions().setTimeout(timeout.toMillis())));
            popup.waitForLoadState(LoadState.DOMCONTENTLOADED, new Page.WaitForLoadStateOptions().setTimeout(timeout.toMillis()));
            return popup.url();
        } catch (PlaywrightException e) {
            throw ErrorClassifier.toExtractionException(e, "Popup from '" + selector + "'");
        } finally {
            if (popup != null && !popup.isClosed()) {
                try {
                    popup.close();
                } catch (PlaywrightException e) {
                    logger.debug("Failed to close popup window on {}: {}", id(), e.getMessage());
                }
            }
        }
    }

    @Override
    public String currentUrl() {
        try {
            return page.url();
        } catch (PlaywrightException e) {
            return "";
        }
    }

    @Override
    public String pageText() throws ExtractionException {
        try {
            return page.locator("body").innerText();
        } catch (PlaywrightException e) {
            throw ErrorClassifier.toExtractionException(e, "Reading page text");
        }
    }

    @Override
    public boolean resetState() {
        try {
            for (Page p : context.pages()) {
                if (p != page && !p.isClosed()) p.close();
            }
            context.clearCookies();
            return true;
        } catch (PlaywrightException e) {
            logger.warn("Failed to reset session {}: {}", id(), e.getMessage());
            return false;
        }
    }

    @Override
    public boolean isAlive() {
        try {
            return !isClosed() && browser.isConnected() && !page.isClosed();
        } catch (PlaywrightException e) {
            return false;
        }
    }

    @Override
    protected void doClose() {
        try {
            context.close();
        } catch (Exception e) {
            logger.warn("Failed to close browser context of {}: {}", id(), e.getMessage());
        }
        try {
            browser.close();
        } catch (Exception e) {
            logger.warn("Failed to close browser of {}: {}", id(), e.getMessage());
        }
        try {
            playwright.close();
        } catch (Exception e) {
            logger.warn("Failed to close Playwright driver of {}: {}", id(), e.getMessage());
        }
        logger.debug("Closed browser session {}", id());
    }

    private static void rethrowIfCrashed(PlaywrightException e, String action) throws ExtractionException {
        if (ErrorClassifier.classify(e) == ExtractionErrorKind.SESSION_CRASHED) {
            throw new SessionCrashedException(action + " failed: " + e.getMessage(), e);
        }
    }

    private static String stripHash(String url) {
        if (url == null) return "";
        int idx = url.indexOf('#');
        return idx < 0 ? url : url.substring(0, idx);
    }
}
