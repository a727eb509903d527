package com.gradspider.scraper;

import com.microsoft.playwright.Browser;
import com.microsoft.playwright.BrowserContext;
import com.microsoft.playwright.BrowserType;
import com.microsoft.playwright.Page;
import com.microsoft.playwright.Playwright;
import com.microsoft.playwright.PlaywrightException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.List;

/**
 * Launches a Chromium browser per session through Playwright.
 */
public class PlaywrightSessionFactory implements SessionFactory {
    private static final Logger logger = LoggerFactory.getLogger(PlaywrightSessionFactory.class);

    static final String USER_AGENT = "Mozilla/5.0 (Windows NT 10.0; Win64; x64) AppleWebKit/537.36 "
        + "(KHTML, like Gecko) Chrome/124.0.0.0 Safari/537.36";

    private static final List<String> LAUNCH_ARGS = List.of(
        "--disable-dev-shm-usage",
        "--disable-gpu",
        "--disable-extensions",
        "--mute-audio"
    );

    private final Duration operationTimeout;

    public PlaywrightSessionFactory(Duration operationTimeout) {
        this.operationTimeout = operationTimeout;
    }

    @Override
    public SessionHandle create(String id, VisibilityMode visibility) throws SessionCreationException {
        Playwright playwright;
        try {
            playwright = Playwright.create();
        } catch (PlaywrightException e) {
            throw new SessionCreationException("Failed to start Playwright driver for " + id, e);
        }
        try {
            Browser browser = playwright.chromium().launch(new BrowserType.LaunchOptions()
                .setHeadless(visibility.headless())
                .setArgs(LAUNCH_ARGS));
            BrowserContext context = browser.newContext(new Browser.NewContextOptions()
                .setViewportSize(1920, 1080)
                .setUserAgent(USER_AGENT)
                .setLocale("en-US")
                .setIgnoreHTTPSErrors(true));
            Page page = context.newPage();
            page.setDefaultTimeout(operationTimeout.toMillis());
            page.setDefaultNavigationTimeout(operationTimeout.toMillis());
            logger.debug("Launched Chromium for {} (headless={})", id, visibility.headless());
            return new PlaywrightSessionHandle(id, visibility, playwright, browser, context, page);
        } catch (PlaywrightException e) {
            try {
                playwright.close();
            } catch (Exception closeError) {
                logger.warn("Failed to close Playwright after launch failure of {}: {}", id, closeError.getMessage());
            }
            throw new SessionCreationException("Failed to launch browser for " + id, e);
        }
    }
}
