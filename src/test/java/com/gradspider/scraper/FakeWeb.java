package com.gradspider.scraper;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Scripted web content shared by every {@link FakeSessionHandle} of a test.
 * Pages are keyed by their full URL, fragment included.
 */
public class FakeWeb {
    private final Map<String, FakePage> pages = new ConcurrentHashMap<>();

    public FakePage page(String url) {
        return pages.computeIfAbsent(url, u -> new FakePage());
    }

    FakePage existing(String url) {
        return pages.get(url);
    }

    public static class FakePage {
        final Map<String, String> texts = new HashMap<>();
        final Map<String, String> attributes = new HashMap<>();
        final Map<String, List<LinkSnapshot>> links = new HashMap<>();
        final Map<String, String> clicks = new HashMap<>();
        final Map<String, String> popups = new HashMap<>();
        final Set<String> slow = new HashSet<>();
        final AtomicInteger slowLoads = new AtomicInteger();
        String body = "";

        public FakePage text(String selector, String value) {
            texts.put(selector, value);
            return this;
        }

        public FakePage attribute(String selector, String attribute, String value) {
            attributes.put(selector + "@" + attribute, value);
            texts.putIfAbsent(selector, "");
            return this;
        }

        public FakePage link(String selector, String text, String href) {
            links.computeIfAbsent(selector, s -> new ArrayList<>()).add(new LinkSnapshot(text, href));
            return this;
        }

        /**
         * Clicking {@code selector} moves the session to {@code targetUrl}.
         */
        public FakePage click(String selector, String targetUrl) {
            clicks.put(selector, targetUrl);
            return this;
        }

        public FakePage popup(String selector, String url) {
            popups.put(selector, url);
            return this;
        }

        /**
         * Waiting for {@code selector} on this page times out.
         */
        public FakePage slow(String selector) {
            slow.add(selector);
            return this;
        }

        /**
         * The next {@code times} navigations to this page time out.
         */
        public FakePage slowLoad(int times) {
            slowLoads.set(times);
            return this;
        }

        public FakePage body(String text) {
            body = text;
            return this;
        }

        boolean has(String selector) {
            return texts.containsKey(selector) || links.containsKey(selector) || clicks.containsKey(selector)
                || popups.containsKey(selector);
        }
    }
}
