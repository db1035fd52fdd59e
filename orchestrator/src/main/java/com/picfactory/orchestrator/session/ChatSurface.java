package com.picfactory.orchestrator.session;

import com.microsoft.playwright.Locator;
import com.microsoft.playwright.Page;
import com.microsoft.playwright.PlaywrightException;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Polling helpers over a Playwright page. Lookups that fail because the page
 * changed underneath them count as "not found" rather than errors.
 */
public final class ChatSurface {

    private static final long POLL_MS = 250;

    // Same filter as the capture step: large, non-avatar images only.
    private static final String COLLECT_SOURCES_JS = """
            (selector) => {
              const items = new Set();
              for (const node of document.querySelectorAll(selector)) {
                const src = node.currentSrc || node.src || '';
                const alt = (node.alt || '').toLowerCase();
                const width = node.naturalWidth || node.width || 0;
                const height = node.naturalHeight || node.height || 0;
                if (!src || width < 128 || height < 128) continue;
                if (src.includes('avatar') || alt.includes('avatar') || alt.includes('profile')
                    || src.includes('/_next/image')) continue;
                items.add(src);
              }
              return Array.from(items);
            }
            """;

    private ChatSurface() {}

    /** First visible match among {@code selectors}, polling until {@code timeout}. */
    public static Optional<Locator> waitForAny(Page page, List<String> selectors, Duration timeout) {
        long deadline = System.nanoTime() + timeout.toNanos();
        do {
            for (String selector : selectors) {
                Locator locator = page.locator(selector).first();
                if (isVisible(locator)) {
                    return Optional.of(locator);
                }
            }
            page.waitForTimeout(POLL_MS);
        } while (System.nanoTime() < deadline);
        return Optional.empty();
    }

    public static boolean isAnyVisible(Page page, List<String> selectors, Duration timeout) {
        return waitForAny(page, selectors, timeout).isPresent();
    }

    /** Click the first visible match; false when nothing became visible in time. */
    public static boolean clickFirstVisible(Page page, List<String> selectors, Duration timeout) {
        Optional<Locator> element = waitForAny(page, selectors, timeout);
        element.ifPresent(e -> e.click(new Locator.ClickOptions().setTimeout(3_000)));
        return element.isPresent();
    }

    /** First element matching any selector, visible or not. */
    public static Optional<Locator> firstPresent(Page page, List<String> selectors) {
        for (String selector : selectors) {
            Locator locator = page.locator(selector);
            if (locator.count() > 0) {
                return Optional.of(locator.first());
            }
        }
        return Optional.empty();
    }

    /** Visible text of the whole page, or "" when it cannot be read right now. */
    public static String bodyText(Page page) {
        try {
            return page.locator("body").innerText(new Locator.InnerTextOptions().setTimeout(1_000));
        } catch (PlaywrightException e) {
            return "";
        }
    }

    /** Sources of the candidate result images currently on the page. */
    public static List<String> collectImageSources(Page page) {
        String selector = String.join(", ", ChatSurfaceSelectors.RESULT_IMAGES);
        Object raw;
        try {
            raw = page.evaluate(COLLECT_SOURCES_JS, selector);
        } catch (PlaywrightException e) {
            return List.of();
        }
        Set<String> sources = new LinkedHashSet<>();
        if (raw instanceof List<?> list) {
            for (Object item : list) {
                if (item != null) {
                    sources.add(item.toString());
                }
            }
        }
        return new ArrayList<>(sources);
    }

    private static boolean isVisible(Locator locator) {
        try {
            return locator.isVisible();
        } catch (PlaywrightException e) {
            return false;
        }
    }
}
