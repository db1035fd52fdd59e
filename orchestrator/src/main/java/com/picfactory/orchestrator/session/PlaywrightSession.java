package com.picfactory.orchestrator.session;

import com.microsoft.playwright.Browser;
import com.microsoft.playwright.BrowserContext;
import com.microsoft.playwright.Page;
import com.microsoft.playwright.PlaywrightException;
import com.microsoft.playwright.TimeoutError;
import com.microsoft.playwright.options.LoadState;
import com.microsoft.playwright.options.WaitUntilState;
import com.picfactory.orchestrator.config.PicFactoryProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URI;
import java.time.Duration;

/**
 * A persistent-profile Chromium context pointed at the remote surface.
 */
class PlaywrightSession implements RemoteSession {

    private static final Logger log = LoggerFactory.getLogger(PlaywrightSession.class);

    private static final Duration COMPOSER_PROBE = Duration.ofSeconds(7);
    private static final Duration LOGIN_PROBE    = Duration.ofMillis(2_500);
    private static final double   SETTLE_MS      = 12_000;

    private final BrowserContext                context;
    private final PicFactoryProperties.Browser  config;
    private volatile boolean                    closed = false;

    PlaywrightSession(BrowserContext context, PicFactoryProperties.Browser config) {
        this.context = context;
        this.config  = config;
        context.onClose(c -> closed = true);
    }

    @Override
    public boolean isAlive() {
        if (closed) {
            return false;
        }
        try {
            Browser browser = context.browser();
            if (browser != null && !browser.isConnected()) {
                return false;
            }
            context.pages();
            return true;
        } catch (PlaywrightException e) {
            log.debug("Browser session is gone: {}", e.getMessage());
            return false;
        }
    }

    @Override
    public Page page(boolean forceNavigate) {
        Page page = context.pages().stream()
                .filter(p -> !p.isClosed())
                .findFirst()
                .orElseGet(context::newPage);

        if (forceNavigate || !onSurface(page.url())) {
            page.navigate(config.getSurfaceUrl(), new Page.NavigateOptions()
                    .setWaitUntil(WaitUntilState.DOMCONTENTLOADED)
                    .setTimeout(config.getNavigationTimeout().toMillis()));
            try {
                page.waitForLoadState(LoadState.NETWORKIDLE,
                        new Page.WaitForLoadStateOptions().setTimeout(SETTLE_MS));
            } catch (TimeoutError e) {
                // Long-polling pages never go fully idle.
                log.debug("Surface did not settle within {} ms", (long) SETTLE_MS);
            }
        }
        return page;
    }

    @Override
    public SurfaceState probe() {
        Page page = page(false);
        if (ChatSurface.waitForAny(page, ChatSurfaceSelectors.COMPOSER_INPUTS, COMPOSER_PROBE).isPresent()) {
            return SurfaceState.INPUT_READY;
        }
        if (ChatSurface.isAnyVisible(page, ChatSurfaceSelectors.LOGIN_CTAS, LOGIN_PROBE)) {
            return SurfaceState.LOGIN_PROMPT;
        }
        return SurfaceState.UNRECOGNIZED;
    }

    @Override
    public void bringToFront() {
        page(false).bringToFront();
    }

    @Override
    public void close() {
        if (!closed) {
            context.close();
        }
    }

    private boolean onSurface(String url) {
        if (url == null || url.isBlank() || "about:blank".equals(url)) {
            return false;
        }
        String host = URI.create(config.getSurfaceUrl()).getHost();
        return host != null && url.contains(host);
    }
}
