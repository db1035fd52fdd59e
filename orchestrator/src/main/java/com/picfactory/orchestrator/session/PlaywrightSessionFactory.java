package com.picfactory.orchestrator.session;

import com.microsoft.playwright.BrowserContext;
import com.microsoft.playwright.BrowserType;
import com.microsoft.playwright.Playwright;
import com.picfactory.orchestrator.config.PicFactoryProperties;
import com.picfactory.orchestrator.service.FileService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.nio.file.Path;

/**
 * Launches Chromium with the persistent profile so a login made in the
 * interactive window is reused by unattended task sessions.
 *
 * The Playwright driver is created on first launch, on the calling (driver)
 * thread, and closed by {@link #shutdown()} on that same thread.
 */
@Component
public class PlaywrightSessionFactory implements SessionFactory {

    private static final Logger log = LoggerFactory.getLogger(PlaywrightSessionFactory.class);

    private final PicFactoryProperties.Browser config;
    private final FileService                  files;

    private Playwright playwright;

    public PlaywrightSessionFactory(PicFactoryProperties properties, FileService files) {
        this.config = properties.getBrowser();
        this.files  = files;
    }

    @Override
    public RemoteSession launch(boolean headless) {
        if (playwright == null) {
            playwright = Playwright.create();
        }
        Path profile = config.resolveProfileDir();
        files.ensureDir(profile);

        BrowserType.LaunchPersistentContextOptions options = new BrowserType.LaunchPersistentContextOptions()
                .setHeadless(headless)
                .setAcceptDownloads(true)
                .setTimeout(config.getNavigationTimeout().toMillis());
        String channel = config.getChannel() != null && !config.getChannel().isBlank()
                ? config.getChannel().trim()
                : null;
        if (channel != null) {
            options.setChannel(channel);
        }

        BrowserContext context = playwright.chromium().launchPersistentContext(profile, options);
        context.setDefaultTimeout(config.getActionTimeout().toMillis());
        log.info("Launched {} browser session (profile={}, channel={})",
                headless ? "headless" : "visible", profile,
                channel != null ? channel : "bundled chromium");
        return new PlaywrightSession(context, config);
    }

    @Override
    public void shutdown() {
        if (playwright != null) {
            playwright.close();
            playwright = null;
        }
    }
}
