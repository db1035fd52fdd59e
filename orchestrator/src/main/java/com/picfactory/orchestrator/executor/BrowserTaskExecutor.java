package com.picfactory.orchestrator.executor;

import com.microsoft.playwright.Download;
import com.microsoft.playwright.Keyboard;
import com.microsoft.playwright.Locator;
import com.microsoft.playwright.Page;
import com.microsoft.playwright.PlaywrightException;
import com.picfactory.orchestrator.config.PicFactoryProperties;
import com.picfactory.orchestrator.service.FileService;
import com.picfactory.orchestrator.session.ChatSurface;
import com.picfactory.orchestrator.session.ChatSurfaceSelectors;
import com.picfactory.orchestrator.session.RemoteSession;
import com.picfactory.orchestrator.session.RemoteSessionManager;
import com.picfactory.orchestrator.session.SessionErrors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.OptionalLong;
import java.util.Set;

/**
 * Live executor: drives the remote chat surface through Playwright.
 *
 * One attempt:
 *  1. lease a session (the manual one if alive) on the browser-driver thread
 *  2. require a logged-in surface, waiting for a manual login if a login prompt shows
 *  3. open a new conversation, attach the reference image
 *  4. record the images already on the page, submit the prompt
 *  5. wait for a new image (or a rate-limit notice), then capture it:
 *     native downloads first, element screenshots next, a viewport screenshot last
 *
 * Files land in {@code <outputDir>/<ref>/<prompt (80 max)>/<taskId>/}.
 */
public class BrowserTaskExecutor implements TaskExecutor {

    private static final Logger log = LoggerFactory.getLogger(BrowserTaskExecutor.class);

    static final String NOT_LOGGED_IN = "not logged in: log in through the interactive session, then retry";

    private static final Duration LOGIN_CHECK        = Duration.ofSeconds(8);
    private static final Duration LOGIN_PROMPT_CHECK = Duration.ofMillis(2_500);
    private static final Duration SHORT_WAIT         = Duration.ofSeconds(3);
    private static final Duration COMPOSER_WAIT      = Duration.ofSeconds(20);
    private static final Duration ATTACHMENT_WAIT    = Duration.ofSeconds(8);
    private static final Duration SEND_BUTTON_WAIT   = Duration.ofSeconds(2);
    private static final long     GENERATION_POLL_MS = 1_500;
    private static final double   DOWNLOAD_WAIT_MS   = 7_500;
    private static final int      MAX_DOWNLOADS      = 4;
    private static final int      MAX_CAPTURES       = 8;
    private static final int      MIN_CAPTURE_PX     = 160;

    private final RemoteSessionManager         sessions;
    private final FileService                  files;
    private final PicFactoryProperties.Browser config;
    private final Clock                        clock;

    public BrowserTaskExecutor(RemoteSessionManager sessions,
                               FileService files,
                               PicFactoryProperties.Browser config,
                               Clock clock) {
        this.sessions = sessions;
        this.files    = files;
        this.config   = config;
        this.clock    = clock;
    }

    @Override
    public TaskResult execute(TaskInput input) {
        Path taskDir = files.taskOutputDir(input.outputDir(), input.refImage().fileName(),
                input.prompt().text(), input.task().getId());
        try {
            files.ensureDir(taskDir);
            return sessions.withTaskSession(session -> runAttempt(session, input, taskDir));
        } catch (ExecutorException e) {
            if (e.getKind() == ExecutorException.Kind.NON_RETRYABLE && e.getMessage().contains("not logged in")) {
                sessions.markLoggedOut("Login expired; open the interactive session and log in again.");
            }
            log.warn("Task {} attempt failed ({}): {}", input.task().getId(), e.getKind(), e.getMessage());
            return e.toResult();
        } catch (RuntimeException e) {
            return classifyUnexpected(input, e);
        }
    }

    private TaskResult classifyUnexpected(TaskInput input, RuntimeException e) {
        String message = SessionErrors.firstLine(e);
        log.warn("Task {} attempt failed: {}", input.task().getId(), message);

        OptionalLong waitSeconds = RateLimitDetector.parseWaitSeconds(message);
        if (waitSeconds.isPresent()) {
            return TaskResult.rateLimited(waitSeconds.getAsLong(), message);
        }
        String lower = message.toLowerCase(Locale.ROOT);
        if (lower.contains("log in") || lower.contains("login")) {
            sessions.markLoggedOut("Login state looks wrong; log in again before running tasks.");
        }
        return TaskResult.retryable(message);
    }

    // ------------------------------------------------------------------
    // Attempt steps (browser-driver thread)
    // ------------------------------------------------------------------

    private TaskResult runAttempt(RemoteSession session, TaskInput input, Path taskDir) {
        Page page = session.page(false);

        ensureLoggedIn(page);
        sessions.markLoggedIn();

        startNewConversation(page);
        uploadReferenceImage(page, Path.of(input.refImage().filePath()));

        Set<String> baseline = new HashSet<>(ChatSurface.collectImageSources(page));
        submitPrompt(page, input.prompt().text());

        waitForGeneration(page, baseline);
        List<String> outputs = attemptDownloads(page, taskDir);
        if (outputs.isEmpty()) {
            outputs = captureGeneratedImages(page, taskDir, baseline);
        }
        if (outputs.isEmpty()) {
            throw ExecutorException.retryable("no generated output was captured");
        }
        log.info("Task {} captured {} output file(s)", input.task().getId(), outputs.size());
        return TaskResult.success(outputs);
    }

    private void ensureLoggedIn(Page page) {
        if (ChatSurface.waitForAny(page, ChatSurfaceSelectors.COMPOSER_INPUTS, LOGIN_CHECK).isPresent()) {
            return;
        }
        if (!ChatSurface.isAnyVisible(page, ChatSurfaceSelectors.LOGIN_CTAS, LOGIN_PROMPT_CHECK)) {
            throw ExecutorException.retryable("prompt input not found; the page may not be ready or its layout changed");
        }
        log.info("Login prompt visible; waiting up to {} for a manual login", config.getLoginWait());
        if (ChatSurface.waitForAny(page, ChatSurfaceSelectors.COMPOSER_INPUTS, config.getLoginWait()).isEmpty()) {
            throw ExecutorException.nonRetryable(NOT_LOGGED_IN);
        }
    }

    private void startNewConversation(Page page) {
        if (ChatSurface.clickFirstVisible(page, ChatSurfaceSelectors.NEW_CHAT_BUTTONS, SHORT_WAIT)) {
            page.waitForTimeout(500);
        }
    }

    private void uploadReferenceImage(Page page, Path file) {
        Locator input = ChatSurface.firstPresent(page, ChatSurfaceSelectors.FILE_INPUTS).orElse(null);
        if (input == null) {
            ChatSurface.clickFirstVisible(page, ChatSurfaceSelectors.ATTACH_BUTTONS, SHORT_WAIT);
            page.waitForTimeout(350);
            input = ChatSurface.firstPresent(page, ChatSurfaceSelectors.FILE_INPUTS)
                    .orElseThrow(() -> ExecutorException.retryable("image upload input not found on the page"));
        }
        input.setInputFiles(file);
        // Upload previews are optional on some layouts.
        ChatSurface.waitForAny(page, ChatSurfaceSelectors.ATTACHMENT_INDICATORS, ATTACHMENT_WAIT);
    }

    private void submitPrompt(Page page, String prompt) {
        Locator composer = ChatSurface.waitForAny(page, ChatSurfaceSelectors.COMPOSER_INPUTS, COMPOSER_WAIT)
                .orElseThrow(() -> ExecutorException.retryable("prompt input not found before submit"));
        String text = prompt == null ? "" : prompt.trim();
        if (text.isEmpty()) {
            throw ExecutorException.nonRetryable("prompt is empty");
        }

        if ("textarea".equals(tagName(composer))) {
            composer.fill(text);
        } else {
            composer.click();
            page.keyboard().press(isMac() ? "Meta+A" : "Control+A");
            page.keyboard().type(text, new Keyboard.TypeOptions().setDelay(8));
        }

        if (!ChatSurface.clickFirstVisible(page, ChatSurfaceSelectors.SEND_BUTTONS, SEND_BUTTON_WAIT)) {
            composer.press("Enter");
        }
    }

    /** Poll until an image absent from {@code baseline} appears. A rate-limit notice ends the wait. */
    private void waitForGeneration(Page page, Set<String> baseline) {
        long deadline = System.nanoTime() + config.getGenerationTimeout().toNanos();
        while (System.nanoTime() < deadline) {
            RateLimitDetector.detect(ChatSurface.bodyText(page)).ifPresent(signal -> {
                throw ExecutorException.rateLimited(signal.waitSeconds(), signal.message());
            });
            boolean fresh = ChatSurface.collectImageSources(page).stream().anyMatch(src -> !baseline.contains(src));
            if (fresh) {
                return;
            }
            page.waitForTimeout(GENERATION_POLL_MS);
        }
        throw ExecutorException.retryable("timed out waiting for the generated result");
    }

    private List<String> attemptDownloads(Page page, Path taskDir) {
        Set<String> outputs = new LinkedHashSet<>();
        for (String selector : ChatSurfaceSelectors.DOWNLOAD_BUTTONS) {
            Locator buttons = page.locator(selector);
            int count = Math.min(buttons.count(), MAX_DOWNLOADS);
            for (int i = 0; i < count; i++) {
                Locator button = buttons.nth(i);
                if (!isVisible(button)) {
                    continue;
                }
                try {
                    Download download = page.waitForDownload(
                            new Page.WaitForDownloadOptions().setTimeout(DOWNLOAD_WAIT_MS),
                            () -> button.click(new Locator.ClickOptions().setTimeout(3_000)));
                    String suggested = download.suggestedFilename();
                    String name = FileService.sanitizeFilename(suggested == null || suggested.isBlank()
                            ? "generated-" + clock.millis() + ".png"
                            : suggested);
                    Path target = taskDir.resolve(String.format("%02d-%s", i + 1, name));
                    download.saveAs(target);
                    outputs.add(target.toString());
                } catch (PlaywrightException e) {
                    log.debug("Download button '{}' #{} produced no file: {}", selector, i + 1, e.getMessage());
                }
            }
            if (!outputs.isEmpty()) {
                break;
            }
        }
        return new ArrayList<>(outputs);
    }

    private List<String> captureGeneratedImages(Page page, Path taskDir, Set<String> baseline) {
        List<String> captured = new ArrayList<>();
        Locator images = page.locator(String.join(", ", ChatSurfaceSelectors.RESULT_IMAGES));
        int count = Math.min(images.count(), MAX_CAPTURES);

        for (int i = 0; i < count; i++) {
            Locator image = images.nth(i);
            ImageMeta meta = imageMeta(image);
            if (meta == null || !meta.likelyGenerated() || baseline.contains(meta.src())) {
                continue;
            }
            Path target = taskDir.resolve("generated-" + clock.millis() + "-" + (i + 1) + ".png");
            try {
                image.scrollIntoViewIfNeeded();
                image.screenshot(new Locator.ScreenshotOptions().setPath(target).setTimeout(6_000));
                captured.add(target.toString());
            } catch (PlaywrightException e) {
                log.debug("Screenshot of image #{} failed: {}", i + 1, e.getMessage());
            }
        }

        if (captured.isEmpty()) {
            Path fallback = taskDir.resolve("generated-fallback-" + clock.millis() + ".png");
            page.screenshot(new Page.ScreenshotOptions().setPath(fallback).setFullPage(false));
            captured.add(fallback.toString());
        }
        return captured;
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    record ImageMeta(String src, String alt, double width, double height) {

        boolean likelyGenerated() {
            if (width < MIN_CAPTURE_PX || height < MIN_CAPTURE_PX) {
                return false;
            }
            return !src.contains("avatar") && !alt.contains("avatar") && !alt.contains("profile");
        }
    }

    private static ImageMeta imageMeta(Locator image) {
        try {
            Object raw = image.evaluate("node => ({"
                    + " src: node.currentSrc || node.src || '',"
                    + " alt: (node.alt || '').toLowerCase(),"
                    + " width: node.naturalWidth || node.width || 0,"
                    + " height: node.naturalHeight || node.height || 0 })");
            if (!(raw instanceof Map<?, ?> map)) {
                return null;
            }
            return new ImageMeta(
                    String.valueOf(map.get("src")),
                    String.valueOf(map.get("alt")),
                    number(map.get("width")),
                    number(map.get("height")));
        } catch (PlaywrightException e) {
            return null;
        }
    }

    private static double number(Object value) {
        return value instanceof Number n ? n.doubleValue() : 0;
    }

    private static String tagName(Locator element) {
        try {
            Object tag = element.evaluate("node => node.tagName.toLowerCase()");
            return tag == null ? "" : tag.toString();
        } catch (PlaywrightException e) {
            return "";
        }
    }

    private static boolean isVisible(Locator element) {
        try {
            return element.isVisible();
        } catch (PlaywrightException e) {
            return false;
        }
    }

    private static boolean isMac() {
        return System.getProperty("os.name", "").toLowerCase(Locale.ROOT).contains("mac");
    }
}
