package com.picfactory.orchestrator.executor;

import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.OptionalLong;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Recognises rate-limit notices in the remote surface's visible text and
 * extracts the requested cooldown.
 *
 * Pure functions only, so the classification can be tested without a browser.
 */
public final class RateLimitDetector {

    /** Cooldown assumed when the notice does not state a duration. */
    public static final long DEFAULT_WAIT_SECONDS = 15 * 60;

    /** Longest cooldown honoured; longer requests are capped to this. */
    public static final long MAX_WAIT_SECONDS = 24 * 60 * 60;

    private static final List<String> PHRASES = List.of(
            "rate limit",
            "try again",
            "too many requests",
            "please wait",
            "请稍后",
            "请等待",
            "达到上限",
            "请求过于频繁"
    );

    // Minutes are checked first: "1 minute 30 seconds" waits a minute.
    private static final Pattern MINUTES = Pattern.compile("(\\d+)\\s*(minute|min|分钟)", Pattern.CASE_INSENSITIVE);
    private static final Pattern SECONDS = Pattern.compile("(\\d+)\\s*(second|sec|秒)", Pattern.CASE_INSENSITIVE);
    private static final Pattern HOURS   = Pattern.compile("(\\d+)\\s*(hour|hr|小时)", Pattern.CASE_INSENSITIVE);

    private static final Pattern SUMMARY_LINE =
            Pattern.compile("rate limit|try again|too many|请稍后|请等待|上限|频繁", Pattern.CASE_INSENSITIVE);

    /** A detected notice: how long to wait and the line that said so. */
    public record Signal(long waitSeconds, String message) {}

    private RateLimitDetector() {}

    /**
     * Inspect the page text for a rate-limit notice.
     *
     * @return the signal, or empty if the text contains none of the known phrases
     */
    public static Optional<Signal> detect(String pageText) {
        if (pageText == null || pageText.isBlank()) {
            return Optional.empty();
        }
        String normalized = pageText.toLowerCase(Locale.ROOT);
        boolean hit = PHRASES.stream().anyMatch(normalized::contains);
        if (!hit) {
            return Optional.empty();
        }

        long waitSeconds = parseWaitSeconds(pageText).orElse(DEFAULT_WAIT_SECONDS);
        String summary = Arrays.stream(pageText.split("\\n+"))
                .map(String::strip)
                .filter(line -> !line.isEmpty())
                .filter(line -> SUMMARY_LINE.matcher(line).find())
                .findFirst()
                .orElse("Rate limit detected, waiting " + waitSeconds + " seconds before retrying.");
        return Optional.of(new Signal(waitSeconds, summary));
    }

    /**
     * Parse a duration such as "try again in 3 minutes", "等待 30 秒" or
     * "in 1 hour". Non-positive numbers are ignored; results are capped at
     * {@link #MAX_WAIT_SECONDS}.
     */
    public static OptionalLong parseWaitSeconds(String message) {
        if (message == null) {
            return OptionalLong.empty();
        }
        OptionalLong minutes = firstPositive(MINUTES, message);
        if (minutes.isPresent()) {
            return OptionalLong.of(toSeconds(minutes.getAsLong(), 60));
        }
        OptionalLong seconds = firstPositive(SECONDS, message);
        if (seconds.isPresent()) {
            return OptionalLong.of(toSeconds(seconds.getAsLong(), 1));
        }
        OptionalLong hours = firstPositive(HOURS, message);
        if (hours.isPresent()) {
            return OptionalLong.of(toSeconds(hours.getAsLong(), 3600));
        }
        return OptionalLong.empty();
    }

    /** Clamp a requested cooldown into {@code [1, MAX_WAIT_SECONDS]}. */
    public static long clampWaitSeconds(long seconds) {
        return Math.max(1, Math.min(seconds, MAX_WAIT_SECONDS));
    }

    private static long toSeconds(long amount, long unitSeconds) {
        try {
            return clampWaitSeconds(Math.multiplyExact(amount, unitSeconds));
        } catch (ArithmeticException e) {
            return MAX_WAIT_SECONDS;
        }
    }

    private static OptionalLong firstPositive(Pattern pattern, String text) {
        Matcher m = pattern.matcher(text);
        if (!m.find()) {
            return OptionalLong.empty();
        }
        try {
            long value = Long.parseLong(m.group(1));
            return value > 0 ? OptionalLong.of(value) : OptionalLong.empty();
        } catch (NumberFormatException e) {
            return OptionalLong.empty();
        }
    }
}
