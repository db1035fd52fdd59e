package com.picfactory.orchestrator.session;

import java.util.Locale;

/**
 * Turns raw driver exceptions into one-line operator messages.
 */
public final class SessionErrors {

    static final String INSTALL_HINT =
            "Playwright browser not found; run `mvn exec:java -e -D exec.mainClass=com.microsoft.playwright.CLI"
            + " -D exec.args=\"install chromium\"` once, then retry.";

    private SessionErrors() {}

    /** First line of the exception message, or the install hint when the browser binary is missing. */
    public static String firstLine(Throwable error) {
        String raw = error.getMessage();
        if (raw == null || raw.isBlank()) {
            return error.getClass().getSimpleName();
        }
        if (isMissingBrowser(raw)) {
            return INSTALL_HINT;
        }
        String first = raw.strip().lines().findFirst().orElse("").trim();
        return first.isEmpty() ? error.getClass().getSimpleName() : first;
    }

    public static String describe(String prefix, Throwable error) {
        return prefix + ": " + firstLine(error);
    }

    static boolean isMissingBrowser(String message) {
        String lower = message.toLowerCase(Locale.ROOT);
        return lower.contains("executable doesn't exist")
                || lower.contains("download new browsers")
                || lower.contains("playwright install");
    }
}
