package com.picfactory.orchestrator.service;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.text.Normalizer;
import java.time.Clock;
import java.util.List;
import java.util.Locale;

/**
 * Local filesystem operations used by the scheduler and the executors.
 *
 * Output layout: {@code <outputDir>/<reference-slug>/<prompt-slug>/...}.
 * Prompt slugs are capped at 80 characters.
 */
@Service
public class FileService {

    private static final Logger log = LoggerFactory.getLogger(FileService.class);

    private static final int MAX_PROMPT_SLUG = 80;

    private final Clock clock;

    public FileService(Clock clock) {
        this.clock = clock;
    }

    /** Create the directory and any missing parents. */
    public void ensureDir(Path dir) {
        try {
            Files.createDirectories(dir);
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot create directory " + dir, e);
        }
    }

    /**
     * Delete the given files. Best-effort and idempotent: files that are
     * already gone are skipped, other failures are logged and skipped.
     */
    public void deleteFiles(List<String> paths) {
        for (String p : paths) {
            try {
                Files.deleteIfExists(Path.of(p));
            } catch (IOException e) {
                log.warn("Could not delete output file {}: {}", p, e.getMessage());
            }
        }
    }

    /**
     * Directory for one attempt of one task. Stable across retries of the
     * same task, so a later attempt replaces the leftovers of an earlier one.
     */
    public Path taskOutputDir(String outputDir, String refFileName, String promptText, String taskId) {
        return Path.of(outputDir,
                sanitizeFilename(refFileName),
                truncate(sanitizeFilename(promptText), MAX_PROMPT_SLUG),
                taskId);
    }

    /**
     * Placeholder output for the offline executor: a copy of the reference
     * image under {@code <outputDir>/<ref-slug>/<prompt-slug>/<millis><ext>}.
     * When the reference is not readable the prompt text is written instead.
     */
    public Path saveOfflineOutput(Path referencePath, String outputDir, String refFileName, String promptText) {
        String promptSlug = truncate(slugify(promptText), MAX_PROMPT_SLUG);
        String refSlug    = slugify(refFileName);
        Path targetDir = Path.of(outputDir,
                refSlug.isEmpty() ? "reference" : refSlug,
                promptSlug.isEmpty() ? "prompt" : promptSlug);
        ensureDir(targetDir);

        Path target = targetDir.resolve(clock.millis() + extensionOf(referencePath));
        try {
            if (Files.isRegularFile(referencePath)) {
                Files.copy(referencePath, target, StandardCopyOption.REPLACE_EXISTING);
            } else {
                Files.writeString(target, promptText == null ? "" : promptText);
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot write placeholder output " + target, e);
        }
        return target;
    }

    // ------------------------------------------------------------------
    // Naming helpers
    // ------------------------------------------------------------------

    /** Strip characters that are illegal in file names and collapse whitespace to dashes. */
    public static String sanitizeFilename(String raw) {
        String normalized = Normalizer.normalize(raw == null ? "" : raw, Normalizer.Form.NFKD)
                .replaceAll("[<>:\"/\\\\|?*\\x00-\\x1F]", "")
                .trim()
                .replaceAll("\\s+", "-")
                .replaceAll("-+", "-");
        return normalized.isEmpty() ? "item" : normalized;
    }

    /** Lower-case slug of letters, digits, CJK ideographs and dashes. */
    public static String slugify(String raw) {
        return Normalizer.normalize(raw == null ? "" : raw, Normalizer.Form.NFKD)
                .replaceAll("[^a-zA-Z0-9\\u4e00-\\u9fa5\\s\\-_]", "")
                .trim()
                .replaceAll("[\\s_]+", "-")
                .replaceAll("-+", "-")
                .toLowerCase(Locale.ROOT);
    }

    private static String truncate(String value, int max) {
        return value.length() <= max ? value : value.substring(0, max);
    }

    private static String extensionOf(Path file) {
        String name = file.getFileName().toString();
        int dot = name.lastIndexOf('.');
        return dot > 0 ? name.substring(dot) : ".png";
    }
}
