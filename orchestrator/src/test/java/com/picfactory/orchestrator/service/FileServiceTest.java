package com.picfactory.orchestrator.service;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class FileServiceTest {

    @TempDir Path tmp;

    FileService files = new FileService(Clock.systemUTC());

    @Test
    void ensureDir_createsMissingParents() {
        Path dir = tmp.resolve("a/b/c");

        files.ensureDir(dir);
        files.ensureDir(dir);

        assertThat(dir).isDirectory();
    }

    @Test
    void deleteFiles_isIdempotentAndSkipsMissing() throws Exception {
        Path existing = Files.writeString(tmp.resolve("out.png"), "x");
        List<String> paths = List.of(existing.toString(), tmp.resolve("never-there.png").toString());

        files.deleteFiles(paths);
        files.deleteFiles(paths);

        assertThat(existing).doesNotExist();
    }

    @Test
    void taskOutputDir_sanitizesAndCapsPromptAtEightyChars() {
        String longPrompt = "x".repeat(120);

        Path dir = files.taskOutputDir("/out", "my:ref?.png", longPrompt, "task_1");

        assertThat(dir.getFileName().toString()).isEqualTo("task_1");
        assertThat(dir.getParent().getFileName().toString()).hasSize(80);
        assertThat(dir.getParent().getParent().getFileName().toString()).isEqualTo("myref.png");
    }

    @Test
    void sanitizeFilename_blankFallsBackToItem() {
        assertThat(FileService.sanitizeFilename("  ")).isEqualTo("item");
        assertThat(FileService.sanitizeFilename("a  b\tc")).isEqualTo("a-b-c");
    }

    @Test
    void slugify_keepsLettersDigitsAndCjk() {
        assertThat(FileService.slugify("Hello, World_2!")).isEqualTo("hello-world-2");
        assertThat(FileService.slugify("水彩 猫")).isEqualTo("水彩-猫");
    }
}
