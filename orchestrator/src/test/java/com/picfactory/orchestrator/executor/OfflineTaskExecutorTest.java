package com.picfactory.orchestrator.executor;

import com.picfactory.orchestrator.model.GenerationTask;
import com.picfactory.orchestrator.model.PromptItem;
import com.picfactory.orchestrator.model.ReferenceImage;
import com.picfactory.orchestrator.service.FileService;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;

import static org.assertj.core.api.Assertions.assertThat;

class OfflineTaskExecutorTest {

    @TempDir Path tmp;

    final Clock clock = Clock.fixed(Instant.ofEpochMilli(1_700_000_000_000L), ZoneOffset.UTC);

    @Test
    void execute_copiesReferenceUnderRefAndPromptSlugs() throws Exception {
        Path ref = Files.write(tmp.resolve("Cat Photo.jpg"), new byte[]{9, 8, 7});
        OfflineTaskExecutor executor = new OfflineTaskExecutor(new FileService(clock), Duration.ZERO);

        TaskResult result = executor.execute(input(ref, "Cat Photo.jpg", "A watercolor cat"));

        assertThat(result.ok()).isTrue();
        Path output = Path.of(result.outputPaths().get(0));
        assertThat(output).isEqualTo(tmp.resolve("out/cat-photojpg/a-watercolor-cat/1700000000000.jpg"));
        assertThat(Files.readAllBytes(output)).containsExactly(9, 8, 7);
    }

    @Test
    void execute_missingReference_stillSucceedsWithPromptText() throws Exception {
        OfflineTaskExecutor executor = new OfflineTaskExecutor(new FileService(clock), Duration.ZERO);

        TaskResult result = executor.execute(input(tmp.resolve("gone.png"), "gone.png", "sunrise"));

        assertThat(result.ok()).isTrue();
        assertThat(Files.readString(Path.of(result.outputPaths().get(0)))).isEqualTo("sunrise");
    }

    private TaskInput input(Path ref, String fileName, String prompt) {
        return new TaskInput("job_1",
                new GenerationTask("task_1", "ref_1", "prompt_1"),
                new ReferenceImage("ref_1", ref.toString(), fileName),
                new PromptItem("prompt_1", prompt),
                tmp.resolve("out").toString());
    }
}
