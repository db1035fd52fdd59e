package com.picfactory.orchestrator.config;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;

class SchedulerConfigTest {

    ThreadPoolTaskExecutor executor = new SchedulerConfig().jobLoopExecutor();

    @AfterEach
    void tearDown() {
        executor.shutdown();
    }

    @Test
    void jobLoopExecutor_givesEveryLoopItsOwnDaemonThread() throws Exception {
        int loops = 3;
        CountDownLatch allStarted = new CountDownLatch(loops);
        CountDownLatch release    = new CountDownLatch(1);
        List<Thread> threads = new CopyOnWriteArrayList<>();

        for (int i = 0; i < loops; i++) {
            executor.execute(() -> {
                threads.add(Thread.currentThread());
                allStarted.countDown();
                try {
                    release.await(5, TimeUnit.SECONDS);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
            });
        }

        assertThat(allStarted.await(5, TimeUnit.SECONDS)).isTrue();
        release.countDown();
        assertThat(threads).hasSize(loops).allSatisfy(t -> {
            assertThat(t.isDaemon()).isTrue();
            assertThat(t.getName()).startsWith("job-loop-");
        });
        assertThat(threads).doesNotHaveDuplicates();
    }
}
