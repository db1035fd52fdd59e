package com.picfactory.orchestrator.repository;

import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;

class RuntimeControlTest {

    @Test
    void awaitUnless_readyCondition_returnsImmediately() throws Exception {
        RuntimeControl control = new RuntimeControl();

        long start = System.nanoTime();
        control.awaitUnless(() -> true, Duration.ofSeconds(10));

        assertThat(Duration.ofNanos(System.nanoTime() - start)).isLessThan(Duration.ofSeconds(1));
    }

    @Test
    void signalChange_wakesBlockedWaiterEarly() throws Exception {
        RuntimeControl control = new RuntimeControl();
        control.setPaused(true);

        CompletableFuture<Long> waited = CompletableFuture.supplyAsync(() -> {
            long start = System.nanoTime();
            try {
                control.awaitUnless(() -> !control.isPaused(), Duration.ofSeconds(30));
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            return System.nanoTime() - start;
        });
        Thread.sleep(50);
        control.setPaused(false);
        control.signalChange();

        assertThat(Duration.ofNanos(waited.get(5, TimeUnit.SECONDS))).isLessThan(Duration.ofSeconds(5));
    }
}
