package com.runway.executor;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class ExecutorConfigTest {

    @Test
    @DisplayName("worker threads are named daemons and blocked tasks never starve new ones")
    void workerPool() throws Exception {
        var pool = new ExecutorConfig().runwayExecutor();
        try {
            var release = new CountDownLatch(1);
            // stand-ins for drain tasks blocked on a quiet pipe
            for (int i = 0; i < 32; i++) {
                pool.execute(() -> {
                    try {
                        release.await();
                    } catch (InterruptedException e) {
                        Thread.currentThread().interrupt();
                    }
                });
            }

            var thread = CompletableFuture.supplyAsync(Thread::currentThread, pool).get(5, TimeUnit.SECONDS);

            assertTrue(thread.getName().startsWith("runway-exec-"));
            assertTrue(thread.isDaemon());
            release.countDown();
        } finally {
            pool.shutdownNow();
        }
    }
}
