package com.baykanat.socialsync.scheduler;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for GuardedCronJob's overlap guard and failure containment.
 */
class GuardedCronJobTest {

    @Test
    @DisplayName("Tick arriving while the previous run is active does nothing")
    void overlappingTickIsDropped() throws Exception {
        CountDownLatch started = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        AtomicInteger executions = new AtomicInteger();
        GuardedCronJob job = new TestJob(() -> {
            executions.incrementAndGet();
            started.countDown();
            await(release);
        });

        ExecutorService executor = Executors.newSingleThreadExecutor();
        try {
            Future<Boolean> first = executor.submit(job::trigger);
            assertThat(started.await(5, TimeUnit.SECONDS)).isTrue();
            assertThat(job.isRunning()).isTrue();

            assertThat(job.trigger()).isFalse();

            release.countDown();
            assertThat(first.get(5, TimeUnit.SECONDS)).isTrue();
        } finally {
            executor.shutdownNow();
        }

        assertThat(executions.get()).isEqualTo(1);
        assertThat(job.isRunning()).isFalse();
    }

    @Test
    @DisplayName("Failure in the job body is contained and the guard is released")
    void failureReleasesGuard() {
        AtomicInteger executions = new AtomicInteger();
        GuardedCronJob job = new TestJob(() -> {
            executions.incrementAndGet();
            throw new IllegalStateException("upstream down");
        });

        assertThat(job.trigger()).isTrue();
        assertThat(job.trigger()).isTrue();
        assertThat(executions.get()).isEqualTo(2);
        assertThat(job.isRunning()).isFalse();
    }

    private static void await(CountDownLatch latch) {
        try {
            latch.await(5, TimeUnit.SECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    private static final class TestJob extends GuardedCronJob {

        private final Runnable body;

        TestJob(Runnable body) {
            this.body = body;
        }

        @Override
        public String name() {
            return "test";
        }

        @Override
        public String cronExpression() {
            return "0 * * * * *";
        }

        @Override
        protected void execute() {
            body.run();
        }
    }
}
