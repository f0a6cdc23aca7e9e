package com.baykanat.socialsync.scheduler;

import lombok.extern.slf4j.Slf4j;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Cron ile tetiklenen iş. Önceki çalışma sürerken gelen tetik hiçbir şey yapmaz (kuyruklanmaz);
 * iş gövdesindeki hata loglanır, scheduler'a taşınmaz.
 */
@Slf4j
public abstract class GuardedCronJob implements Runnable {

    private final AtomicBoolean running = new AtomicBoolean(false);

    /** Log ve orchestrator için kısa ad (ör. engagement). */
    public abstract String name();

    /** Spring 6 alanlı cron ifadesi. */
    public abstract String cronExpression();

    /** Global enable flag'inden ayrı, işe özel açma/kapama. */
    public boolean enabled() {
        return true;
    }

    protected abstract void execute();

    /** Çalıştıysa true; önceki çalışma sürüyorsa false. */
    public boolean trigger() {
        if (!running.compareAndSet(false, true)) {
            log.info("[{}] Previous run still active, skipping", name());
            return false;
        }
        try {
            execute();
        } catch (Exception e) {
            log.error("[{}] Job run failed: {}", name(), e.getMessage(), e);
        } finally {
            running.set(false);
        }
        return true;
    }

    @Override
    public void run() {
        trigger();
    }

    public boolean isRunning() {
        return running.get();
    }
}
