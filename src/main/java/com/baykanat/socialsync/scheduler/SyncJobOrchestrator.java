package com.baykanat.socialsync.scheduler;

import com.baykanat.socialsync.config.AppProperties;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.scheduling.support.CronExpression;
import org.springframework.scheduling.support.CronTrigger;
import org.springframework.stereotype.Component;

import java.time.DateTimeException;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ScheduledFuture;

/**
 * Tüm cron zamanlayıcılarının sahibi. start() geçerli ifadeye sahip işleri planlar;
 * geçersiz ifade yalnızca o işi başlatmaz. stop() tüm handle'ları iptal eder.
 */
@Slf4j
@Component
public class SyncJobOrchestrator {

    private final TaskScheduler taskScheduler;
    private final List<GuardedCronJob> jobs;
    private final AppProperties appProperties;

    private final Map<String, ScheduledFuture<?>> scheduled = new LinkedHashMap<>();

    public SyncJobOrchestrator(TaskScheduler taskScheduler, List<GuardedCronJob> jobs, AppProperties appProperties) {
        this.taskScheduler = taskScheduler;
        this.jobs = List.copyOf(jobs);
        this.appProperties = appProperties;
    }

    /** Planlanan iş adlarını döner; sync kapalıysa boş. */
    public synchronized List<String> start() {
        if (!appProperties.getSync().isEnabled()) {
            log.info("[ProactiveSync] Disabled (app.sync.enabled=false), no jobs scheduled");
            return List.of();
        }
        if (!scheduled.isEmpty()) {
            log.warn("[ProactiveSync] Jobs already scheduled: {}", scheduled.keySet());
            return List.copyOf(scheduled.keySet());
        }

        ZoneId zone = resolveZone(appProperties.getSync().getZone());
        for (GuardedCronJob job : jobs) {
            if (!job.enabled()) {
                log.info("[ProactiveSync] Job {} disabled, not scheduled", job.name());
                continue;
            }
            String expression = job.cronExpression();
            if (expression == null || !CronExpression.isValidExpression(expression)) {
                log.error("[ProactiveSync] Invalid cron expression for {}: \"{}\", job not started", job.name(), expression);
                continue;
            }
            ScheduledFuture<?> future = taskScheduler.schedule(job, new CronTrigger(expression, zone));
            scheduled.put(job.name(), future);
            log.info("[ProactiveSync] Scheduled {} with \"{}\" ({})", job.name(), expression, zone);
        }

        log.info("[ProactiveSync] {} job(s) scheduled", scheduled.size());
        return List.copyOf(scheduled.keySet());
    }

    /** İdempotent; çalışan işler kesilmez, bitmelerine izin verilir. */
    @PreDestroy
    public synchronized void stop() {
        if (scheduled.isEmpty()) {
            return;
        }
        log.info("[ProactiveSync] Stopping {} scheduled job(s)...", scheduled.size());
        List<String> stopped = new ArrayList<>();
        scheduled.forEach((name, future) -> {
            if (future != null) {
                future.cancel(false);
            }
            stopped.add(name);
        });
        scheduled.clear();
        log.info("[ProactiveSync] All jobs stopped: {}", stopped);
    }

    public synchronized List<String> scheduledJobs() {
        return List.copyOf(scheduled.keySet());
    }

    private static ZoneId resolveZone(String zone) {
        if (zone == null || zone.isBlank()) {
            return ZoneId.of("UTC");
        }
        try {
            return ZoneId.of(zone);
        } catch (DateTimeException e) {
            log.warn("[ProactiveSync] Unknown zone \"{}\", falling back to UTC", zone);
            return ZoneId.of("UTC");
        }
    }
}
