package com.baykanat.socialsync.scheduler;

import com.baykanat.socialsync.config.AppProperties;
import com.baykanat.socialsync.domain.service.ProactiveSyncService;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/** Medya metrikleri (varsayılan her gün 02:00 UTC). */
@Component
@RequiredArgsConstructor
public class InsightsSyncJob extends GuardedCronJob {

    private final ProactiveSyncService syncService;
    private final AppProperties appProperties;

    @Override
    public String name() {
        return "insights";
    }

    @Override
    public String cronExpression() {
        return appProperties.getSync().getInsights().getCron();
    }

    @Override
    protected void execute() {
        syncService.runInsightsCycle();
    }
}
