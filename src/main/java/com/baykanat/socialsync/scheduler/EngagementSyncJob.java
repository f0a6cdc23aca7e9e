package com.baykanat.socialsync.scheduler;

import com.baykanat.socialsync.config.AppProperties;
import com.baykanat.socialsync.domain.service.ProactiveSyncService;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/** Yorum, konuşma ve mesaj senkronu (varsayılan 3 dakikada bir). */
@Component
@RequiredArgsConstructor
public class EngagementSyncJob extends GuardedCronJob {

    private final ProactiveSyncService syncService;
    private final AppProperties appProperties;

    @Override
    public String name() {
        return "engagement";
    }

    @Override
    public String cronExpression() {
        return appProperties.getSync().getEngagement().getCron();
    }

    @Override
    protected void execute() {
        syncService.runEngagementCycle();
    }
}
