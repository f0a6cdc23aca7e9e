package com.baykanat.socialsync.scheduler;

import com.baykanat.socialsync.config.AppProperties;
import com.baykanat.socialsync.domain.service.ProactiveSyncService;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/** Etiketlenen ve hashtag medyası keşfi (varsayılan 3 saatte bir). */
@Component
@RequiredArgsConstructor
public class UgcSyncJob extends GuardedCronJob {

    private final ProactiveSyncService syncService;
    private final AppProperties appProperties;

    @Override
    public String name() {
        return "ugc";
    }

    @Override
    public String cronExpression() {
        return appProperties.getSync().getUgc().getCron();
    }

    @Override
    protected void execute() {
        syncService.runUgcCycle();
    }
}
