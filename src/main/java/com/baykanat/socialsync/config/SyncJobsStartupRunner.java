package com.baykanat.socialsync.config;

import com.baykanat.socialsync.scheduler.SyncJobOrchestrator;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.util.List;

/** Uygulama açılışında (datasource ve schema hazır olduktan sonra) cron işlerini başlatır. */
@Slf4j
@Component
@Order(1)
@RequiredArgsConstructor
public class SyncJobsStartupRunner implements ApplicationRunner {

    private final SyncJobOrchestrator orchestrator;

    @Override
    public void run(ApplicationArguments args) {
        List<String> started = orchestrator.start();
        log.debug("Startup: scheduled jobs={}", started);
    }
}
