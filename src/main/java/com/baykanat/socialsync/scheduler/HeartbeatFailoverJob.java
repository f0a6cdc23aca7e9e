package com.baykanat.socialsync.scheduler;

import com.baykanat.socialsync.config.AppProperties;
import com.baykanat.socialsync.domain.model.FailoverReport;
import com.baykanat.socialsync.domain.service.HeartbeatFailoverService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/** Agent heartbeat kontrolü ve takılı post failover'ı (varsayılan 5 dakikada bir). */
@Slf4j
@Component
@RequiredArgsConstructor
public class HeartbeatFailoverJob extends GuardedCronJob {

    private final HeartbeatFailoverService failoverService;
    private final AppProperties appProperties;

    @Override
    public String name() {
        return "heartbeat";
    }

    @Override
    public String cronExpression() {
        return appProperties.getHeartbeat().getCron();
    }

    @Override
    protected void execute() {
        FailoverReport report = failoverService.runOnce();
        log.debug("[Failover] Run finished: down={}, alerted={}, enqueued={}",
                report.getDownAgents().size(), report.getAlertedAgents().size(), report.getEnqueuedPostIds().size());
    }
}
