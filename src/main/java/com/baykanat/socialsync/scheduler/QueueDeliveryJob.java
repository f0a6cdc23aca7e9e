package com.baykanat.socialsync.scheduler;

import com.baykanat.socialsync.config.AppProperties;
import com.baykanat.socialsync.domain.service.QueueDeliveryService;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/** post_queue fallback dağıtımı; app.delivery.enabled ile açılır. */
@Component
@RequiredArgsConstructor
public class QueueDeliveryJob extends GuardedCronJob {

    private final QueueDeliveryService deliveryService;
    private final AppProperties appProperties;

    @Override
    public String name() {
        return "delivery";
    }

    @Override
    public String cronExpression() {
        return appProperties.getDelivery().getCron();
    }

    @Override
    public boolean enabled() {
        return appProperties.getDelivery().isEnabled();
    }

    @Override
    protected void execute() {
        deliveryService.runOnce();
    }
}
