package com.baykanat.socialsync.domain.service;

import com.baykanat.socialsync.client.AuditSink;
import com.baykanat.socialsync.domain.model.AuditEvent;
import com.baykanat.socialsync.domain.model.SyncType;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.Map;

/** proactive_sync audit kayıtları: event_type proactive_sync, action sync_&lt;tür&gt;. */
@Slf4j
@Service
@RequiredArgsConstructor
public class SyncAuditService {

    static final String EVENT_TYPE = "proactive_sync";

    private final AuditSink auditSink;
    private final Clock clock;

    /** Tek adımın sonucunu yazar; sync_type ve timestamp eklenir. */
    public void recordStep(SyncType syncType, String accountId, Map<String, Object> details, boolean success) {
        Map<String, Object> enriched = new LinkedHashMap<>(details);
        enriched.put("success", success);
        enriched.put("sync_type", syncType.wireValue());
        enriched.put("timestamp", clock.instant().toString());

        try {
            auditSink.logAudit(AuditEvent.builder()
                    .eventType(EVENT_TYPE)
                    .action("sync_" + syncType.wireValue())
                    .resourceType(syncType.wireValue())
                    .resourceId(accountId)
                    .details(enriched)
                    .success(success)
                    .build());
        } catch (RuntimeException e) {
            log.warn("[ProactiveSync] Audit log failed for {}: {}", syncType.wireValue(), e.getMessage());
        }
    }

    /** Circuit breaker nedeniyle atlanan hesap. */
    public void recordSkipped(SyncType cycleType, String accountId) {
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("error", "rate_limited");
        details.put("skipped", true);
        recordStep(cycleType, accountId, details, false);
    }

    /** Hesap işlenirken beklenmeyen hata. */
    public void recordAccountFailure(SyncType cycleType, String accountId, String error) {
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("error", error);
        recordStep(cycleType, accountId, details, false);
    }
}
