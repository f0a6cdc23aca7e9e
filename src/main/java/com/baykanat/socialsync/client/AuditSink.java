package com.baykanat.socialsync.client;

import com.baykanat.socialsync.domain.model.AuditEvent;

/** Audit yazıcısı; çağırana hiçbir zaman istisna fırlatmaz. */
public interface AuditSink {

    void logAudit(AuditEvent event);
}
