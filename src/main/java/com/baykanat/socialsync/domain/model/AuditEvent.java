package com.baykanat.socialsync.domain.model;

import lombok.Builder;
import lombok.Value;

import java.util.Map;

/** audit_log'a yazılacak olay. */
@Value
@Builder
public class AuditEvent {

    String userId;
    String eventType;
    String action;
    String resourceType;
    String resourceId;
    Map<String, Object> details;
    boolean success;
}
