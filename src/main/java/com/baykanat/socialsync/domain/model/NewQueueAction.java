package com.baykanat.socialsync.domain.model;

import lombok.Builder;
import lombok.Value;

import java.util.Map;

/**
 * Üretici tarafından kuyruğa eklenecek aksiyon. idempotencyKey verilmezse
 * idempotencySeed'in SHA-256 hex değeri kullanılır.
 */
@Value
@Builder
public class NewQueueAction {

    String businessAccountId;
    ActionType actionType;
    Map<String, Object> payload;

    /** Mantıksal aksiyonun kararlı tanımı, ör. repost_ugc:&lt;permissionId&gt;. */
    String idempotencySeed;

    String idempotencyKey;
}
