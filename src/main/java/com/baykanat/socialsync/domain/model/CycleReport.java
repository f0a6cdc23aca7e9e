package com.baykanat.socialsync.domain.model;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.Map;

/** Tek döngü çalışmasının özeti; hesap sırası korunur. */
@Value
@Builder
public class CycleReport {

    String runId;
    SyncType syncType;
    Instant startedAt;
    Instant finishedAt;
    Map<String, AccountOutcome> outcomes;

    public long count(AccountOutcome outcome) {
        return outcomes.values().stream().filter(o -> o == outcome).count();
    }
}
