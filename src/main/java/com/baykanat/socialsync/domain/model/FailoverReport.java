package com.baykanat.socialsync.domain.model;

import lombok.Builder;
import lombok.Value;

import java.util.List;

/** Heartbeat failover çalışmasının özeti. */
@Value
@Builder
public class FailoverReport {

    @Builder.Default
    List<String> downAgents = List.of();

    @Builder.Default
    List<String> alertedAgents = List.of();

    @Builder.Default
    List<String> enqueuedPostIds = List.of();
}
