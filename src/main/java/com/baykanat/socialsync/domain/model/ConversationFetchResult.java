package com.baykanat.socialsync.domain.model;

import lombok.Builder;
import lombok.Value;

import java.util.List;

/** Konuşma listesi çekme sonucu; mesaj adımı için açık pencereli konuşmaları da taşır. */
@Value
@Builder
public class ConversationFetchResult {

    FetchResult result;

    @Builder.Default
    List<ConversationSummary> conversations = List.of();

    @Value
    public static class ConversationSummary {
        String id;
        boolean windowOpen;
    }
}
