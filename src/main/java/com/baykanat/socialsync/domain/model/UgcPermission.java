package com.baykanat.socialsync.domain.model;

import lombok.Builder;
import lombok.Value;

/** ugc_permissions satırı; repost için status granted olmalı. */
@Value
@Builder
public class UgcPermission {

    public static final String STATUS_GRANTED = "granted";

    String id;
    String businessAccountId;
    String ugcContentId;
    String status;
    String repostedMediaId;

    public boolean isGranted() {
        return STATUS_GRANTED.equals(status);
    }
}
