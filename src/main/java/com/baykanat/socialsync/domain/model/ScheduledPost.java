package com.baykanat.socialsync.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/** scheduled_posts satırı. approved → publishing → published geçişleri koşullu UPDATE ile yapılır. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ScheduledPost {

    public static final String STATUS_APPROVED = "approved";
    public static final String STATUS_PUBLISHING = "publishing";
    public static final String STATUS_PUBLISHED = "published";

    private String id;
    private String businessAccountId;
    private String assetId;
    private String caption;
    private String status;
    private String instagramMediaId;
    private Instant publishedAt;
    private Instant createdAt;
}
