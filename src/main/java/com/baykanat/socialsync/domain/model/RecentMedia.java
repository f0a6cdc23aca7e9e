package com.baykanat.socialsync.domain.model;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;

/** Yorum senkronu için seçilen son yayınlanmış medya. */
@Value
@Builder
public class RecentMedia {

    String businessAccountId;
    String instagramMediaId;
    Instant publishedAt;
}
