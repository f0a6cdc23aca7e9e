package com.baykanat.socialsync.domain.model;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class AccountCredentials {

    String pageToken;
    String igUserId;
    String userId;
}
