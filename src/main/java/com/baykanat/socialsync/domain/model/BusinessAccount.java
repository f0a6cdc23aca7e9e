package com.baykanat.socialsync.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** instagram_business_accounts satırı; auth hatasında soft-disable edilir, silinmez. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class BusinessAccount {

    private String id;
    private String instagramBusinessId;
    private String userId;
    private boolean connected;
    private String connectionStatus;
}
