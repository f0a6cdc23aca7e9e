package com.baykanat.socialsync.domain.model;

/** Bir hesabın tek döngüdeki sonucu. */
public enum AccountOutcome {
    COMPLETED,
    SKIPPED_ALREADY_BLOCKED,
    BROKE_ON_RATE_LIMIT,
    DISABLED_ON_AUTH_FAILURE,
    FAILED
}
