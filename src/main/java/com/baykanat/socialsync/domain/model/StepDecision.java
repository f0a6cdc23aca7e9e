package com.baykanat.socialsync.domain.model;

/** Tek adım sonucunun triage kararı. */
public enum StepDecision {
    CONTINUE,
    BREAK_ACCOUNT,
    DISABLE_ACCOUNT
}
