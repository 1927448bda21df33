package com.dealerscout.core.model;

/** 파이프라인 실패 사유. retryable=true 인 것만 "다시 시도해볼 가치가 있음" */
public enum FailureReason {
    INVALID_URL(false),
    FETCH_ERROR(true),
    NO_STRATEGY(false),
    MATCHED_EMPTY(false),
    NO_VALID_RECORDS(false),
    INTERNAL_ERROR(false);

    private final boolean retryable;

    FailureReason(boolean retryable) { this.retryable = retryable; }

    public boolean isRetryable() { return retryable; }
}
