package com.dealerscout.core.model;

import java.util.List;
import java.util.Objects;

/**
 * 파이프라인의 최종 산출물. 호출자(UI/CLI)는 이것만 받는다.
 * 실패도 예외가 아니라 failureReason이 채워진 Outcome으로 돌아온다.
 */
public final class ExtractionOutcome {
    private final boolean success;
    private final List<CanonicalRecord> records;
    private final String strategyUsed;
    private final List<String> diagnostics;
    private final FailureReason failureReason;
    private final String message;
    private final Transport transportUsed;

    private ExtractionOutcome(boolean success, List<CanonicalRecord> records, String strategyUsed,
                              List<String> diagnostics, FailureReason failureReason,
                              String message, Transport transportUsed) {
        this.success = success;
        this.records = (records == null) ? List.of() : List.copyOf(records);
        this.strategyUsed = strategyUsed;
        this.diagnostics = (diagnostics == null) ? List.of() : List.copyOf(diagnostics);
        this.failureReason = failureReason;
        this.message = message;
        this.transportUsed = transportUsed;
    }

    public static ExtractionOutcome success(List<CanonicalRecord> records, String strategyUsed,
                                            Transport transportUsed, List<String> diagnostics) {
        Objects.requireNonNull(records, "records");
        return new ExtractionOutcome(true, records, strategyUsed, diagnostics, null,
                records.size() + " location(s) extracted", transportUsed);
    }

    public static ExtractionOutcome failure(FailureReason reason, String message,
                                            String strategyUsed, Transport transportUsed,
                                            List<String> diagnostics) {
        Objects.requireNonNull(reason, "reason");
        return new ExtractionOutcome(false, List.of(), strategyUsed, diagnostics, reason,
                message, transportUsed);
    }

    public boolean isSuccess() { return success; }
    public List<CanonicalRecord> getRecords() { return records; }
    /** 실제로 레코드를 뽑은(혹은 마지막으로 매칭된) 전략 이름. 없으면 null */
    public String getStrategyUsed() { return strategyUsed; }
    /** 상태 전이와 전략별 판정 이력 */
    public List<String> getDiagnostics() { return diagnostics; }
    public FailureReason getFailureReason() { return failureReason; }
    public String getMessage() { return message; }
    public Transport getTransportUsed() { return transportUsed; }

    /** "가져오기 실패"(일시적)면 true, "데이터 없음"(레이아웃 미지원 등)이면 false */
    public boolean isRetryable() {
        return !success && failureReason != null && failureReason.isRetryable();
    }

    @Override
    public String toString() {
        return success
                ? "ExtractionOutcome{SUCCESS, records=" + records.size() + ", strategy=" + strategyUsed + "}"
                : "ExtractionOutcome{FAILED(" + failureReason + "), " + message + "}";
    }
}
