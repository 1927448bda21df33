package com.dealerscout.core.strategy;

import com.dealerscout.core.model.RawRecord;
import com.dealerscout.core.model.Tier;

import java.util.List;
import java.util.Objects;

/**
 * 전략 선택 + 추출 한 번의 결과.
 * MATCHED_EMPTY(선택됐지만 추출 실패/0건)와 NO_MATCH(아무 전략도 canHandle 안 함)는 구분된다.
 */
public final class SelectionResult {

    public enum Status { MATCHED, MATCHED_EMPTY, NO_MATCH }

    private final Status status;
    private final String strategyName;   // NO_MATCH면 null
    private final Tier tier;             // NO_MATCH면 null
    private final List<RawRecord> records;
    private final List<String> diagnostics;

    private SelectionResult(Status status, String strategyName, Tier tier,
                            List<RawRecord> records, List<String> diagnostics) {
        this.status = Objects.requireNonNull(status, "status");
        this.strategyName = strategyName;
        this.tier = tier;
        this.records = (records == null) ? List.of() : List.copyOf(records);
        this.diagnostics = (diagnostics == null) ? List.of() : List.copyOf(diagnostics);
    }

    public static SelectionResult matched(String strategyName, Tier tier,
                                          List<RawRecord> records, List<String> diagnostics) {
        Objects.requireNonNull(strategyName, "strategyName");
        if (records == null || records.isEmpty()) {
            throw new IllegalArgumentException("matched result needs at least one record");
        }
        return new SelectionResult(Status.MATCHED, strategyName, tier, records, diagnostics);
    }

    public static SelectionResult matchedEmpty(String strategyName, Tier tier, List<String> diagnostics) {
        Objects.requireNonNull(strategyName, "strategyName");
        return new SelectionResult(Status.MATCHED_EMPTY, strategyName, tier, List.of(), diagnostics);
    }

    public static SelectionResult noMatch(List<String> diagnostics) {
        return new SelectionResult(Status.NO_MATCH, null, null, List.of(), diagnostics);
    }

    public Status getStatus() { return status; }
    public boolean isMatched() { return status == Status.MATCHED; }
    public String getStrategyName() { return strategyName; }
    public Tier getTier() { return tier; }
    public List<RawRecord> getRecords() { return records; }
    public List<String> getDiagnostics() { return diagnostics; }

    @Override
    public String toString() {
        return "SelectionResult{" + status
                + (strategyName != null ? ", strategy=" + strategyName : "")
                + ", records=" + records.size() + '}';
    }
}
