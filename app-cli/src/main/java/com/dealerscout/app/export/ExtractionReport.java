package com.dealerscout.app.export;

import com.dealerscout.core.model.CanonicalRecord;
import com.dealerscout.core.model.ExtractionOutcome;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/** 한 번의 CLI 실행 결과: URL별 Outcome + 병합/중복제거된 레코드 */
public final class ExtractionReport {

    /** 입력 URL과 그 결과 */
    public record Source(String url, ExtractionOutcome outcome) {
        public Source {
            Objects.requireNonNull(url, "url");
            Objects.requireNonNull(outcome, "outcome");
        }
    }

    private final String dealerGroup;
    private final Instant startedAt;
    private final List<Source> sources;
    private final List<CanonicalRecord> records;

    public ExtractionReport(String dealerGroup, Instant startedAt, List<Source> sources, List<CanonicalRecord> records) {
        this.dealerGroup = dealerGroup;
        this.startedAt = (startedAt == null) ? Instant.now() : startedAt;
        this.sources = List.copyOf(sources == null ? new ArrayList<>() : sources);
        this.records = List.copyOf(records == null ? new ArrayList<>() : records);
    }

    public String getDealerGroup() { return dealerGroup; }
    public Instant getStartedAt() { return startedAt; }
    public List<Source> getSources() { return sources; }
    public List<CanonicalRecord> getRecords() { return records; }
}
