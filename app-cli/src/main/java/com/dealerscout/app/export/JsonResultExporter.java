package com.dealerscout.app.export;

import com.dealerscout.core.model.CanonicalRecord;
import com.dealerscout.core.model.ExtractionOutcome;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

import java.io.IOException;
import java.io.Writer;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * 결과 JSON(v=1). 구조: meta / sources / records.
 * 시간은 ISO-8601 문자열, 들여쓰기 출력.
 */
public class JsonResultExporter implements ResultExporter {

    private final ObjectMapper om = new ObjectMapper()
            .registerModule(new JavaTimeModule())
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
            .disable(SerializationFeature.FAIL_ON_EMPTY_BEANS)
            .setSerializationInclusion(JsonInclude.Include.NON_NULL);

    @Override
    public String extension() { return "json"; }

    @Override
    public void write(ExtractionReport report, Writer out) throws IOException {
        Document doc = toDocument(report);
        om.writerWithDefaultPrettyPrinter().writeValue(new NonClosingWriter(out), doc);
        out.flush();
    }

    Document toDocument(ExtractionReport report) {
        Document d = new Document();
        d.meta = new Meta();
        d.meta.dealerGroup = report.getDealerGroup();
        d.meta.startedAt = report.getStartedAt();
        d.meta.generatedAt = Instant.now();
        d.meta.recordCount = report.getRecords().size();

        d.sources = new ArrayList<>();
        for (ExtractionReport.Source s : report.getSources()) {
            ExtractionOutcome o = s.outcome();
            SourceDto dto = new SourceDto();
            dto.url = s.url();
            dto.success = o.isSuccess();
            dto.strategy = o.getStrategyUsed();
            dto.transport = (o.getTransportUsed() != null) ? o.getTransportUsed().name() : null;
            dto.failureReason = (o.getFailureReason() != null) ? o.getFailureReason().name() : null;
            dto.retryable = o.isRetryable();
            dto.message = o.getMessage();
            dto.recordCount = o.getRecords().size();
            dto.diagnostics = o.getDiagnostics();
            d.sources.add(dto);
        }

        d.records = new ArrayList<>();
        for (CanonicalRecord r : report.getRecords()) {
            RecordDto dto = new RecordDto();
            dto.name = r.getName();
            dto.street = r.getStreet();
            dto.city = r.getCity();
            dto.region = r.getRegion();
            dto.postalCode = r.getPostalCode();
            dto.country = r.getCountry();
            dto.phone = r.getPhone();
            dto.website = r.getWebsite();
            dto.websiteDomain = r.getWebsiteDomain();
            dto.brandTags = new ArrayList<>(r.getBrandTags());
            dto.category = r.getCategory().name();
            dto.dealerGroup = r.getDealerGroup();
            dto.sourceStrategy = r.getSourceStrategy();
            dto.sourceTier = (r.getSourceTier() != null) ? r.getSourceTier().name() : null;
            dto.sourceUrl = r.getSourceUrl();
            d.records.add(dto);
        }
        return d;
    }

    // ---- 파일 포맷 ----
    static final class Document {
        public String v = "1";
        public Meta meta;
        public List<SourceDto> sources;
        public List<RecordDto> records;
    }

    static final class Meta {
        public String dealerGroup;
        public Instant startedAt;
        public Instant generatedAt;
        public int recordCount;
    }

    static final class SourceDto {
        public String url;
        public boolean success;
        public String strategy;
        public String transport;
        public String failureReason;
        public boolean retryable;
        public String message;
        public int recordCount;
        public List<String> diagnostics;
    }

    static final class RecordDto {
        public String name;
        public String street;
        public String city;
        public String region;
        public String postalCode;
        public String country;
        public String phone;
        public String website;
        public String websiteDomain;
        public List<String> brandTags;
        public String category;
        public String dealerGroup;
        public String sourceStrategy;
        public String sourceTier;
        public String sourceUrl;
    }

    /** Jackson이 호출자 Writer(예: stdout)를 닫지 않도록 */
    private static final class NonClosingWriter extends java.io.FilterWriter {
        NonClosingWriter(Writer w) { super(w); }
        @Override public void close() throws IOException { flush(); }
    }
}
