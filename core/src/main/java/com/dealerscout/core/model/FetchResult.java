package com.dealerscout.core.model;

import java.time.Instant;
import java.util.List;
import java.util.Objects;

/** 한 번의 fetch 결과(불변). 추출 시도 동안 호출자가 소유한다. */
public final class FetchResult {
    private final String html;
    private final String finalUrl;
    private final Transport transportUsed;
    private final Instant fetchedAt;
    private final int statusCode;
    private final List<String> diagnostics;

    private FetchResult(Builder b) {
        this.html = (b.html == null) ? "" : b.html;
        this.finalUrl = b.finalUrl;
        this.transportUsed = b.transportUsed;
        this.fetchedAt = (b.fetchedAt == null) ? Instant.now() : b.fetchedAt;
        this.statusCode = b.statusCode;
        this.diagnostics = (b.diagnostics == null) ? List.of() : List.copyOf(b.diagnostics);
    }

    public String getHtml() { return html; }
    public String getFinalUrl() { return finalUrl; }
    public Transport getTransportUsed() { return transportUsed; }
    public Instant getFetchedAt() { return fetchedAt; }
    /** 브라우저 경로에서 상태코드를 모르면 0 */
    public int getStatusCode() { return statusCode; }
    /** 예: LIGHT 응답을 버린 이유 */
    public List<String> getDiagnostics() { return diagnostics; }

    @Override
    public String toString() {
        return "FetchResult{" + transportUsed + ", " + finalUrl + ", status=" + statusCode
                + ", bytes=" + html.length() + "}";
    }

    // ----- 빌더 -----
    public static Builder builder() { return new Builder(); }

    public static final class Builder {
        private String html;
        private String finalUrl;
        private Transport transportUsed;
        private Instant fetchedAt;
        private int statusCode;
        private List<String> diagnostics;

        public Builder html(String html) { this.html = html; return this; }
        public Builder finalUrl(String finalUrl) { this.finalUrl = finalUrl; return this; }
        public Builder transportUsed(Transport t) { this.transportUsed = t; return this; }
        public Builder fetchedAt(Instant at) { this.fetchedAt = at; return this; }
        public Builder statusCode(int statusCode) { this.statusCode = statusCode; return this; }
        public Builder diagnostics(List<String> diagnostics) { this.diagnostics = diagnostics; return this; }

        public FetchResult build() {
            Objects.requireNonNull(finalUrl, "finalUrl");
            Objects.requireNonNull(transportUsed, "transportUsed");
            return new FetchResult(this);
        }
    }
}
