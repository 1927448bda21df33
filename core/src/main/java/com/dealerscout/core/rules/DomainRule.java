package com.dealerscout.core.rules;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Map;
import java.util.Objects;

/**
 * 학습된 추출 규칙(v=version).
 * host가 {@link #PATTERN_HOST}이면 pathPattern 자리에 레이아웃 시그니처가 들어간다.
 * fields 키: name, street, city_state_zip, phone, website (CSS 셀렉터)
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record DomainRule(
        @JsonProperty("host") String host,
        @JsonProperty("path_pattern") String pathPattern,
        @JsonProperty("version") int version,
        @JsonProperty("card_selector") String cardSelector,
        @JsonProperty("fields") Map<String, String> fields,
        @JsonProperty("dom_signature") String domSignature,
        @JsonProperty("success_count") int successCount) {

    /** 도메인이 아닌 레이아웃 시그니처로 매칭되는 규칙의 host 값 */
    public static final String PATTERN_HOST = "*pattern*";

    public DomainRule {
        Objects.requireNonNull(host, "host");
        Objects.requireNonNull(pathPattern, "pathPattern");
        Objects.requireNonNull(cardSelector, "cardSelector");
        fields = (fields == null) ? Map.of() : Map.copyOf(fields);
        domSignature = (domSignature == null) ? "" : domSignature;
    }

    public boolean isPatternRule() {
        return PATTERN_HOST.equals(host);
    }

    /** 필드 셀렉터. 없거나 비어 있으면 null */
    public String field(String key) {
        String v = fields.get(key);
        return (v == null || v.isBlank()) ? null : v;
    }
}
