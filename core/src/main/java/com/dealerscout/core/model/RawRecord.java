package com.dealerscout.core.model;

import java.util.Objects;

/**
 * 전략 한 번의 extract 호출이 만든 가공 전 레코드.
 * phone/website는 없을 수 있다(null). tier는 생산한 전략의 등급.
 */
public record RawRecord(String name,
                        String rawAddress,
                        String phone,
                        String website,
                        String sourceUrl,
                        String strategyName,
                        Tier tier) {

    public RawRecord {
        Objects.requireNonNull(sourceUrl, "sourceUrl");
        Objects.requireNonNull(strategyName, "strategyName");
        Objects.requireNonNull(tier, "tier");
    }

    public static RawRecord of(String name, String rawAddress, String phone, String website,
                               String sourceUrl, String strategyName, Tier tier) {
        return new RawRecord(blankToNull(name), blankToNull(rawAddress), blankToNull(phone),
                blankToNull(website), sourceUrl, strategyName, tier);
    }

    private static String blankToNull(String s) {
        if (s == null) return null;
        String t = s.trim();
        return t.isEmpty() ? null : t;
    }
}
