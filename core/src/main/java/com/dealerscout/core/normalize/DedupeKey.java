package com.dealerscout.core.normalize;

import com.dealerscout.core.model.CanonicalRecord;

import java.util.Locale;
import java.util.regex.Pattern;

/**
 * 중복 판정 키: (법인 접미사를 뗀 소문자 이름, 호수 표기를 뗀 영숫자 street)
 * "123 Main St Suite 200" 과 "123 Main St" 는 같은 위치로 본다.
 */
public record DedupeKey(String name, String street) {

    /** 부속 호수 표기(Suite/Ste/Unit/#…)와 그 뒤 전부 */
    private static final Pattern SECONDARY_UNIT = Pattern.compile(
            "(?i)(?:[\\s,]+(?:suite|ste|unit|apt|apartment|bldg|building|floor|fl|room|rm)\\.?\\s*(?:[a-z]?\\d[a-z0-9-]*|[a-z])\\b"
                    + "|[\\s,]*#\\s*[a-z0-9-]+"
                    + "|[\\s,]+\\d+(?:st|nd|rd|th)\\s+floor\\b).*$");

    public static DedupeKey of(CanonicalRecord r) {
        return new DedupeKey(nameKey(r.getName()), streetKey(r.getStreet()));
    }

    /** name/street 중 하나라도 비면 병합 대상이 아니다 */
    public boolean isComplete() {
        return !name.isEmpty() && !street.isEmpty();
    }

    static String nameKey(String name) {
        if (name == null) return "";
        return CorporateSuffix.strip(name).toLowerCase(Locale.ROOT).replaceAll("\\s+", " ").trim();
    }

    static String streetKey(String street) {
        if (street == null) return "";
        String s = SECONDARY_UNIT.matcher(street.trim()).replaceFirst("");
        return s.toLowerCase(Locale.ROOT).replaceAll("[^a-z0-9]", "");
    }
}
