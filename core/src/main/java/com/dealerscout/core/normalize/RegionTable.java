package com.dealerscout.core.normalize;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * 닫힌 지역 테이블: 미국 50개 주 + DC, 캐나다 13개 주/준주.
 * country는 오직 이 테이블로만 결정한다(본문 속 국가 언급은 무시).
 */
public final class RegionTable {
    private RegionTable() {}

    public static final String USA = "United States of America";
    public static final String CANADA = "Canada";

    private static final Map<String, String> US = new LinkedHashMap<>();
    private static final Map<String, String> CA = new LinkedHashMap<>();
    /** 소문자 전체 이름 → 코드 */
    private static final Map<String, String> BY_NAME = new LinkedHashMap<>();

    static {
        us("AL", "Alabama"); us("AK", "Alaska"); us("AZ", "Arizona"); us("AR", "Arkansas");
        us("CA", "California"); us("CO", "Colorado"); us("CT", "Connecticut"); us("DE", "Delaware");
        us("DC", "District of Columbia"); us("FL", "Florida"); us("GA", "Georgia"); us("HI", "Hawaii");
        us("ID", "Idaho"); us("IL", "Illinois"); us("IN", "Indiana"); us("IA", "Iowa");
        us("KS", "Kansas"); us("KY", "Kentucky"); us("LA", "Louisiana"); us("ME", "Maine");
        us("MD", "Maryland"); us("MA", "Massachusetts"); us("MI", "Michigan"); us("MN", "Minnesota");
        us("MS", "Mississippi"); us("MO", "Missouri"); us("MT", "Montana"); us("NE", "Nebraska");
        us("NV", "Nevada"); us("NH", "New Hampshire"); us("NJ", "New Jersey"); us("NM", "New Mexico");
        us("NY", "New York"); us("NC", "North Carolina"); us("ND", "North Dakota"); us("OH", "Ohio");
        us("OK", "Oklahoma"); us("OR", "Oregon"); us("PA", "Pennsylvania"); us("RI", "Rhode Island");
        us("SC", "South Carolina"); us("SD", "South Dakota"); us("TN", "Tennessee"); us("TX", "Texas");
        us("UT", "Utah"); us("VT", "Vermont"); us("VA", "Virginia"); us("WA", "Washington");
        us("WV", "West Virginia"); us("WI", "Wisconsin"); us("WY", "Wyoming");

        ca("AB", "Alberta"); ca("BC", "British Columbia"); ca("MB", "Manitoba");
        ca("NB", "New Brunswick"); ca("NL", "Newfoundland and Labrador"); ca("NS", "Nova Scotia");
        ca("NT", "Northwest Territories"); ca("NU", "Nunavut"); ca("ON", "Ontario");
        ca("PE", "Prince Edward Island"); ca("QC", "Quebec"); ca("SK", "Saskatchewan"); ca("YT", "Yukon");
        BY_NAME.put("newfoundland", "NL");
        BY_NAME.put("québec", "QC");
        BY_NAME.put("yukon territory", "YT");
        BY_NAME.put("washington dc", "DC");
        BY_NAME.put("washington d.c.", "DC");
    }

    private static void us(String code, String name) { US.put(code, name); BY_NAME.put(name.toLowerCase(Locale.ROOT), code); }
    private static void ca(String code, String name) { CA.put(code, name); BY_NAME.put(name.toLowerCase(Locale.ROOT), code); }

    public static boolean isUsState(String code) { return code != null && US.containsKey(code); }

    public static boolean isCanadianProvince(String code) { return code != null && CA.containsKey(code); }

    public static boolean isKnown(String code) { return isUsState(code) || isCanadianProvince(code); }

    /** 코드 → 국가명, 테이블에 없으면 null */
    public static String countryOf(String code) {
        if (isUsState(code)) return USA;
        if (isCanadianProvince(code)) return CANADA;
        return null;
    }

    /**
     * 코드 또는 전체 이름을 코드로. 2글자 코드는 대문자만 인정한다
     * (소문자 "or", "in" 같은 일반 단어와 구분하기 위함). 전체 이름은 대소문자 무시.
     */
    public static String codeOf(String text) {
        if (text == null) return null;
        String t = text.trim();
        if (t.endsWith(".")) t = t.substring(0, t.length() - 1);
        if (t.isEmpty()) return null;
        if (t.length() == 2) return isKnown(t) ? t : null;
        return BY_NAME.get(t.toLowerCase(Locale.ROOT).replaceAll("\\s+", " "));
    }

    public static Set<String> usStates() { return Collections.unmodifiableSet(US.keySet()); }

    public static Set<String> canadianProvinces() { return Collections.unmodifiableSet(CA.keySet()); }
}
