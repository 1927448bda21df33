package com.dealerscout.core.normalize;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/** 이름 끝의 법인 접미사(LLC, Inc. …) 표기 통일/제거 */
final class CorporateSuffix {
    private CorporateSuffix() {}

    private static final Pattern SUFFIX = Pattern.compile(
            "(?i)[,\\s]+(l\\.?\\s?l\\.?\\s?c\\.?|inc\\.?|incorporated|corp\\.?|corporation|ltd\\.?|limited|co\\.?)$");

    /** "Smith Motors, llc" → "Smith Motors LLC" */
    static String standardize(String name) {
        if (name == null) return null;
        Matcher m = SUFFIX.matcher(name);
        if (!m.find()) return name;
        String head = name.substring(0, m.start()).trim();
        if (head.isEmpty()) return name;
        return head + " " + canonical(m.group(1));
    }

    /** 접미사를 떼어낸 본체. 중복 판정 키 용도 */
    static String strip(String name) {
        if (name == null) return "";
        Matcher m = SUFFIX.matcher(name.trim());
        if (!m.find()) return name.trim();
        String head = name.trim().substring(0, m.start()).trim();
        return head.isEmpty() ? name.trim() : head;
    }

    private static String canonical(String raw) {
        String k = raw.toLowerCase(java.util.Locale.ROOT).replaceAll("[.\\s]", "");
        switch (k) {
            case "llc": return "LLC";
            case "inc": case "incorporated": return "Inc.";
            case "corp": case "corporation": return "Corp.";
            case "ltd": case "limited": return "Ltd.";
            case "co": return "Co.";
            default: return raw;
        }
    }
}
