package com.dealerscout.core.normalize;

import com.dealerscout.core.model.ParsedAddress;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * 자유 형식 주소 → (street, city, region, postalCode).
 *
 * 패턴 우선순위:
 *  1) 쉼표 구분   "123 Main St, Springfield, OR 97477"
 *  2) 줄바꿈 블록 "123 Main St\nSpringfield, OR 97477"
 *  3) 인라인 꼬리 "123 Main St Springfield OR 97477"
 * region이 닫힌 테이블(RegionTable)에 있어야만 채택한다.
 * 도로 약어 정규화는 분해가 끝난 street에만 적용한다.
 */
public final class AddressParser {

    private static final Pattern POSTAL_LIKE = Pattern.compile("(?=.*\\d)[A-Za-z0-9][A-Za-z0-9 -]{2,9}");
    private static final Pattern US_ZIP = Pattern.compile("\\d{5}(?:-\\d{4})?");
    private static final Pattern US_ZIP9 = Pattern.compile("\\d{9}");
    private static final Pattern CA_POSTAL_COMPACT = Pattern.compile("[A-Z]\\d[A-Z]\\d[A-Z]\\d");

    private static final Pattern TRAILING_COUNTRY = Pattern.compile(
            "(?i)[,\\s]+(?:u\\.?s\\.?a\\.?|u\\.s\\.|united states(?: of america)?|canada)\\.?\\s*$");
    private static final Pattern COUNTRY_ONLY = Pattern.compile(
            "(?i)^(?:u\\.?s\\.?a?\\.?|united states(?: of america)?|canada)\\.?$");
    private static final Pattern PHONE_LINE = Pattern.compile(
            "(?i)^(?:phone|tel|fax|sales|service|parts)?\\s*[:.]?\\s*[\\d()+.\\s-]{10,}$");
    private static final Pattern ADDRESS_LABEL = Pattern.compile("(?i)^address\\s*[:\\-]\\s*");

    /** 분해 이후 street에만 적용하는 약어 표 */
    private static final Map<Pattern, String> STREET_ABBREVIATIONS = new LinkedHashMap<>();
    static {
        abbr("Street", "St"); abbr("Avenue", "Ave"); abbr("Boulevard", "Blvd");
        abbr("Highway", "Hwy"); abbr("Lane", "Ln"); abbr("Drive", "Dr"); abbr("Road", "Rd");
        abbr("Parkway", "Pkwy"); abbr("Expressway", "Expy"); abbr("Freeway", "Fwy");
        abbr("Court", "Ct"); abbr("Place", "Pl"); abbr("Circle", "Cir");
        abbr("Terrace", "Ter"); abbr("Turnpike", "Tpke");
    }
    private static void abbr(String word, String shortForm) {
        STREET_ABBREVIATIONS.put(Pattern.compile("(?i)\\b" + word + "\\b\\.?"), shortForm);
        // "St." → "St"
        STREET_ABBREVIATIONS.put(Pattern.compile("\\b" + shortForm + "\\.(?=\\s|,|$)"), shortForm);
    }

    /** 인라인 패턴에서 street 끝을 알려주는 토큰(소문자, 마침표 제거) */
    private static final Set<String> STREET_ENDINGS = Set.of(
            "st", "street", "ave", "av", "avenue", "blvd", "boulevard", "rd", "road", "dr", "drive",
            "ln", "lane", "way", "hwy", "highway", "pkwy", "parkway", "ct", "court", "pl", "place",
            "cir", "circle", "ter", "terrace", "trl", "trail", "expy", "expressway", "fwy", "freeway",
            "pike", "tpke", "turnpike", "loop", "sq", "square", "plz", "plaza", "xing", "crossing");
    private static final Set<String> DIRECTIONALS = Set.of("N", "S", "E", "W", "NE", "NW", "SE", "SW");
    private static final Set<String> UNIT_DESIGNATORS = Set.of(
            "suite", "ste", "unit", "apt", "bldg", "building", "floor", "fl", "room", "rm", "#");

    /** region + 우편번호 꼬리 */
    private record RegionTail(String region, String postal) {}

    /** 도시 + 꼬리 */
    private record CityLine(String city, RegionTail tail) {}

    public ParsedAddress parse(String text) {
        if (text == null) return null;
        String t = text.replace('\u00A0', ' ').replace("\r", "").trim();
        t = ADDRESS_LABEL.matcher(t).replaceFirst("");
        if (t.isEmpty()) return null;

        ParsedAddress p = null;
        if (t.indexOf('\n') < 0) {
            p = parseCommaDelimited(t);
        } else {
            p = parseLines(t);
        }
        if (p == null) {
            p = parseInline(t.replace('\n', ' '));
        }
        return p;
    }

    /** 정규화된 필드를 다시 한 줄 주소로. 재파싱하면 같은 결과가 나온다 */
    public static String format(String street, String city, String region, String postalCode) {
        StringBuilder sb = new StringBuilder();
        if (street != null) sb.append(street);
        if (city != null) { if (sb.length() > 0) sb.append(", "); sb.append(city); }
        if (region != null) { if (sb.length() > 0) sb.append(", "); sb.append(region); }
        if (postalCode != null) { if (sb.length() > 0) sb.append(' '); sb.append(postalCode); }
        return sb.toString();
    }

    // ---- 1) 쉼표 구분 ----
    private ParsedAddress parseCommaDelimited(String text) {
        String t = TRAILING_COUNTRY.matcher(text).replaceFirst("");
        List<String> parts = new ArrayList<>();
        for (String s : t.split(",")) {
            String p = collapse(s);
            if (!p.isEmpty()) parts.add(p);
        }
        while (!parts.isEmpty() && COUNTRY_ONLY.matcher(parts.get(parts.size() - 1)).matches()) {
            parts.remove(parts.size() - 1);
        }
        int n = parts.size();
        if (n < 2) return null;
        String last = parts.get(n - 1);

        // street, city, ST zip
        if (n >= 3) {
            RegionTail rt = regionTail(upperLeadingCode(last));
            if (rt != null) {
                return build(String.join(", ", parts.subList(0, n - 2)), parts.get(n - 2), rt);
            }
        }
        // street, city, ST, zip
        if (n >= 4 && POSTAL_LIKE.matcher(last).matches()) {
            String code = RegionTable.codeOf(upperLeadingCode(parts.get(n - 2)));
            if (code != null) {
                return build(String.join(", ", parts.subList(0, n - 3)), parts.get(n - 3),
                        new RegionTail(code, last));
            }
        }
        // street, city ST zip
        CityLine cl = cityLine(last);
        if (cl != null) {
            return build(String.join(", ", parts.subList(0, n - 1)), cl.city(), cl.tail());
        }
        return null;
    }

    // ---- 2) 줄바꿈 블록 ----
    private ParsedAddress parseLines(String text) {
        List<String> lines = new ArrayList<>();
        for (String raw : text.split("\n")) {
            String l = collapse(raw);
            if (l.endsWith(",")) l = l.substring(0, l.length() - 1).trim();
            if (l.isEmpty()) continue;
            if (COUNTRY_ONLY.matcher(l).matches()) continue;
            if (PHONE_LINE.matcher(l).matches()) continue;
            lines.add(TRAILING_COUNTRY.matcher(l).replaceFirst(""));
        }
        int n = lines.size();
        if (n < 2) return null;
        String last = lines.get(n - 1);

        CityLine cl = cityLine(last);
        if (cl != null) {
            return build(String.join(", ", lines.subList(0, n - 1)), cl.city(), cl.tail());
        }
        if (n >= 3) {
            RegionTail rt = regionTail(last);
            if (rt != null) {
                return build(String.join(", ", lines.subList(0, n - 2)), lines.get(n - 2), rt);
            }
        }
        return null;
    }

    // ---- 3) 인라인 꼬리 ----
    private ParsedAddress parseInline(String text) {
        String t = collapse(TRAILING_COUNTRY.matcher(text).replaceFirst(""));
        String[] tok = t.split(" ");
        int n = tok.length;
        if (n < 3) return null;

        // 오른쪽부터 region 꼬리를 찾되, 더 긴 이름("West Virginia")이 있으면 그쪽을 채택.
        // 도시를 지역명으로 삼키는 꼬리는 regionTail이 거른다
        int best = -1;
        RegionTail bestTail = null;
        for (int j = n - 1; j >= Math.max(1, n - 5); j--) {
            RegionTail rt = regionTail(String.join(" ", Arrays.copyOfRange(tok, j, n)));
            if (rt != null) { best = j; bestTail = rt; }
        }
        if (bestTail == null) return null;

        String head = String.join(" ", Arrays.copyOfRange(tok, 0, best)).trim();
        if (head.endsWith(",")) head = head.substring(0, head.length() - 1).trim();
        int comma = head.lastIndexOf(',');
        if (comma > 0) {
            return build(head.substring(0, comma), head.substring(comma + 1), bestTail);
        }

        String[] ht = head.split(" ");
        int cut = -1;
        for (int i = 0; i < ht.length - 1; i++) {
            String w = ht[i].replace(".", "");
            String lw = w.toLowerCase(Locale.ROOT);
            boolean ending = STREET_ENDINGS.contains(lw) || DIRECTIONALS.contains(w);
            boolean unitId = i > 0 && UNIT_DESIGNATORS.contains(ht[i - 1].replace(".", "").toLowerCase(Locale.ROOT));
            boolean hashUnit = w.startsWith("#") && w.length() > 1;
            if ((ending || unitId || hashUnit) && i > 0) cut = i;
        }
        if (cut < 0) return null;
        return build(String.join(" ", Arrays.copyOfRange(ht, 0, cut + 1)),
                String.join(" ", Arrays.copyOfRange(ht, cut + 1, ht.length)), bestTail);
    }

    // ---- 꼬리/도시 판정 ----

    /**
     * "OR 97477", "New York 10001", "Ontario M5V 2T6", "TX". 뒤에 잡음이 있으면 null.
     * 여러 단어 지역명은 쉼표를 넘지 못하고("Washington, DC"는 DC),
     * 뒤따르는 부분이 또 다른 지역 코드로 시작하면("New York NY 10001") 지역명이 아니라 도시다.
     */
    private static RegionTail regionTail(String tail) {
        String t = collapse(tail);
        if (t.isEmpty()) return null;
        String[] tok = t.split(" ");
        for (int k = Math.min(tok.length, 4); k >= 1; k--) {
            if (spansComma(tok, k)) continue;
            String code = RegionTable.codeOf(stripCommas(String.join(" ", Arrays.copyOfRange(tok, 0, k))));
            if (code == null) continue;
            String rest = collapse(stripCommas(String.join(" ", Arrays.copyOfRange(tok, k, tok.length))));
            if (rest.isEmpty()) return new RegionTail(code, null);
            if (RegionTable.codeOf(rest.split(" ")[0]) != null) return null;
            if (POSTAL_LIKE.matcher(rest).matches()) return new RegionTail(code, rest);
            return null;
        }
        return null;
    }

    /** 앞 k개 토큰 중 마지막을 제외한 토큰이 쉼표로 끝나면 true */
    private static boolean spansComma(String[] tok, int k) {
        for (int i = 0; i < k - 1; i++) {
            if (tok[i].endsWith(",")) return true;
        }
        return false;
    }

    private static String stripCommas(String s) {
        return s.replace(',', ' ').trim();
    }

    /** 쉼표로 떨어진 region 칸에서는 소문자 코드("or 97477")도 코드로 본다 */
    private static String upperLeadingCode(String segment) {
        int sp = segment.indexOf(' ');
        String head = (sp < 0) ? segment : segment.substring(0, sp);
        String bare = head.endsWith(".") ? head.substring(0, head.length() - 1) : head;
        if (bare.length() == 2 && bare.chars().allMatch(Character::isLetter)) {
            return head.toUpperCase(Locale.ROOT) + (sp < 0 ? "" : segment.substring(sp));
        }
        return segment;
    }

    /** "Springfield, OR 97477" 또는 "Kansas City MO 64101" */
    private static CityLine cityLine(String line) {
        int comma = line.lastIndexOf(',');
        if (comma > 0) {
            RegionTail rt = regionTail(line.substring(comma + 1));
            String city = collapse(line.substring(0, comma));
            if (rt != null && plausibleCity(city)) return new CityLine(city, rt);
        }
        String[] tok = collapse(line.replace(',', ' ')).split(" ");
        for (int i = 1; i < tok.length; i++) {
            RegionTail rt = regionTail(String.join(" ", Arrays.copyOfRange(tok, i, tok.length)));
            if (rt == null) continue;
            String city = String.join(" ", Arrays.copyOfRange(tok, 0, i));
            return plausibleCity(city) ? new CityLine(city, rt) : null;
        }
        return null;
    }

    private static boolean plausibleCity(String city) {
        if (city == null || city.isBlank()) return false;
        if (city.chars().noneMatch(Character::isLetter)) return false;
        // 숫자로 시작하면 번지가 섞인 것
        return !Character.isDigit(city.charAt(0));
    }

    // ---- 조립/정규화 ----
    private static ParsedAddress build(String street, String city, RegionTail rt) {
        String s = normalizeStreet(street);
        String c = tidyCity(city);
        if (s.isEmpty() || c.isEmpty() || s.chars().noneMatch(Character::isLetterOrDigit)) return null;

        List<String> warnings = new ArrayList<>();
        String postal = null;
        if (rt.postal() != null) {
            postal = normalizePostal(rt.postal(), rt.region(), warnings);
        }
        return new ParsedAddress(s, c, rt.region(), postal, warnings);
    }

    /** 공백 정리 + 도로 약어 통일(Street→St, Avenue→Ave …) */
    static String normalizeStreet(String street) {
        String s = collapse(street);
        while (s.endsWith(",") || s.endsWith(";")) s = s.substring(0, s.length() - 1).trim();
        for (Map.Entry<Pattern, String> e : STREET_ABBREVIATIONS.entrySet()) {
            s = e.getKey().matcher(s).replaceAll(Matcher.quoteReplacement(e.getValue()));
        }
        return collapse(s);
    }

    static String tidyCity(String city) {
        String c = collapse(city);
        while (c.endsWith(",") || c.endsWith(".")) c = c.substring(0, c.length() - 1).trim();
        return Casing.isSingleCase(c) ? Casing.titleCase(c) : c;
    }

    /**
     * US: 12345 / 12345-6789, Canada: "A1A 1A1".
     * 형식이 맞지 않아도 버리지 않고 그대로 두되 warnings에 남긴다.
     */
    static String normalizePostal(String raw, String region, List<String> warnings) {
        String trimmed = collapse(raw);
        String compact = trimmed.toUpperCase(Locale.ROOT).replaceAll("[\\s-]", "");
        boolean canadian = RegionTable.isCanadianProvince(region);

        if (CA_POSTAL_COMPACT.matcher(compact).matches()) {
            String v = compact.substring(0, 3) + " " + compact.substring(3);
            if (!canadian) warnings.add("Canadian postal code '" + v + "' for US region " + region);
            return v;
        }
        if (US_ZIP.matcher(trimmed).matches() || US_ZIP9.matcher(compact).matches()) {
            String v = US_ZIP.matcher(trimmed).matches()
                    ? trimmed
                    : compact.substring(0, 5) + "-" + compact.substring(5);
            if (canadian) warnings.add("US ZIP code '" + v + "' for Canadian region " + region);
            return v;
        }
        warnings.add("unrecognized postal code '" + trimmed + "' for region " + region);
        return trimmed;
    }

    private static String collapse(String s) {
        return (s == null) ? "" : s.replaceAll("\\s+", " ").trim();
    }
}
