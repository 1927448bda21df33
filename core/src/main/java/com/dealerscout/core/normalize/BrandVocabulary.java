package com.dealerscout.core.normalize;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * 자동차 브랜드 사전.
 * 대소문자 무시 + 단어 경계 매칭, 겹치면 가장 긴 표기가 이긴다("Buick GMC" > "GMC").
 * Chrysler/Dodge/Jeep/RAM(+FIAT)이 모두 있으면 CDJR(F) 하나로 묶는다.
 */
public final class BrandVocabulary {

    static final List<String> BRANDS = List.of(
            "Acura", "Airstream", "Alfa Romeo", "Aston Martin", "Audi", "Bentley", "BMW",
            "Bugatti", "Buick", "Cadillac", "Chevrolet", "Ferrari", "FIAT", "Ford", "Genesis", "GMC",
            "Honda", "Hummer", "Hyundai", "Infiniti", "Isuzu", "Jaguar", "Kia", "Lamborghini",
            "Land Rover", "Lexus", "Lincoln", "Maserati", "Mazda", "McLaren", "Mercedes-Benz",
            "MINI", "Mitsubishi", "Nissan", "Polestar", "Porsche", "Rolls-Royce", "smart",
            "Sprinter", "Subaru", "Tesla", "Toyota", "Volkswagen", "Volvo", "Lotus", "INEOS",
            "Koenigsegg", "Harley-Davidson", "Rimac", "Karma", "Lucid", "Vinfast", "CDJR",
            "CDJRF", "Buick GMC", "Rivian", "Ford PRO", "RAM", "RAM Commercial", "Freightliner",
            "Western Star", "Peterbilt", "Kenworth", "Mack", "Hino", "Autocar", "Fuso", "Maybach",
            "Pagani", "Chrysler", "Dodge", "Scion", "Jeep");

    /** 별칭 → 정식 표기 */
    static final Map<String, String> ALIASES = Map.of(
            "Chevy", "Chevrolet",
            "VW", "Volkswagen",
            "Mercedes", "Mercedes-Benz",
            "Chrysler Dodge Jeep Ram", "CDJR");

    private static final List<String> CDJR_PARTS = List.of("Chrysler", "Dodge", "Jeep", "RAM");

    private record Entry(Pattern pattern, String canonical) {}
    private record Hit(int start, int end, String canonical) {}

    private final List<Entry> entries;

    public BrandVocabulary() {
        this(BRANDS, ALIASES);
    }

    public BrandVocabulary(List<String> brands, Map<String, String> aliases) {
        Map<String, String> all = new LinkedHashMap<>();
        for (String b : brands) all.put(b, b);
        all.putAll(aliases);
        List<Entry> list = new ArrayList<>(all.size());
        for (var e : all.entrySet()) {
            Pattern p = Pattern.compile("(?<![A-Za-z0-9])" + Pattern.quote(e.getKey()) + "(?![A-Za-z0-9])",
                    Pattern.CASE_INSENSITIVE);
            list.add(new Entry(p, e.getValue()));
        }
        this.entries = List.copyOf(list);
    }

    /** 이름에 나온 순서대로 정식 브랜드 표기 */
    public Set<String> brandsIn(String text) {
        if (text == null || text.isBlank()) return Set.of();

        List<Hit> hits = new ArrayList<>();
        for (Entry e : entries) {
            Matcher m = e.pattern().matcher(text);
            while (m.find()) hits.add(new Hit(m.start(), m.end(), e.canonical()));
        }
        if (hits.isEmpty()) return Set.of();

        // 시작 위치 오름차순, 같은 위치면 긴 것 먼저 → 겹치지 않는 것만 탐욕적으로 채택
        hits.sort(Comparator.comparingInt(Hit::start)
                .thenComparing(Comparator.comparingInt((Hit h) -> h.end() - h.start()).reversed()));
        List<Hit> chosen = new ArrayList<>();
        int coveredTo = -1;
        for (Hit h : hits) {
            if (h.start() < coveredTo) {
                // 앞선 채택 구간과 겹침: 더 길면 교체
                Hit prev = chosen.get(chosen.size() - 1);
                if (h.end() - h.start() > prev.end() - prev.start()) {
                    chosen.set(chosen.size() - 1, h);
                    coveredTo = h.end();
                }
                continue;
            }
            chosen.add(h);
            coveredTo = h.end();
        }

        Set<String> out = new LinkedHashSet<>();
        for (Hit h : chosen) out.add(h.canonical());
        return collapseCdjr(out);
    }

    public boolean containsBrand(String text) {
        return !brandsIn(text).isEmpty();
    }

    private static Set<String> collapseCdjr(Set<String> tags) {
        if (!tags.containsAll(CDJR_PARTS)) return tags;
        String combined = tags.contains("FIAT") ? "CDJRF" : "CDJR";
        Set<String> out = new LinkedHashSet<>();
        for (String t : tags) {
            if (CDJR_PARTS.contains(t) || ("CDJRF".equals(combined) && "FIAT".equals(t))) {
                out.add(combined);
            } else {
                out.add(t);
            }
        }
        return out;
    }
}
