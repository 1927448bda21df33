package com.dealerscout.core.normalize;

import com.dealerscout.core.model.CanonicalRecord;
import com.dealerscout.core.model.Category;
import com.dealerscout.core.model.ParsedAddress;
import com.dealerscout.core.model.RawRecord;
import com.dealerscout.core.util.UrlUtils;

import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * RawRecord → CanonicalRecord. 실제 위치가 아니면 null(버림).
 *
 * 적용 순서:
 *  (a) 이름 검증: 비었거나 내비게이션/설명문/본사 항목이면 버림
 *  (b) 주소 분해: street+region이 안 나오면 버림
 *  (c) 이름/전화/웹사이트 정리
 *  (d) region → country (닫힌 테이블)
 *  (e) 브랜드 태그
 *  (f) 분류
 * 결과는 고정점이다: 정규화된 값을 다시 넣어도 그대로 나온다.
 */
public class RecordNormalizer {

    /** 소문자 완전일치로 버리는 이름 */
    private static final Set<String> INVALID_NAMES = Set.of(
            "locations", "our locations", "all locations", "find a location", "location",
            "saved", "community news", "essential cookies", "sales", "service", "parts",
            "service phone:", "parts phone:", "sales phone:", "home", "contact", "contact us",
            "directions", "get directions", "hours", "menu", "search", "view all", "view details",
            "privacy policy", "careers", "about us", "dealer locator", "map");

    /** 설명문에서 흔한 단어(단어 경계 매칭) */
    private static final Pattern DESCRIPTIVE = Pattern.compile(
            "(?i)\\b(treat|need|customers?|concerns?|expectations?|standards?|demonstrate|about"
                    + "|welcome to|group description|our mission|click here|learn more)\\b");

    private static final Pattern CORPORATE_ENTRY = Pattern.compile(
            "(?i)\\b(corporate (office|headquarters|hq)|headquarters|home office|investor relations"
                    + "|support center|regional office)\\b");

    private static final Pattern PHONE = Pattern.compile(
            "(?:\\+?1[\\s.-]?)?\\(?(\\d{3})\\)?[\\s.-]?(\\d{3})[\\s.-]?(\\d{4})(?!\\d)");

    private static final int MAX_NAME = 80;
    private static final int MAX_STREET = 100;

    private static final List<String> COLLISION_CUES = List.of(
            "collision", "body shop", "bodyshop", "autobody", "auto body", "body repair", "repair center");
    private static final List<String> FIXED_OPS_CUES = List.of(
            "quick lane", "express service", "service center", "service centre", "maintenance",
            "tire", "lube", "oil change", "parts center", "parts & service");
    private static final List<String> USED_CUES = List.of(
            "used", "pre-owned", "preowned", "pre owned", "auto sales", "car sales", "certified");

    private final AddressParser addressParser;
    private final BrandVocabulary brands;
    private final List<String> singleBrandDomains;

    public RecordNormalizer() {
        this(new AddressParser(), new BrandVocabulary(), List.of());
    }

    public RecordNormalizer(List<String> singleBrandDomains) {
        this(new AddressParser(), new BrandVocabulary(), singleBrandDomains);
    }

    public RecordNormalizer(AddressParser addressParser, BrandVocabulary brands, List<String> singleBrandDomains) {
        this.addressParser = Objects.requireNonNull(addressParser, "addressParser");
        this.brands = Objects.requireNonNull(brands, "brands");
        this.singleBrandDomains = (singleBrandDomains == null) ? List.of() : List.copyOf(singleBrandDomains);
    }

    public CanonicalRecord normalize(RawRecord raw) {
        return normalize(raw, NormalizationContext.none());
    }

    public CanonicalRecord normalize(RawRecord raw, NormalizationContext ctx) {
        Objects.requireNonNull(raw, "raw");
        NormalizationContext c = (ctx != null) ? ctx : NormalizationContext.none();

        // ---- (a) 이름 검증 ----
        String name = cleanName(raw.name());
        String rejection = rejectName(name);
        if (rejection != null) {
            c.note("discarded '" + raw.name() + "': " + rejection);
            return null;
        }

        // ---- (b) 주소 ----
        ParsedAddress addr = addressParser.parse(raw.rawAddress());
        if (addr == null || addr.street() == null || addr.region() == null) {
            c.note("discarded '" + name + "': unparseable address '" + raw.rawAddress() + "'");
            return null;
        }
        if (addr.street().length() > MAX_STREET
                || (addr.street().toLowerCase(Locale.ROOT).contains("directions") && addr.street().contains(","))) {
            c.note("discarded '" + name + "': mangled street '" + abbreviate(addr.street()) + "'");
            return null;
        }
        for (String w : addr.warnings()) c.note("'" + name + "': " + w);

        // ---- (c) 전화/웹사이트 ----
        String phone = formatPhone(raw.phone());
        String website = cleanWebsite(raw.website(), raw.sourceUrl());
        String domain = (website == null) ? null : UrlUtils.stripWww(UrlUtils.hostOf(website));
        if (domain != null && domain.isEmpty()) domain = null;

        // ---- (d) country ----
        String country = RegionTable.countryOf(addr.region());

        // ---- (e) 브랜드 ----
        Set<String> tags = brands.brandsIn(name);

        // ---- (f) 분류 ----
        Category category = categorize(name, tags, raw.sourceUrl());

        return CanonicalRecord.builder()
                .name(name)
                .street(addr.street())
                .city(addr.city())
                .region(addr.region())
                .postalCode(addr.postalCode())
                .country(country)
                .phone(phone)
                .website(website)
                .websiteDomain(domain)
                .brandTags(tags)
                .category(category)
                .dealerGroup(c.getDealerGroup())
                .sourceStrategy(raw.strategyName())
                .sourceTier(raw.tier())
                .sourceUrl(raw.sourceUrl())
                .build();
    }

    // ---------- 이름 ----------

    /** 공백 정리 → (단일 대소문자면) Title Case → 법인 접미사 표기 통일 */
    static String cleanName(String raw) {
        if (raw == null) return "";
        String n = raw.replace('\u00A0', ' ').replaceAll("\\s+", " ").trim();
        while (!n.isEmpty() && ",;:|-\u2013".indexOf(n.charAt(n.length() - 1)) >= 0) {
            n = n.substring(0, n.length() - 1).trim();
        }
        if (Casing.isSingleCase(n)) n = Casing.titleCase(n);
        return CorporateSuffix.standardize(n);
    }

    private static String rejectName(String name) {
        if (name == null || name.isBlank()) return "empty name";
        String lower = name.toLowerCase(Locale.ROOT);
        if (INVALID_NAMES.contains(lower)) return "navigation label";
        if (name.length() > MAX_NAME) return "name too long (" + name.length() + ")";
        if (CORPORATE_ENTRY.matcher(name).find()) return "corporate entry";
        if (DESCRIPTIVE.matcher(name).find()) return "descriptive text";
        if (name.chars().noneMatch(Character::isLetter)) return "no letters in name";
        return null;
    }

    // ---------- 전화 ----------

    /** 10자리 북미 번호 → "(XXX) XXX-XXXX". 번호가 없으면 null */
    static String formatPhone(String raw) {
        if (raw == null) return null;
        Matcher m = PHONE.matcher(raw);
        if (!m.find()) return null;
        return "(" + m.group(1) + ") " + m.group(2) + "-" + m.group(3);
    }

    // ---------- 웹사이트 ----------

    static String cleanWebsite(String raw, String sourceUrl) {
        if (raw == null) return null;
        String w = raw.trim().replace('\\', '/');
        String lower = w.toLowerCase(Locale.ROOT);
        if (w.isEmpty() || w.startsWith("#") || lower.startsWith("javascript:")
                || lower.startsWith("mailto:") || lower.startsWith("tel:")) {
            return null;
        }
        String abs;
        if (w.startsWith("/") || w.startsWith("./") || w.startsWith("../")) {
            abs = UrlUtils.resolve(sourceUrl, w);
        } else {
            abs = UrlUtils.ensureScheme(w);
        }
        if (abs == null || !UrlUtils.isHttpUrl(abs)) return null;
        return UrlUtils.stripTrackingParams(abs);
    }

    // ---------- 분류 ----------

    private Category categorize(String name, Set<String> tags, String sourceUrl) {
        String lower = name.toLowerCase(Locale.ROOT);
        if (containsAny(lower, COLLISION_CUES)) return Category.COLLISION;
        if (containsAny(lower, FIXED_OPS_CUES)) return Category.FIXED_OPS;
        if (containsAny(lower, USED_CUES)) return Category.USED;
        if (!tags.isEmpty()) return Category.FRANCHISED;
        if (isSingleBrandSite(sourceUrl)) return Category.FRANCHISED;
        return Category.UNKNOWN;
    }

    private boolean isSingleBrandSite(String sourceUrl) {
        if (singleBrandDomains.isEmpty()) return false;
        String host = UrlUtils.hostOf(sourceUrl);
        for (String d : singleBrandDomains) {
            if (UrlUtils.hostMatches(host, d)) return true;
        }
        return false;
    }

    private static boolean containsAny(String haystack, List<String> needles) {
        for (String n : needles) {
            if (haystack.contains(n)) return true;
        }
        return false;
    }

    private static String abbreviate(String s) {
        return s.length() <= 50 ? s : s.substring(0, 50) + "...";
    }
}
