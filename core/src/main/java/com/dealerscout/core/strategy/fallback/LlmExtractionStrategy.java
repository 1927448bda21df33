package com.dealerscout.core.strategy.fallback;

import com.dealerscout.core.llm.LlmClient;
import com.dealerscout.core.llm.LlmException;
import com.dealerscout.core.model.RawRecord;
import com.dealerscout.core.model.Tier;
import com.dealerscout.core.strategy.AbstractStrategy;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.jsoup.nodes.Document;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.regex.Pattern;

/**
 * 최후 수단: 압축한 HTML을 LLM에 넘겨 위치 JSON 배열을 받는다.
 * 응답 검증은 보수적으로 한다(이름 필수, 주소 또는 도시+지역 필수).
 * LlmException은 그대로 올려 레지스트리가 MATCHED_EMPTY로 처리하게 한다.
 */
public final class LlmExtractionStrategy extends AbstractStrategy {

    public static final String NAME = "LLM Extraction";

    static final String PROMPT =
            "You are an information extractor. Given an HTML snippet of a dealer group page, "
            + "return a JSON array of objects with keys: Name, Street, City, State, Zip, Phone, Website. "
            + "Only include real physical locations present in the snippet. "
            + "Use two-letter US state or Canadian province codes. Return JSON only, no extra text.";

    private static final Pattern REGION_CODE = Pattern.compile("^[A-Z]{2}$");
    private static final Pattern POSTAL = Pattern.compile("^(\\d{5}(-\\d{4})?|[A-Za-z]\\d[A-Za-z]\\s?\\d[A-Za-z]\\d)$");
    private static final Pattern PHONE_DIGITS = Pattern.compile("\\d{3}[-.\\s)]*\\d{3}[-.\\s]?\\d{4}");

    private final ObjectMapper om = new ObjectMapper();
    private final LlmClient client;
    private final int maxHtmlChars;

    public LlmExtractionStrategy(LlmClient client, int maxHtmlChars) {
        super(NAME, Tier.FALLBACK);
        this.client = Objects.requireNonNull(client, "client");
        this.maxHtmlChars = Math.max(1000, maxHtmlChars);
    }

    /** 본문이 있으면 항상 맡는다(FALLBACK 마지막 순번) */
    @Override
    public boolean canHandle(String html, String url) {
        return html != null && !html.isBlank();
    }

    @Override
    public List<RawRecord> extract(String html, String url) throws LlmException {
        String content = client.complete(PROMPT, compact(html, url));
        List<RawRecord> out = new ArrayList<>();
        for (JsonNode it : items(content)) {
            RawRecord r = toRecord(it, url);
            if (r != null) out.add(r);
        }
        return out;
    }

    /** script/style/noscript/svg 제거 후 길이 제한 */
    String compact(String html, String url) {
        Document doc = parse(html, url);
        doc.select("script, style, noscript, svg, iframe").remove();
        String s = doc.body() != null ? doc.body().html() : doc.html();
        return s.length() <= maxHtmlChars ? s : s.substring(0, maxHtmlChars);
    }

    /** 배열, {"items"|"locations"|"dealers": [...]}, 또는 본문 속 첫 JSON 배열 */
    List<JsonNode> items(String content) throws LlmException {
        if (content == null || content.isBlank()) return List.of();
        JsonNode root = readJson(content.trim());
        if (root == null) {
            int start = content.indexOf('[');
            int end = content.lastIndexOf(']');
            if (start >= 0 && end > start) root = readJson(content.substring(start, end + 1));
        }
        if (root == null) throw new LlmException("LLM reply contains no JSON array");

        JsonNode arr = root;
        if (root.isObject()) {
            for (String key : List.of("items", "locations", "dealers")) {
                if (root.path(key).isArray()) { arr = root.get(key); break; }
            }
        }
        if (!arr.isArray()) return List.of();
        List<JsonNode> list = new ArrayList<>();
        arr.forEach(list::add);
        return list;
    }

    private JsonNode readJson(String s) {
        try {
            return om.readTree(s);
        } catch (JsonProcessingException e) {
            return null;   // 호출부에서 배열 부분만 다시 시도
        }
    }

    private RawRecord toRecord(JsonNode it, String pageUrl) {
        if (it == null || !it.isObject()) return null;
        String name = field(it, "Name");
        String street = field(it, "Street");
        String city = field(it, "City");
        String state = field(it, "State").toUpperCase(Locale.ROOT);
        String zip = field(it, "Zip");
        String phone = field(it, "Phone");
        String website = field(it, "Website");

        if (name.isEmpty() || (street.isEmpty() && (city.isEmpty() || state.isEmpty()))) return null;
        if (!state.isEmpty() && !REGION_CODE.matcher(state).matches()) return null;
        if (!zip.isEmpty() && !POSTAL.matcher(zip).matches()) zip = "";
        if (!phone.isEmpty() && !PHONE_DIGITS.matcher(phone).find()) phone = "";

        return record(name, joinAddress(street, city, state, zip), phone,
                website.isEmpty() ? pageUrl : website, pageUrl);
    }

    /** "Name" 또는 "name" */
    private static String field(JsonNode it, String key) {
        JsonNode v = it.get(key);
        if (v == null) v = it.get(key.toLowerCase(Locale.ROOT));
        if (v == null || v.isNull() || v.isContainerNode()) return "";
        return v.asText("").trim();
    }
}
