package com.dealerscout.core.strategy.generic;

import com.dealerscout.core.model.RawRecord;
import com.dealerscout.core.model.Tier;
import com.dealerscout.core.strategy.AbstractStrategy;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.json.JsonReadFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.json.JsonMapper;
import org.jsoup.nodes.Element;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * 인라인 스크립트에 박힌 위치 배열을 읽는다.
 * <pre>
 *   var locations = [ {...}, ... ];
 *   window.dealerData = [ ... ];
 *   locationData: [ ... ]
 * </pre>
 * 배열 범위는 괄호 짝을 세어 자르고(문자열 리터럴 안의 괄호는 무시), JS 객체 리터럴에 관대한 Jackson으로 파싱한다.
 */
public final class ScriptVariableStrategy extends AbstractStrategy {

    private static final Logger LOG = LoggerFactory.getLogger(ScriptVariableStrategy.class);

    public static final String NAME = "Script Variables";

    /** 매치 끝이 여는 대괄호 '[' */
    static final Pattern ARRAY_START = Pattern.compile(
            "(?:(?:var|let|const)\\s+(?:locations|dealers|stores)\\s*=\\s*|window\\.dealerData\\s*=\\s*|locationData\\s*:\\s*)\\[",
            Pattern.CASE_INSENSITIVE);

    private static final JsonMapper JSON = JsonMapper.builder()
            .enable(JsonReadFeature.ALLOW_UNQUOTED_FIELD_NAMES)
            .enable(JsonReadFeature.ALLOW_SINGLE_QUOTES)
            .enable(JsonReadFeature.ALLOW_TRAILING_COMMA)
            .enable(JsonReadFeature.ALLOW_JAVA_COMMENTS)
            .enable(JsonReadFeature.ALLOW_UNESCAPED_CONTROL_CHARS)
            .build();

    public ScriptVariableStrategy() {
        super(NAME, Tier.GENERIC);
    }

    @Override
    public boolean canHandle(String html, String url) {
        return html != null && ARRAY_START.matcher(html).find();
    }

    @Override
    public List<RawRecord> extract(String html, String url) {
        List<RawRecord> out = new ArrayList<>();
        for (Element script : parse(html, url).select("script")) {
            String js = script.data();
            if (js == null || js.isEmpty()) continue;

            Matcher m = ARRAY_START.matcher(js);
            while (m.find()) {
                int open = m.end() - 1;
                int close = matchingBracket(js, open);
                if (close < 0) continue;
                try {
                    JsonNode arr = JSON.readTree(js.substring(open, close + 1));
                    for (JsonNode item : arr) {
                        RawRecord r = toRecord(item, url);
                        if (r != null) out.add(r);
                    }
                } catch (JsonProcessingException e) {
                    LOG.debug("Script array at offset {} is not JSON-like: {}", open, e.getOriginalMessage());
                }
            }
        }
        return out;
    }

    /** s.charAt(open)=='[' 에 짝이 맞는 ']' 위치. 없으면 -1 */
    static int matchingBracket(String s, int open) {
        int depth = 0;
        char quote = 0;
        for (int i = open; i < s.length(); i++) {
            char c = s.charAt(i);
            if (quote != 0) {
                if (c == '\\') { i++; continue; }
                if (c == quote) quote = 0;
                continue;
            }
            if (c == '"' || c == '\'' || c == '`') {
                quote = c;
            } else if (c == '[' || c == '{') {
                depth++;
            } else if (c == ']' || c == '}') {
                depth--;
                if (depth == 0) return (c == ']') ? i : -1;
            }
        }
        return -1;
    }

    private RawRecord toRecord(JsonNode obj, String pageUrl) {
        if (obj == null || !obj.isObject()) return null;
        String name = pick(obj, "name", "title", "storeName", "locationName", "dealerName");
        if (name.isEmpty()) return null;

        String address;
        JsonNode addrNode = obj.get("address");
        if (addrNode != null && addrNode.isObject()) {
            address = joinAddress(
                    pick(addrNode, "street", "streetAddress", "address1", "line1"),
                    pick(addrNode, "city", "locality", "addressLocality"),
                    pick(addrNode, "state", "province", "region", "addressRegion"),
                    pick(addrNode, "zip", "zipCode", "postalCode", "postal"));
        } else {
            address = joinAddress(
                    pick(obj, "address", "street", "streetAddress", "address1"),
                    pick(obj, "city", "locality"),
                    pick(obj, "state", "province", "region"),
                    pick(obj, "zip", "zipCode", "postalCode", "postal"));
        }

        String phone = pick(obj, "phone", "telephone", "phoneNumber", "salesPhone");
        String website = pick(obj, "url", "website", "link");
        return record(name, address, phone, website.isEmpty() ? pageUrl : website, pageUrl);
    }

    /** 먼저 나오는 비어있지 않은 스칼라 값 */
    private static String pick(JsonNode obj, String... keys) {
        for (String k : keys) {
            JsonNode v = obj.get(k);
            if (v == null || v.isNull() || v.isContainerNode()) continue;
            String t = v.asText("").trim();
            if (!t.isEmpty()) return t;
        }
        return "";
    }
}
