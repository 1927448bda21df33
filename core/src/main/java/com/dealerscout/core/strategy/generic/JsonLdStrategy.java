package com.dealerscout.core.strategy.generic;

import com.dealerscout.core.model.RawRecord;
import com.dealerscout.core.model.Tier;
import com.dealerscout.core.strategy.AbstractStrategy;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.json.JsonReadFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.json.JsonMapper;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * schema.org JSON-LD에서 AutoDealer / AutomotiveBusiness / LocalBusiness 노드를 모은다.
 * 중첩 노드(@graph, department, subOrganization 등)까지 재귀 탐색한다.
 * 본사/부서 항목은 건너뛴다.
 */
public final class JsonLdStrategy extends AbstractStrategy {

    private static final Logger LOG = LoggerFactory.getLogger(JsonLdStrategy.class);

    public static final String NAME = "JSON-LD";

    static final Set<String> DEALER_TYPES = Set.of("AutoDealer", "AutomotiveBusiness", "LocalBusiness");

    private static final Pattern CORPORATE_NAME = Pattern.compile(
            "\\b(auto(motive)? group|corporate|corporation|headquarters|hq|department)\\b",
            Pattern.CASE_INSENSITIVE);

    private static final JsonMapper JSON = JsonMapper.builder()
            .enable(JsonReadFeature.ALLOW_TRAILING_COMMA)
            .enable(JsonReadFeature.ALLOW_JAVA_COMMENTS)
            .enable(JsonReadFeature.ALLOW_UNESCAPED_CONTROL_CHARS)
            .build();

    public JsonLdStrategy() {
        super(NAME, Tier.GENERIC);
    }

    /** 이름 있는 비-본사 딜러 노드가 하나라도 있어야 맡는다 */
    @Override
    public boolean canHandle(String html, String url) {
        if (html == null || !html.contains("application/ld+json")) return false;
        for (JsonNode node : dealerNodes(parse(html, url))) {
            String name = str(node.get("name"));
            if (!name.isEmpty() && !isCorporate(node, name)) return true;
        }
        return false;
    }

    @Override
    public List<RawRecord> extract(String html, String url) {
        List<RawRecord> out = new ArrayList<>();
        for (JsonNode node : dealerNodes(parse(html, url))) {
            RawRecord r = toRecord(node, url);
            if (r != null) out.add(r);
        }
        return out;
    }

    private List<JsonNode> dealerNodes(Document doc) {
        List<JsonNode> nodes = new ArrayList<>();
        for (Element script : doc.select("script[type=application/ld+json]")) {
            String body = script.data();
            if (body == null || body.isBlank()) continue;
            try {
                collect(JSON.readTree(body), nodes);
            } catch (JsonProcessingException e) {
                LOG.debug("Unparseable JSON-LD block skipped: {}", e.getOriginalMessage());
            }
        }
        return nodes;
    }

    private static void collect(JsonNode node, List<JsonNode> out) {
        if (node == null) return;
        if (node.isArray()) {
            for (JsonNode it : node) collect(it, out);
            return;
        }
        if (!node.isObject()) return;
        if (isDealerType(node.get("@type"))) out.add(node);
        Iterator<JsonNode> values = node.elements();
        while (values.hasNext()) collect(values.next(), out);
    }

    private static boolean isDealerType(JsonNode type) {
        if (type == null) return false;
        if (type.isTextual()) return DEALER_TYPES.contains(type.asText());
        if (type.isArray()) {
            for (JsonNode t : type) {
                if (t.isTextual() && DEALER_TYPES.contains(t.asText())) return true;
            }
        }
        return false;
    }

    private RawRecord toRecord(JsonNode node, String pageUrl) {
        String name = str(node.get("name"));
        if (name.isEmpty()) return null;
        if (isCorporate(node, name)) {
            LOG.debug("Skipping corporate JSON-LD entry: {}", name);
            return null;
        }

        JsonNode addr = first(node.get("address"));
        String address;
        if (addr != null && addr.isObject()) {
            address = joinAddress(
                    str(addr.get("streetAddress")),
                    str(addr.get("addressLocality")),
                    str(addr.get("addressRegion")),
                    str(addr.get("postalCode")));
        } else {
            address = str(addr);
        }

        String phone = str(first(node.get("telephone")));
        String website = str(first(node.get("url")));
        if (website.isEmpty()) website = pageUrl;

        return record(name, address, phone, website, pageUrl);
    }

    /** 부서 목록을 가진 상위 조직이거나 이름이 본사/그룹 표기면 본사 항목 */
    private static boolean isCorporate(JsonNode node, String name) {
        if (node.has("department")) return true;
        return CORPORATE_NAME.matcher(name.toLowerCase(Locale.ROOT)).find();
    }

    private static JsonNode first(JsonNode n) {
        if (n != null && n.isArray()) return n.size() > 0 ? n.get(0) : null;
        return n;
    }

    private static String str(JsonNode n) {
        if (n == null || n.isNull() || n.isContainerNode()) return "";
        return n.asText("").trim();
    }
}
