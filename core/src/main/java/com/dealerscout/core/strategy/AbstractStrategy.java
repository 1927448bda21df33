package com.dealerscout.core.strategy;

import com.dealerscout.core.api.StrategyDescriptor;
import com.dealerscout.core.model.RawRecord;
import com.dealerscout.core.model.Tier;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;

import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * 전략 공통 뼈대: 이름/등급 보관, jsoup 파싱, 텍스트 추출, RawRecord 생성.
 * 하위 클래스는 상태를 갖지 않는다.
 */
public abstract class AbstractStrategy implements StrategyDescriptor {

    protected static final Pattern PHONE =
            Pattern.compile("\\(?\\d{3}\\)?[-.\\s]?\\d{3}[-.\\s]?\\d{4}");

    private final String name;
    private final Tier tier;

    protected AbstractStrategy(String name, Tier tier) {
        this.name = Objects.requireNonNull(name, "name");
        this.tier = Objects.requireNonNull(tier, "tier");
    }

    @Override public final String name() { return name; }
    @Override public final Tier tier() { return tier; }

    /** baseUri를 지정해 abs:href가 동작하도록 파싱 */
    protected static Document parse(String html, String url) {
        return Jsoup.parse(html == null ? "" : html, url == null ? "" : url);
    }

    /** 요소 텍스트(공백 정리). null 요소면 빈 문자열 */
    protected static String text(Element el) {
        return (el == null) ? "" : el.text().trim();
    }

    protected static String text(Element root, String cssQuery) {
        return (root == null) ? "" : text(root.selectFirst(cssQuery));
    }

    /** &lt;br&gt;, 블록 요소 경계를 줄바꿈으로 보존한 텍스트 */
    protected static String multilineText(Element el) {
        if (el == null) return "";
        Element copy = el.clone();
        copy.select("br").after("\\n");
        for (Element block : copy.select("p, div, li")) {
            if (block != copy) block.after("\\n");   // 복제본 루트는 부모가 없다
        }
        String raw = copy.text().replace("\\n", "\n");
        StringBuilder sb = new StringBuilder();
        for (String line : raw.split("\n")) {
            String t = line.trim();
            if (t.isEmpty()) continue;
            if (sb.length() > 0) sb.append('\n');
            sb.append(t);
        }
        return sb.toString();
    }

    /** 절대 URL href. 없으면 빈 문자열 */
    protected static String absHref(Element a) {
        return (a == null) ? "" : a.attr("abs:href").trim();
    }

    protected static String firstPhone(String text) {
        if (text == null) return "";
        Matcher m = PHONE.matcher(text);
        return m.find() ? m.group() : "";
    }

    /** 주소 조각들을 "street, city, region postal" 형태로 이어 붙인다(빈 조각 생략) */
    protected static String joinAddress(String street, String city, String region, String postal) {
        StringBuilder sb = new StringBuilder();
        appendPart(sb, street, ", ");
        appendPart(sb, city, ", ");
        appendPart(sb, region, ", ");
        appendPart(sb, postal, " ");
        return sb.toString();
    }

    private static void appendPart(StringBuilder sb, String part, String sep) {
        if (part == null || part.isBlank()) return;
        if (sb.length() > 0) sb.append(sep);
        sb.append(part.trim());
    }

    protected RawRecord record(String dealerName, String rawAddress, String phone, String website, String pageUrl) {
        return RawRecord.of(dealerName, rawAddress, phone, website, pageUrl, name, tier);
    }
}
