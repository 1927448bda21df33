package com.dealerscout.core.strategy.fallback;

import com.dealerscout.core.model.RawRecord;
import com.dealerscout.core.model.Tier;
import com.dealerscout.core.strategy.AbstractStrategy;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.jsoup.nodes.Node;
import org.jsoup.nodes.TextNode;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * 제목(h2~h5) 바로 뒤에 주소/전화 줄이 오는 단순 목록 페이지.
 * "Our Locations" 섹션이 있으면 그 안만 본다.
 */
public final class HeadingAddressStrategy extends AbstractStrategy {

    public static final String NAME = "Heading Address Blocks";

    private static final String HEADINGS = "h2, h3, h4, h5";
    private static final int MAX_HOPS = 8;

    /** "City, ST 12345" 또는 "City, PR A1A 1A1" */
    static final Pattern CITY_REGION_POSTAL = Pattern.compile(
            "([^,\\n]+),\\s*([A-Z]{2})\\s+(\\d{5}(?:-\\d{4})?|[A-Z]\\d[A-Z]\\s?\\d[A-Z]\\d)");

    private static final List<String> NAVIGATION_TERMS = List.of(
            "explore our locations", "our locations", "find us", "visit us", "locations",
            "dealerships", "store locations", "branches", "offices", "contact us",
            "where to find us", "find a location", "location finder", "store finder");

    public HeadingAddressStrategy() {
        super(NAME, Tier.FALLBACK);
    }

    /** 주소가 따라오는 제목이 하나라도 있으면 맡는다 */
    @Override
    public boolean canHandle(String html, String url) {
        if (html == null) return false;
        Element root = searchRoot(parse(html, url));
        for (Element h : root.select(HEADINGS)) {
            if (blockFor(h) != null) return true;
        }
        return false;
    }

    @Override
    public List<RawRecord> extract(String html, String url) {
        Element root = searchRoot(parse(html, url));
        List<RawRecord> out = new ArrayList<>();
        for (Element h : root.select(HEADINGS)) {
            Block b = blockFor(h);
            if (b == null) continue;
            out.add(record(b.name(), b.address(), b.phone(), url, url));
        }
        return out;
    }

    private record Block(String name, String address, String phone) {}

    private static Block blockFor(Element heading) {
        String name = heading.text().trim();
        if (name.length() < 3 || isNavigation(name)) return null;

        List<String> lines = followingLines(heading);
        for (int i = 0; i < lines.size(); i++) {
            Matcher m = CITY_REGION_POSTAL.matcher(lines.get(i));
            if (!m.find()) continue;
            String street = (i > 0) ? lines.get(i - 1) : "";
            String address = joinAddress(street, m.group(1).trim(), m.group(2), m.group(3));
            String phone = "";
            for (String ln : lines) {
                phone = firstPhone(ln);
                if (!phone.isEmpty()) break;
            }
            return new Block(name, address, phone);
        }
        return null;
    }

    private static boolean isNavigation(String name) {
        String lower = name.toLowerCase(Locale.ROOT);
        for (String term : NAVIGATION_TERMS) {
            if (lower.contains(term)) return true;
        }
        return false;
    }

    /** 다음 제목 전까지 형제 노드들의 텍스트 줄 */
    private static List<String> followingLines(Element heading) {
        List<String> lines = new ArrayList<>();
        Node next = heading.nextSibling();
        int hops = 0;
        while (next != null && hops < MAX_HOPS) {
            if (next instanceof Element el) {
                if (el.tagName().matches("h[1-6]")) break;
                addLines(lines, multilineText(el));
            } else if (next instanceof TextNode tn) {
                addLines(lines, tn.text());
            }
            next = next.nextSibling();
            hops++;
        }
        return lines;
    }

    private static void addLines(List<String> lines, String text) {
        for (String ln : text.split("\n")) {
            String t = ln.trim();
            if (!t.isEmpty()) lines.add(t);
        }
    }

    private static Element searchRoot(Document doc) {
        for (Element tag : doc.select("h1, h2, h3")) {
            if (tag.text().trim().equalsIgnoreCase("our locations")) {
                return (tag.parent() != null) ? tag.parent() : tag;
            }
        }
        return doc;
    }
}
