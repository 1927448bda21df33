package com.dealerscout.core.rules;

import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.jsoup.nodes.TextNode;
import org.jsoup.select.NodeTraversor;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * 페이지 구조를 요약한 레이아웃 시그니처. "*pattern*" 규칙의 pathPattern과 비교한다.
 * 지표가 2개 미만이면 빈 문자열(매칭 불가).
 */
public final class LayoutSignature {
    private LayoutSignature() {}

    private static final String[] CONTAINER_WORDS = {"location", "dealer", "store", "office", "branch"};
    private static final int MIN_HITS = 3;

    private static final Pattern STREET = Pattern.compile(
            "\\d+\\s+[A-Za-z\\s]+(?:St|Street|Ave|Avenue|Rd|Road|Blvd|Boulevard|Dr|Drive)");
    private static final Pattern PHONE = Pattern.compile("\\(?\\d{3}\\)?[-.\\s]?\\d{3}[-.\\s]?\\d{4}");
    private static final Pattern STATE_ZIP = Pattern.compile("\\b[A-Z]{2}\\s+\\d{5}");

    public static String of(Document doc) {
        List<String> parts = new ArrayList<>();

        int containers = 0;
        for (Element el : doc.select("section[class], div[class], article[class]")) {
            if (hasContainerClass(el)) containers++;
        }
        if (containers >= MIN_HITS) parts.add("containers:" + containers);

        int listItems = doc.select("ul li, ol li").size();
        if (listItems >= MIN_HITS) parts.add("lists:" + listItems);

        int[] counts = new int[3];
        NodeTraversor.traverse((node, depth) -> {
            if (!(node instanceof TextNode tn)) return;
            String t = tn.getWholeText();
            if (t.isBlank()) return;
            if (STREET.matcher(t).find()) counts[0]++;
            if (PHONE.matcher(t).find()) counts[1]++;
            if (STATE_ZIP.matcher(t).find()) counts[2]++;
        }, doc);
        if (counts[0] >= MIN_HITS) parts.add("addresses:multiple");
        if (counts[1] >= MIN_HITS) parts.add("phones:multiple");
        if (counts[2] >= MIN_HITS) parts.add("states:multiple");

        if (parts.size() < 2) return "";
        Collections.sort(parts);
        return "layout:" + String.join("|", parts);
    }

    private static boolean hasContainerClass(Element el) {
        for (String cls : el.classNames()) {
            String c = cls.toLowerCase(Locale.ROOT);
            for (String w : CONTAINER_WORDS) {
                if (c.contains(w)) return true;
            }
        }
        return false;
    }
}
