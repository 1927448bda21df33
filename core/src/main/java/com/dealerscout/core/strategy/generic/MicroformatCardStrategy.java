package com.dealerscout.core.strategy.generic;

import com.dealerscout.core.model.RawRecord;
import com.dealerscout.core.model.Tier;
import com.dealerscout.core.strategy.AbstractStrategy;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * hCard(.street-address/.locality/.region) 또는 schema.org microdata(itemprop) 주소 카드.
 * 주소 요소에서 위로 올라가며 이름을 가진 가장 가까운 조상을 카드로 본다.
 */
public final class MicroformatCardStrategy extends AbstractStrategy {

    public static final String NAME = "Microformat Cards";

    static final String STREET = ".street-address, [itemprop=streetAddress]";
    static final String LOCALITY = ".locality, [itemprop=addressLocality]";
    static final String REGION = ".region, [itemprop=addressRegion]";
    static final String POSTAL = ".postal-code, [itemprop=postalCode]";
    static final String CARD_NAME = ".org, .fn, [itemprop=name], h2, h3, h4";

    public MicroformatCardStrategy() {
        super(NAME, Tier.GENERIC);
    }

    @Override
    public boolean canHandle(String html, String url) {
        if (html == null) return false;
        if (!html.contains("street-address") && !html.contains("streetAddress")) return false;
        return !cards(parse(html, url)).isEmpty();
    }

    @Override
    public List<RawRecord> extract(String html, String url) {
        List<RawRecord> out = new ArrayList<>();
        for (Element card : cards(parse(html, url))) {
            String name = text(card, CARD_NAME);
            if (name.isEmpty()) continue;

            String address = joinAddress(
                    text(card, STREET), text(card, LOCALITY), text(card, REGION), text(card, POSTAL));

            String phone = text(card, ".tel .value");
            if (phone.isEmpty()) phone = firstPhone(text(card, ".tel, [itemprop=telephone]"));
            if (phone.isEmpty()) {
                Element tel = card.selectFirst("a[href^='tel:']");
                if (tel != null) phone = firstPhone(tel.attr("href"));
            }

            Element link = card.selectFirst("a.url, a[itemprop=url]");
            String website = absHref(link);

            out.add(record(name, address, phone, website.isEmpty() ? url : website, url));
        }
        return out;
    }

    /** 주소 요소 하나씩을 감싸는 카드. 등장 순서 유지 */
    private static Set<Element> cards(Document doc) {
        Set<Element> cards = new LinkedHashSet<>();
        for (Element street : doc.select(STREET)) {
            Element card = cardOf(street);
            if (card != null) cards.add(card);
        }
        return cards;
    }

    private static Element cardOf(Element street) {
        for (Element p : street.parents()) {
            if (p.tagName().equals("body") || p.tagName().equals("html")) return null;
            // 주소가 둘 이상 들어 있으면 카드 목록 컨테이너까지 올라온 것
            if (p.select(STREET).size() > 1) return null;
            if (p.selectFirst(CARD_NAME) != null && p.selectFirst(LOCALITY) != null) return p;
        }
        return null;
    }
}
