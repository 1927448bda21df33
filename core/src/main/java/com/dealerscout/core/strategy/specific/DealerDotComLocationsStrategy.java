package com.dealerscout.core.strategy.specific;

import com.dealerscout.core.model.RawRecord;
import com.dealerscout.core.model.Tier;
import com.dealerscout.core.strategy.AbstractStrategy;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Dealer.com 플랫폼의 근접 딜러 목록(ol#proximity-dealer-list).
 * Sonic Automotive 도메인이거나 vcard가 충분히 많을 때만 맡는다.
 */
public final class DealerDotComLocationsStrategy extends AbstractStrategy {

    public static final String NAME = "Dealer.com Locations";

    /** 도메인 지문이 없을 때 요구하는 최소 vcard 수 */
    static final int MIN_CARDS = 5;

    public DealerDotComLocationsStrategy() {
        super(NAME, Tier.SPECIFIC);
    }

    @Override
    public boolean canHandle(String html, String url) {
        if (html == null || !html.contains("proximity-dealer-list")) return false;
        Document doc = parse(html, url);
        if (doc.selectFirst("div.dealer-list ol#proximity-dealer-list") == null) return false;
        if (url != null && url.toLowerCase(Locale.ROOT).contains("sonicautomotive.com")) return true;
        return doc.select("ol#proximity-dealer-list li .vcard .org").size() >= MIN_CARDS;
    }

    @Override
    public List<RawRecord> extract(String html, String url) {
        Document doc = parse(html, url);
        List<RawRecord> out = new ArrayList<>();
        for (Element card : doc.select("ol#proximity-dealer-list li.info-window .vcard")) {
            String name = text(card, ".org");
            if (name.isEmpty()) continue;

            String address = joinAddress(
                    text(card, ".street-address"),
                    text(card, ".locality"),
                    text(card, ".region"),
                    text(card, ".postal-code"));

            String phone = text(card, "ul.tels li.tel .value");
            if (phone.isEmpty()) {
                Element tel = card.selectFirst("a[href^='tel:']");
                if (tel != null) phone = tel.attr("href").substring("tel:".length()).trim();
            }

            Element link = card.selectFirst(".fn.n a.url");
            if (link == null) link = card.selectFirst("a.url");
            String website = absHref(link);

            out.add(record(name, address, phone, website.isEmpty() ? url : website, url));
        }
        return out;
    }
}
