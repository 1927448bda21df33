package com.dealerscout.core.strategy.specific;

import com.dealerscout.core.model.RawRecord;
import com.dealerscout.core.model.Tier;
import com.dealerscout.core.strategy.AbstractStrategy;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;

import java.util.ArrayList;
import java.util.List;

/**
 * AutoCanada 딜러 카드(div.well.matchable-heights).
 * 주소는 span.di-dealer-address 안에서 &lt;br&gt;로 줄이 나뉜다(캐나다 주소).
 */
public final class AutoCanadaStrategy extends AbstractStrategy {

    public static final String NAME = "AutoCanada";

    public AutoCanadaStrategy() {
        super(NAME, Tier.SPECIFIC);
    }

    @Override
    public boolean canHandle(String html, String url) {
        if (html == null || !html.contains("matchable-heights")) return false;
        Element first = parse(html, url).selectFirst("div.well.matchable-heights");
        return first != null
                && first.selectFirst("span.di-dealer-address") != null
                && first.selectFirst("span.dealer-phone") != null;
    }

    @Override
    public List<RawRecord> extract(String html, String url) {
        Document doc = parse(html, url);
        List<RawRecord> out = new ArrayList<>();
        for (Element card : doc.select("div.well.matchable-heights")) {
            String name = text(card, "h2");
            if (name.isEmpty()) continue;

            String address = multilineText(card.selectFirst("span.di-dealer-address"));

            String phone = text(card, "span.dealer-phone.sales span");
            if (phone.isEmpty()) phone = firstPhone(text(card, "span.dealer-phone"));

            // 카드 전체가 <a>로 감싸져 있다
            Element anchor = enclosingLink(card);
            if (anchor == null) anchor = card.selectFirst("a[href]");
            String website = absHref(anchor);

            out.add(record(name, address, phone, website.isEmpty() ? url : website, url));
        }
        return out;
    }

    private static Element enclosingLink(Element card) {
        for (Element p : card.parents()) {
            if (p.is("a[href]")) return p;
        }
        return null;
    }
}
