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
 * Lithia 계열 위치 목록: li.info-window 안의 hCard 마이크로포맷.
 * 같은 마크업을 쓰는 다른 그룹과 구분하려고 "lithia" 지문을 함께 본다.
 */
public final class LithiaStrategy extends AbstractStrategy {

    public static final String NAME = "Lithia Motors";

    public LithiaStrategy() {
        super(NAME, Tier.SPECIFIC);
    }

    @Override
    public boolean canHandle(String html, String url) {
        if (html == null || !html.contains("info-window")) return false;
        boolean fingerprint = (url != null && url.toLowerCase(Locale.ROOT).contains("lithia"))
                || html.toLowerCase(Locale.ROOT).contains("lithia");
        if (!fingerprint) return false;
        return !parse(html, url).select("li.info-window").isEmpty();
    }

    @Override
    public List<RawRecord> extract(String html, String url) {
        Document doc = parse(html, url);
        List<RawRecord> out = new ArrayList<>();
        for (Element li : doc.select("li.info-window")) {
            String name = text(li, ".org");
            if (name.isEmpty()) continue;

            String address = joinAddress(
                    text(li, ".street-address"),
                    text(li, ".locality"),
                    text(li, ".region"),
                    text(li, ".postal-code"));

            String website = absHref(li.selectFirst("a.url"));
            if (website.isEmpty()) website = url;

            out.add(record(name, address, salesPhone(li), website, url));
        }
        return out;
    }

    private static String salesPhone(Element li) {
        Element tel = li.selectFirst(".tel[data-click-to-call='Sales']");
        if (tel == null) tel = li.selectFirst(".tel");
        if (tel == null) return "";
        String attr = tel.attr("data-click-to-call-phone").trim();
        if (!attr.isEmpty()) return attr;
        String value = text(tel, ".value");
        return value.isEmpty() ? firstPhone(tel.text()) : value;
    }
}
