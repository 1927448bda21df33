package com.dealerscout.core.strategy.generic;

import com.dealerscout.core.model.RawRecord;
import com.dealerscout.core.model.Tier;
import com.dealerscout.core.rules.DomainRule;
import com.dealerscout.core.rules.LayoutSignature;
import com.dealerscout.core.rules.RuleStore;
import com.dealerscout.core.strategy.AbstractStrategy;
import com.dealerscout.core.util.UrlUtils;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.jsoup.select.Selector;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URI;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * 규칙 저장소의 셀렉터로 카드를 읽는다.
 *  1) 호스트 규칙: path_pattern(정규식)이 URL 경로에 걸리면 적용
 *  2) 호스트 규칙이 없으면 "*pattern*" 규칙 중 레이아웃 시그니처가 같은 것
 */
public final class LearnedRuleStrategy extends AbstractStrategy {

    private static final Logger LOG = LoggerFactory.getLogger(LearnedRuleStrategy.class);

    public static final String NAME = "Learned Rule";

    private static final Pattern CITY_STATE_ZIP =
            Pattern.compile("([^,]+),\\s*([A-Za-z]{2})\\s*(\\d{5}(?:-\\d{4})?|[A-Za-z]\\d[A-Za-z]\\s?\\d[A-Za-z]\\d)");

    private final RuleStore store;

    public LearnedRuleStrategy(RuleStore store) {
        super(NAME, Tier.GENERIC);
        this.store = Objects.requireNonNull(store, "store");
    }

    @Override
    public boolean canHandle(String html, String url) {
        String host = UrlUtils.hostOf(url);
        String path = pathOf(url);
        for (DomainRule r : store.rulesFor(host)) {
            if (pathMatches(r, path)) return true;
        }
        List<DomainRule> patternRules = store.patternRules();
        if (patternRules.isEmpty()) return false;
        String signature = LayoutSignature.of(parse(html, url));
        if (signature.isEmpty()) return false;
        for (DomainRule r : patternRules) {
            if (r.pathPattern().equals(signature)) return true;
        }
        return false;
    }

    @Override
    public List<RawRecord> extract(String html, String url) {
        Document doc = parse(html, url);
        String path = pathOf(url);

        List<DomainRule> rules = new ArrayList<>();
        for (DomainRule r : store.rulesFor(UrlUtils.hostOf(url))) {
            if (pathMatches(r, path)) rules.add(r);
        }
        if (rules.isEmpty()) {
            String signature = LayoutSignature.of(doc);
            if (!signature.isEmpty()) {
                for (DomainRule r : store.patternRules()) {
                    if (r.pathPattern().equals(signature)) rules.add(r);
                }
            }
        }

        List<RawRecord> out = new ArrayList<>();
        for (DomainRule r : rules) {
            try {
                applyRule(r, doc, url, out);
            } catch (Selector.SelectorParseException | IllegalArgumentException e) {
                LOG.warn("Skipping learned rule v{} for {}: bad selector ({})", r.version(), r.host(), e.getMessage());
            }
        }
        return out;
    }

    private void applyRule(DomainRule r, Document doc, String url, List<RawRecord> out) {
        for (Element card : doc.select(r.cardSelector())) {
            String name = fieldText(card, r.field("name"));
            String street = fieldText(card, r.field("street"));
            String csz = fieldText(card, r.field("city_state_zip"));

            String city = "", region = "", postal = "";
            if (!csz.isEmpty()) {
                Matcher m = CITY_STATE_ZIP.matcher(csz);
                if (m.find()) {
                    city = m.group(1).trim();
                    region = m.group(2).toUpperCase(Locale.ROOT);
                    postal = m.group(3);
                }
            }
            if (name.isEmpty() || (street.isEmpty() && city.isEmpty())) continue;

            String phone = "";
            String phoneSel = r.field("phone");
            if (phoneSel != null) {
                Element ph = card.selectFirst(phoneSel);
                if (ph != null) phone = firstPhone(ph.text());
            }

            String website = url;
            String siteSel = r.field("website");
            Element a = card.selectFirst(siteSel != null ? siteSel : "a[href]");
            if (a != null) {
                String href = absHref(a);
                if (href.startsWith("http")) website = href;
            }

            out.add(record(name, joinAddress(street, city, region, postal), phone, website, url));
        }
    }

    private static String fieldText(Element card, String selector) {
        return (selector == null) ? "" : text(card, selector);
    }

    private static boolean pathMatches(DomainRule r, String path) {
        try {
            return Pattern.compile(r.pathPattern()).matcher(path).find();
        } catch (PatternSyntaxException e) {
            LOG.warn("Ignoring learned rule v{} for {}: invalid path pattern '{}'", r.version(), r.host(), r.pathPattern());
            return false;
        }
    }

    private static String pathOf(String url) {
        try {
            String p = URI.create(url).getPath();
            return (p == null || p.isEmpty()) ? "/" : p;
        } catch (IllegalArgumentException e) {
            return "/";
        }
    }
}
