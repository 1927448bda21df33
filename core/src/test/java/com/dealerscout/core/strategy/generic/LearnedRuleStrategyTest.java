package com.dealerscout.core.strategy.generic;

import com.dealerscout.core.model.RawRecord;
import com.dealerscout.core.rules.DomainRule;
import com.dealerscout.core.rules.LayoutSignature;
import com.dealerscout.core.rules.RuleStore;
import org.jsoup.Jsoup;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class LearnedRuleStrategyTest {

    private static final String HOST = "www.example-group.com";
    private static final String URL = "https://" + HOST + "/locations/";

    private static final Map<String, String> FIELDS = Map.of(
            "name", "h4",
            "street", ".addr1",
            "city_state_zip", ".addr2",
            "phone", ".phone",
            "website", "a.site");

    private static final String HTML = """
            <html><body>
            <div class="location-card"><h4>Springfield Toyota</h4><p class="addr1">123 Main St</p>
              <p class="addr2">Springfield, or 97477</p><p class="phone">Sales (541) 555-0100</p>
              <a class="site" href="https://springfieldtoyota.com/">Visit</a></div>
            <div class="location-card"><h4>Eugene Honda</h4><p class="addr1">9 Oak Ave</p>
              <p class="addr2">Eugene, OR 97401</p><p class="phone">541-555-0200</p>
              <a class="site" href="javascript:void(0)">Visit</a></div>
            <div class="location-card"><h4>Salem Kia</h4><p class="addr1">2 Kia Ave</p>
              <p class="addr2">Salem, OR 97301</p><p class="phone">503-555-0300</p></div>
            <div class="location-card"><h4>No Address Motors</h4></div>
            </body></html>
            """;

    private static DomainRule rule(String host, String pathPattern, String cardSelector) {
        return new DomainRule(host, pathPattern, 1, cardSelector, FIELDS, "", 3);
    }

    private static RuleStore storeOf(String host, List<DomainRule> rules) {
        return h -> h.equals(host) ? rules : List.of();
    }

    @Test
    void host_rule_applies_when_path_matches() {
        var s = new LearnedRuleStrategy(storeOf(HOST, List.of(rule(HOST, "^/locations", "div.location-card"))));

        assertThat(s.canHandle(HTML, URL)).isTrue();
        assertThat(s.canHandle(HTML, "https://" + HOST + "/about")).isFalse();

        List<RawRecord> out = s.extract(HTML, URL);
        assertThat(out).extracting(RawRecord::name).containsExactly("Springfield Toyota", "Eugene Honda", "Salem Kia");
        assertThat(out.get(0).rawAddress()).isEqualTo("123 Main St, Springfield, OR 97477");
        assertThat(out.get(0).phone()).isEqualTo("(541) 555-0100");
        assertThat(out.get(0).website()).isEqualTo("https://springfieldtoyota.com/");
        assertThat(out.get(1).website()).isEqualTo(URL);
        assertThat(out.get(2).website()).isEqualTo(URL);
    }

    @Test
    void pattern_rule_matches_by_layout_signature() {
        String signature = LayoutSignature.of(Jsoup.parse(HTML));
        assertThat(signature).startsWith("layout:").contains("containers:4");

        var s = new LearnedRuleStrategy(storeOf(DomainRule.PATTERN_HOST,
                List.of(rule(DomainRule.PATTERN_HOST, signature, "div.location-card"))));

        String otherUrl = "https://www.unknown-dealers.com/stores";
        assertThat(s.canHandle(HTML, otherUrl)).isTrue();
        assertThat(s.extract(HTML, otherUrl)).hasSize(3);
        assertThat(s.canHandle("<html><body><p>hi</p></body></html>", otherUrl)).isFalse();
    }

    @Test
    void bad_selector_rule_is_skipped() {
        var s = new LearnedRuleStrategy(storeOf(HOST, List.of(
                rule(HOST, "^/locations", "div:nope"),
                rule(HOST, "^/locations", "div.location-card"))));

        assertThat(s.extract(HTML, URL)).hasSize(3);
    }

    @Test
    void invalid_path_pattern_is_no_match() {
        var s = new LearnedRuleStrategy(storeOf(HOST, List.of(rule(HOST, "([", "div.location-card"))));
        assertThat(s.canHandle(HTML, URL)).isFalse();
    }

    @Test
    void empty_store_never_handles() {
        assertThat(new LearnedRuleStrategy(RuleStore.EMPTY).canHandle(HTML, URL)).isFalse();
    }
}
