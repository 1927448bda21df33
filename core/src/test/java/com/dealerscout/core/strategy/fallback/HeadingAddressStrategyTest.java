package com.dealerscout.core.strategy.fallback;

import com.dealerscout.core.model.RawRecord;
import com.dealerscout.core.model.Tier;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class HeadingAddressStrategyTest {

    private static final String URL = "https://www.example-group.com/";

    private static final String HTML = """
            <html><body>
            <section>
              <h2>Our Locations</h2>
              <h3>Springfield Toyota</h3>
              <p>123 Main St<br>Springfield, OR 97477<br>(541) 555-0100</p>
              <h3>Eugene Honda</h3>
              <p>9 Oak Ave</p><p>Eugene, OR 97401</p><p>Sales: 541-555-0200</p>
              <h3>Find Us</h3>
              <p>1 Visit Rd<br>Salem, OR 97301</p>
            </section>
            <footer>
              <h3>Corporate Office</h3>
              <p>1 HQ Way<br>Portland, OR 97201</p>
            </footer>
            </body></html>
            """;

    private final HeadingAddressStrategy strategy = new HeadingAddressStrategy();

    @Test
    void is_fallback_tier() {
        assertThat(strategy.tier()).isEqualTo(Tier.FALLBACK);
    }

    @Test
    void reads_blocks_inside_our_locations_section_only() {
        assertThat(strategy.canHandle(HTML, URL)).isTrue();

        List<RawRecord> out = strategy.extract(HTML, URL);

        assertThat(out).extracting(RawRecord::name).containsExactly("Springfield Toyota", "Eugene Honda");
        assertThat(out.get(0).rawAddress()).isEqualTo("123 Main St, Springfield, OR 97477");
        assertThat(out.get(0).phone()).isEqualTo("(541) 555-0100");
        assertThat(out.get(1).rawAddress()).isEqualTo("9 Oak Ave, Eugene, OR 97401");
        assertThat(out.get(1).phone()).isEqualTo("541-555-0200");
        assertThat(out.get(1).website()).isEqualTo(URL);
    }

    @Test
    void canadian_postal_code_block() {
        String html = "<h4>Airdrie Honda</h4><div>191 East Lake Cres NE<br>Airdrie, AB T4A 2H7</div>";
        assertThat(strategy.extract(html, URL)).singleElement()
                .satisfies(r -> assertThat(r.rawAddress()).isEqualTo("191 East Lake Cres NE, Airdrie, AB T4A 2H7"));
    }

    @Test
    void headings_without_addresses_are_not_handled() {
        String html = "<h2>Welcome</h2><p>Great cars, great people.</p><h3>New Inventory</h3><p>Browse now</p>";
        assertThat(strategy.canHandle(html, URL)).isFalse();
    }
}
