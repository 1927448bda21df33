package com.dealerscout.core.rules;

import org.jsoup.Jsoup;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;

class LayoutSignatureTest {

    private static String card(String name, String street, String cityLine) {
        return "<div class=\"location-card\"><h3>" + name + "</h3><p>" + street + "</p><p>" + cityLine
                + "</p><p>(541) 555-0100</p></div>";
    }

    @Test
    void repeated_location_cards_produce_sorted_signature() {
        String html = "<main>"
                + card("Springfield Toyota", "123 Main St", "Springfield, OR 97477")
                + card("Eugene Honda", "9 Oak Ave", "Eugene, OR 97401")
                + card("Bend Kia", "2 Kia Road", "Bend, OR 97701")
                + "</main>";

        assertEquals("layout:addresses:multiple|containers:3|phones:multiple|states:multiple",
                LayoutSignature.of(Jsoup.parse(html)));
    }

    @Test
    void single_signal_is_not_enough() {
        String html = "<div class=\"store\">a</div><div class=\"store\">b</div><div class=\"store\">c</div>";
        assertEquals("", LayoutSignature.of(Jsoup.parse(html)));
        assertEquals("", LayoutSignature.of(Jsoup.parse("<p>hello</p>")));
    }
}
