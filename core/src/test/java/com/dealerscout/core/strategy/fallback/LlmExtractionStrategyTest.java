package com.dealerscout.core.strategy.fallback;

import com.dealerscout.core.llm.LlmException;
import com.dealerscout.core.model.RawRecord;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;

class LlmExtractionStrategyTest {

    private static final String URL = "https://www.example-group.com/";

    @Test
    void sends_compacted_html_and_validates_reply() throws Exception {
        AtomicReference<String> prompt = new AtomicReference<>();
        AtomicReference<String> sent = new AtomicReference<>();
        var s = new LlmExtractionStrategy((system, user) -> {
            prompt.set(system);
            sent.set(user);
            return """
                    Here you go:
                    ```json
                    [
                      {"Name": "Springfield Toyota", "Street": "123 Main St", "City": "Springfield",
                       "State": "or", "Zip": "97477", "Phone": "541-555-0100", "Website": "https://springfieldtoyota.com"},
                      {"Name": "Eugene Honda", "Street": "", "City": "Eugene", "State": "OR", "Zip": "ABCDE", "Phone": "call us"},
                      {"Name": "Somewhere Kia", "Street": "2 Kia Ave", "City": "Salem", "State": "Oregon"},
                      {"Name": "", "Street": "5 Nowhere Rd", "City": "Bend", "State": "OR"}
                    ]
                    ```
                    """;
        }, 5000);

        String html = "<html><head><script>var x = 1;</script><style>p{}</style></head>"
                + "<body><p>Springfield Toyota</p><svg><path/></svg></body></html>";
        List<RawRecord> out = s.extract(html, URL);

        assertThat(prompt.get()).isEqualTo(LlmExtractionStrategy.PROMPT);
        assertThat(sent.get()).contains("Springfield Toyota").doesNotContain("<script").doesNotContain("<svg");

        assertThat(out).extracting(RawRecord::name).containsExactly("Springfield Toyota", "Eugene Honda");
        assertThat(out.get(0).rawAddress()).isEqualTo("123 Main St, Springfield, OR 97477");
        assertThat(out.get(0).website()).isEqualTo("https://springfieldtoyota.com");
        assertThat(out.get(1).rawAddress()).isEqualTo("Eugene, OR");
        assertThat(out.get(1).phone()).isNull();
        assertThat(out.get(1).website()).isEqualTo(URL);
    }

    @Test
    void object_wrapper_is_accepted() throws Exception {
        var s = new LlmExtractionStrategy((system, user) ->
                "{\"locations\": [{\"name\": \"Bay BMW\", \"street\": \"5 Pier Rd\", \"city\": \"Coos Bay\", \"state\": \"OR\"}]}",
                5000);

        assertThat(s.extract("<p>x</p>", URL)).singleElement()
                .satisfies(r -> assertThat(r.rawAddress()).isEqualTo("5 Pier Rd, Coos Bay, OR"));
    }

    @Test
    void reply_without_json_fails() {
        var s = new LlmExtractionStrategy((system, user) -> "Sorry, I could not find any locations.", 5000);
        assertThrows(LlmException.class, () -> s.extract("<p>x</p>", URL));
    }

    @Test
    void client_failure_propagates() {
        var s = new LlmExtractionStrategy((system, user) -> { throw new LlmException("rate limited"); }, 5000);
        assertThrows(LlmException.class, () -> s.extract("<p>x</p>", URL));
    }

    @Test
    void compact_truncates_to_limit() {
        var s = new LlmExtractionStrategy((system, user) -> "[]", 1000);
        String big = "<html><body>" + "<p>row</p>".repeat(500) + "</body></html>";

        assertThat(s.compact(big, URL)).hasSize(1000);
        assertThat(s.canHandle("  ", URL)).isFalse();
        assertThat(s.canHandle(big, URL)).isTrue();
    }
}
