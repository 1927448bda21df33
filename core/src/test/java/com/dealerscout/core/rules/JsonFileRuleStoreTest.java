package com.dealerscout.core.rules;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class JsonFileRuleStoreTest {

    private static final String RULES = """
            {
              "www.example-group.com": [
                {
                  "host": "www.example-group.com",
                  "path_pattern": "/locations",
                  "version": 2,
                  "card_selector": "div.location-card",
                  "fields": { "name": "h3", "street": ".street", "phone": "" },
                  "success_count": 5,
                  "learned_at": "2024-05-01"
                }
              ],
              "*pattern*": [
                {
                  "host": "*pattern*",
                  "path_pattern": "layout:addresses:multiple|containers:3",
                  "version": 1,
                  "card_selector": "article.store",
                  "fields": { "name": "h2" },
                  "dom_signature": "abc",
                  "success_count": 1
                }
              ]
            }
            """;

    @TempDir
    Path tmp;

    @Test
    void loads_rules_by_host_and_pattern() throws IOException {
        Path file = tmp.resolve("rules.json");
        Files.writeString(file, RULES, StandardCharsets.UTF_8);

        JsonFileRuleStore store = JsonFileRuleStore.load(file);

        assertThat(store.size()).isEqualTo(2);
        assertThat(store.rulesFor("WWW.Example-Group.com")).singleElement().satisfies(r -> {
            assertThat(r.version()).isEqualTo(2);
            assertThat(r.cardSelector()).isEqualTo("div.location-card");
            assertThat(r.field("street")).isEqualTo(".street");
            assertThat(r.field("phone")).isNull();
            assertThat(r.field("website")).isNull();
            assertThat(r.domSignature()).isEmpty();
            assertThat(r.isPatternRule()).isFalse();
        });
        assertThat(store.patternRules()).singleElement()
                .satisfies(r -> assertThat(r.isPatternRule()).isTrue());
        assertThat(store.rulesFor("other.com")).isEmpty();
        assertThat(store.rulesFor(null)).isEmpty();
    }

    @Test
    void missing_file_is_empty_for_load_or_empty_but_fails_for_load() throws IOException {
        Path missing = tmp.resolve("nope.json");

        assertThat(JsonFileRuleStore.loadOrEmpty(missing)).isSameAs(RuleStore.EMPTY);
        assertThat(JsonFileRuleStore.loadOrEmpty(null)).isSameAs(RuleStore.EMPTY);
        assertThatThrownBy(() -> JsonFileRuleStore.load(missing))
                .isInstanceOf(IOException.class).hasMessageContaining("not found");
    }

    @Test
    void malformed_file_propagates() throws IOException {
        Path file = tmp.resolve("rules.json");
        Files.writeString(file, "{ \"a.com\": [ { \"host\": ", StandardCharsets.UTF_8);

        assertThatThrownBy(() -> JsonFileRuleStore.loadOrEmpty(file)).isInstanceOf(IOException.class);
    }

    @Test
    void rule_without_selector_is_rejected() {
        String bad = "{\"a.com\": [{\"host\": \"a.com\", \"path_pattern\": \"/\"}]}";

        assertThatThrownBy(() -> JsonFileRuleStore.load(
                new java.io.ByteArrayInputStream(bad.getBytes(StandardCharsets.UTF_8))))
                .isInstanceOf(IOException.class);
    }
}
