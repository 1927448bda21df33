package com.dealerscout.core.util;

import com.dealerscout.core.model.ScrapeConfig;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class YamlConfigLoaderTest {

    private static InputStream yaml(String s) {
        return new ByteArrayInputStream(s.getBytes(StandardCharsets.UTF_8));
    }

    @Test
    void reads_all_sections() {
        ScrapeConfig cfg = YamlConfigLoader.load(yaml("""
                timeoutMs: 12000
                concurrency: 8
                userAgent: "TestAgent/1.0"
                output:
                  dir: "build/out"
                fetch:
                  browserTimeoutMs: 45000
                  networkIdleTimeoutMs: 5000
                  minBodyBytes: 256
                  headless: false
                  knownBlockedDomains: "a.com, b.com"
                  debugCapture: true
                  debugDir: "build/debug"
                normalize:
                  singleBrandDomains: ["hondaofexample.com"]
                sitemap:
                  enabled: false
                  maxPages: 20
                rules:
                  path: "conf/rules.json"
                llm:
                  enabled: true
                  model: "gpt-test"
                  apiKeyEnv: "MY_KEY"
                  maxHtmlChars: 5000
                """));

        assertThat(cfg.getTimeoutMs()).isEqualTo(12_000);
        assertThat(cfg.getConcurrency()).isEqualTo(8);
        assertThat(cfg.getUserAgent()).isEqualTo("TestAgent/1.0");
        assertThat(cfg.getOutputDir()).isEqualTo(Path.of("build/out"));
        assertThat(cfg.fetch().getBrowserTimeoutMs()).isEqualTo(45_000);
        assertThat(cfg.fetch().getNetworkIdleTimeoutMs()).isEqualTo(5_000);
        assertThat(cfg.fetch().getMinBodyBytes()).isEqualTo(256);
        assertThat(cfg.fetch().isHeadless()).isFalse();
        assertThat(cfg.fetch().getKnownBlockedDomains()).isEqualTo(List.of("a.com", "b.com"));
        assertThat(cfg.fetch().isDebugCapture()).isTrue();
        assertThat(cfg.fetch().getDebugDir()).isEqualTo(Path.of("build/debug"));
        assertThat(cfg.normalize().getSingleBrandDomains()).containsExactly("hondaofexample.com");
        assertThat(cfg.sitemap().isEnabled()).isFalse();
        assertThat(cfg.sitemap().getMaxPages()).isEqualTo(20);
        assertThat(cfg.rules().getPath()).isEqualTo(Path.of("conf/rules.json"));
        assertThat(cfg.llm().isEnabled()).isTrue();
        assertThat(cfg.llm().getModel()).isEqualTo("gpt-test");
        assertThat(cfg.llm().getApiKeyEnv()).isEqualTo("MY_KEY");
        assertThat(cfg.llm().getMaxHtmlChars()).isEqualTo(5000);
    }

    @Test
    void empty_document_keeps_defaults() {
        ScrapeConfig cfg = YamlConfigLoader.load(yaml(""));
        ScrapeConfig defaults = ScrapeConfig.defaults();

        assertThat(cfg.getTimeoutMs()).isEqualTo(defaults.getTimeoutMs());
        assertThat(cfg.fetch().getKnownBlockedDomains()).isEqualTo(defaults.fetch().getKnownBlockedDomains());
    }

    @Test
    void invalid_values_fail_validation() {
        assertThatThrownBy(() -> YamlConfigLoader.load(yaml("""
                fetch:
                  browserTimeoutMs: 2000
                  networkIdleTimeoutMs: 5000
                """)))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("networkIdleTimeoutMs");
    }

    @Test
    void missing_file_is_reported(@TempDir Path tmp) throws IOException {
        assertThatThrownBy(() -> YamlConfigLoader.load(tmp.resolve("scrape.yml")))
                .isInstanceOf(IOException.class)
                .hasMessageContaining("scrape.yml not found");

        Path file = tmp.resolve("scrape.yml");
        Files.writeString(file, "concurrency: 2\n");
        assertThat(YamlConfigLoader.load(file).getConcurrency()).isEqualTo(2);
    }
}
