package com.dealerscout.core.util;

import com.dealerscout.core.model.ScrapeConfig;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.SafeConstructor;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.Consumer;
import java.util.function.IntConsumer;

/**
 * scrape.yml을 읽어 ScrapeConfig로 변환.
 *
 * 예상 YAML 키:
 * timeoutMs: 30000
 * concurrency: 4
 * userAgent: "Mozilla/5.0 ..."
 * output:
 *   dir: "out"
 * fetch:
 *   browserTimeoutMs: 60000
 *   networkIdleTimeoutMs: 15000
 *   minBodyBytes: 512
 *   headless: true
 *   viewportWidth: 1920
 *   viewportHeight: 1080
 *   knownBlockedDomains: ["ancira.com"]
 *   debugCapture: false
 *   debugDir: "out/debug"
 * normalize:
 *   singleBrandDomains: ["hondaofexample.com"]
 * sitemap:
 *   enabled: true
 *   maxPages: 500
 * rules:
 *   path: "rules.json"
 * llm:
 *   enabled: false
 *   model: "gpt-4o-mini"
 *   endpoint: "https://api.openai.com/v1/chat/completions"
 *   apiKeyEnv: "OPENAI_API_KEY"
 *   maxHtmlChars: 60000
 *   timeoutMs: 60000
 */
public final class YamlConfigLoader {

    private YamlConfigLoader() {}

    public static ScrapeConfig loadDefault() throws IOException {
        return load(Path.of("scrape.yml"));
    }

    public static ScrapeConfig load(Path yamlPath) throws IOException {
        Objects.requireNonNull(yamlPath, "yamlPath");
        if (!Files.exists(yamlPath)) {
            throw new IOException("scrape.yml not found at: " + yamlPath.toAbsolutePath());
        }
        try (InputStream in = Files.newInputStream(yamlPath)) {
            return load(in);
        }
    }

    /** 클래스패스 리소스 등 스트림에서 읽기 */
    public static ScrapeConfig load(InputStream in) {
        Objects.requireNonNull(in, "in");
        LoaderOptions opts = new LoaderOptions();
        Yaml yaml = new Yaml(new SafeConstructor(opts));
        Object root = yaml.load(in);

        ScrapeConfig cfg = ScrapeConfig.defaults();

        if (!(root instanceof Map<?, ?> map)) {
            // 비어있거나 단순 스칼라면 defaults 유지
            cfg.validate();
            return cfg;
        }

        // 1) 평면 키
        setLong(map, "timeoutMs", cfg::setTimeoutMs);
        setInt(map, "concurrency", cfg::setConcurrency);
        setString(map, "userAgent", cfg::setUserAgent);

        // 2) output.dir
        Map<String, Object> output = getMap(map, "output");
        if (output != null) {
            setPath(output, "dir", cfg::setOutputDir);
        }

        // 3) fetch.*
        Map<String, Object> fetch = getMap(map, "fetch");
        if (fetch != null) {
            var f = cfg.fetch();
            setInt(fetch, "browserTimeoutMs", f::setBrowserTimeoutMs);
            setInt(fetch, "networkIdleTimeoutMs", f::setNetworkIdleTimeoutMs);
            setInt(fetch, "minBodyBytes", f::setMinBodyBytes);
            setBoolean(fetch, "headless", f::setHeadless);
            setInt(fetch, "viewportWidth", f::setViewportWidth);
            setInt(fetch, "viewportHeight", f::setViewportHeight);
            setStringList(fetch, "knownBlockedDomains", f::setKnownBlockedDomains);
            setBoolean(fetch, "debugCapture", f::setDebugCapture);
            setPath(fetch, "debugDir", f::setDebugDir);
        }

        // 4) normalize.*
        Map<String, Object> normalize = getMap(map, "normalize");
        if (normalize != null) {
            setStringList(normalize, "singleBrandDomains", cfg.normalize()::setSingleBrandDomains);
        }

        // 5) sitemap.*
        Map<String, Object> sitemap = getMap(map, "sitemap");
        if (sitemap != null) {
            setBoolean(sitemap, "enabled", cfg.sitemap()::setEnabled);
            setInt(sitemap, "maxPages", cfg.sitemap()::setMaxPages);
        }

        // 6) rules.path
        Map<String, Object> rules = getMap(map, "rules");
        if (rules != null) {
            setPath(rules, "path", cfg.rules()::setPath);
        }

        // 7) llm.*
        Map<String, Object> llm = getMap(map, "llm");
        if (llm != null) {
            var l = cfg.llm();
            setBoolean(llm, "enabled", l::setEnabled);
            setString(llm, "model", l::setModel);
            setString(llm, "endpoint", l::setEndpoint);
            setString(llm, "apiKeyEnv", l::setApiKeyEnv);
            setInt(llm, "maxHtmlChars", l::setMaxHtmlChars);
            setInt(llm, "timeoutMs", l::setTimeoutMs);
        }

        // 기본값/필수값 확인
        cfg.validate();
        return cfg;
    }

    // ------------ helpers ------------
    @SuppressWarnings("unchecked")
    private static Map<String, Object> getMap(Map<?, ?> map, String key) {
        Object v = map.get(key);
        if (v instanceof Map<?, ?> m) return (Map<String, Object>) m;
        return null;
    }

    private static void setString(Map<?, ?> map, String key, Consumer<String> setter) {
        Object v = map.get(key);
        if (v != null) setter.accept(String.valueOf(v));
    }

    private static void setStringList(Map<?, ?> map, String key, Consumer<List<String>> setter) {
        Object v = map.get(key);
        if (v == null) return;
        if (v instanceof List<?> list) {
            List<String> out = new ArrayList<>();
            for (Object o : list) if (o != null) out.add(String.valueOf(o).trim());
            setter.accept(List.copyOf(out));
            return;
        }
        // "a,b,c" 형태 지원
        String s = String.valueOf(v).trim();
        List<String> out = new ArrayList<>();
        if (!s.isEmpty()) {
            for (String p : s.split("\\s*,\\s*")) if (!p.isEmpty()) out.add(p);
        }
        setter.accept(List.copyOf(out));
    }

    private static void setBoolean(Map<?, ?> map, String key, Consumer<Boolean> setter) {
        Object v = map.get(key);
        if (v instanceof Boolean b) setter.accept(b);
        else if (v != null) setter.accept(Boolean.parseBoolean(String.valueOf(v)));
    }

    private static void setInt(Map<?, ?> map, String key, IntConsumer setter) {
        Object v = map.get(key);
        if (v instanceof Number n) setter.accept(n.intValue());
        else if (v != null) setter.accept(Integer.parseInt(String.valueOf(v).trim()));
    }

    private static void setLong(Map<?, ?> map, String key, Consumer<Long> setter) {
        Object v = map.get(key);
        if (v == null) return;
        long n = (v instanceof Number num) ? num.longValue() : Long.parseLong(String.valueOf(v).trim());
        if (n > 0) setter.accept(n);
    }

    private static void setPath(Map<?, ?> map, String key, Consumer<Path> setter) {
        Object v = map.get(key);
        if (v != null) setter.accept(Path.of(String.valueOf(v)));
    }
}
