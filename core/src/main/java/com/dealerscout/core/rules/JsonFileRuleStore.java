package com.dealerscout.core.rules;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * rules.json 파일 기반 저장소. 형식: { "host": [ DomainRule, ... ], ... }
 * 생성 시 한 번만 읽고 이후 불변(스레드 안전).
 */
public final class JsonFileRuleStore implements RuleStore {

    private static final Logger LOG = LoggerFactory.getLogger(JsonFileRuleStore.class);

    private static final ObjectMapper OM = new ObjectMapper()
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

    private static final TypeReference<Map<String, List<DomainRule>>> SHAPE = new TypeReference<>() {};

    private final Map<String, List<DomainRule>> byHost;

    private JsonFileRuleStore(Map<String, List<DomainRule>> raw) {
        Map<String, List<DomainRule>> m = new LinkedHashMap<>();
        if (raw != null) {
            for (Map.Entry<String, List<DomainRule>> e : raw.entrySet()) {
                if (e.getKey() == null || e.getValue() == null) continue;
                List<DomainRule> rules = new ArrayList<>();
                for (DomainRule r : e.getValue()) if (r != null) rules.add(r);
                m.put(e.getKey().toLowerCase(Locale.ROOT), List.copyOf(rules));
            }
        }
        this.byHost = Collections.unmodifiableMap(m);
    }

    /** 파일이 없으면 IOException */
    public static JsonFileRuleStore load(Path file) throws IOException {
        if (!Files.exists(file)) throw new IOException("Rules file not found: " + file);
        try (InputStream in = Files.newInputStream(file)) {
            JsonFileRuleStore store = load(in);
            LOG.info("Loaded {} learned rule(s) for {} host(s) from {}", store.size(), store.byHost.size(), file);
            return store;
        }
    }

    public static JsonFileRuleStore load(InputStream in) throws IOException {
        return new JsonFileRuleStore(OM.readValue(in, SHAPE));
    }

    /**
     * 설정 경로가 비었거나 파일이 없으면 {@link RuleStore#EMPTY}.
     * 파일이 있는데 읽지 못하면 예외를 그대로 올린다.
     */
    public static RuleStore loadOrEmpty(Path path) throws IOException {
        if (path == null) return RuleStore.EMPTY;
        if (!Files.exists(path)) {
            LOG.info("No rules file at {}, learned rules disabled", path);
            return RuleStore.EMPTY;
        }
        return load(path);
    }

    @Override
    public List<DomainRule> rulesFor(String host) {
        if (host == null) return List.of();
        return byHost.getOrDefault(host.toLowerCase(Locale.ROOT), List.of());
    }

    public int size() {
        int n = 0;
        for (List<DomainRule> l : byHost.values()) n += l.size();
        return n;
    }
}
