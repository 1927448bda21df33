package com.dealerscout.core.strategy;

import com.dealerscout.core.api.StrategyDescriptor;
import com.dealerscout.core.model.RawRecord;
import com.dealerscout.core.model.Tier;
import com.dealerscout.core.util.StructuredLog;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * 등급(SPECIFIC → GENERIC → FALLBACK) 순서의 전략 목록.
 * <ul>
 *   <li>첫 번째로 canHandle=true인 전략 하나만 extract 한다(엄격한 first-match)</li>
 *   <li>extract가 예외/0건이면 MATCHED_EMPTY. 같은 호출 안에서 다음 전략으로 넘어가지 않는다</li>
 *   <li>FALLBACK은 SPECIFIC/GENERIC 모두 불일치일 때만 select에서 본다.
 *       MATCHED_EMPTY 이후에는 호출자가 {@link #selectFallback}을 부른다</li>
 * </ul>
 * build() 이후 불변이라 여러 스레드에서 잠금 없이 공유한다.
 */
public final class StrategyRegistry {

    private static final Logger LOG = LoggerFactory.getLogger(StrategyRegistry.class);
    private static final StructuredLog SLOG = StructuredLog.get(StrategyRegistry.class);

    private final Map<Tier, List<StrategyDescriptor>> byTier;
    private final Map<String, StrategyDescriptor> byName;

    private StrategyRegistry(Builder b) {
        EnumMap<Tier, List<StrategyDescriptor>> m = new EnumMap<>(Tier.class);
        for (Tier t : Tier.values()) m.put(t, List.of());
        for (Map.Entry<Tier, List<StrategyDescriptor>> e : b.byTier.entrySet()) {
            m.put(e.getKey(), List.copyOf(e.getValue()));
        }
        this.byTier = Collections.unmodifiableMap(m);
        this.byName = Collections.unmodifiableMap(new LinkedHashMap<>(b.byName));
    }

    public static Builder builder() { return new Builder(); }

    // ---- 조회 ----

    /** 등급 순서 + 등록 순서로 전체 목록 */
    public List<StrategyDescriptor> strategies() {
        List<StrategyDescriptor> all = new ArrayList<>(byName.size());
        for (Tier t : Tier.values()) all.addAll(byTier.get(t));
        return Collections.unmodifiableList(all);
    }

    public List<StrategyDescriptor> strategies(Tier tier) {
        return byTier.get(Objects.requireNonNull(tier, "tier"));
    }

    public Optional<StrategyDescriptor> find(String name) {
        return Optional.ofNullable(byName.get(name));
    }

    public Set<String> names() {
        return Collections.unmodifiableSet(new LinkedHashSet<>(byName.keySet()));
    }

    public Optional<Tier> tierOf(String name) {
        return find(name).map(StrategyDescriptor::tier);
    }

    public int size() { return byName.size(); }

    // ---- 선택 ----

    /** SPECIFIC → GENERIC, 둘 다 불일치면 FALLBACK */
    public SelectionResult select(String html, String url) {
        List<String> diag = new ArrayList<>();
        SelectionResult r = firstMatch(Tier.SPECIFIC, html, url, diag);
        if (r == null) r = firstMatch(Tier.GENERIC, html, url, diag);
        if (r == null) r = firstMatch(Tier.FALLBACK, html, url, diag);
        if (r == null) r = SelectionResult.noMatch(diag);
        logSelection("select", url, r);
        return r;
    }

    /** FALLBACK 등급만 */
    public SelectionResult selectFallback(String html, String url) {
        List<String> diag = new ArrayList<>();
        SelectionResult r = firstMatch(Tier.FALLBACK, html, url, diag);
        if (r == null) r = SelectionResult.noMatch(diag);
        logSelection("select-fallback", url, r);
        return r;
    }

    /** 해당 등급에서 첫 매칭 전략의 결과. 매칭이 없으면 null */
    private SelectionResult firstMatch(Tier tier, String html, String url, List<String> diag) {
        for (StrategyDescriptor s : byTier.get(tier)) {
            boolean handles;
            try {
                handles = s.canHandle(html, url);
            } catch (RuntimeException e) {
                diag.add(s.name() + ": canHandle failed (" + summary(e) + "), treated as no match");
                LOG.warn("Strategy '{}' canHandle failed for {}: {}", s.name(), url, summary(e));
                continue;
            }
            if (!handles) {
                diag.add(s.name() + ": not applicable");
                continue;
            }
            diag.add(s.name() + ": selected (" + tier + ")");
            return runExtract(s, tier, html, url, diag);
        }
        return null;
    }

    private SelectionResult runExtract(StrategyDescriptor s, Tier tier, String html, String url, List<String> diag) {
        List<RawRecord> raw;
        try {
            raw = s.extract(html, url);
        } catch (Exception e) {
            diag.add(s.name() + ": extract failed (" + summary(e) + ")");
            LOG.warn("Strategy '{}' extract failed for {}: {}", s.name(), url, summary(e));
            return SelectionResult.matchedEmpty(s.name(), tier, diag);
        }
        List<RawRecord> records = new ArrayList<>();
        if (raw != null) {
            for (RawRecord rr : raw) if (rr != null) records.add(rr);
        }
        if (records.isEmpty()) {
            diag.add(s.name() + ": extract returned no records");
            return SelectionResult.matchedEmpty(s.name(), tier, diag);
        }
        diag.add(s.name() + ": extracted " + records.size() + " raw record(s)");
        return SelectionResult.matched(s.name(), tier, records, diag);
    }

    private static void logSelection(String event, String url, SelectionResult r) {
        SLOG.info(event, "url", url, "status", r.getStatus(),
                "strategy", r.getStrategyName(), "tier", r.getTier(), "records", r.getRecords().size());
    }

    private static String summary(Throwable t) {
        String m = t.getMessage();
        return t.getClass().getSimpleName() + (m == null || m.isBlank() ? "" : ": " + m);
    }

    // ---------------- Builder ----------------
    public static final class Builder {
        private final Map<Tier, List<StrategyDescriptor>> byTier = new EnumMap<>(Tier.class);
        private final Map<String, StrategyDescriptor> byName = new LinkedHashMap<>();

        /** 등록 순서가 곧 같은 등급 안의 우선순위 */
        public Builder register(StrategyDescriptor s) {
            Objects.requireNonNull(s, "strategy");
            String name = Objects.requireNonNull(s.name(), "strategy name");
            Tier tier = Objects.requireNonNull(s.tier(), "strategy tier");
            if (name.isBlank()) throw new IllegalArgumentException("strategy name is blank");
            if (byName.containsKey(name)) {
                throw new IllegalArgumentException("duplicate strategy name: " + name);
            }
            byName.put(name, s);
            byTier.computeIfAbsent(tier, k -> new ArrayList<>()).add(s);
            return this;
        }

        public Builder registerAll(List<? extends StrategyDescriptor> list) {
            for (StrategyDescriptor s : list) register(s);
            return this;
        }

        public StrategyRegistry build() {
            return new StrategyRegistry(this);
        }
    }
}
