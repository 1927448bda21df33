package com.dealerscout.core.pipeline;

import com.dealerscout.core.api.IFetcher;
import com.dealerscout.core.http.FetchException;
import com.dealerscout.core.http.FetchOptions;
import com.dealerscout.core.model.CanonicalRecord;
import com.dealerscout.core.model.ExtractionOutcome;
import com.dealerscout.core.model.FailureReason;
import com.dealerscout.core.model.FetchResult;
import com.dealerscout.core.model.RawRecord;
import com.dealerscout.core.model.Tier;
import com.dealerscout.core.model.Transport;
import com.dealerscout.core.normalize.Deduplicator;
import com.dealerscout.core.normalize.NormalizationContext;
import com.dealerscout.core.normalize.RecordNormalizer;
import com.dealerscout.core.strategy.SelectionResult;
import com.dealerscout.core.strategy.StrategyRegistry;
import com.dealerscout.core.util.StructuredLog;
import com.dealerscout.core.util.UrlUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * 딜러 그룹 URL 하나에 대한 추출 오케스트레이터.
 * <pre>
 * INIT → FETCH_LIGHT → [FETCH_BROWSER] → SELECT_STRATEGY → EXTRACT → NORMALIZE → DEDUPE → SUCCESS
 *                                       (어디서든) → FAILED
 * </pre>
 * LIGHT로 가져온 페이지가 MATCHED_EMPTY면 브라우저로 한 번만 다시 가져와 재선택하고,
 * 그래도 비면 FALLBACK 등급을 본다.
 * 호출자에게 예외를 던지지 않는다. 모든 결과는 {@link ExtractionOutcome}.
 *
 * 상태는 run() 호출마다 지역 변수로만 존재하므로 인스턴스는 스레드 간 공유 가능.
 */
public class ExtractionPipeline {

    private static final Logger LOG = LoggerFactory.getLogger(ExtractionPipeline.class);
    private static final StructuredLog SLOG = StructuredLog.get(ExtractionPipeline.class);

    private final IFetcher fetcher;
    private final StrategyRegistry registry;
    private final RecordNormalizer normalizer;
    private final Deduplicator deduplicator;

    public ExtractionPipeline(IFetcher fetcher, StrategyRegistry registry,
                              RecordNormalizer normalizer, Deduplicator deduplicator) {
        this.fetcher = Objects.requireNonNull(fetcher, "fetcher");
        this.registry = Objects.requireNonNull(registry, "registry");
        this.normalizer = Objects.requireNonNull(normalizer, "normalizer");
        this.deduplicator = Objects.requireNonNull(deduplicator, "deduplicator");
    }

    public StrategyRegistry getRegistry() { return registry; }

    public ExtractionOutcome run(String dealerGroup, String url) {
        Run run = new Run(url);
        long t0 = System.nanoTime();
        ExtractionOutcome out;
        try {
            out = execute(run, dealerGroup, url);
        } catch (RuntimeException e) {
            LOG.error("Pipeline crashed for {}: {}", url, e.toString(), e);
            run.diag.add("internal error: " + e);
            run.to(PipelineState.FAILED, FailureReason.INTERNAL_ERROR.name());
            out = ExtractionOutcome.failure(FailureReason.INTERNAL_ERROR,
                    "unexpected error: " + e.getClass().getSimpleName()
                            + (e.getMessage() != null ? ": " + e.getMessage() : ""),
                    run.strategy, run.transport, run.diag);
        }
        long ms = (System.nanoTime() - t0) / 1_000_000;
        SLOG.info("pipeline-done", "url", url, "success", out.isSuccess(),
                "reason", out.getFailureReason(), "strategy", out.getStrategyUsed(),
                "transport", out.getTransportUsed(), "records", out.getRecords().size(), "ms", ms);
        return out;
    }

    private ExtractionOutcome execute(Run run, String dealerGroup, String url) {
        // ---- 0) 입력 검증 ----
        if (url == null || !UrlUtils.isHttpUrl(url)) {
            return run.fail(FailureReason.INVALID_URL, "not an http(s) url: " + url);
        }

        // ---- 1) FETCH (LIGHT, 필요 시 BROWSER 승격은 Fetcher 내부) ----
        run.to(PipelineState.FETCH_LIGHT, url);
        FetchResult page;
        try {
            page = fetcher.fetch(url, FetchOptions.defaults());
        } catch (FetchException e) {
            run.diag.addAll(e.getDiagnostics());
            return run.fail(FailureReason.FETCH_ERROR, e.getReason() + ": " + e.getMessage());
        }
        run.diag.addAll(page.getDiagnostics());
        if (page.getTransportUsed() == Transport.BROWSER) {
            run.to(PipelineState.FETCH_BROWSER, "escalated by fetcher");
        }
        run.transport = page.getTransportUsed();

        // ---- 2) SELECT_STRATEGY ----
        run.to(PipelineState.SELECT_STRATEGY, null);
        SelectionResult sel = registry.select(page.getHtml(), page.getFinalUrl());
        run.absorb(sel);

        if (sel.getStatus() == SelectionResult.Status.NO_MATCH) {
            return run.fail(FailureReason.NO_STRATEGY, "no strategy recognised the page");
        }

        if (sel.getStatus() == SelectionResult.Status.MATCHED_EMPTY) {
            sel = recoverEmpty(run, url, page, sel);
            if (!sel.isMatched()) {
                return run.fail(FailureReason.MATCHED_EMPTY,
                        "strategy '" + run.strategy + "' matched but produced no records");
            }
        }

        // ---- 3) EXTRACT ----
        run.to(PipelineState.EXTRACT, sel.getStrategyName() + " -> " + sel.getRecords().size() + " raw");

        // ---- 4) NORMALIZE ----
        run.to(PipelineState.NORMALIZE, null);
        NormalizationContext ctx = new NormalizationContext(dealerGroup);
        List<CanonicalRecord> normalized = new ArrayList<>();
        for (RawRecord raw : sel.getRecords()) {
            CanonicalRecord c = normalizer.normalize(raw, ctx);
            if (c != null) normalized.add(c);
        }
        run.diag.addAll(ctx.getDiagnostics());
        run.diag.add("normalized " + normalized.size() + "/" + sel.getRecords().size() + " record(s)");
        if (normalized.isEmpty()) {
            return run.fail(FailureReason.NO_VALID_RECORDS,
                    "all " + sel.getRecords().size() + " record(s) were discarded during normalization");
        }

        // ---- 5) DEDUPE ----
        run.to(PipelineState.DEDUPE, null);
        List<CanonicalRecord> unique = deduplicator.dedupe(normalized);
        run.diag.add("deduplicated " + normalized.size() + " -> " + unique.size());

        run.to(PipelineState.SUCCESS, null);
        LOG.info("Extracted {} location(s) from {} via '{}' ({})",
                unique.size(), url, run.strategy, run.transport);
        return ExtractionOutcome.success(unique, run.strategy, run.transport, run.diag);
    }

    /**
     * MATCHED_EMPTY 복구.
     *  - LIGHT였고 SPECIFIC/GENERIC 전략이 비었다면 브라우저로 한 번만 다시 가져와 재선택
     *  - 그래도 비면 FALLBACK 등급(이미 FALLBACK이 빈 결과를 냈다면 생략)
     */
    private SelectionResult recoverEmpty(Run run, String url, FetchResult page, SelectionResult empty) {
        String html = page.getHtml();
        String finalUrl = page.getFinalUrl();
        SelectionResult last = empty;

        if (page.getTransportUsed() == Transport.LIGHT && empty.getTier() != Tier.FALLBACK) {
            run.to(PipelineState.FETCH_BROWSER, "re-render after empty match");
            try {
                FetchResult rendered = fetcher.fetch(url, FetchOptions.defaults().withForceBrowser(true));
                run.diag.addAll(rendered.getDiagnostics());
                run.transport = rendered.getTransportUsed();
                html = rendered.getHtml();
                finalUrl = rendered.getFinalUrl();

                run.to(PipelineState.SELECT_STRATEGY, "after re-render");
                last = registry.select(html, finalUrl);
                run.absorb(last);
                if (last.isMatched()) return last;
            } catch (FetchException e) {
                run.diag.addAll(e.getDiagnostics());
                run.diag.add("browser re-fetch failed: " + e.getReason() + " " + e.getMessage());
                LOG.info("Browser re-fetch failed for {} ({}), continuing with the light copy", url, e.getReason());
            }
        }

        if (last.getStatus() == SelectionResult.Status.MATCHED_EMPTY && last.getTier() == Tier.FALLBACK) {
            return last;   // FALLBACK 전략이 이미 같은 HTML에서 비었다
        }
        if (last.getStatus() == SelectionResult.Status.NO_MATCH) {
            return last;   // select가 FALLBACK까지 이미 훑었다
        }
        run.to(PipelineState.SELECT_STRATEGY, "fallback tier");
        SelectionResult fb = registry.selectFallback(html, finalUrl);
        run.absorb(fb);
        return fb.isMatched() ? fb : last;
    }

    /** run() 한 번의 가변 상태 */
    private static final class Run {
        final String url;
        final List<String> diag = new ArrayList<>();
        PipelineState state = PipelineState.INIT;
        String strategy;
        Transport transport;

        Run(String url) {
            this.url = url;
            diag.add("state " + PipelineState.INIT);
        }

        void to(PipelineState next, String detail) {
            PipelineState prev = state;
            state = next;
            diag.add("state " + prev + " -> " + next + (detail != null ? " (" + detail + ")" : ""));
            SLOG.info("pipeline-state", "url", url, "from", prev, "to", next, "detail", detail);
        }

        void absorb(SelectionResult sel) {
            diag.addAll(sel.getDiagnostics());
            if (sel.getStrategyName() != null) strategy = sel.getStrategyName();
        }

        ExtractionOutcome fail(FailureReason reason, String message) {
            to(PipelineState.FAILED, reason.name());
            LOG.info("Extraction failed for {}: {} ({})", url, reason, message);
            return ExtractionOutcome.failure(reason, message, strategy, transport, diag);
        }
    }
}
