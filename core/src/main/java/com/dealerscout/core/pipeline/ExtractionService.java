package com.dealerscout.core.pipeline;

import com.dealerscout.core.api.IFetcher;
import com.dealerscout.core.http.Fetcher;
import com.dealerscout.core.llm.OpenAiChatClient;
import com.dealerscout.core.model.CanonicalRecord;
import com.dealerscout.core.model.ExtractionOutcome;
import com.dealerscout.core.model.FailureReason;
import com.dealerscout.core.model.ScrapeConfig;
import com.dealerscout.core.model.Transport;
import com.dealerscout.core.normalize.Deduplicator;
import com.dealerscout.core.normalize.RecordNormalizer;
import com.dealerscout.core.rules.JsonFileRuleStore;
import com.dealerscout.core.rules.RuleStore;
import com.dealerscout.core.strategy.StrategyCatalog;
import com.dealerscout.core.strategy.StrategyRegistry;
import com.dealerscout.core.util.ProgressListener;
import com.dealerscout.core.util.StructuredLog;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * 배치 오케스트레이터:
 *  - extractAll: URL별 파이프라인을 고정 스레드풀(동시성=concurrency)에서 실행
 *  - extractGroup: 단일 URL 실패(데이터 없음) 시 사이트맵의 위치 페이지로 재시도 후 병합
 *  - 한 URL의 실패/타임아웃은 다른 URL을 취소하지 않는다
 * 파이프라인끼리는 읽기 전용 협력자만 공유한다.
 */
public final class ExtractionService implements AutoCloseable {

    private static final Logger LOG = LoggerFactory.getLogger(ExtractionService.class);
    private static final StructuredLog SLOG = StructuredLog.get(ExtractionService.class);

    /** 사이트맵 재시도 대상이 되는 실패(가져오기 실패는 제외) */
    static final Set<FailureReason> SITEMAP_RETRY_REASONS =
            EnumSet.of(FailureReason.NO_STRATEGY, FailureReason.MATCHED_EMPTY, FailureReason.NO_VALID_RECORDS);

    private final ScrapeConfig config;
    private final IFetcher fetcher;
    private final ExtractionPipeline pipeline;
    private final SitemapDiscovery sitemap;
    private final Deduplicator deduplicator = new Deduplicator();

    /** DI/테스트용 */
    public ExtractionService(ScrapeConfig config, IFetcher fetcher, ExtractionPipeline pipeline, SitemapDiscovery sitemap) {
        this.config = Objects.requireNonNull(config, "config");
        this.fetcher = Objects.requireNonNull(fetcher, "fetcher");
        this.pipeline = Objects.requireNonNull(pipeline, "pipeline");
        this.sitemap = sitemap;   // null이면 사이트맵 재시도 없음
    }

    /**
     * 기본 구성: Fetcher(HttpClient + Playwright), 규칙 저장소, (설정 시) LLM, 기본 전략 목록.
     * 규칙 파일이 있는데 읽지 못하면 IOException.
     */
    public static ExtractionService create(ScrapeConfig config) throws IOException {
        config.validate();
        IFetcher fetcher = new Fetcher(config);
        RuleStore rules = JsonFileRuleStore.loadOrEmpty(config.rules().getPath());
        StrategyRegistry registry = StrategyCatalog.defaults(rules,
                OpenAiChatClient.fromConfig(config.llm()), config.llm().getMaxHtmlChars());
        ExtractionPipeline pipeline = new ExtractionPipeline(fetcher, registry,
                new RecordNormalizer(config.normalize().getSingleBrandDomains()), new Deduplicator());
        SitemapDiscovery sitemap = new SitemapDiscovery(fetcher, config.sitemap().getMaxPages());
        LOG.info("Extraction service ready: strategies={}, concurrency={}", registry.names(), config.getConcurrency());
        return new ExtractionService(config, fetcher, pipeline, sitemap);
    }

    public ExtractionOutcome extract(String dealerGroup, String url) {
        return pipeline.run(dealerGroup, url);
    }

    public ExtractionOutcome extractGroup(String dealerGroup, String url) {
        return extractGroup(dealerGroup, url, ProgressListener.NONE);
    }

    /**
     * 단일 URL 추출. 데이터 없음 계열 실패면 사이트맵 위치 페이지들을 대신 추출해 병합한다.
     */
    public ExtractionOutcome extractGroup(String dealerGroup, String url, ProgressListener listener) {
        final ProgressListener pl = (listener != null) ? listener : ProgressListener.NONE;
        ExtractionOutcome primary = pipeline.run(dealerGroup, url);
        if (primary.isSuccess()
                || !SITEMAP_RETRY_REASONS.contains(primary.getFailureReason())
                || sitemap == null
                || !config.sitemap().isEnabled()) {
            return primary;
        }

        safeProgress(pl, 0.0, "discover", -1, -1);
        List<String> pages = sitemap.discover(url);
        if (pages.isEmpty()) {
            List<String> diag = new ArrayList<>(primary.getDiagnostics());
            diag.add("sitemap: no location pages found");
            return ExtractionOutcome.failure(primary.getFailureReason(), primary.getMessage(),
                    primary.getStrategyUsed(), primary.getTransportUsed(), diag);
        }
        LOG.info("Primary extraction for {} failed ({}), trying {} sitemap page(s)",
                url, primary.getFailureReason(), pages.size());

        List<ExtractionOutcome> perPage = extractAll(dealerGroup, pages, pl);
        return merge(primary, pages, perPage, pl);
    }

    private ExtractionOutcome merge(ExtractionOutcome primary, List<String> pages,
                                    List<ExtractionOutcome> perPage, ProgressListener pl) {
        List<String> diag = new ArrayList<>(primary.getDiagnostics());
        diag.add("sitemap: " + pages.size() + " location page(s)");

        List<CanonicalRecord> all = new ArrayList<>();
        Set<String> strategies = new LinkedHashSet<>();
        Transport transport = null;
        int ok = 0;
        for (int i = 0; i < perPage.size(); i++) {
            ExtractionOutcome o = perPage.get(i);
            if (o.isSuccess()) {
                ok++;
                all.addAll(o.getRecords());
                if (o.getStrategyUsed() != null) strategies.add(o.getStrategyUsed());
                if (transport == null || o.getTransportUsed() == Transport.BROWSER) transport = o.getTransportUsed();
                diag.add("sitemap page ok: " + pages.get(i) + " (" + o.getRecords().size() + ")");
            } else {
                diag.add("sitemap page failed: " + pages.get(i) + " (" + o.getFailureReason() + ")");
            }
        }

        safeProgress(pl, 1.0, "dedupe", perPage.size(), perPage.size());
        if (all.isEmpty()) {
            return ExtractionOutcome.failure(primary.getFailureReason(),
                    primary.getMessage() + "; sitemap pages yielded no records",
                    primary.getStrategyUsed(), primary.getTransportUsed(), diag);
        }
        List<CanonicalRecord> unique = deduplicator.dedupe(all);
        diag.add("sitemap merge: " + ok + "/" + pages.size() + " page(s), "
                + all.size() + " -> " + unique.size() + " record(s)");
        return ExtractionOutcome.success(unique, String.join(", ", strategies), transport, diag);
    }

    public List<ExtractionOutcome> extractAll(String dealerGroup, List<String> urls) {
        return extractAll(dealerGroup, urls, ProgressListener.NONE);
    }

    /**
     * URL 목록을 병렬 추출. 결과는 입력 순서와 같다.
     * 작업이 예외로 끝나면 그 URL은 INTERNAL_ERROR Outcome으로 채운다.
     */
    public List<ExtractionOutcome> extractAll(String dealerGroup, List<String> urls, ProgressListener listener) {
        final ProgressListener pl = (listener != null) ? listener : ProgressListener.NONE;
        final List<String> targets = (urls == null) ? List.of() : List.copyOf(urls);
        final int total = targets.size();
        if (total == 0) return List.of();

        final int cc = Math.max(1, Math.min(config.getConcurrency(), total));
        LOG.info("Batch start: group={}, urls={}, cc={}", dealerGroup, total, cc);
        SLOG.info("batch-start", "group", dealerGroup, "urls", total, "cc", cc);
        safeProgress(pl, 0.0, "extract", 0, total);

        // ---- 1) 고정 스레드풀(+역압) 구성 ----
        ExecutorService exec = new ThreadPoolExecutor(
                cc, cc,
                0L, TimeUnit.MILLISECONDS,
                new LinkedBlockingQueue<>(cc * 2),
                new NamedThreadFactory("extract-worker"),
                (r, e) -> {
                    try { e.getQueue().put(r); }
                    catch (InterruptedException ie) {
                        Thread.currentThread().interrupt();
                        throw new RejectedExecutionException("Interrupted while enqueueing", ie);
                    }
                }
        );

        final List<Future<ExtractionOutcome>> futures = new ArrayList<>(total);
        final AtomicInteger done = new AtomicInteger(0);

        // ---- 2) 작업 제출 ----
        for (String url : targets) {
            futures.add(exec.submit(() -> {
                try {
                    return pipeline.run(dealerGroup, url);
                } finally {
                    int d = done.incrementAndGet();
                    safeProgress(pl, (double) d / (double) total, "extract", d, total);
                }
            }));
        }

        // ---- 3) 결과 수집 ----
        List<ExtractionOutcome> results = new ArrayList<>(total);
        int success = 0;
        try {
            for (int i = 0; i < futures.size(); i++) {
                ExtractionOutcome o;
                try {
                    o = futures.get(i).get();
                } catch (ExecutionException e) {
                    Throwable cause = (e.getCause() != null ? e.getCause() : e);
                    LOG.warn("Extraction task failed: {}", cause.toString());
                    SLOG.error("task-failed", cause, "url", targets.get(i));
                    o = ExtractionOutcome.failure(FailureReason.INTERNAL_ERROR, cause.toString(),
                            null, null, List.of("task failed: " + cause));
                } catch (InterruptedException ie) {
                    Thread.currentThread().interrupt();
                    throw new CancellationException("Interrupted while collecting results");
                }
                if (o.isSuccess()) success++;
                results.add(o);
            }
        } finally {
            // ---- 4) 종료 ----
            exec.shutdownNow();
            try {
                exec.awaitTermination(30, TimeUnit.SECONDS);
            } catch (InterruptedException ie) {
                Thread.currentThread().interrupt();
            }
        }

        LOG.info("Batch done: group={}, urls={}, succeeded={}", dealerGroup, total, success);
        SLOG.info("batch-done", "group", dealerGroup, "urls", total, "succeeded", success);
        return results;
    }

    private static void safeProgress(ProgressListener pl, double p, String phase, long done, long total) {
        try {
            pl.onProgress(Math.max(0.0, Math.min(1.0, p)), phase, done, total);
        } catch (RuntimeException e) {
            LOG.debug("Progress listener failed: {}", e.toString());
        }
    }

    @Override
    public void close() throws Exception {
        fetcher.close();
    }

    static final class NamedThreadFactory implements ThreadFactory {
        private final String prefix;
        private final AtomicInteger seq = new AtomicInteger(1);
        NamedThreadFactory(String prefix) { this.prefix = prefix; }
        @Override public Thread newThread(Runnable r) {
            Thread t = new Thread(r, prefix + "-" + seq.getAndIncrement());
            t.setDaemon(true);
            return t;
        }
    }
}
