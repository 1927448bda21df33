package com.dealerscout.core.http;

import com.dealerscout.core.api.IFetcher;
import com.dealerscout.core.model.FetchResult;
import com.dealerscout.core.model.ScrapeConfig;
import com.dealerscout.core.model.Transport;
import com.dealerscout.core.util.StructuredLog;
import com.dealerscout.core.util.UrlUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * LIGHT → BROWSER 2단 전송 fetch.
 *  - forceBrowser 또는 차단 도메인이면 LIGHT를 건너뛴다
 *  - LIGHT가 비-2xx/짧은 본문/차단 판정이면 같은 URL을 BROWSER로 한 번 더 가져온다
 *  - 그 외 재시도는 하지 않는다(오케스트레이터 책임)
 */
public class Fetcher implements IFetcher {

    private static final Logger LOG = LoggerFactory.getLogger(Fetcher.class);
    private static final StructuredLog SLOG = StructuredLog.get(Fetcher.class);

    private final ScrapeConfig config;
    private final LightTransport light;
    private final BrowserTransport browser;   // null이면 브라우저 경로 없음
    private final DebugCapture debug;

    /** 기본 구현(HttpClient + Playwright) */
    public Fetcher(ScrapeConfig config) {
        this(config, new LightTransport(config), new PlaywrightBrowserTransport(config));
    }

    /** DI/테스트용 */
    public Fetcher(ScrapeConfig config, LightTransport light, BrowserTransport browser) {
        this.config = Objects.requireNonNull(config, "config");
        this.light = Objects.requireNonNull(light, "light");
        this.browser = browser;
        this.debug = new DebugCapture(config.fetch().getDebugDir());
    }

    @Override
    public FetchResult fetch(String url, FetchOptions options) throws FetchException {
        Objects.requireNonNull(url, "url");
        FetchOptions opts = (options != null) ? options : FetchOptions.defaults();
        if (!UrlUtils.isHttpUrl(url)) {
            throw new IllegalArgumentException("not an http(s) url: " + url);
        }
        boolean capture = opts.debugCapture() || config.fetch().isDebugCapture();
        List<String> trail = new ArrayList<>();

        // ---- 1) LIGHT (조건부) ----
        FetchException lightFailure = null;
        String host = UrlUtils.hostOf(url);
        boolean knownBlocked = isKnownBlocked(host);

        if (opts.forceBrowser()) {
            trail.add("light skipped: browser forced");
        } else if (knownBlocked) {
            trail.add("light skipped: known blocked domain " + host);
        } else {
            long t0 = System.nanoTime();
            try {
                LightTransport.LightResponse r = light.get(url, opts.timeout());
                long ms = (System.nanoTime() - t0) / 1_000_000;
                BlockDetector.Verdict v = BlockDetector.inspect(r.statusCode(), r.body(),
                        config.fetch().getMinBodyBytes());
                SLOG.info("fetch-light", "url", url, "status", r.statusCode(),
                        "bytes", r.body().length(), "ms", ms, "verdict", v.detail());

                if (!v.rejected()) {
                    if (capture) debug.save(url, Transport.LIGHT, r.body());
                    trail.add("light ok: status " + r.statusCode());
                    return FetchResult.builder()
                            .html(r.body())
                            .finalUrl(r.finalUrl())
                            .transportUsed(Transport.LIGHT)
                            .fetchedAt(Instant.now())
                            .statusCode(r.statusCode())
                            .diagnostics(trail)
                            .build();
                }
                trail.add("light rejected: " + v.detail());
                lightFailure = new FetchException(v.reason(), "light rejected: " + v.detail());
            } catch (FetchException e) {
                trail.add("light failed: " + e.getReason() + " " + e.getMessage());
                lightFailure = e;
            }
        }

        // ---- 2) BROWSER ----
        if (browser == null) {
            FetchException fe = (lightFailure != null)
                    ? lightFailure
                    : new FetchException(FetchException.Reason.RENDER_FAILURE, "no browser transport configured");
            throw fe.withDiagnostics(trail);
        }

        LOG.info("Escalating to browser: {} ({})", url, trail.get(trail.size() - 1));
        SLOG.info("fetch-escalate", "url", url, "cause", trail.get(trail.size() - 1));

        long t0 = System.nanoTime();
        Duration timeout = (opts.timeout() != null)
                ? opts.timeout()
                : Duration.ofMillis(config.fetch().getBrowserTimeoutMs());
        BrowserTransport.RenderedPage page;
        try {
            page = browser.render(url, timeout);
        } catch (FetchException e) {
            trail.add("browser failed: " + e.getReason() + " " + e.getMessage());
            SLOG.warn("fetch-browser", "url", url, "ok", false, "reason", e.getReason());
            throw e.withDiagnostics(trail);
        }
        long ms = (System.nanoTime() - t0) / 1_000_000;

        // 렌더링 후에도 비-2xx거나 챌린지 페이지면 fetch 실패
        BlockDetector.Verdict rv = BlockDetector.inspectRendered(page.statusCode(), page.html());
        if (rv.rejected()) {
            trail.add("browser rejected: " + rv.detail());
            SLOG.warn("fetch-browser", "url", url, "ok", false, "reason", rv.reason(),
                    "status", page.statusCode(), "ms", ms);
            throw new FetchException(rv.reason(),
                    "browser rejected (" + rv.detail() + "): " + url, null, trail);
        }

        SLOG.info("fetch-browser", "url", url, "ok", true, "status", page.statusCode(),
                "bytes", page.html().length(), "ms", ms);
        if (capture) debug.save(url, Transport.BROWSER, page.html());
        trail.add("browser ok: status " + page.statusCode());

        return FetchResult.builder()
                .html(page.html())
                .finalUrl(page.finalUrl() != null ? page.finalUrl() : url)
                .transportUsed(Transport.BROWSER)
                .fetchedAt(Instant.now())
                .statusCode(page.statusCode())
                .diagnostics(trail)
                .build();
    }

    private boolean isKnownBlocked(String host) {
        for (String d : config.fetch().getKnownBlockedDomains()) {
            if (UrlUtils.hostMatches(host, d)) return true;
        }
        return false;
    }
}
