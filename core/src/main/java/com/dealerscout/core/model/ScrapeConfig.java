package com.dealerscout.core.model;

import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Objects;

/**
 * 추출 설정 (scrape.yml 매핑 대상). 순수 설정 보관용.
 * 하위 섹션(fetch/normalize/sitemap/rules/llm)은 YAML의 같은 이름 섹션과 매핑된다.
 */
public final class ScrapeConfig {

    public static final String DEFAULT_USER_AGENT =
            "Mozilla/5.0 (Windows NT 10.0; Win64; x64) AppleWebKit/537.36 "
                    + "(KHTML, like Gecko) Chrome/120.0.0.0 Safari/537.36";

    /** YAML `fetch:` 섹션 */
    public static final class FetchCfg {
        private int browserTimeoutMs = 60_000;
        /** 네트워크 유휴 대기 상한. 초과해도 실패가 아니라 현재 DOM을 읽는다 */
        private int networkIdleTimeoutMs = 15_000;
        /** 이보다 짧은 LIGHT 응답 본문은 렌더링 필요로 간주 */
        private int minBodyBytes = 512;
        private boolean headless = true;
        private int viewportWidth = 1920;
        private int viewportHeight = 1080;
        /** 곧장 브라우저로 가는 호스트(접미사 매칭) */
        private List<String> knownBlockedDomains = List.of(
                "ancira.com", "albrechtauto.com", "allensamuels.com",
                "baliseauto.com", "bakermotorcompany.com", "bakerautogroup.com");
        private boolean debugCapture = false;
        private Path debugDir = Path.of("out", "debug");

        public int getBrowserTimeoutMs() { return browserTimeoutMs; }
        public FetchCfg setBrowserTimeoutMs(int v) { this.browserTimeoutMs = Math.max(1000, v); return this; }

        public int getNetworkIdleTimeoutMs() { return networkIdleTimeoutMs; }
        public FetchCfg setNetworkIdleTimeoutMs(int v) { this.networkIdleTimeoutMs = Math.max(0, v); return this; }

        public int getMinBodyBytes() { return minBodyBytes; }
        public FetchCfg setMinBodyBytes(int v) { this.minBodyBytes = Math.max(0, v); return this; }

        public boolean isHeadless() { return headless; }
        public FetchCfg setHeadless(boolean v) { this.headless = v; return this; }

        public int getViewportWidth() { return viewportWidth; }
        public FetchCfg setViewportWidth(int v) { this.viewportWidth = v; return this; }

        public int getViewportHeight() { return viewportHeight; }
        public FetchCfg setViewportHeight(int v) { this.viewportHeight = v; return this; }

        public List<String> getKnownBlockedDomains() { return knownBlockedDomains; }
        public FetchCfg setKnownBlockedDomains(List<String> v) {
            this.knownBlockedDomains = (v == null) ? List.of() : List.copyOf(v);
            return this;
        }

        public boolean isDebugCapture() { return debugCapture; }
        public FetchCfg setDebugCapture(boolean v) { this.debugCapture = v; return this; }

        public Path getDebugDir() { return debugDir; }
        public FetchCfg setDebugDir(Path v) { this.debugDir = v; return this; }
    }

    /** YAML `normalize:` 섹션 */
    public static final class NormalizeCfg {
        /** 단일 브랜드 사이트로 알려진 도메인. 브랜드 단서가 없을 때 FRANCHISED 기본값 판단에 쓴다 */
        private List<String> singleBrandDomains = List.of();

        public List<String> getSingleBrandDomains() { return singleBrandDomains; }
        public NormalizeCfg setSingleBrandDomains(List<String> v) {
            this.singleBrandDomains = (v == null) ? List.of() : List.copyOf(v);
            return this;
        }
    }

    /** YAML `sitemap:` 섹션 */
    public static final class SitemapCfg {
        private boolean enabled = true;
        private int maxPages = 500;

        public boolean isEnabled() { return enabled; }
        public SitemapCfg setEnabled(boolean v) { this.enabled = v; return this; }

        public int getMaxPages() { return maxPages; }
        public SitemapCfg setMaxPages(int v) { this.maxPages = Math.max(1, v); return this; }
    }

    /** YAML `rules:` 섹션 */
    public static final class RulesCfg {
        /** null이면 학습 규칙 없이 동작 */
        private Path path;

        public Path getPath() { return path; }
        public RulesCfg setPath(Path v) { this.path = v; return this; }
    }

    /** YAML `llm:` 섹션 */
    public static final class LlmCfg {
        private boolean enabled = false;
        private String model = "gpt-4o-mini";
        private String endpoint = "https://api.openai.com/v1/chat/completions";
        private String apiKeyEnv = "OPENAI_API_KEY";
        private int maxHtmlChars = 60_000;
        private int timeoutMs = 60_000;

        public boolean isEnabled() { return enabled; }
        public LlmCfg setEnabled(boolean v) { this.enabled = v; return this; }

        public String getModel() { return model; }
        public LlmCfg setModel(String v) { this.model = v; return this; }

        public String getEndpoint() { return endpoint; }
        public LlmCfg setEndpoint(String v) { this.endpoint = v; return this; }

        public String getApiKeyEnv() { return apiKeyEnv; }
        public LlmCfg setApiKeyEnv(String v) { this.apiKeyEnv = v; return this; }

        public int getMaxHtmlChars() { return maxHtmlChars; }
        public LlmCfg setMaxHtmlChars(int v) { this.maxHtmlChars = Math.max(1000, v); return this; }

        public int getTimeoutMs() { return timeoutMs; }
        public LlmCfg setTimeoutMs(int v) { this.timeoutMs = Math.max(1000, v); return this; }
    }

    // ---------- 기본 필드 ----------
    private Duration timeout = Duration.ofSeconds(30); // LIGHT 요청 타임아웃
    private int concurrency = 4;                       // 배치 워커 수
    private String userAgent = DEFAULT_USER_AGENT;
    private Path outputDir = Path.of("out");

    private final FetchCfg fetch = new FetchCfg();
    private final NormalizeCfg normalize = new NormalizeCfg();
    private final SitemapCfg sitemap = new SitemapCfg();
    private final RulesCfg rules = new RulesCfg();
    private final LlmCfg llm = new LlmCfg();

    // ---------- getters ----------
    public Duration getTimeout() { return timeout; }
    public long getTimeoutMs() { return timeout.toMillis(); }
    public int getConcurrency() { return concurrency; }
    public String getUserAgent() { return userAgent; }
    public Path getOutputDir() { return outputDir; }

    public FetchCfg fetch() { return fetch; }
    public NormalizeCfg normalize() { return normalize; }
    public SitemapCfg sitemap() { return sitemap; }
    public RulesCfg rules() { return rules; }
    public LlmCfg llm() { return llm; }

    // ---------- fluent setters ----------
    public ScrapeConfig setTimeout(Duration timeout) { this.timeout = timeout; return this; }
    public ScrapeConfig setTimeoutMs(long ms) {
        this.timeout = Duration.ofMillis(Math.max(1, ms));
        return this;
    }
    public ScrapeConfig setConcurrency(int concurrency) { this.concurrency = Math.max(1, concurrency); return this; }
    public ScrapeConfig setUserAgent(String userAgent) { this.userAgent = userAgent; return this; }
    public ScrapeConfig setOutputDir(Path outputDir) { this.outputDir = outputDir; return this; }

    // ---------- validate ----------
    public void validate() {
        if (timeout == null || timeout.isNegative() || timeout.isZero())
            throw new IllegalArgumentException("timeout must be > 0");
        if (concurrency < 1) throw new IllegalArgumentException("concurrency must be >= 1");
        if (userAgent == null || userAgent.isBlank())
            throw new IllegalArgumentException("userAgent must not be blank");
        Objects.requireNonNull(outputDir, "outputDir");

        if (fetch.getBrowserTimeoutMs() < 1000)
            throw new IllegalArgumentException("fetch.browserTimeoutMs must be >= 1000");
        if (fetch.getNetworkIdleTimeoutMs() > fetch.getBrowserTimeoutMs())
            throw new IllegalArgumentException("fetch.networkIdleTimeoutMs must be <= fetch.browserTimeoutMs");
        if (fetch.getViewportWidth() < 1 || fetch.getViewportHeight() < 1)
            throw new IllegalArgumentException("fetch viewport must be positive");
        if (fetch.isDebugCapture()) Objects.requireNonNull(fetch.getDebugDir(), "fetch.debugDir");

        if (llm.isEnabled()) {
            if (llm.getEndpoint() == null || llm.getEndpoint().isBlank())
                throw new IllegalArgumentException("llm.endpoint must not be blank when llm.enabled");
            if (llm.getModel() == null || llm.getModel().isBlank())
                throw new IllegalArgumentException("llm.model must not be blank when llm.enabled");
        }
    }

    // ---------- helpers ----------
    public static ScrapeConfig defaults() { return new ScrapeConfig(); }
}
