package com.dealerscout.core.http;

import com.dealerscout.core.model.ScrapeConfig;
import com.microsoft.playwright.Browser;
import com.microsoft.playwright.BrowserContext;
import com.microsoft.playwright.BrowserType;
import com.microsoft.playwright.Page;
import com.microsoft.playwright.Playwright;
import com.microsoft.playwright.PlaywrightException;
import com.microsoft.playwright.Response;
import com.microsoft.playwright.TimeoutError;
import com.microsoft.playwright.options.LoadState;
import com.microsoft.playwright.options.WaitUntilState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * Playwright(헤드리스 Chromium) 렌더링 전송.
 *  - 호출마다 Playwright/Browser/Context를 열고 try-with-resources로 반드시 닫는다
 *  - DOMCONTENTLOADED까지 이동 후 NETWORKIDLE을 상한 시간만큼 기다린다(초과는 허용)
 *  - navigator.webdriver 숨김 + 실제 브라우저와 같은 UA/뷰포트
 */
public class PlaywrightBrowserTransport implements BrowserTransport {

    private static final Logger LOG = LoggerFactory.getLogger(PlaywrightBrowserTransport.class);

    private static final List<String> LAUNCH_ARGS = List.of(
            "--disable-blink-features=AutomationControlled",
            "--no-sandbox",
            "--disable-dev-shm-usage");

    private static final String STEALTH_SCRIPT =
            "Object.defineProperty(navigator, 'webdriver', { get: () => undefined });";

    private final ScrapeConfig config;

    public PlaywrightBrowserTransport(ScrapeConfig config) {
        this.config = Objects.requireNonNull(config, "config");
    }

    @Override
    public RenderedPage render(String url, Duration timeout) throws FetchException {
        Objects.requireNonNull(url, "url");
        var fc = config.fetch();
        double navTimeoutMs = (timeout != null) ? timeout.toMillis() : fc.getBrowserTimeoutMs();

        try (Playwright pw = Playwright.create();
             Browser browser = pw.chromium().launch(new BrowserType.LaunchOptions()
                     .setHeadless(fc.isHeadless())
                     .setArgs(LAUNCH_ARGS));
             BrowserContext ctx = browser.newContext(new Browser.NewContextOptions()
                     .setUserAgent(config.getUserAgent())
                     .setViewportSize(fc.getViewportWidth(), fc.getViewportHeight())
                     .setLocale("en-US"))) {

            ctx.addInitScript(STEALTH_SCRIPT);
            Page page = ctx.newPage();

            Response resp = page.navigate(url, new Page.NavigateOptions()
                    .setWaitUntil(WaitUntilState.DOMCONTENTLOADED)
                    .setTimeout(navTimeoutMs));

            // 네트워크 유휴는 best-effort: 채팅 위젯 등으로 끝나지 않는 페이지가 많다
            if (fc.getNetworkIdleTimeoutMs() > 0) {
                try {
                    page.waitForLoadState(LoadState.NETWORKIDLE,
                            new Page.WaitForLoadStateOptions().setTimeout((double) fc.getNetworkIdleTimeoutMs()));
                } catch (TimeoutError te) {
                    LOG.debug("Network idle not reached within {}ms: {}", fc.getNetworkIdleTimeoutMs(), url);
                }
            }

            String html = page.content();
            int status = (resp != null) ? resp.status() : 0;
            return new RenderedPage(html == null ? "" : html, page.url(), status);

        } catch (TimeoutError e) {
            throw new FetchException(FetchException.Reason.TIMEOUT, "browser timeout: " + url, e);
        } catch (PlaywrightException e) {
            throw classify(url, e);
        }
    }

    /** Chromium 네트워크 오류 코드 기준 분류 */
    static FetchException classify(String url, PlaywrightException e) {
        String msg = String.valueOf(e.getMessage()).toUpperCase(Locale.ROOT);
        if (msg.contains("ERR_NAME_NOT_RESOLVED") || msg.contains("ERR_NAME_RESOLUTION_FAILED")) {
            return new FetchException(FetchException.Reason.DNS, "unresolved host: " + url, e);
        }
        if (msg.contains("ERR_TIMED_OUT") || msg.contains("TIMEOUT")) {
            return new FetchException(FetchException.Reason.TIMEOUT, "browser timeout: " + url, e);
        }
        if (msg.contains("ERR_CONNECTION") || msg.contains("ERR_HTTP")) {
            return new FetchException(FetchException.Reason.HTTP_ERROR, "browser connection failed: " + url, e);
        }
        return new FetchException(FetchException.Reason.RENDER_FAILURE,
                "render failed: " + url + " (" + e.getMessage() + ")", e);
    }
}
