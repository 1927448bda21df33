package com.dealerscout.core.http;

import com.dealerscout.core.model.FetchResult;
import com.dealerscout.core.model.ScrapeConfig;
import com.dealerscout.core.model.Transport;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.net.ConnectException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

class FetcherTest {

    private static final String PAGE = "<html><body>" + "<p>Springfield Toyota, 123 Main St</p>".repeat(30) + "</body></html>";
    private static final String URL = "https://www.example-group.com/locations";

    /** 렌더링 호출 횟수를 세는 가짜 브라우저 */
    static final class FakeBrowser implements BrowserTransport {
        final AtomicInteger calls = new AtomicInteger();
        final String html;
        final int status;
        FetchException failure;

        FakeBrowser(String html, int status) {
            this.html = html;
            this.status = status;
        }

        @Override
        public RenderedPage render(String url, Duration timeout) throws FetchException {
            calls.incrementAndGet();
            if (failure != null) throw failure;
            return new RenderedPage(html, url, status);
        }
    }

    private static ScrapeConfig cfg() {
        return new ScrapeConfig();
    }

    private static LightTransport light(ScrapeConfig cfg, int status, String body, List<String> sent) {
        return new LightTransport(cfg, req -> {
            sent.add(req.uri().toString());
            return new StubHttpResponse(status, body, req);
        });
    }

    @Test
    void light_ok_does_not_touch_browser() throws Exception {
        var cfg = cfg();
        List<String> sent = new ArrayList<>();
        var browser = new FakeBrowser("<html>rendered</html>", 200);

        FetchResult r = new Fetcher(cfg, light(cfg, 200, PAGE, sent), browser).fetch(URL);

        assertEquals(Transport.LIGHT, r.getTransportUsed());
        assertEquals(200, r.getStatusCode());
        assertEquals(PAGE, r.getHtml());
        assertEquals(0, browser.calls.get());
        assertThat(sent).containsExactly(URL);
        assertThat(r.getDiagnostics()).contains("light ok: status 200");
    }

    @Test
    @DisplayName("403 → 같은 URL을 브라우저로 다시 가져온다")
    void blocked_status_escalates_to_browser() throws Exception {
        var cfg = cfg();
        var browser = new FakeBrowser(PAGE, 200);

        FetchResult r = new Fetcher(cfg, light(cfg, 403, "Forbidden", new ArrayList<>()), browser).fetch(URL);

        assertEquals(Transport.BROWSER, r.getTransportUsed());
        assertEquals(1, browser.calls.get());
        assertThat(r.getDiagnostics())
                .anyMatch(d -> d.startsWith("light rejected: blocking status 403"))
                .contains("browser ok: status 200");
    }

    @Test
    void challenge_page_with_200_escalates() throws Exception {
        var cfg = cfg();
        String challenge = "<html><head><title>Just a moment...</title></head><body>"
                + "x".repeat(2000) + "</body></html>";
        var browser = new FakeBrowser(PAGE, 200);

        FetchResult r = new Fetcher(cfg, light(cfg, 200, challenge, new ArrayList<>()), browser).fetch(URL);

        assertEquals(Transport.BROWSER, r.getTransportUsed());
        assertThat(r.getDiagnostics()).anyMatch(d -> d.contains("challenge marker"));
    }

    @Test
    void short_body_escalates() throws Exception {
        var cfg = cfg();
        var browser = new FakeBrowser(PAGE, 200);

        FetchResult r = new Fetcher(cfg, light(cfg, 200, "<html></html>", new ArrayList<>()), browser).fetch(URL);

        assertEquals(Transport.BROWSER, r.getTransportUsed());
        assertThat(r.getDiagnostics()).anyMatch(d -> d.contains("body too small"));
    }

    @Test
    void connection_failure_escalates() throws Exception {
        var cfg = cfg();
        var lt = new LightTransport(cfg, req -> { throw new ConnectException("refused"); });
        var browser = new FakeBrowser(PAGE, 200);

        FetchResult r = new Fetcher(cfg, lt, browser).fetch(URL);

        assertEquals(Transport.BROWSER, r.getTransportUsed());
        assertThat(r.getDiagnostics()).anyMatch(d -> d.startsWith("light failed: HTTP_ERROR"));
    }

    @Test
    void force_browser_skips_light() throws Exception {
        var cfg = cfg();
        List<String> sent = new ArrayList<>();
        var browser = new FakeBrowser(PAGE, 200);

        FetchResult r = new Fetcher(cfg, light(cfg, 200, PAGE, sent), browser)
                .fetch(URL, FetchOptions.defaults().withForceBrowser(true));

        assertEquals(Transport.BROWSER, r.getTransportUsed());
        assertThat(sent).isEmpty();
        assertThat(r.getDiagnostics()).contains("light skipped: browser forced");
    }

    @Test
    void known_blocked_domain_goes_straight_to_browser() throws Exception {
        var cfg = cfg();
        cfg.fetch().setKnownBlockedDomains(List.of("example-group.com"));
        List<String> sent = new ArrayList<>();
        var browser = new FakeBrowser(PAGE, 200);

        FetchResult r = new Fetcher(cfg, light(cfg, 200, PAGE, sent), browser).fetch(URL);

        assertEquals(Transport.BROWSER, r.getTransportUsed());
        assertThat(sent).isEmpty();
        assertThat(r.getDiagnostics()).anyMatch(d -> d.startsWith("light skipped: known blocked domain"));
    }

    @Test
    void no_browser_rethrows_light_failure_with_trail() {
        var cfg = cfg();
        var f = new Fetcher(cfg, light(cfg, 403, "Forbidden", new ArrayList<>()), null);

        FetchException e = assertThrows(FetchException.class, () -> f.fetch(URL));
        assertEquals(FetchException.Reason.BLOCKED, e.getReason());
        assertThat(e.getDiagnostics()).anyMatch(d -> d.startsWith("light rejected"));
    }

    @Test
    void browser_failure_carries_both_steps() {
        var cfg = cfg();
        var browser = new FakeBrowser(PAGE, 200);
        browser.failure = new FetchException(FetchException.Reason.TIMEOUT, "browser timeout: " + URL);
        var f = new Fetcher(cfg, light(cfg, 503, "busy", new ArrayList<>()), browser);

        FetchException e = assertThrows(FetchException.class, () -> f.fetch(URL));
        assertEquals(FetchException.Reason.TIMEOUT, e.getReason());
        assertThat(e.getDiagnostics()).hasSize(2);
        assertThat(e.getDiagnostics().get(1)).startsWith("browser failed: TIMEOUT");
    }

    @Test
    void challenge_after_rendering_is_blocked() {
        var cfg = cfg();
        var browser = new FakeBrowser("<html><div id=\"px-captcha\"></div></html>", 403);
        var f = new Fetcher(cfg, light(cfg, 403, "Forbidden", new ArrayList<>()), browser);

        FetchException e = assertThrows(FetchException.class, () -> f.fetch(URL));
        assertEquals(FetchException.Reason.BLOCKED, e.getReason());
    }

    @Test
    @DisplayName("브라우저도 403이면 BLOCKED로 실패한다")
    void browser_403_is_blocked() {
        var cfg = cfg();
        var browser = new FakeBrowser("<html>Forbidden</html>", 403);
        var f = new Fetcher(cfg, light(cfg, 403, "Forbidden", new ArrayList<>()), browser);

        FetchException e = assertThrows(FetchException.class, () -> f.fetch(URL));
        assertEquals(FetchException.Reason.BLOCKED, e.getReason());
        assertThat(e.getDiagnostics()).anyMatch(d -> d.startsWith("browser rejected: blocking status 403"));
    }

    @Test
    void browser_500_is_http_error() {
        var cfg = cfg();
        var browser = new FakeBrowser(PAGE, 500);
        var f = new Fetcher(cfg, light(cfg, 403, "Forbidden", new ArrayList<>()), browser);

        FetchException e = assertThrows(FetchException.class, () -> f.fetch(URL));
        assertEquals(FetchException.Reason.HTTP_ERROR, e.getReason());
    }

    @Test
    void browser_challenge_with_200_is_blocked() {
        var cfg = cfg();
        String challenge = "<html><head><title>Just a moment...</title></head><body></body></html>";
        var browser = new FakeBrowser(challenge, 200);
        var f = new Fetcher(cfg, light(cfg, 403, "Forbidden", new ArrayList<>()), browser);

        FetchException e = assertThrows(FetchException.class, () -> f.fetch(URL));
        assertEquals(FetchException.Reason.BLOCKED, e.getReason());
        assertThat(e.getDiagnostics()).anyMatch(d -> d.contains("challenge marker"));
    }

    @Test
    @DisplayName("status를 모르는(0) 렌더링 결과는 짧아도 받아들인다")
    void browser_unknown_status_is_accepted() throws Exception {
        var cfg = cfg();
        var browser = new FakeBrowser("<html>ok</html>", 0);

        FetchResult r = new Fetcher(cfg, light(cfg, 403, "Forbidden", new ArrayList<>()), browser).fetch(URL);

        assertEquals(Transport.BROWSER, r.getTransportUsed());
        assertEquals("<html>ok</html>", r.getHtml());
    }

    @Test
    void rejects_non_http_url() {
        var cfg = cfg();
        var f = new Fetcher(cfg, light(cfg, 200, PAGE, new ArrayList<>()), null);
        assertThrows(IllegalArgumentException.class, () -> f.fetch("ftp://example.com/file"));
    }
}
