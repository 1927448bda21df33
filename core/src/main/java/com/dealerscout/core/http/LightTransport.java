package com.dealerscout.core.http;

import com.dealerscout.core.model.ScrapeConfig;

import java.io.IOException;
import java.net.ConnectException;
import java.net.URI;
import java.net.UnknownHostException;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.nio.channels.UnresolvedAddressException;
import java.time.Duration;
import java.util.Objects;

/** 스크립트를 실행하지 않는 단순 HTTP GET 전송. 실제 브라우저와 비슷한 헤더 세트를 보낸다 */
public class LightTransport {

    /** 테스트/모킹용 송신 훅 */
    @FunctionalInterface
    public interface HttpSender {
        HttpResponse<String> send(HttpRequest req) throws Exception;
    }

    /** LIGHT 응답 요약 */
    public record LightResponse(int statusCode, String body, String finalUrl) {}

    private final ScrapeConfig config;
    private final HttpClient client;   // 프로덕션 경로
    private final HttpSender sender;   // 테스트 경로(있으면 이걸 사용)

    public LightTransport(ScrapeConfig config) {
        this.config = Objects.requireNonNull(config, "config");
        this.client = HttpClient.newBuilder()
                .followRedirects(HttpClient.Redirect.NORMAL)
                .connectTimeout(config.getTimeout())
                .build();
        this.sender = null; // 기본은 HttpClient 사용
    }

    /** 테스트용 생성자(송신 훅 주입) */
    public LightTransport(ScrapeConfig config, HttpSender testSender) {
        this.config = Objects.requireNonNull(config, "config");
        this.client = null; // 테스트에선 사용 안 함
        this.sender = Objects.requireNonNull(testSender, "testSender");
    }

    /**
     * GET 요청. 상태코드와 무관하게 응답을 돌려주고,
     * 연결 자체가 실패한 경우에만 FetchException(TIMEOUT/DNS/HTTP_ERROR)을 던진다.
     */
    public LightResponse get(String url, Duration timeout) throws FetchException {
        Objects.requireNonNull(url, "url");
        Duration t = (timeout != null) ? timeout : config.getTimeout();
        HttpRequest req = HttpRequest.newBuilder(URI.create(url))
                .timeout(t)
                .header("User-Agent", config.getUserAgent())
                .header("Accept", "text/html,application/xhtml+xml,application/xml;q=0.9,image/avif,image/webp,*/*;q=0.8")
                .header("Accept-Language", "en-US,en;q=0.9")
                .header("Cache-Control", "max-age=0")
                .header("Upgrade-Insecure-Requests", "1")
                .header("Sec-Fetch-Dest", "document")
                .header("Sec-Fetch-Mode", "navigate")
                .header("Sec-Fetch-Site", "none")
                .header("Sec-Fetch-User", "?1")
                .GET()
                .build();
        try {
            HttpResponse<String> resp = (sender != null)
                    ? sender.send(req)
                    : client.send(req, HttpResponse.BodyHandlers.ofString());

            String finalUrl = (resp.uri() != null) ? resp.uri().toString() : url;
            return new LightResponse(resp.statusCode(), resp.body() == null ? "" : resp.body(), finalUrl);
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            throw new FetchException(FetchException.Reason.TIMEOUT, "interrupted: " + url, ie);
        } catch (Exception e) {
            throw classify(url, e);
        }
    }

    /** 전송 예외를 FetchException 사유로 분류 */
    static FetchException classify(String url, Throwable e) {
        Throwable root = e;
        for (Throwable c = e; c != null; c = c.getCause()) {
            if (c instanceof HttpTimeoutException) {
                return new FetchException(FetchException.Reason.TIMEOUT, "timeout: " + url, e);
            }
            if (c instanceof UnknownHostException || c instanceof UnresolvedAddressException) {
                return new FetchException(FetchException.Reason.DNS, "unresolved host: " + url, e);
            }
            root = c;
        }
        if (root instanceof ConnectException || root instanceof IOException) {
            return new FetchException(FetchException.Reason.HTTP_ERROR,
                    "connection failed: " + url + " (" + root + ")", e);
        }
        return new FetchException(FetchException.Reason.HTTP_ERROR, "request failed: " + url + " (" + e + ")", e);
    }
}
