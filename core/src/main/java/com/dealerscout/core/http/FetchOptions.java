package com.dealerscout.core.http;

import java.time.Duration;

/**
 * fetch 호출 옵션.
 * timeout이 null이면 설정(ScrapeConfig)의 전송별 기본값을 쓴다.
 */
public record FetchOptions(boolean forceBrowser, Duration timeout, boolean debugCapture) {

    private static final FetchOptions DEFAULTS = new FetchOptions(false, null, false);

    public static FetchOptions defaults() { return DEFAULTS; }

    public FetchOptions withForceBrowser(boolean v) { return new FetchOptions(v, timeout, debugCapture); }

    public FetchOptions withTimeout(Duration v) { return new FetchOptions(forceBrowser, v, debugCapture); }

    public FetchOptions withDebugCapture(boolean v) { return new FetchOptions(forceBrowser, timeout, v); }
}
