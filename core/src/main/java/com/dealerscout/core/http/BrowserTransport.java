package com.dealerscout.core.http;

import java.time.Duration;

/**
 * 스크립트를 실행하는 렌더링 전송. 비용이 크므로 LIGHT 실패 시에만 쓴다.
 * 구현체는 호출마다 렌더링 컨텍스트를 얻고, 모든 종료 경로에서 반납해야 한다.
 */
public interface BrowserTransport {

    /** 렌더링된 DOM. status를 알 수 없으면 0 */
    record RenderedPage(String html, String finalUrl, int statusCode) {}

    RenderedPage render(String url, Duration timeout) throws FetchException;
}
