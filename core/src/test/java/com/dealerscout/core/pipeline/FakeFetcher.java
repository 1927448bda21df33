package com.dealerscout.core.pipeline;

import com.dealerscout.core.api.IFetcher;
import com.dealerscout.core.http.FetchException;
import com.dealerscout.core.http.FetchOptions;
import com.dealerscout.core.model.FetchResult;
import com.dealerscout.core.model.Transport;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * 네트워크 없이 URL → HTML 맵으로 응답하는 fetcher.
 *  - light에 있으면 LIGHT로 응답
 *  - light에 없고 browser에 있으면 "승격된" BROWSER로 응답
 *  - forceBrowser면 browser 맵만 본다
 */
final class FakeFetcher implements IFetcher {
    final Map<String, String> light = new HashMap<>();
    final Map<String, String> browser = new HashMap<>();
    final List<String> calls = Collections.synchronizedList(new ArrayList<>());
    FetchException failure;
    RuntimeException crash;
    boolean closed;

    FakeFetcher light(String url, String html) { light.put(url, html); return this; }
    FakeFetcher browser(String url, String html) { browser.put(url, html); return this; }

    @Override
    public FetchResult fetch(String url, FetchOptions options) throws FetchException {
        boolean force = options != null && options.forceBrowser();
        calls.add((force ? "BROWSER " : "LIGHT ") + url);
        if (crash != null) throw crash;
        if (failure != null) throw failure;

        if (!force && light.containsKey(url)) {
            return result(url, light.get(url), Transport.LIGHT);
        }
        if (browser.containsKey(url)) {
            return result(url, browser.get(url), Transport.BROWSER);
        }
        throw new FetchException(force ? FetchException.Reason.RENDER_FAILURE : FetchException.Reason.HTTP_ERROR,
                "no page for " + url, null, List.of("fake: no page"));
    }

    long browserCalls() {
        synchronized (calls) {
            return calls.stream().filter(c -> c.startsWith("BROWSER ")).count();
        }
    }

    private static FetchResult result(String url, String html, Transport t) {
        return FetchResult.builder()
                .html(html)
                .finalUrl(url)
                .transportUsed(t)
                .statusCode(200)
                .diagnostics(List.of("fake " + t))
                .build();
    }

    @Override
    public void close() {
        closed = true;
    }
}
