package com.dealerscout.core.http;

import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * LIGHT 응답을 그대로 쓸 수 있는지 판정.
 * 봇 차단 상태코드/챌린지 마커, 비-2xx, 너무 짧은 본문이면 브라우저 렌더링이 필요하다.
 */
public final class BlockDetector {
    private BlockDetector() {}

    static final Set<Integer> BLOCK_STATUSES = Set.of(403, 429, 503);

    /** 챌린지 페이지 식별 문자열(소문자). 본문 앞부분에서만 찾는다 */
    static final List<String> CHALLENGE_MARKERS = List.of(
            "cf-browser-verification",
            "cf-chl-",
            "<title>just a moment...</title>",
            "attention required! | cloudflare",
            "_incapsula_resource",
            "request unsuccessful. incapsula",
            "px-captcha",
            "<title>access denied</title>",
            "distil_r_captcha");

    private static final int MARKER_SCAN_CHARS = 16_384;

    /** 판정 결과: rejected=false면 사용 가능 */
    public record Verdict(boolean rejected, FetchException.Reason reason, String detail) {
        static final Verdict OK = new Verdict(false, null, "ok");
    }

    public static Verdict inspect(int status, String body, int minBodyBytes) {
        String b = (body == null) ? "" : body;

        if (BLOCK_STATUSES.contains(status)) {
            return new Verdict(true, FetchException.Reason.BLOCKED, "blocking status " + status);
        }
        if (status < 200 || status > 299) {
            return new Verdict(true, FetchException.Reason.HTTP_ERROR, "status " + status);
        }
        String marker = challengeMarker(b);
        if (marker != null) {
            return new Verdict(true, FetchException.Reason.BLOCKED, "challenge marker '" + marker + "'");
        }
        if (b.length() < minBodyBytes) {
            return new Verdict(true, FetchException.Reason.HTTP_ERROR,
                    "body too small (" + b.length() + " < " + minBodyBytes + ")");
        }
        return Verdict.OK;
    }

    /**
     * 렌더링된 페이지 판정. 본문 길이는 보지 않는다.
     * status 0(알 수 없음)은 2xx로 취급하고 마커만 본다.
     */
    public static Verdict inspectRendered(int status, String body) {
        return inspect(status == 0 ? 200 : status, body, 0);
    }

    /** 발견된 챌린지 마커, 없으면 null */
    public static String challengeMarker(String body) {
        if (body == null || body.isEmpty()) return null;
        String head = body.length() > MARKER_SCAN_CHARS ? body.substring(0, MARKER_SCAN_CHARS) : body;
        String lower = head.toLowerCase(Locale.ROOT);
        for (String m : CHALLENGE_MARKERS) {
            if (lower.contains(m)) return m;
        }
        return null;
    }
}
