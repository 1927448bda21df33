package com.dealerscout.core.util;

import java.net.URI;
import java.net.URISyntaxException;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/** URL 검증/호스트 추출/추적 파라미터 제거 유틸 */
public final class UrlUtils {
    private UrlUtils(){}

    /** 광고/분석용 추적 쿼리 파라미터. utm_ 계열은 접두사로 판정 */
    private static final Set<String> TRACKING_PARAMS = Set.of(
            "gclid", "fbclid", "msclkid", "mc_cid", "mc_eid", "_ga", "_gl", "dclid", "yclid");

    /** http/https 절대 URL이고 host가 있으면 true */
    public static boolean isHttpUrl(String url) {
        if (url == null || url.isBlank()) return false;
        try {
            URI u = new URI(url.trim());
            String s = u.getScheme();
            if (s == null) return false;
            if (!s.equalsIgnoreCase("http") && !s.equalsIgnoreCase("https")) return false;
            return u.getHost() != null && !u.getHost().isBlank();
        } catch (URISyntaxException e) {
            return false;
        }
    }

    /** 소문자 host. 파싱 실패 시 "" */
    public static String hostOf(String url) {
        if (url == null) return "";
        try {
            String h = new URI(url.trim()).getHost();
            return h == null ? "" : h.toLowerCase(Locale.ROOT);
        } catch (URISyntaxException e) {
            return "";
        }
    }

    /** 선행 "www." 제거 */
    public static String stripWww(String host) {
        if (host == null) return null;
        String h = host.toLowerCase(Locale.ROOT);
        return h.startsWith("www.") ? h.substring(4) : h;
    }

    /** host가 도메인 자체이거나 그 하위 도메인이면 true */
    public static boolean hostMatches(String host, String domain) {
        if (host == null || domain == null || domain.isBlank()) return false;
        String h = host.toLowerCase(Locale.ROOT);
        String d = domain.toLowerCase(Locale.ROOT).trim();
        return h.equals(d) || h.endsWith("." + d);
    }

    /** base 기준 상대 링크 해석. 실패하면 null */
    public static String resolve(String base, String href) {
        if (href == null || href.isBlank()) return null;
        String h = href.trim();
        try {
            if (h.startsWith("//")) {
                String scheme = (base != null && base.startsWith("http://")) ? "http:" : "https:";
                return new URI(scheme + h).toString();
            }
            URI ref = new URI(h);
            if (ref.isAbsolute()) return ref.toString();
            if (base == null) return null;
            return new URI(base.trim()).resolve(ref).toString();
        } catch (URISyntaxException | IllegalArgumentException e) {
            return null;
        }
    }

    /** 스킴이 없는 "example.com/x" 형태에 https:// 를 붙인다 */
    public static String ensureScheme(String url) {
        if (url == null) return null;
        String u = url.trim();
        if (u.isEmpty()) return null;
        String lower = u.toLowerCase(Locale.ROOT);
        if (lower.startsWith("http://") || lower.startsWith("https://")) return u;
        if (u.startsWith("//")) return "https:" + u;
        return "https://" + u;
    }

    /**
     * 추적 파라미터(utm_*, gclid, fbclid 등)와 fragment를 제거한다.
     * 남은 파라미터 순서는 유지. 파싱할 수 없으면 원본 반환.
     */
    public static String stripTrackingParams(String url) {
        if (url == null) return null;
        try {
            URI u = new URI(url.trim());
            String q = u.getRawQuery();
            String kept = null;
            if (q != null && !q.isEmpty()) {
                List<String> out = new ArrayList<>();
                for (String part : q.split("&")) {
                    if (part.isEmpty()) continue;
                    int eq = part.indexOf('=');
                    String key = (eq < 0 ? part : part.substring(0, eq)).toLowerCase(Locale.ROOT);
                    if (key.startsWith("utm_") || TRACKING_PARAMS.contains(key)) continue;
                    out.add(part);
                }
                kept = out.isEmpty() ? null : String.join("&", out);
            }
            StringBuilder sb = new StringBuilder();
            if (u.getScheme() != null) sb.append(u.getScheme()).append(':');
            if (u.getRawAuthority() != null) sb.append("//").append(u.getRawAuthority());
            if (u.getRawPath() != null) sb.append(u.getRawPath());
            if (kept != null) sb.append('?').append(kept);
            return sb.toString();
        } catch (URISyntaxException e) {
            return url.trim();
        }
    }
}
