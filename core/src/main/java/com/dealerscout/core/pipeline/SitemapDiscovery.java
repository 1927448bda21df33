package com.dealerscout.core.pipeline;

import com.dealerscout.core.api.IFetcher;
import com.dealerscout.core.http.FetchException;
import com.dealerscout.core.model.FetchResult;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.jsoup.parser.Parser;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URI;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Set;

/**
 * 사이트맵에서 개별 위치 페이지(/locations/...)를 찾는다.
 *  - /sitemap-index.xml, 없으면 /sitemap.xml
 *  - "location"이 들어간 하위 사이트맵은 한 단계만 따라간다
 *  - 등장 순서 유지, 중복 제거, maxPages 상한
 * 가져오기 실패는 빈 목록으로 끝난다(배치 보조 경로라 원 실패를 덮지 않는다).
 */
public class SitemapDiscovery {

    private static final Logger LOG = LoggerFactory.getLogger(SitemapDiscovery.class);

    static final List<String> ROOT_SITEMAPS = List.of("/sitemap-index.xml", "/sitemap.xml");

    private final IFetcher fetcher;
    private final int maxPages;

    public SitemapDiscovery(IFetcher fetcher, int maxPages) {
        this.fetcher = Objects.requireNonNull(fetcher, "fetcher");
        this.maxPages = Math.max(1, maxPages);
    }

    public List<String> discover(String rootUrl) {
        String origin = originOf(rootUrl);
        if (origin == null) return List.of();

        for (String path : ROOT_SITEMAPS) {
            String sitemapUrl = origin + path;
            List<String> locs = fetchLocs(sitemapUrl);
            if (locs.isEmpty()) continue;

            Set<String> pages = new LinkedHashSet<>();
            collectPages(locs, pages);
            for (String child : locs) {
                if (pages.size() >= maxPages) break;
                if (isLocationSitemap(child)) collectPages(fetchLocs(child), pages);
            }

            List<String> out = new ArrayList<>(pages);
            if (out.size() > maxPages) out = out.subList(0, maxPages);
            LOG.info("Sitemap {} yielded {} location page(s)", sitemapUrl, out.size());
            return List.copyOf(out);
        }
        LOG.info("No usable sitemap found under {}", origin);
        return List.of();
    }

    private void collectPages(List<String> locs, Set<String> pages) {
        for (String u : locs) {
            if (pages.size() >= maxPages) return;
            if (isLocationPage(u)) pages.add(u);
        }
    }

    private List<String> fetchLocs(String sitemapUrl) {
        FetchResult r;
        try {
            r = fetcher.fetch(sitemapUrl);
        } catch (FetchException e) {
            LOG.debug("Sitemap fetch failed: {} ({} {})", sitemapUrl, e.getReason(), e.getMessage());
            return List.of();
        }
        return parseLocs(r.getHtml());
    }

    /** &lt;loc&gt; 값들(등장 순서) */
    static List<String> parseLocs(String xml) {
        if (xml == null || xml.isBlank()) return List.of();
        Document doc = Jsoup.parse(xml, "", Parser.xmlParser());
        List<String> out = new ArrayList<>();
        for (Element loc : doc.select("loc")) {
            String u = loc.text().trim();
            if (!u.isEmpty()) out.add(u);
        }
        return out;
    }

    static boolean isLocationPage(String u) {
        String l = u.toLowerCase(Locale.ROOT);
        return l.contains("/locations/") && !l.endsWith(".xml");
    }

    static boolean isLocationSitemap(String u) {
        String l = u.toLowerCase(Locale.ROOT);
        return l.endsWith(".xml") && l.contains("location");
    }

    static String originOf(String url) {
        try {
            URI u = URI.create(url.trim());
            if (u.getScheme() == null || u.getHost() == null) return null;
            return u.getScheme().toLowerCase(Locale.ROOT) + "://" + u.getHost()
                    + (u.getPort() > 0 ? ":" + u.getPort() : "");
        } catch (IllegalArgumentException e) {
            return null;
        }
    }
}
