package com.dealerscout.core.pipeline;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

class SitemapDiscoveryTest {

    private static final String ORIGIN = "https://dealers.example.com";

    private static String urlset(String... locs) {
        StringBuilder sb = new StringBuilder("<urlset xmlns=\"http://www.sitemaps.org/schemas/sitemap/0.9\">");
        for (String l : locs) sb.append("<url><loc> ").append(l).append(" </loc></url>");
        return sb.append("</urlset>").toString();
    }

    @Test
    void index_is_preferred_and_location_pages_are_filtered() {
        FakeFetcher f = new FakeFetcher()
                .light(ORIGIN + "/sitemap-index.xml", urlset(
                        ORIGIN + "/about",
                        ORIGIN + "/locations/a",
                        ORIGIN + "/locations/b",
                        ORIGIN + "/locations/a"))
                .light(ORIGIN + "/sitemap.xml", urlset(ORIGIN + "/locations/never"));

        List<String> pages = new SitemapDiscovery(f, 10).discover(ORIGIN + "/our-stores?x=1");

        assertThat(pages).containsExactly(ORIGIN + "/locations/a", ORIGIN + "/locations/b");
        assertThat(f.calls).containsExactly("LIGHT " + ORIGIN + "/sitemap-index.xml");
    }

    @Test
    void max_pages_caps_the_result() {
        FakeFetcher f = new FakeFetcher()
                .light(ORIGIN + "/sitemap.xml", urlset(ORIGIN + "/location-sitemap.xml"))
                .light(ORIGIN + "/location-sitemap.xml", urlset(
                        ORIGIN + "/locations/1", ORIGIN + "/locations/2", ORIGIN + "/locations/3"));

        assertThat(new SitemapDiscovery(f, 2).discover(ORIGIN))
                .containsExactly(ORIGIN + "/locations/1", ORIGIN + "/locations/2");
    }

    @Test
    void unreachable_sitemaps_yield_nothing() {
        FakeFetcher f = new FakeFetcher();
        assertThat(new SitemapDiscovery(f, 10).discover(ORIGIN)).isEmpty();
        assertThat(new SitemapDiscovery(f, 10).discover("not a url")).isEmpty();
    }

    @Test
    void helpers() {
        assertEquals(List.of("https://a/1", "https://a/2"),
                SitemapDiscovery.parseLocs("<urlset><url><loc>https://a/1</loc></url><url><loc>https://a/2</loc></url></urlset>"));
        assertTrue(SitemapDiscovery.parseLocs("  ").isEmpty());

        assertTrue(SitemapDiscovery.isLocationPage("https://x.com/Locations/springfield"));
        assertFalse(SitemapDiscovery.isLocationPage("https://x.com/locations/sitemap.xml"));
        assertTrue(SitemapDiscovery.isLocationSitemap("https://x.com/sitemap-locations.xml"));
        assertFalse(SitemapDiscovery.isLocationSitemap("https://x.com/sitemap-pages.xml"));

        assertEquals("https://x.com:8443", SitemapDiscovery.originOf("HTTPS://x.com:8443/a/b?c"));
        assertEquals("http://x.com", SitemapDiscovery.originOf("http://x.com"));
        assertNull(SitemapDiscovery.originOf("/relative/path"));
    }
}
