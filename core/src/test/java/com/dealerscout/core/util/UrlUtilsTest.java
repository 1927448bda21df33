package com.dealerscout.core.util;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class UrlUtilsTest {

    @Test
    void isHttpUrl() {
        assertTrue(UrlUtils.isHttpUrl("https://www.example.com/locations"));
        assertTrue(UrlUtils.isHttpUrl(" HTTP://example.com "));
        assertFalse(UrlUtils.isHttpUrl("ftp://example.com"));
        assertFalse(UrlUtils.isHttpUrl("mailto:sales@example.com"));
        assertFalse(UrlUtils.isHttpUrl("example.com/locations"));
        assertFalse(UrlUtils.isHttpUrl("https://"));
        assertFalse(UrlUtils.isHttpUrl(null));
    }

    @Test
    void host_helpers() {
        assertEquals("www.example.com", UrlUtils.hostOf("https://WWW.Example.com/a?b"));
        assertEquals("", UrlUtils.hostOf("not a url"));
        assertEquals("example.com", UrlUtils.stripWww("WWW.example.com"));
        assertTrue(UrlUtils.hostMatches("shop.ancira.com", "ancira.com"));
        assertTrue(UrlUtils.hostMatches("ancira.com", "ANCIRA.com"));
        assertFalse(UrlUtils.hostMatches("notancira.com", "ancira.com"));
        assertFalse(UrlUtils.hostMatches("ancira.com", ""));
    }

    @Test
    void resolve_relative_and_protocol_relative() {
        assertEquals("https://a.com/z", UrlUtils.resolve("https://a.com/x/y", "../z"));
        assertEquals("https://b.com/p", UrlUtils.resolve("https://a.com/", "https://b.com/p"));
        assertEquals("http://cdn.com/a", UrlUtils.resolve("http://a.com/", "//cdn.com/a"));
        assertNull(UrlUtils.resolve("https://a.com/", " "));
        assertNull(UrlUtils.resolve(null, "/relative"));
    }

    @Test
    void ensureScheme() {
        assertEquals("https://example.com/x", UrlUtils.ensureScheme("example.com/x"));
        assertEquals("http://example.com", UrlUtils.ensureScheme("http://example.com"));
        assertEquals("https://example.com", UrlUtils.ensureScheme("//example.com"));
        assertNull(UrlUtils.ensureScheme("  "));
    }

    @Test
    void stripTrackingParams_keepsOtherParamsInOrder() {
        assertEquals("https://a.com/p?id=3&page=2",
                UrlUtils.stripTrackingParams("https://a.com/p?utm_source=x&id=3&GCLID=9&page=2#top"));
        assertEquals("https://a.com/p", UrlUtils.stripTrackingParams("https://a.com/p?utm_medium=cpc"));
        assertEquals("https://a.com", UrlUtils.stripTrackingParams("https://a.com"));
    }
}
