package com.dealerscout.core.http;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class BlockDetectorTest {

    private static final String BODY = "<html>" + "a".repeat(600) + "</html>";

    @Test
    void ok_response_is_accepted() {
        BlockDetector.Verdict v = BlockDetector.inspect(200, BODY, 512);
        assertFalse(v.rejected());
        assertNull(v.reason());
    }

    @Test
    void blocking_statuses_are_blocked() {
        for (int s : new int[]{403, 429, 503}) {
            BlockDetector.Verdict v = BlockDetector.inspect(s, BODY, 512);
            assertTrue(v.rejected(), "status " + s);
            assertEquals(FetchException.Reason.BLOCKED, v.reason());
        }
    }

    @Test
    void other_non_2xx_is_http_error() {
        BlockDetector.Verdict v = BlockDetector.inspect(404, BODY, 512);
        assertTrue(v.rejected());
        assertEquals(FetchException.Reason.HTTP_ERROR, v.reason());
        assertEquals("status 404", v.detail());
    }

    @Test
    void challenge_marker_is_case_insensitive() {
        String body = "<html><head><TITLE>Access Denied</TITLE></head>" + "a".repeat(600) + "</html>";
        assertEquals("<title>access denied</title>", BlockDetector.challengeMarker(body));
        assertEquals(FetchException.Reason.BLOCKED, BlockDetector.inspect(200, body, 512).reason());
    }

    @Test
    void short_body_is_rejected() {
        BlockDetector.Verdict v = BlockDetector.inspect(200, "<html></html>", 512);
        assertTrue(v.rejected());
        assertTrue(v.detail().startsWith("body too small"));
    }

    @Test
    void null_body_has_no_marker() {
        assertNull(BlockDetector.challengeMarker(null));
        assertTrue(BlockDetector.inspect(200, null, 1).rejected());
    }
}
