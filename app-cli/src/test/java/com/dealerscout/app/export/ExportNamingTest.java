package com.dealerscout.app.export;

import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

class ExportNamingTest {

    @Test
    void slug() {
        assertEquals("lithia-motors", ExportNaming.slug("Lithia Motors"));
        assertEquals("ken-garff-automotive-group", ExportNaming.slug("  Ken Garff Automotive Group!! "));
        assertEquals("dealers", ExportNaming.slug("***"));
        assertEquals("dealers", ExportNaming.slug(null));
        assertTrue(ExportNaming.slug("a".repeat(80)).length() <= 60);
    }

    @Test
    void resultPath_underResultsDir() {
        Instant at = Instant.parse("2024-05-01T10:15:30Z");
        Path p = ExportNaming.resultPath(Path.of("build", "out"), "AutoCanada", at, "csv");

        assertEquals(Path.of("build", "out", "results"), p.getParent());
        assertEquals("autocanada-" + ExportNaming.TS_FMT.format(at) + ".csv", p.getFileName().toString());
        assertEquals(Path.of("out", "results"), ExportNaming.resultPath(null, "x", at, "json").getParent());
    }
}
