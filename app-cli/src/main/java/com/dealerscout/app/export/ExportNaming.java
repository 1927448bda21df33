package com.dealerscout.app.export;

import java.nio.file.Path;
import java.time.Instant;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.util.Locale;

public final class ExportNaming {
    private ExportNaming() {}

    public static final DateTimeFormatter TS_FMT =
            DateTimeFormatter.ofPattern("yyyyMMdd-HHmm").withZone(ZoneId.systemDefault());

    public static Path resultPath(Path baseDir, String dealerGroup, Instant startedAt, String ext) {
        Path out = (baseDir == null ? Path.of("out") : baseDir);
        Instant at = (startedAt == null ? Instant.now() : startedAt);
        return out.resolve("results").resolve(slug(dealerGroup) + "-" + TS_FMT.format(at) + "." + ext);
    }

    static String slug(String name) {
        if (name == null || name.isBlank()) return "dealers";
        String s = name.toLowerCase(Locale.ROOT)
                .replaceAll("[^a-z0-9]+", "-")
                .replaceAll("^-+|-+$", "");
        if (s.length() > 60) s = s.substring(0, 60).replaceAll("-+$", "");
        return s.isEmpty() ? "dealers" : s;
    }
}
