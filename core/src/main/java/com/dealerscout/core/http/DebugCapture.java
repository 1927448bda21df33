package com.dealerscout.core.http;

import com.dealerscout.core.model.Transport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.util.Locale;
import java.util.Objects;

/**
 * 사후 분석용 HTML 덤프. 파일명은 host_path_transport_epochMillis.html.
 * 실패해도 로그만 남기고 fetch 결과에는 영향을 주지 않는다.
 */
public final class DebugCapture {

    private static final Logger LOG = LoggerFactory.getLogger(DebugCapture.class);
    private static final int MAX_SLUG = 80;

    private final Path dir;
    private final Clock clock;

    public DebugCapture(Path dir) {
        this(dir, Clock.systemUTC());
    }

    DebugCapture(Path dir, Clock clock) {
        this.dir = Objects.requireNonNull(dir, "dir");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    /** 저장된 파일 경로, 실패하면 null */
    public Path save(String url, Transport transport, String html) {
        try {
            Files.createDirectories(dir);
            Path file = dir.resolve(fileName(url, transport, clock.millis()));
            Files.writeString(file, html == null ? "" : html, StandardCharsets.UTF_8);
            LOG.debug("Debug HTML saved: {}", file);
            return file;
        } catch (IOException | RuntimeException e) {
            LOG.warn("Debug capture failed for {}: {}", url, e.toString());
            return null;
        }
    }

    static String fileName(String url, Transport transport, long epochMillis) {
        String host = "unknown";
        String path = "";
        try {
            URI u = URI.create(url);
            if (u.getHost() != null) host = u.getHost();
            if (u.getPath() != null) path = u.getPath();
        } catch (IllegalArgumentException ignore) {
            // 파일명만 만들 수 있으면 된다
        }
        String slug = slug(host + "_" + path);
        return slug + "_" + transport.name().toLowerCase(Locale.ROOT) + "_" + epochMillis + ".html";
    }

    private static String slug(String s) {
        String out = s.replaceAll("[^A-Za-z0-9._-]+", "_").replaceAll("_+", "_");
        if (out.endsWith("_")) out = out.substring(0, out.length() - 1);
        return out.length() > MAX_SLUG ? out.substring(0, MAX_SLUG) : out;
    }
}
