package com.dealerscout.core.http;

import com.dealerscout.core.model.Transport;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;

import static org.assertj.core.api.Assertions.assertThat;

class DebugCaptureTest {

    @TempDir
    Path tmp;

    @Test
    void file_name_is_host_path_transport_millis() {
        assertThat(DebugCapture.fileName("https://www.example.com/our-locations/", Transport.LIGHT, 123L))
                .isEqualTo("www.example.com_our-locations_light_123.html");
        assertThat(DebugCapture.fileName("not a url", Transport.BROWSER, 1L))
                .isEqualTo("unknown_browser_1.html");
    }

    @Test
    void saves_html_under_dir() throws Exception {
        var clock = Clock.fixed(Instant.ofEpochMilli(1_000L), ZoneOffset.UTC);
        var cap = new DebugCapture(tmp.resolve("debug"), clock);

        Path file = cap.save("https://dealer.example.com/", Transport.BROWSER, "<html>ok</html>");

        assertThat(file).isNotNull();
        assertThat(file.getFileName().toString()).isEqualTo("dealer.example.com_browser_1000.html");
        assertThat(Files.readString(file)).isEqualTo("<html>ok</html>");
    }

    @Test
    void failure_returns_null() throws Exception {
        Path blocker = Files.writeString(tmp.resolve("plain-file"), "x");
        var cap = new DebugCapture(blocker.resolve("sub"));

        assertThat(cap.save("https://dealer.example.com/", Transport.LIGHT, "<html/>")).isNull();
    }
}
