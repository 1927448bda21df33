package com.dealerscout.app.export;

import java.io.IOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/** 추출 결과를 파일/스트림으로 내보내는 책임 (JSON/CSV) */
public interface ResultExporter {

    /** 파일 확장자(점 제외) */
    String extension();

    /** 스트림에 쓴다. writer는 닫지 않는다 */
    void write(ExtractionReport report, Writer out) throws IOException;

    /**
     * @param baseDir 출력 루트 (null이면 "out")
     * @return 생성된 파일 경로: baseDir/results/&lt;group-slug&gt;-&lt;yyyyMMdd-HHmm&gt;.&lt;ext&gt;
     */
    default Path export(Path baseDir, ExtractionReport report) throws IOException {
        Path file = ExportNaming.resultPath(baseDir, report.getDealerGroup(), report.getStartedAt(), extension());
        Files.createDirectories(file.getParent());
        try (Writer w = Files.newBufferedWriter(file, StandardCharsets.UTF_8)) {
            write(report, w);
        }
        return file;
    }
}
