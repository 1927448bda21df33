package com.dealerscout.app.cli;

import com.dealerscout.app.export.CsvResultExporter;
import com.dealerscout.app.export.ExtractionReport;
import com.dealerscout.app.export.JsonResultExporter;
import com.dealerscout.app.export.ResultExporter;
import com.dealerscout.app.logging.LogSetup;
import com.dealerscout.core.model.CanonicalRecord;
import com.dealerscout.core.model.ExtractionOutcome;
import com.dealerscout.core.model.ScrapeConfig;
import com.dealerscout.core.normalize.Deduplicator;
import com.dealerscout.core.pipeline.ExtractionService;
import com.dealerscout.core.util.UrlUtils;
import com.dealerscout.core.util.YamlConfigLoader;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.OutputStreamWriter;
import java.io.PrintStream;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * 명령줄 진입점.
 * <pre>
 *   dealerscout --name "Lithia Motors" --url https://www.lithia.com/locations [--url ...]
 *               [--config scrape.yml] [--out out] [--format json|csv] [--debug-capture]
 * </pre>
 * 종료 코드: 0 성공, 2 데이터 없음, 3 가져오기 실패, 64 사용법 오류, 1 그 밖의 오류(출력 실패 등).
 */
public final class DealerScoutCli {

    private static final Logger LOG = LoggerFactory.getLogger(DealerScoutCli.class);

    public static final int EXIT_OK = 0;
    public static final int EXIT_ERROR = 1;
    public static final int EXIT_NO_DATA = 2;
    public static final int EXIT_FETCH_FAILED = 3;
    public static final int EXIT_USAGE = 64;

    static final String USAGE = String.join(System.lineSeparator(),
            "Usage: dealerscout --name <dealer group> --url <url> [--url <url> ...]",
            "                   [--config <scrape.yml>] [--out <dir>] [--format json|csv] [--debug-capture]",
            "  --name           dealer group name recorded on every location",
            "  --url            dealer group locations page (repeatable)",
            "  --config         YAML settings file (default: ./scrape.yml when present)",
            "  --out            write the result file under <dir>/results instead of stdout",
            "  --format         json (default) or csv",
            "  --debug-capture  save fetched HTML under fetch.debugDir");

    /** 설정으로 서비스를 만든다(테스트에서 가짜 fetcher 주입용) */
    @FunctionalInterface
    public interface ServiceFactory {
        ExtractionService create(ScrapeConfig config) throws IOException;
    }

    /** 파싱된 인자 */
    record Args(String name, List<String> urls, Path config, Path out, String format, boolean debugCapture) {}

    /** 사용법 오류 */
    static final class UsageException extends Exception {
        UsageException(String message) { super(message); }
    }

    private final PrintStream out;
    private final PrintStream err;
    private final ServiceFactory factory;

    public DealerScoutCli(PrintStream out, PrintStream err, ServiceFactory factory) {
        this.out = Objects.requireNonNull(out, "out");
        this.err = Objects.requireNonNull(err, "err");
        this.factory = Objects.requireNonNull(factory, "factory");
    }

    public static void main(String[] argv) {
        Path outRoot = Path.of(System.getProperty("ds.out.dir", "out"));
        LogSetup.configure(outRoot);
        Thread.setDefaultUncaughtExceptionHandler((t, e) ->
                LOG.error("Uncaught exception in {}", t.getName(), e));

        int code = new DealerScoutCli(System.out, System.err, ExtractionService::create).run(argv);
        System.exit(code);
    }

    public int run(String[] argv) {
        Args args;
        try {
            args = parse(argv);
        } catch (UsageException e) {
            err.println("error: " + e.getMessage());
            err.println(USAGE);
            return EXIT_USAGE;
        }

        ScrapeConfig config;
        try {
            config = loadConfig(args.config());
            if (args.debugCapture()) config.fetch().setDebugCapture(true);
            if (args.out() != null) config.setOutputDir(args.out());
            config.validate();
        } catch (IOException | IllegalArgumentException e) {
            err.println("error: invalid configuration: " + e.getMessage());
            return EXIT_USAGE;
        }

        Instant started = Instant.now();
        List<ExtractionReport.Source> sources = new ArrayList<>();
        try (ExtractionService service = factory.create(config)) {
            for (String url : args.urls()) {
                ExtractionOutcome o = service.extractGroup(args.name(), url);
                sources.add(new ExtractionReport.Source(url, o));
                if (o.isSuccess()) {
                    err.println("ok    " + url + " -> " + o.getRecords().size() + " location(s) via " + o.getStrategyUsed());
                } else {
                    err.println("fail  " + url + " -> " + o.getFailureReason() + ": " + o.getMessage());
                }
            }
        } catch (Exception e) {
            LOG.error("Extraction run failed", e);
            err.println("error: " + e.getMessage());
            return EXIT_ERROR;
        }

        List<CanonicalRecord> all = new ArrayList<>();
        for (ExtractionReport.Source s : sources) all.addAll(s.outcome().getRecords());
        List<CanonicalRecord> merged = new Deduplicator().dedupe(all);
        ExtractionReport report = new ExtractionReport(args.name(), started, sources, merged);

        ResultExporter exporter = "csv".equals(args.format()) ? new CsvResultExporter() : new JsonResultExporter();
        try {
            if (args.out() != null) {
                Path file = exporter.export(args.out(), report);
                err.println("wrote " + merged.size() + " location(s) to " + file.toAbsolutePath());
            } else {
                Writer w = new OutputStreamWriter(out, StandardCharsets.UTF_8);
                exporter.write(report, w);
                w.flush();
            }
        } catch (IOException e) {
            LOG.error("Export failed", e);
            err.println("error: cannot write results: " + e.getMessage());
            return EXIT_ERROR;
        }

        return exitCode(sources, merged);
    }

    /** 레코드가 있으면 0, 없으면서 모든 실패가 가져오기 실패면 3, 아니면 2 */
    static int exitCode(List<ExtractionReport.Source> sources, List<CanonicalRecord> merged) {
        if (!merged.isEmpty()) return EXIT_OK;
        boolean allRetryable = !sources.isEmpty();
        for (ExtractionReport.Source s : sources) {
            if (!s.outcome().isRetryable()) { allRetryable = false; break; }
        }
        return allRetryable ? EXIT_FETCH_FAILED : EXIT_NO_DATA;
    }

    static ScrapeConfig loadConfig(Path explicit) throws IOException {
        if (explicit != null) return YamlConfigLoader.load(explicit);
        Path local = Path.of("scrape.yml");
        if (Files.exists(local)) return YamlConfigLoader.load(local);
        return ScrapeConfig.defaults();
    }

    static Args parse(String[] argv) throws UsageException {
        String name = null;
        List<String> urls = new ArrayList<>();
        Path config = null;
        Path outDir = null;
        String format = "json";
        boolean debug = false;

        if (argv == null || argv.length == 0) throw new UsageException("no arguments");
        for (int i = 0; i < argv.length; i++) {
            String a = argv[i];
            switch (a) {
                case "--name":
                    name = value(argv, ++i, a);
                    break;
                case "--url":
                    String u = value(argv, ++i, a);
                    if (!UrlUtils.isHttpUrl(u)) throw new UsageException("not an http(s) url: " + u);
                    urls.add(u);
                    break;
                case "--config":
                    config = Path.of(value(argv, ++i, a));
                    break;
                case "--out":
                    outDir = Path.of(value(argv, ++i, a));
                    break;
                case "--format":
                    format = value(argv, ++i, a).toLowerCase(Locale.ROOT);
                    if (!format.equals("json") && !format.equals("csv")) {
                        throw new UsageException("unknown format: " + format + " (use json or csv)");
                    }
                    break;
                case "--debug-capture":
                    debug = true;
                    break;
                default:
                    throw new UsageException("unknown option: " + a);
            }
        }
        if (name == null || name.isBlank()) throw new UsageException("--name is required");
        if (urls.isEmpty()) throw new UsageException("at least one --url is required");
        return new Args(name.trim(), List.copyOf(urls), config, outDir, format, debug);
    }

    private static String value(String[] argv, int i, String option) throws UsageException {
        if (i >= argv.length || argv[i].startsWith("--")) {
            throw new UsageException(option + " needs a value");
        }
        return argv[i];
    }
}
