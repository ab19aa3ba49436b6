package com.qaradar.app;

import com.qaradar.app.logging.LogSetup;
import com.qaradar.core.model.DiscoveryBrief;
import com.qaradar.core.model.DiscoveryConfig;
import com.qaradar.core.model.FetchError;
import com.qaradar.core.model.FetchFailureException;
import com.qaradar.core.model.InvalidConfigurationException;
import com.qaradar.core.model.InvalidInputException;
import com.qaradar.core.model.PageRecord;
import com.qaradar.core.model.TrustDomain;
import com.qaradar.core.service.DiscoveryService;
import com.qaradar.core.service.export.BriefExporter;
import com.qaradar.core.service.export.JsonBriefExporter;
import com.qaradar.core.util.YamlConfigLoader;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Locale;

/**
 * CLI 진입점.
 * <pre>
 *   qa-radar &lt;origin&gt; [--max-pages N] [--strict] [--config discovery.yml] [--out dir]
 * </pre>
 * 설정 우선순위: discovery.yml &lt; -Dqr.* 시스템 프로퍼티 &lt; 명령행 인자.
 * 종료 코드: 0 성공, 1 기타 오류, 2 잘못된 입력/설정, 3 내보내기 실패, 4 홈페이지 fetch 실패.
 */
public final class Main {

    static final int EXIT_OK = 0;
    static final int EXIT_ERROR = 1;
    static final int EXIT_INVALID = 2;
    static final int EXIT_EXPORT = 3;
    static final int EXIT_HOMEPAGE = 4;

    private static final String USAGE =
            "usage: qa-radar <origin> [--max-pages N] [--strict] [--config file] [--out dir]";

    private Main() {}

    public static void main(String[] args) {
        System.exit(run(args, System.out, System.err));
    }

    /** 테스트 가능한 본체. System.exit은 호출하지 않는다. */
    public static int run(String[] args, PrintStream out, PrintStream err) {
        final DiscoveryConfig cfg;
        try {
            cfg = buildConfig(args);
        } catch (UsageException e) {
            if (e.getMessage() != null) err.println("error: " + e.getMessage());
            err.println(USAGE);
            return e.help ? EXIT_OK : EXIT_INVALID;
        } catch (InvalidInputException | InvalidConfigurationException e) {
            err.println("invalid configuration: " + e.getMessage());
            return EXIT_INVALID;
        } catch (IOException e) {
            err.println("cannot read config: " + e.getMessage());
            return EXIT_INVALID;
        }

        LogSetup.configure(cfg.getOutputDir());
        Logger log = LoggerFactory.getLogger(Main.class);

        final DiscoveryBrief brief;
        try {
            brief = new DiscoveryService(cfg).run();
        } catch (InvalidInputException | InvalidConfigurationException e) {
            err.println("invalid input: " + e.getMessage());
            return EXIT_INVALID;
        } catch (FetchFailureException e) {
            log.warn("Discovery aborted: {}", e.getMessage());
            err.println(e.getMessage());
            return EXIT_HOMEPAGE;
        } catch (RuntimeException e) {
            log.error("Discovery failed", e);
            err.println("discovery failed: " + e);
            return EXIT_ERROR;
        }

        printSummary(brief, out);

        BriefExporter exporter = new JsonBriefExporter();
        try {
            Path file = exporter.export(cfg.getOutputDir(), brief);
            out.println("Brief written: " + file.toAbsolutePath());
            log.info("Brief exported: {}", file);
        } catch (IOException e) {
            log.error("Export failed", e);
            err.println("export failed: " + e.getMessage());
            return EXIT_EXPORT;
        }
        return EXIT_OK;
    }

    /* =========================
       설정 조립
       ========================= */

    static DiscoveryConfig buildConfig(String[] args) throws IOException {
        String origin = null;
        Integer maxPages = null;
        boolean strict = false;
        Path configFile = null;
        Path outDir = null;

        for (int i = 0; i < args.length; i++) {
            String a = args[i];
            switch (a) {
                case "-h":
                case "--help":
                    throw new UsageException(null, true);
                case "--strict":
                    strict = true;
                    break;
                case "--max-pages":
                    maxPages = parsePositive(a, valueAt(args, ++i, a));
                    break;
                case "--config":
                    configFile = Path.of(valueAt(args, ++i, a));
                    break;
                case "--out":
                    outDir = Path.of(valueAt(args, ++i, a));
                    break;
                default:
                    if (a.startsWith("--")) throw new UsageException("unknown option " + a, false);
                    if (origin != null) throw new UsageException("more than one origin given", false);
                    origin = a;
            }
        }

        // 1) 파일 (명시 > 현재 디렉터리의 discovery.yml > 기본값)
        DiscoveryConfig cfg;
        if (configFile != null) {
            cfg = YamlConfigLoader.load(configFile);
        } else if (Files.exists(Path.of("discovery.yml"))) {
            cfg = YamlConfigLoader.loadDefault();
        } else {
            cfg = DiscoveryConfig.defaults();
        }

        // 2) 시스템 프로퍼티
        Integer sysMax = sysInt("qr.maxPages");
        if (sysMax != null) cfg.setMaxPages(sysMax);
        Integer sysCc = sysInt("qr.concurrency");
        if (sysCc != null) cfg.setConcurrency(sysCc);
        String sysStrict = System.getProperty("qr.strict");
        if (sysStrict != null && !sysStrict.isBlank()) cfg.setStrictMode(Boolean.parseBoolean(sysStrict.trim()));
        String sysOut = System.getProperty("qr.out.dir");
        if (sysOut != null && !sysOut.isBlank()) cfg.setOutputDir(Path.of(sysOut.trim()));

        // 3) 명령행
        if (origin != null) cfg.setTarget(origin);
        if (maxPages != null) cfg.setMaxPages(maxPages);
        if (strict) cfg.setStrictMode(true);
        if (outDir != null) cfg.setOutputDir(outDir);

        if (cfg.getTarget() == null || cfg.getTarget().isBlank()) {
            throw new UsageException("origin is required", false);
        }
        cfg.validate();
        return cfg;
    }

    private static String valueAt(String[] args, int i, String opt) {
        if (i >= args.length) throw new UsageException(opt + " requires a value", false);
        return args[i];
    }

    private static int parsePositive(String opt, String v) {
        try {
            int n = Integer.parseInt(v.trim());
            if (n < 1) throw new InvalidConfigurationException(opt + " must be a positive integer: " + v);
            return n;
        } catch (NumberFormatException e) {
            throw new InvalidConfigurationException(opt + " must be a positive integer: " + v);
        }
    }

    private static Integer sysInt(String key) {
        String v = System.getProperty(key);
        if (v == null || v.isBlank()) return null;
        try {
            return Integer.parseInt(v.trim());
        } catch (NumberFormatException e) {
            throw new InvalidConfigurationException("-D" + key + " is not an integer: " + v);
        }
    }

    /* =========================
       출력
       ========================= */

    static void printSummary(DiscoveryBrief brief, PrintStream out) {
        out.println("QA Radar 2.0 - Trust & Risk Discovery");
        out.println("Origin:           " + brief.getOrigin());
        out.println("Discovery health: " + brief.getDiscoveryHealth().label());
        out.println("Archetype:        " + brief.getArchetype().label());
        out.println("Strict mode:      " + brief.isStrictMode());
        for (TrustDomain d : TrustDomain.values()) {
            var pages = brief.pagesIn(d);
            if (pages.isEmpty()) continue;
            out.println();
            out.println("[" + d.label() + "]");
            for (PageRecord p : pages) {
                out.printf(Locale.ROOT, "  %s  attention=%s confidence=%s signals=%d%n",
                        p.getUrl(), p.getAttentionBand().label(), p.getConfidence().label(), p.getSignals().size());
            }
        }
        if (!brief.getFetchErrors().isEmpty()) {
            out.println();
            out.println("Fetch errors:");
            for (FetchError fe : brief.getFetchErrors()) {
                out.println("  " + fe.getUrl() + "  " + fe.getError());
            }
        }
        out.println();
        out.println(brief.getDoctrine().getNotice());
    }

    /** 사용법 오류(--help 포함) */
    static final class UsageException extends RuntimeException {
        final boolean help;
        UsageException(String message, boolean help) {
            super(message);
            this.help = help;
        }
    }
}
