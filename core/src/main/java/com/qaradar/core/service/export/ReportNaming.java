package com.qaradar.core.service.export;

import java.net.URI;
import java.nio.file.Path;
import java.time.Instant;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.util.Locale;

/** 브리프 파일 경로 규칙: {@code <base>/briefs/<host>/brief-<slug>-<yyyyMMdd-HHmm>.json} */
public final class ReportNaming {
    private ReportNaming() {}

    public static final DateTimeFormatter TS_FMT =
            DateTimeFormatter.ofPattern("yyyyMMdd-HHmm").withZone(ZoneId.systemDefault());

    public record ReportContext(Path baseDir, String host, String slug, Instant startedAt) {}

    public static ReportContext context(Path baseDir, String origin, Instant startedAt) {
        Path out = (baseDir == null ? Path.of("out") : baseDir);
        return new ReportContext(out, extractHost(origin), makeSlug(origin),
                startedAt == null ? Instant.now() : startedAt);
    }

    public static Path briefsDir(ReportContext ctx) {
        return ctx.baseDir().resolve("briefs").resolve(ctx.host());
    }

    public static Path jsonPath(ReportContext ctx) {
        return briefsDir(ctx).resolve(filePrefix(ctx) + ".json");
    }

    public static String filePrefix(ReportContext ctx) {
        return "brief-" + ctx.slug() + "-" + TS_FMT.format(ctx.startedAt());
    }

    // ===== helpers =====
    static String extractHost(String origin) {
        try {
            String h = URI.create(origin).getHost();
            return (h == null ? "unknown-host" : h.toLowerCase(Locale.ROOT)).replaceAll("[^a-z0-9._-]", "-");
        } catch (IllegalArgumentException e) {
            return "unknown-host";
        }
    }

    static String makeSlug(String url) {
        if (url == null || url.isBlank()) return "no-url";
        String s = url.toLowerCase(Locale.ROOT).replaceFirst("^https?://", "");
        s = s.replaceAll("[^a-z0-9._/-]", "-").replaceAll("-{2,}", "-");
        if (s.length() > 60) s = s.substring(0, 60);
        s = s.replace('/', '-').replaceAll("^-+|-+$", "");
        return s.isEmpty() ? "no-url" : s;
    }
}
