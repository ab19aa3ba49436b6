package com.qaradar.core.crawler;

import com.qaradar.core.util.UrlUtils;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URI;
import java.util.LinkedHashSet;
import java.util.Locale;
import java.util.Set;

/** 기본 JSoup 기반 링크 추출기: a[href] → abs:href → same-host 필터 → canonical */
public class JsoupLinkExtractor implements LinkExtractor {

    private static final Logger LOG = LoggerFactory.getLogger(JsoupLinkExtractor.class);

    @Override
    public Set<URI> extract(String html, URI baseUrl) {
        Set<URI> out = new LinkedHashSet<>();
        if (html == null || html.isEmpty() || baseUrl == null || baseUrl.getHost() == null) return out;

        Document doc = Jsoup.parse(html, baseUrl.toString());
        for (Element a : doc.select("a[href]")) {
            String raw = a.attr("href").trim();
            if (isIgnorable(raw)) continue;

            String abs = a.absUrl("href");
            if (abs.isBlank()) continue;
            try {
                URI u = URI.create(encodeIllegal(abs.trim()));
                String s = u.getScheme();
                if (s == null) continue;
                if (!s.equalsIgnoreCase("http") && !s.equalsIgnoreCase("https")) continue;
                // protocol은 달라도 되지만 host는 정확히 같아야 한다
                if (!UrlUtils.sameHost(baseUrl, u)) continue;

                URI c = UrlUtils.canonicalize(u);
                if (c != null) out.add(c);
            } catch (IllegalArgumentException e) {
                LOG.debug("Dropped unparseable href '{}' on {}: {}", raw, baseUrl, e.getMessage());
            }
        }
        return out;
    }

    /** 실제 사이트에 흔한 공백 등 URI에 못 들어가는 문자를 퍼센트 인코딩("/about us" → "/about%20us") */
    static String encodeIllegal(String url) {
        StringBuilder sb = null;
        for (int i = 0; i < url.length(); i++) {
            char c = url.charAt(i);
            String esc = escapeOf(c);
            if (esc == null) {
                if (sb != null) sb.append(c);
                continue;
            }
            if (sb == null) sb = new StringBuilder(url.length() + 8).append(url, 0, i);
            sb.append(esc);
        }
        return sb == null ? url : sb.toString();
    }

    private static String escapeOf(char c) {
        switch (c) {
            case ' ': return "%20";
            case '"': return "%22";
            case '<': return "%3C";
            case '>': return "%3E";
            case '\\': return "%5C";
            case '^': return "%5E";
            case '`': return "%60";
            case '{': return "%7B";
            case '|': return "%7C";
            case '}': return "%7D";
            default: return null;
        }
    }

    /** fragment 전용, mailto:, tel:, 스크립트 scheme 링크 */
    static boolean isIgnorable(String href) {
        if (href.isEmpty() || href.startsWith("#")) return true;
        String h = href.toLowerCase(Locale.ROOT);
        return h.startsWith("mailto:")
                || h.startsWith("tel:")
                || h.startsWith("javascript:")
                || h.startsWith("vbscript:")
                || h.startsWith("data:");
    }
}
