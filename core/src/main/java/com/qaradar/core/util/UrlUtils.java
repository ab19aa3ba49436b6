package com.qaradar.core.util;

import com.qaradar.core.model.InvalidInputException;

import java.net.URI;
import java.net.URISyntaxException;
import java.util.Locale;
import java.util.Set;

/** origin 입력 정규화 + canonical URL + same-host 판정 유틸 */
public final class UrlUtils {
    private UrlUtils(){}

    private static final Set<String> STATIC_EXT = Set.of(
            "css","js","png","jpg","jpeg","gif","ico","svg","webp",
            "woff","woff2","ttf","eot","otf","map","pdf","zip","rar","7z",
            "gz","bz2","tar","mp4","mp3","wav","avi","mov","mkv","webm","xml","json","txt"
    );

    /**
     * 사용자 입력 문자열 → 절대 origin URL. 네트워크 접근 없음.
     * - 앞뒤 공백 제거, 비어있으면 InvalidInputException
     * - scheme이 없으면 https:// 를 붙인다
     * - scheme은 http/https만, host 필수
     */
    public static URI normalizeOrigin(String raw) {
        String s = (raw == null ? "" : raw.trim());
        if (s.isEmpty()) throw new InvalidInputException("origin must not be empty");
        if (!s.contains("://")) s = "https://" + s;

        URI u;
        try {
            u = new URI(s);
        } catch (URISyntaxException e) {
            throw new InvalidInputException("unparseable origin: " + raw, e);
        }
        String scheme = u.getScheme() == null ? "" : u.getScheme().toLowerCase(Locale.ROOT);
        if (!scheme.equals("http") && !scheme.equals("https")) {
            throw new InvalidInputException("unsupported scheme: " + u.getScheme());
        }
        if (u.getHost() == null || u.getHost().isBlank()) {
            throw new InvalidInputException("origin has no host: " + raw);
        }
        URI c = canonicalize(u);
        if (c == null) throw new InvalidInputException("unparseable origin: " + raw);
        return c;
    }

    /**
     * canonical 규칙:
     * - scheme/host 소문자, 기본 포트 제거
     * - query, fragment 제거
     * - 중복 슬래시 축소, 끝 슬래시 제거(루트는 빈 경로)
     * 해석 불가하면 null.
     */
    public static URI canonicalize(URI u) {
        if (u == null || u.getHost() == null) return null;

        String scheme = (u.getScheme() == null ? "https" : u.getScheme()).toLowerCase(Locale.ROOT);
        String host = u.getHost().toLowerCase(Locale.ROOT);

        int port = u.getPort();
        if ((scheme.equals("http") && port == 80) || (scheme.equals("https") && port == 443)) {
            port = -1; // 기본 포트 제거
        }

        String path = (u.getPath() == null ? "" : u.getPath());
        path = path.replaceAll("/{2,}", "/");
        while (path.endsWith("/")) path = path.substring(0, path.length() - 1);

        try {
            return new URI(scheme, null, host, port, path.isEmpty() ? null : path, null, null);
        } catch (URISyntaxException e) {
            return null;
        }
    }

    /** host 기준 동일 판정(소문자 비교). scheme은 보지 않는다. */
    public static boolean sameHost(URI a, URI b) {
        if (a == null || b == null) return false;
        String ha = a.getHost() == null ? "" : a.getHost().toLowerCase(Locale.ROOT);
        String hb = b.getHost() == null ? "" : b.getHost().toLowerCase(Locale.ROOT);
        return !ha.isEmpty() && ha.equals(hb);
    }

    /** 정적 리소스(이미지/폰트/아카이브 등)는 페이지 후보에서 제외 */
    public static boolean isStaticAsset(URI u) {
        if (u == null || u.getPath() == null) return false;
        String p = u.getPath().toLowerCase(Locale.ROOT);
        int slash = p.lastIndexOf('/');
        int i = p.lastIndexOf('.');
        if (i < 0 || i < slash) return false;
        return STATIC_EXT.contains(p.substring(i + 1));
    }

    /** 경로만(소문자). 없으면 "/" */
    public static String pathOf(URI u) {
        if (u == null || u.getPath() == null || u.getPath().isEmpty()) return "/";
        return u.getPath().toLowerCase(Locale.ROOT);
    }
}
