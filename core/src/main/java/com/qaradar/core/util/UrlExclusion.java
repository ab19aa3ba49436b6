package com.qaradar.core.util;

import java.net.URI;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * 설정의 excludePaths 규칙을 한 번 컴파일해 두고 URL마다 검사한다.
 * <ul>
 *   <li>접두(prefix): {@code "/account"} (경로 기준) 또는 {@code "https://host/path"} (전체 URL 기준)</li>
 *   <li>glob: {@code '*'}, {@code '?'} 포함 (예: {@code "/blog/*&#47;amp"})</li>
 *   <li>정규식: {@code "re:"} 접두 (예: {@code re:/tag/\d+$})</li>
 * </ul>
 * glob/정규식은 전체 URL 문자열에 대해 find()로 검사한다(대소문자 무시).
 */
public final class UrlExclusion {

    public static final UrlExclusion NONE = new UrlExclusion(List.of(), List.of());

    private final List<String> prefixes;
    private final List<Pattern> patterns;

    private UrlExclusion(List<String> prefixes, List<Pattern> patterns) {
        this.prefixes = prefixes;
        this.patterns = patterns;
    }

    /** 잘못된 정규식 규칙은 IllegalArgumentException */
    public static UrlExclusion compile(List<String> rules) {
        if (rules == null || rules.isEmpty()) return NONE;
        List<String> prefixes = new ArrayList<>();
        List<Pattern> patterns = new ArrayList<>();
        for (String r : rules) {
            if (r == null || r.isBlank()) continue;
            String rule = r.trim();
            try {
                if (rule.startsWith("re:")) {
                    patterns.add(Pattern.compile(rule.substring(3), Pattern.CASE_INSENSITIVE));
                } else if (rule.indexOf('*') >= 0 || rule.indexOf('?') >= 0) {
                    patterns.add(Pattern.compile(globToRegex(rule), Pattern.CASE_INSENSITIVE));
                } else {
                    prefixes.add(rule.toLowerCase(Locale.ROOT));
                }
            } catch (PatternSyntaxException e) {
                throw new IllegalArgumentException("invalid exclude rule: " + rule, e);
            }
        }
        return new UrlExclusion(List.copyOf(prefixes), List.copyOf(patterns));
    }

    public boolean isExcluded(URI url) {
        if (url == null) return false;
        final String full = url.toString();
        final String lowerFull = full.toLowerCase(Locale.ROOT);
        final String path = UrlUtils.pathOf(url);

        for (String p : prefixes) {
            if (p.startsWith("/") ? path.startsWith(p) : lowerFull.startsWith(p)) return true;
        }
        for (Pattern p : patterns) {
            if (p.matcher(full).find()) return true;
        }
        return false;
    }

    public boolean isEmpty() {
        return prefixes.isEmpty() && patterns.isEmpty();
    }

    private static String globToRegex(String glob){
        StringBuilder r = new StringBuilder();
        for (int i = 0; i < glob.length(); i++){
            char c = glob.charAt(i);
            switch(c){
                case '*': r.append(".*"); break;
                case '?': r.append('.'); break;
                case '.': case '\\': case '+': case '(': case ')':
                case '^': case '$': case '|': case '{': case '}':
                case '[': case ']': r.append('\\').append(c); break;
                default: r.append(c);
            }
        }
        return r.toString();
    }
}
