package com.qaradar.core.http;

import com.qaradar.core.api.IPageFetcher;
import com.qaradar.core.model.DiscoveryConfig;
import com.qaradar.core.model.FetchResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.ConnectException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.time.Duration;
import java.util.Locale;
import java.util.Objects;
import java.util.regex.Pattern;

/**
 * JDK HttpClient 기반 Fetcher: GET 한 번 → FetchResult.
 * - 리다이렉트는 따라가고 최종 URL을 따로 기록
 * - 200 + (HTML content-type 또는 본문에 &lt;html 루트 태그)일 때만 body 유지
 * - 타임아웃/연결 실패/비-200/비-HTML은 error 문자열로 반환, 예외 전파 없음
 */
public class HttpPageFetcher implements IPageFetcher {

    private static final Logger LOG = LoggerFactory.getLogger(HttpPageFetcher.class);
    private static final Pattern HTML_ROOT = Pattern.compile("<html[\\s>]", Pattern.CASE_INSENSITIVE);

    /** 테스트/모킹용 송신 훅 */
    @FunctionalInterface
    public interface HttpSender {
        HttpResponse<String> send(HttpRequest req) throws Exception;
    }

    private final Duration timeout;
    private final String userAgent;
    private final HttpClient client;   // 프로덕션 경로
    private final HttpSender sender;   // 테스트 경로(있으면 이걸 사용)

    public HttpPageFetcher(DiscoveryConfig config) {
        Objects.requireNonNull(config, "config");
        this.timeout = config.getTimeout();
        this.userAgent = config.getUserAgent();
        this.client = HttpClient.newBuilder()
                .followRedirects(config.isFollowRedirects() ? HttpClient.Redirect.NORMAL : HttpClient.Redirect.NEVER)
                .connectTimeout(config.getTimeout())
                .build();
        this.sender = null;
    }

    /** 테스트용 생성자(송신 훅 주입) */
    public HttpPageFetcher(DiscoveryConfig config, HttpSender testSender) {
        Objects.requireNonNull(config, "config");
        this.timeout = config.getTimeout();
        this.userAgent = config.getUserAgent();
        this.client = null;
        this.sender = Objects.requireNonNull(testSender, "testSender");
    }

    @Override
    public FetchResult fetch(URI url) {
        Objects.requireNonNull(url, "url");
        long start = System.nanoTime();
        try {
            HttpRequest req = HttpRequest.newBuilder(url)
                    .timeout(timeout)
                    .header("User-Agent", userAgent)
                    .header("Accept", "text/html,application/xhtml+xml;q=0.9,*/*;q=0.5")
                    .GET()
                    .build();

            HttpResponse<String> resp = (sender != null)
                    ? sender.send(req)
                    : client.send(req, HttpResponse.BodyHandlers.ofString());

            return classify(url, resp, elapsedSince(start));

        } catch (HttpTimeoutException e) {
            LOG.debug("Fetch timeout: {}", url);
            return failure(url, "Timeout after " + timeout.toMillis() + "ms", start);
        } catch (ConnectException e) {
            LOG.debug("Connect failed: {} ({})", url, e.toString());
            return failure(url, "Connection failed: " + describe(e), start);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return failure(url, "cancelled", start);
        } catch (Exception e) {
            LOG.debug("Fetch failed: {} ({})", url, e.toString());
            return failure(url, "Request failed: " + describe(e), start);
        }
    }

    /** 응답을 usable / 비-200 / 비-HTML 로 분류 */
    static FetchResult classify(URI requested, HttpResponse<String> resp, long elapsedMs) {
        int status = resp.statusCode();
        URI finalUrl = (resp.uri() != null ? resp.uri() : requested);
        String contentType = resp.headers().firstValue("Content-Type").orElse(null);
        String body = (resp.body() == null ? "" : resp.body());

        FetchResult.Builder b = FetchResult.builder()
                .url(requested)
                .finalUrl(finalUrl)
                .status(status)
                .contentType(contentType)
                .elapsedMs(elapsedMs);

        if (status != 200) {
            return b.error("HTTP " + status).build();
        }
        if (!isHtmlContentType(contentType) && !HTML_ROOT.matcher(body).find()) {
            return b.error("Non-HTML response (" + (contentType == null ? "no content-type" : contentType) + ")").build();
        }
        if (body.isEmpty()) {
            return b.error("Empty body").build();
        }
        return b.body(body).build();
    }

    static boolean isHtmlContentType(String contentType) {
        if (contentType == null) return false;
        String ct = contentType.toLowerCase(Locale.ROOT);
        return ct.contains("text/html") || ct.contains("application/xhtml+xml");
    }

    private static FetchResult failure(URI url, String error, long start) {
        return FetchResult.builder()
                .url(url)
                .status(-1)
                .error(error)
                .elapsedMs(elapsedSince(start))
                .build();
    }

    private static long elapsedSince(long startNs) {
        return (System.nanoTime() - startNs) / 1_000_000;
    }

    private static String describe(Exception e) {
        String m = e.getMessage();
        return (m == null || m.isBlank()) ? e.getClass().getSimpleName() : m;
    }
}
