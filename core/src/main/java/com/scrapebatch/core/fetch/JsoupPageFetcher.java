package com.scrapebatch.core.fetch;

import com.scrapebatch.core.api.FetchException;
import com.scrapebatch.core.api.PageFetcher;
import com.scrapebatch.core.model.BatchConfig;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;

import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.util.Locale;
import java.util.Objects;

/**
 * 기본 fetch 구현: HTTP GET → HTML이면 "제목.\n\n본문텍스트".
 * 2xx 이외 상태, 전송 예외는 모두 FetchException.
 */
public class JsoupPageFetcher implements PageFetcher {

    /** 테스트/모킹용 송신 훅 */
    @FunctionalInterface
    public interface HttpSender {
        HttpResponse<String> send(HttpRequest req) throws Exception;
    }

    private final BatchConfig config;
    private final HttpClient client;   // 프로덕션 경로
    private final HttpSender sender;   // 테스트 경로(있으면 이걸 사용)

    public JsoupPageFetcher(BatchConfig config) {
        this.config = Objects.requireNonNull(config, "config");
        this.client = HttpClient.newBuilder()
                .followRedirects(config.isFollowRedirects() ? HttpClient.Redirect.NORMAL : HttpClient.Redirect.NEVER)
                .connectTimeout(config.getFetchTimeout())
                .build();
        this.sender = null;
    }

    /** 테스트용 생성자(송신 훅 주입) */
    public JsoupPageFetcher(BatchConfig config, HttpSender testSender) {
        this.config = Objects.requireNonNull(config, "config");
        this.client = null;
        this.sender = Objects.requireNonNull(testSender, "testSender");
    }

    @Override
    public String fetch(String url) throws FetchException, InterruptedException {
        Objects.requireNonNull(url, "url");
        URI uri;
        try {
            uri = URI.create(url.trim());
        } catch (IllegalArgumentException e) {
            throw new FetchException(url, "invalid url: " + e.getMessage(), e);
        }

        HttpResponse<String> resp;
        try {
            HttpRequest req = HttpRequest.newBuilder(uri)
                    .timeout(config.getFetchTimeout())
                    .header("User-Agent", config.getUserAgent())
                    .header("Accept", "text/html,application/xhtml+xml,text/plain;q=0.9,*/*;q=0.8")
                    .GET()
                    .build();
            resp = (sender != null)
                    ? sender.send(req)
                    : client.send(req, HttpResponse.BodyHandlers.ofString());
        } catch (InterruptedException e) {
            throw e;
        } catch (Exception e) {
            throw new FetchException(url, e.getClass().getSimpleName() + ": " + e.getMessage(), e);
        }

        int status = resp.statusCode();
        if (status < 200 || status >= 300) {
            throw new FetchException(url, "HTTP " + status);
        }
        String body = resp.body() == null ? "" : resp.body();
        String contentType = resp.headers().firstValue("Content-Type").orElse("").toLowerCase(Locale.ROOT);
        if (!contentType.isEmpty() && !contentType.contains("html")) {
            return body; // text/plain 등은 그대로
        }
        return toFullText(body, url);
    }

    /** 제목 + ".\n\n" + 본문 텍스트 */
    static String toFullText(String html, String baseUri) {
        Document doc = Jsoup.parse(html, baseUri);
        String title = doc.title() == null ? "" : doc.title().trim();
        String text = doc.body() == null ? "" : doc.body().text().trim();
        return title + ".\n\n" + text;
    }
}
