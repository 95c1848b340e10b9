package com.scrapebatch.core.util;

import java.net.URI;
import java.net.URISyntaxException;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/** 캐시 키용 URL 정규화 + 자유 텍스트에서 URL 추출 유틸 */
public final class UrlUtils {
    private UrlUtils(){}

    private static final Pattern URL_IN_TEXT = Pattern.compile("(https?://\\S+)", Pattern.CASE_INSENSITIVE);

    /**
     * 정규화 규칙(사소하게 다른 URL이 같은 키로 모이도록):
     * - scheme/host 소문자
     * - 기본 포트 제거(http:80, https:443)
     * - fragment 제거
     * - 루트가 아닌 경로의 끝 슬래시 제거, 빈 경로는 "/"
     * - 쿼리 파라미터 정렬(key, value 순)
     *
     * URI로 파싱되지 않는 문자열은 trim만 해서 그대로 쓴다(해시 입력으로만 쓰이므로).
     */
    public static String normalizeForKey(String url) {
        if (url == null || url.isBlank()) throw new IllegalArgumentException("url must not be blank");
        String raw = url.trim();
        URI u;
        try {
            u = new URI(raw);
        } catch (URISyntaxException e) {
            return raw;
        }
        if (u.getScheme() == null || u.isOpaque()) return raw;

        String scheme = u.getScheme().toLowerCase(Locale.ROOT);
        String host = u.getHost() != null ? u.getHost() : u.getRawAuthority();
        host = host == null ? "" : host.toLowerCase(Locale.ROOT);

        int port = u.getPort();
        if ((scheme.equals("http") && port == 80) || (scheme.equals("https") && port == 443)) {
            port = -1; // 기본 포트 제거
        }

        String path = u.getRawPath();
        if (path == null || path.isEmpty()) {
            path = "/";
        } else if (path.length() > 1 && path.endsWith("/")) {
            path = path.replaceAll("/+$", "");
            if (path.isEmpty()) path = "/";
        }

        StringBuilder sb = new StringBuilder(raw.length());
        sb.append(scheme).append("://");
        if (u.getRawUserInfo() != null) sb.append(u.getRawUserInfo()).append('@');
        sb.append(host);
        if (port >= 0) sb.append(':').append(port);
        sb.append(path);

        String query = sortedQuery(u.getRawQuery());
        if (!query.isEmpty()) sb.append('?').append(query);
        return sb.toString();
    }

    /** a=2&b=1&a=1 → a=1&a=2&b=1 */
    static String sortedQuery(String rawQuery) {
        if (rawQuery == null || rawQuery.isEmpty()) return "";
        List<String[]> pairs = new ArrayList<>();
        for (String part : rawQuery.split("&")) {
            if (part.isEmpty()) continue;
            String[] kv = part.split("=", 2);
            pairs.add(new String[]{kv[0], kv.length > 1 ? kv[1] : ""});
        }
        pairs.sort((x, y) -> {
            int c = x[0].compareTo(y[0]);
            return c != 0 ? c : x[1].compareTo(y[1]);
        });
        StringBuilder sb = new StringBuilder(rawQuery.length());
        for (String[] p : pairs) {
            if (sb.length() > 0) sb.append('&');
            sb.append(p[0]).append('=').append(p[1]);
        }
        return sb.toString();
    }

    /** 셀/메모 같은 자유 텍스트에서 첫 번째 http(s) URL을 뽑는다. 없으면 null. */
    public static String firstUrlIn(String text) {
        if (text == null || text.isBlank()) return null;
        Matcher m = URL_IN_TEXT.matcher(text);
        return m.find() ? m.group(1) : null;
    }
}
