package com.scrapebatch.core.api;

/** URL 하나의 fetch 실패. 해당 키에만 영향, 다른 키는 무관. */
public class FetchException extends Exception {
    private final String url;

    public FetchException(String url, String message) {
        super(message);
        this.url = url;
    }

    public FetchException(String url, String message, Throwable cause) {
        super(message, cause);
        this.url = url;
    }

    public String getUrl() { return url; }
}
