package com.scrapebatch.core.api;

/**
 * URL → 텍스트 콘텐츠. 브라우저/HTTP 등 실제 수단은 구현체 몫.
 * 구현체는 스레드 세이프해야 한다(워커들이 공유).
 */
@FunctionalInterface
public interface PageFetcher {
    String fetch(String url) throws FetchException, InterruptedException;
}
