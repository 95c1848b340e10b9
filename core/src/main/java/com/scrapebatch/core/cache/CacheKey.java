package com.scrapebatch.core.cache;

import java.util.Objects;

/**
 * 캐시 엔트리 이름을 결정하는 키.
 * urlHash(16 hex) + namespaceHash(8 hex) + pid + taskId.
 */
public record CacheKey(String urlHash, String namespaceHash, long pid, String taskId) {
    public CacheKey {
        Objects.requireNonNull(urlHash, "urlHash");
        Objects.requireNonNull(namespaceHash, "namespaceHash");
        Objects.requireNonNull(taskId, "taskId");
    }

    /** cache_&lt;url16&gt;_&lt;ns8&gt;_&lt;pid&gt;_&lt;task&gt;.txt */
    public String fileName() {
        return "cache_" + urlHash + "_" + namespaceHash + "_" + pid + "_" + taskId + ".txt";
    }

    /** 실패 마커 파일명 */
    public String markerName() {
        return fileName() + ".failed";
    }

    @Override
    public String toString() {
        return fileName();
    }
}
