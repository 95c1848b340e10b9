package com.scrapebatch.core.model;

import com.fasterxml.jackson.annotation.JsonIgnore;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/** (URL, 템플릿) 하나의 처리 결과. 실패도 결과로 남긴다. */
public record ItemOutcome(String url,
                          String templateId,
                          Status status,
                          Map<String, String> attributes,
                          String error,
                          int contentLength,
                          long elapsedMs) {

    public enum Status { OK, FETCH_FAILED, PROCESS_FAILED }

    public ItemOutcome {
        Objects.requireNonNull(url, "url");
        Objects.requireNonNull(status, "status");
        attributes = (attributes == null)
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(attributes));
    }

    public static ItemOutcome ok(String url, ProcessResult r, int contentLength, long elapsedMs) {
        return new ItemOutcome(url, r.templateId(), Status.OK, r.attributes(), null, contentLength, elapsedMs);
    }

    /** fetch 실패는 템플릿과 무관하므로 templateId 없음 */
    public static ItemOutcome fetchFailed(String url, String error, long elapsedMs) {
        return new ItemOutcome(url, null, Status.FETCH_FAILED, Map.of(), error, 0, elapsedMs);
    }

    public static ItemOutcome processFailed(String url, String templateId, String error, int contentLength, long elapsedMs) {
        return new ItemOutcome(url, templateId, Status.PROCESS_FAILED, Map.of(), error, contentLength, elapsedMs);
    }

    @JsonIgnore
    public boolean isOk() { return status == Status.OK; }
}
