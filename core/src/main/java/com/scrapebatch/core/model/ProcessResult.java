package com.scrapebatch.core.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/** 처리기 결과: 템플릿 id + 필드 → 값 (입력 순서 유지) */
public record ProcessResult(String templateId, Map<String, String> attributes) {
    public ProcessResult {
        Objects.requireNonNull(templateId, "templateId");
        attributes = (attributes == null)
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(attributes));
    }
}
