package com.scrapebatch.core.model;

import java.util.Objects;

/** 프롬프트/템플릿 하나. id는 파일명에서 유도(예: prompt-3). */
public record Template(String id, String text) {
    public Template {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(text, "text");
        if (id.isBlank()) throw new IllegalArgumentException("template id must not be blank");
    }

    /** 텍스트 안의 $PROJECT 자리표시자를 프로젝트명으로 치환 */
    public String render(String project) {
        return text.replace("$PROJECT", project == null ? "" : project);
    }
}
