package com.scrapebatch.core.model;

import java.util.List;
import java.util.Objects;

/** 프로젝트 하나 = 처리 단위. 이름이 곧 체크포인트 id. */
public record WorkUnit(String name, List<String> urls) {
    public WorkUnit {
        Objects.requireNonNull(name, "name");
        if (name.isBlank()) throw new IllegalArgumentException("work unit name must not be blank");
        urls = (urls == null) ? List.of() : List.copyOf(urls);
    }

    public String id() { return name; }
}
