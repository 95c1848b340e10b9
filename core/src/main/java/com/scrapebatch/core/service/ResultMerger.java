package com.scrapebatch.core.service;

import com.scrapebatch.core.model.ItemOutcome;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * 아이템 결과 → url별 필드 집계.
 * 서로 다른 값이 하나면 그 값(String), 여럿이면 처음 본 순서대로 전부(List).
 * 빈 값과 실패한 outcome은 무시한다.
 */
public final class ResultMerger {
    private ResultMerger() {}

    /**
     * @param urls     유닛의 URL 순서(결과 map 순서). 결과가 없는 URL은 빈 map으로 남는다.
     * @param outcomes 유닛의 모든 아이템 결과
     */
    public static Map<String, Map<String, Object>> merge(List<String> urls, List<ItemOutcome> outcomes) {
        Map<String, Map<String, Set<String>>> acc = new LinkedHashMap<>();
        for (String u : urls) acc.computeIfAbsent(u, k -> new LinkedHashMap<>());

        for (ItemOutcome o : outcomes) {
            if (!o.isOk()) continue;
            Map<String, Set<String>> fields = acc.computeIfAbsent(o.url(), k -> new LinkedHashMap<>());
            for (Map.Entry<String, String> e : o.attributes().entrySet()) {
                String v = e.getValue();
                if (v == null || v.isBlank()) continue;
                fields.computeIfAbsent(e.getKey(), k -> new LinkedHashSet<>()).add(v.trim());
            }
        }

        Map<String, Map<String, Object>> out = new LinkedHashMap<>();
        for (Map.Entry<String, Map<String, Set<String>>> byUrl : acc.entrySet()) {
            Map<String, Object> fields = new LinkedHashMap<>();
            for (Map.Entry<String, Set<String>> f : byUrl.getValue().entrySet()) {
                Set<String> values = f.getValue();
                fields.put(f.getKey(), values.size() == 1 ? values.iterator().next() : new ArrayList<>(values));
            }
            out.put(byUrl.getKey(), fields);
        }
        return out;
    }
}
