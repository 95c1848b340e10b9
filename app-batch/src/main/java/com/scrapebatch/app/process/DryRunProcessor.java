package com.scrapebatch.app.process;

import com.scrapebatch.core.api.ItemContext;
import com.scrapebatch.core.api.ItemProcessor;
import com.scrapebatch.core.model.ProcessResult;
import com.scrapebatch.core.model.Template;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 실제 처리기 없이 fetch/체크포인트 배관만 돌려보는 처리기.
 * 템플릿 id, 콘텐츠 길이, 앞부분 발췌를 결과로 남긴다.
 */
public final class DryRunProcessor implements ItemProcessor {
    static final int EXCERPT_CHARS = 120;

    @Override
    public ProcessResult process(String content, Template template, ItemContext context) {
        Map<String, String> attrs = new LinkedHashMap<>();
        attrs.put("template", template.id());
        attrs.put("contentLength", String.valueOf(content.length()));
        attrs.put("excerpt", excerpt(content));
        return new ProcessResult(template.id(), attrs);
    }

    static String excerpt(String content) {
        String flat = content.replaceAll("\\s+", " ").trim();
        return flat.length() <= EXCERPT_CHARS ? flat : flat.substring(0, EXCERPT_CHARS) + "...";
    }
}
