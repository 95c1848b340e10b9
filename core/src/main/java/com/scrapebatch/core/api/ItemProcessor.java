package com.scrapebatch.core.api;

import com.scrapebatch.core.model.ProcessResult;
import com.scrapebatch.core.model.Template;

/**
 * 같은 콘텐츠에 템플릿 하나씩 적용해 필드 → 값 결과를 만든다.
 * 한 콘텐츠에 대해 템플릿 수만큼 호출되며, 여러 워커가 동시에 호출한다.
 */
@FunctionalInterface
public interface ItemProcessor {
    ProcessResult process(String content, Template template, ItemContext context)
            throws ProcessingException, InterruptedException;
}
