package com.scrapebatch.app.process;

import com.scrapebatch.core.api.ItemProcessor;
import com.scrapebatch.core.api.ItemProcessorProvider;
import com.scrapebatch.core.model.BatchConfig;
import com.scrapebatch.core.model.ProcessResult;

import java.util.Map;

/** 테스트용 provider (META-INF/services 로 등록) */
public class EchoProcessorProvider implements ItemProcessorProvider {
    @Override
    public String id() { return "test-echo"; }

    @Override
    public ItemProcessor create(BatchConfig config) {
        return (content, template, ctx) -> new ProcessResult(template.id(),
                Map.of("project", ctx.project(), "prompt", template.render(ctx.project())));
    }
}
