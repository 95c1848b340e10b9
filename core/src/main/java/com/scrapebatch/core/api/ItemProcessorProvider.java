package com.scrapebatch.core.api;

import com.scrapebatch.core.model.BatchConfig;

/**
 * ServiceLoader로 찾는 처리기 공급자.
 * META-INF/services/com.scrapebatch.core.api.ItemProcessorProvider 에 등록.
 */
public interface ItemProcessorProvider {
    /** 로그/선택용 이름 */
    String id();

    ItemProcessor create(BatchConfig config);
}
