package com.scrapebatch.core.api;

/** 템플릿 하나를 콘텐츠에 적용하다 실패. 아이템 결과에 PROCESS_FAILED로 남는다. */
public class ProcessingException extends Exception {
    private final String templateId;

    public ProcessingException(String templateId, String message) {
        super(message);
        this.templateId = templateId;
    }

    public ProcessingException(String templateId, String message, Throwable cause) {
        super(message, cause);
        this.templateId = templateId;
    }

    public String getTemplateId() { return templateId; }
}
