package com.scrapebatch.core.api;

/** 처리기에 넘기는 아이템 위치 정보 (프로젝트명, URL, 유닛 내 순번) */
public record ItemContext(String project, String url, int itemIndex, int itemCount) {
}
