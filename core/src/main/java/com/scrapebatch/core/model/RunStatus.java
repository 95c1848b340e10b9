package com.scrapebatch.core.model;

/** 실행 결과 → 프로세스 종료 코드 */
public enum RunStatus {
    /** 끝까지 돌았음. 실패 유닛이 있어도 0 (리포트에 목록) */
    COMPLETED(0),
    /** 중단(cancel/인터럽트). 다음 실행이 체크포인트부터 이어감 */
    CANCELLED(1),
    /** 같은 입력으로 다른 인스턴스가 실행 중 */
    ALREADY_RUNNING(3);

    private final int exitCode;

    RunStatus(int exitCode) { this.exitCode = exitCode; }

    public int exitCode() { return exitCode; }
}
