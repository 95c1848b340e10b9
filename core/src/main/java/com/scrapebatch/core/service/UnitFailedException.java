package com.scrapebatch.core.service;

/** 유닛 전체 실패(체크포인트에 기록하지 않고 다음 실행에서 재시도) */
public class UnitFailedException extends Exception {
    private final String unit;

    public UnitFailedException(String unit, String message) {
        super(message);
        this.unit = unit;
    }

    public UnitFailedException(String unit, String message, Throwable cause) {
        super(message, cause);
        this.unit = unit;
    }

    public String getUnit() { return unit; }
}
