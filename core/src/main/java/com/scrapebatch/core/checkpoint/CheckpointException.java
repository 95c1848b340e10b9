package com.scrapebatch.core.checkpoint;

/** 체크포인트 flush 불가. 진행 상황을 잃을 수 있으므로 실행을 중단시킨다. */
public class CheckpointException extends Exception {
    public CheckpointException(String message, Throwable cause) {
        super(message, cause);
    }
}
