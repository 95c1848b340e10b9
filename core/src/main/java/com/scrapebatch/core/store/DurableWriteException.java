package com.scrapebatch.core.store;

import java.io.IOException;

/** 원자적 쓰기 재시도를 모두 소진했을 때. 마지막 원인을 cause로 보존. */
public class DurableWriteException extends IOException {
    private final String name;
    private final int attempts;

    public DurableWriteException(String name, int attempts, Throwable cause) {
        super("durable write failed: " + name + " after " + attempts + " attempt(s)", cause);
        this.name = name;
        this.attempts = attempts;
    }

    public String getName() { return name; }
    public int getAttempts() { return attempts; }
}
