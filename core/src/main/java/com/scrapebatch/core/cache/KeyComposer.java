package com.scrapebatch.core.cache;

import com.scrapebatch.core.util.Hashes;
import com.scrapebatch.core.util.UrlUtils;

import java.util.Objects;
import java.util.regex.Pattern;

/**
 * (URL, 네임스페이스) → CacheKey.
 * 같은 프로세스/태스크에서 같은 입력은 항상 같은 키, 다른 입력은 사실상 충돌 없음.
 */
public final class KeyComposer {
    private static final Pattern WS = Pattern.compile("\\s+");
    private static final Pattern TASK_ID = Pattern.compile("[A-Za-z0-9-]+");

    private final long pid;
    private final String taskId;

    public KeyComposer(long pid, String taskId) {
        Objects.requireNonNull(taskId, "taskId");
        if (!TASK_ID.matcher(taskId).matches()) {
            throw new IllegalArgumentException("taskId must match [A-Za-z0-9-]+: " + taskId);
        }
        this.pid = pid;
        this.taskId = taskId;
    }

    public static KeyComposer forCurrentProcess(String taskId) {
        return new KeyComposer(ProcessHandle.current().pid(), taskId);
    }

    public long pid() { return pid; }
    public String taskId() { return taskId; }

    public CacheKey compose(String url, String namespace) {
        Objects.requireNonNull(url, "url");
        Objects.requireNonNull(namespace, "namespace");
        String nu = UrlUtils.normalizeForKey(url);
        String nn = normalizeNamespace(namespace);
        return new CacheKey(sha256Hex(nu).substring(0, 16), sha256Hex(nn).substring(0, 8), pid, taskId);
    }

    /** trim + 내부 공백 하나로. 대소문자는 유지 */
    public static String normalizeNamespace(String namespace) {
        if (namespace == null || namespace.isBlank()) {
            throw new IllegalArgumentException("namespace must not be blank");
        }
        return WS.matcher(namespace.trim()).replaceAll(" ");
    }

    static String sha256Hex(String s) {
        return Hashes.sha256Hex(s);
    }
}
