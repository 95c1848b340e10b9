package com.scrapebatch.core.util;

import java.time.Duration;
import java.time.Instant;
import java.util.Arrays;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * JSON 라인 기반 구조화 로거.
 * LogSetup(콘솔/파일 핸들러) 세팅 후 여기서 호출하면 JSON 한 줄로 찍힘.
 *
 * with(k, v)로 고정 컨텍스트(unit, runId 등)를 붙인 파생 로거를 만들 수 있다.
 */
public final class StructuredLog {
    private final Logger jul;
    private final String comp;
    private final Object[] context; // "key", value, ... (불변)

    private StructuredLog(Logger jul, String comp, Object[] context) {
        this.jul = jul;
        this.comp = comp;
        this.context = context;
    }

    public static StructuredLog get(Class<?> cls) {
        return new StructuredLog(Logger.getLogger(cls.getName()), cls.getSimpleName(), new Object[0]);
    }

    /** 컨텍스트 키/값을 하나 더 붙인 파생 로거 */
    public StructuredLog with(String key, Object value) {
        Object[] next = Arrays.copyOf(context, context.length + 2);
        next[context.length] = key;
        next[context.length + 1] = value;
        return new StructuredLog(jul, comp, next);
    }

    public boolean isDebugEnabled() { return jul.isLoggable(Level.FINE); }

    public void debug(String event, Object... kvs) { log(Level.FINE,    event, null, kvs); }
    public void info (String event, Object... kvs) { log(Level.INFO,    event, null, kvs); }
    public void warn (String event, Object... kvs) { log(Level.WARNING, event, null, kvs); }
    public void warn (String event, Throwable t, Object... kvs) { log(Level.WARNING, event, t, kvs); }
    public void error(String event, Throwable t, Object... kvs) { log(Level.SEVERE,  event, t, kvs); }

    private void log(Level lvl, String event, Throwable t, Object... kvs) {
        if (!jul.isLoggable(lvl)) return;
        String line = toJson(lvl, event, t, kvs);
        if (t == null) jul.log(lvl, line); else jul.log(lvl, line, t);
    }

    /** 테스트에서 포맷 확인용으로 노출 */
    String toJson(Level lvl, String event, Throwable t, Object... kvs) {
        StringBuilder sb = new StringBuilder(160);
        sb.append('{');
        kv(sb, "ts", Instant.now().toString());
        kv(sb, "lvl", lvl.getName());
        kv(sb, "comp", comp);
        kv(sb, "thread", Thread.currentThread().getName());
        kv(sb, "event", event);

        appendPairs(sb, context);
        appendPairs(sb, kvs);

        if (t != null) {
            kv(sb, "error", t.getClass().getSimpleName());
            kv(sb, "message", t.getMessage());
        }
        // 마지막 콤마 제거
        if (sb.charAt(sb.length() - 1) == ',') sb.setLength(sb.length() - 1);
        sb.append('}');
        return sb.toString();
    }

    private static void appendPairs(StringBuilder sb, Object[] kvs) {
        if (kvs == null || kvs.length == 0) return;
        for (int i = 0; i + 1 < kvs.length; i += 2) {
            kv(sb, String.valueOf(kvs[i]), kvs[i + 1]);
        }
        if (kvs.length % 2 == 1) kv(sb, "_kv_mismatch", true);
    }

    private static void kv(StringBuilder sb, String k, Object v) {
        sb.append('"').append(esc(k)).append('"').append(':');
        if (v == null) {
            sb.append("null");
        } else if (v instanceof Number || v instanceof Boolean) {
            sb.append(v);
        } else if (v instanceof Duration d) {
            sb.append(d.toMillis()); // 밀리초 숫자로
        } else {
            sb.append('"').append(esc(String.valueOf(v))).append('"');
        }
        sb.append(',');
    }

    private static String esc(String s) {
        StringBuilder r = new StringBuilder(s.length() + 8);
        for (int i = 0; i < s.length(); i++) {
            char c = s.charAt(i);
            switch (c) {
                case '"':  r.append("\\\""); break;
                case '\\': r.append("\\\\"); break;
                case '\n': r.append("\\n");  break;
                case '\r': r.append("\\r");  break;
                case '\t': r.append("\\t");  break;
                default:
                    if (c < 0x20) r.append(String.format("\\u%04x", (int) c));
                    else r.append(c);
            }
        }
        return r.toString();
    }
}
