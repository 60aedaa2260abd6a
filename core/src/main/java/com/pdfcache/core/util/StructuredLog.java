package com.pdfcache.core.util;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.time.Instant;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * JSON 라인 기반 구조화 로거.
 * 사람이 읽는 로그는 slf4j, 집계용 이벤트(fetch-start, cache-hit 등)는 여기로 남긴다.
 * <pre>
 * SLOG.info("fetch-done", "url", url, "bytes", 1234);
 * {"ts":"...","lvl":"INFO","comp":"RemoteFetcher","thread":"main","event":"fetch-done","url":"...","bytes":1234}
 * </pre>
 */
public final class StructuredLog {

    private static final ObjectMapper OM = new ObjectMapper();

    private final Logger jul;
    private final String comp;

    private StructuredLog(Class<?> cls) {
        this.jul = Logger.getLogger(cls.getName());
        this.comp = cls.getSimpleName();
    }

    public static StructuredLog get(Class<?> cls) {
        return new StructuredLog(cls);
    }

    public void debug(String event, Object... kvs) { log(Level.FINE,    event, null, kvs); }
    public void info (String event, Object... kvs) { log(Level.INFO,    event, null, kvs); }
    public void warn (String event, Object... kvs) { log(Level.WARNING, event, null, kvs); }
    public void error(String event, Throwable t, Object... kvs) { log(Level.SEVERE, event, t, kvs); }

    private void log(Level lvl, String event, Throwable t, Object... kvs) {
        if (!jul.isLoggable(lvl)) return;
        String line = toJson(lvl, event, t, kvs);
        if (t == null) jul.log(lvl, line); else jul.log(lvl, line, t);
    }

    /** 패키지 공개: 포맷 검증용 */
    String toJson(Level lvl, String event, Throwable t, Object... kvs) {
        ObjectNode node = OM.createObjectNode();
        node.put("ts", Instant.now().toString());
        node.put("lvl", lvl.getName());
        node.put("comp", comp);
        node.put("thread", Thread.currentThread().getName());
        node.put("event", event);

        // kvs: "key", value, ...
        if (kvs != null && kvs.length > 0) {
            for (int i = 0; i + 1 < kvs.length; i += 2) {
                put(node, String.valueOf(kvs[i]), kvs[i + 1]);
            }
            if (kvs.length % 2 == 1) node.put("_kv_mismatch", true);
        }
        if (t != null) {
            node.put("error", t.getClass().getSimpleName());
            node.put("message", String.valueOf(t.getMessage()));
        }
        try {
            return OM.writeValueAsString(node);
        } catch (JsonProcessingException e) {
            // ObjectNode 직렬화는 실패하지 않는다. 혹시 몰라 이벤트명만 남김
            return "{\"event\":\"" + event + "\",\"_serialize_error\":true}";
        }
    }

    private static void put(ObjectNode node, String k, Object v) {
        if (v == null) node.putNull(k);
        else if (v instanceof Integer i) node.put(k, i);
        else if (v instanceof Long l) node.put(k, l);
        else if (v instanceof Double d) node.put(k, d);
        else if (v instanceof Boolean b) node.put(k, b);
        else if (v instanceof Number n) node.put(k, n.doubleValue());
        else node.put(k, String.valueOf(v));
    }
}
