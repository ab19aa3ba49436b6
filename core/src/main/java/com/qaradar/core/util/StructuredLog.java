package com.qaradar.core.util;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * JSON 라인 기반 구조화 로거.
 * 일반 로그와 같은 SLF4J 백엔드로 나가며 logger 이름에 ".events" 접미사가 붙는다.
 * <pre>SLOG.info("page-analysed", "url", url, "signals", 3);</pre>
 */
public final class StructuredLog {
    private static final ObjectMapper OM = new ObjectMapper();

    private final Logger log;
    private final String comp;

    private StructuredLog(Class<?> cls) {
        this.log = LoggerFactory.getLogger(cls.getName() + ".events");
        this.comp = cls.getSimpleName();
    }

    public static StructuredLog get(Class<?> cls) {
        return new StructuredLog(cls);
    }

    public void debug(String event, Object... kvs) {
        if (log.isDebugEnabled()) log.debug(line("DEBUG", event, null, kvs));
    }

    public void info(String event, Object... kvs) {
        if (log.isInfoEnabled()) log.info(line("INFO", event, null, kvs));
    }

    public void warn(String event, Object... kvs) {
        if (log.isWarnEnabled()) log.warn(line("WARN", event, null, kvs));
    }

    public void error(String event, Throwable t, Object... kvs) {
        if (!log.isErrorEnabled()) return;
        if (t == null) log.error(line("ERROR", event, null, kvs));
        else log.error(line("ERROR", event, t, kvs), t);
    }

    /** 테스트에서 포맷 확인용 */
    String line(String lvl, String event, Throwable t, Object... kvs) {
        Map<String, Object> m = new LinkedHashMap<>();
        m.put("ts", Instant.now().toString());
        m.put("lvl", lvl);
        m.put("comp", comp);
        m.put("thread", Thread.currentThread().getName());
        m.put("event", event);

        if (kvs != null && kvs.length > 0) {
            for (int i = 0; i + 1 < kvs.length; i += 2) {
                m.put(String.valueOf(kvs[i]), scalar(kvs[i + 1]));
            }
            if (kvs.length % 2 == 1) m.put("_kv_mismatch", true);
        }
        if (t != null) {
            m.put("error", t.getClass().getSimpleName());
            m.put("message", t.getMessage());
        }
        try {
            return OM.writeValueAsString(m);
        } catch (JsonProcessingException e) {
            return "{\"event\":\"" + event + "\",\"_encode_error\":true}";
        }
    }

    private static Object scalar(Object v) {
        if (v == null || v instanceof Number || v instanceof Boolean) return v;
        return String.valueOf(v);
    }
}
