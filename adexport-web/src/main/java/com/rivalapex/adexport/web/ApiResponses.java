package com.rivalapex.adexport.web;

import java.util.LinkedHashMap;
import java.util.Map;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;

/**
 * 统一响应信封：成功为 {success, data, meta?}，失败为 {success:false, error}。
 */
public final class ApiResponses {

    private ApiResponses() {
    }

    public static ResponseEntity<Map<String, Object>> ok(Object data) {
        return body(HttpStatus.OK, data, null);
    }

    public static ResponseEntity<Map<String, Object>> ok(Object data, Map<String, Object> meta) {
        return body(HttpStatus.OK, data, meta);
    }

    public static ResponseEntity<Map<String, Object>> created(Object data, Map<String, Object> meta) {
        return body(HttpStatus.CREATED, data, meta);
    }

    public static ResponseEntity<Map<String, Object>> error(HttpStatus status, String message) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("success", false);
        body.put("error", message);
        return ResponseEntity.status(status).body(body);
    }

    public static Map<String, Object> meta(Object... keysAndValues) {
        Map<String, Object> meta = new LinkedHashMap<>();
        for (int i = 0; i + 1 < keysAndValues.length; i += 2) {
            meta.put((String) keysAndValues[i], keysAndValues[i + 1]);
        }
        return meta;
    }

    private static ResponseEntity<Map<String, Object>> body(HttpStatus status, Object data, Map<String, Object> meta) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("success", true);
        body.put("data", data);
        if (meta != null && !meta.isEmpty()) {
            body.put("meta", meta);
        }
        return ResponseEntity.status(status).body(body);
    }
}
