package com.discusscall.core.model;

import lombok.Value;

import java.util.List;
import java.util.Map;

/**
 * 事件通道里按 kind 打标签的通用通知，payload 保持后端原始字段名
 * （id / channel_id / partner_id / caller_name / is_camera_on ...）。
 *
 * 取值方法对类型很宽松：数字可能是 Integer / Long / "42"，many2one 可能是 [id, name]。
 */
@Value
public class BackendNotification {
    NotificationKind kind;
    Map<String, Object> payload;

    public Long getLong(String key) {
        return toLong(payload == null ? null : payload.get(key));
    }

    public String getString(String key) {
        Object v = payload == null ? null : payload.get(key);
        if (v instanceof List<?> list && list.size() > 1) {
            v = list.get(1);
        }
        if (v == null || v instanceof Boolean) return null;
        String s = v.toString();
        return s.isBlank() ? null : s;
    }

    public boolean getBoolean(String key) {
        Object v = payload == null ? null : payload.get(key);
        if (v instanceof Boolean b) return b;
        return v != null && "true".equalsIgnoreCase(v.toString());
    }

    private static Long toLong(Object v) {
        if (v instanceof Number n) return n.longValue();
        if (v instanceof List<?> list) return list.isEmpty() ? null : toLong(list.get(0));
        if (v instanceof String s) {
            try {
                return Long.parseLong(s.trim());
            } catch (NumberFormatException e) {
                return null;
            }
        }
        return null;
    }
}
