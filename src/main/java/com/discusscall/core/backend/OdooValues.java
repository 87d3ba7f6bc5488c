package com.discusscall.core.backend;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.ArrayList;
import java.util.List;

/**
 * Odoo 字段值的小工具：many2one 可能是 [id, "name"]、裸 id 或 false。
 */
final class OdooValues {

    private OdooValues() {
    }

    static Long many2oneId(JsonNode v) {
        if (v == null || v.isNull() || v.isBoolean()) return null;
        if (v.isArray()) {
            return v.isEmpty() || !v.get(0).isIntegralNumber() ? null : v.get(0).asLong();
        }
        return v.isIntegralNumber() ? v.asLong() : null;
    }

    static String many2oneName(JsonNode v) {
        if (v != null && v.isArray() && v.size() > 1 && v.get(1).isTextual()) {
            return v.get(1).asText();
        }
        return null;
    }

    /** false / null 都当作没有值 */
    static String text(JsonNode v) {
        if (v == null || v.isNull() || v.isBoolean()) return null;
        return v.asText();
    }

    /** 转成普通 Java 值，保留原始形态交给使用方解析 */
    static Object toPlain(JsonNode v) {
        if (v == null || v.isNull() || (v.isBoolean() && !v.asBoolean())) return null;
        if (v.isIntegralNumber()) return v.asLong();
        if (v.isArray()) {
            List<Object> items = new ArrayList<>();
            for (JsonNode item : v) {
                items.add(toPlain(item));
            }
            return items;
        }
        return v.asText();
    }
}
