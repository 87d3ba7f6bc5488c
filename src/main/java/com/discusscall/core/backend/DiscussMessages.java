package com.discusscall.core.backend;

import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Odoo 消息字段的解析工具。
 * 作者字段的形态不固定：数字、[id, name]、"42"，还有 XML-RPC 片段 &lt;value&gt;&lt;int&gt;42&lt;/int&gt;。
 */
public final class DiscussMessages {

    private static final Pattern XMLRPC_INT = Pattern.compile("<value><int>(\\d+)</int>");
    private static final Pattern DIGITS = Pattern.compile("^\\s*(\\d+)\\s*$");
    private static final Pattern QUOTED_NAME = Pattern.compile("^\"([^\"]+)\"");

    private DiscussMessages() {
    }

    /**
     * 解析作者 partner id，解析不了返回 null，不抛异常。
     */
    public static Long authorId(Object author) {
        if (author == null) return null;
        if (author instanceof Number n) {
            return n.longValue();
        }
        if (author instanceof List<?> list) {
            return list.isEmpty() ? null : authorId(list.get(0));
        }
        if (author instanceof String s) {
            Matcher xml = XMLRPC_INT.matcher(s);
            if (xml.find()) {
                return parseId(xml.group(1));
            }
            Matcher plain = DIGITS.matcher(s);
            if (plain.find()) {
                return parseId(plain.group(1));
            }
        }
        return null;
    }

    private static Long parseId(String digits) {
        try {
            return Long.parseLong(digits);
        } catch (NumberFormatException e) {
            // 超出 long 范围
            return null;
        }
    }

    /** email_from 形如 "Alex Doe" &lt;alex@example.com&gt;，取引号里的显示名 */
    public static String displayName(String emailFrom) {
        if (emailFrom == null) return null;
        Matcher m = QUOTED_NAME.matcher(emailFrom.trim());
        return m.find() ? m.group(1) : null;
    }

    /** 消息 body 是 HTML，解析前先把常见实体还原 */
    public static String decodeEntities(String html) {
        if (html == null) return "";
        return html
                .replace("&quot;", "\"")
                .replace("&#34;", "\"")
                .replace("&#39;", "'")
                .replace("&#x27;", "'")
                .replace("&lt;", "<")
                .replace("&gt;", ">")
                .replace("&nbsp;", " ")
                .replace("&amp;", "&");
    }
}
