package com.github.dimitryivaniuta.canvas.http;

import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.Collection;
import java.util.Map;
import java.util.StringJoiner;

/**
 * {@code application/x-www-form-urlencoded} encoding. Collection values repeat the key with a
 * {@code []} suffix, the way Canvas expects array parameters.
 */
public final class FormEncoding {
    private FormEncoding() {}

    public static final String CONTENT_TYPE = "application/x-www-form-urlencoded";

    public static String encode(Map<String, ?> params) {
        StringJoiner out = new StringJoiner("&");
        if (params == null) return "";
        params.forEach((key, value) -> {
            if (value instanceof Collection<?> c) {
                String name = key.endsWith("[]") ? key : key + "[]";
                for (Object v : c) {
                    out.add(pair(name, v));
                }
            } else {
                out.add(pair(key, value));
            }
        });
        return out.toString();
    }

    private static String pair(String key, Object value) {
        String v = (value == null) ? "" : String.valueOf(value);
        return URLEncoder.encode(key, StandardCharsets.UTF_8) + "=" + URLEncoder.encode(v, StandardCharsets.UTF_8);
    }
}
