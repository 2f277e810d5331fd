package com.delivery.console.common.encoding;

import com.delivery.console.common.param.ParamValue;

import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.Map;

/**
 * Writes a parameter tree as a form body in bracket notation: {@code a[b]=1&a[c][0]=2&}.
 * Every pair is followed by {@code &}, including the last one. Empty values are skipped,
 * sequence items keep their original index.
 */
public class QueryEncoder {
    public String encode(ParamValue.Mapping params) {
        return encode(params, null);
    }

    /**
     * @param prefix a single, unencoded key segment the value is nested under, or {@code null}
     */
    public String encode(ParamValue value, String prefix) {
        StringBuilder sb = new StringBuilder();
        append(sb, value, prefix == null ? null : percentEncode(prefix));
        return sb.toString();
    }

    private void append(StringBuilder sb, ParamValue value, String prefix) {
        if (value instanceof ParamValue.Mapping mapping) {
            for (Map.Entry<String, ParamValue> entry : mapping.entries().entrySet()) {
                if (!entry.getValue().isEmpty()) {
                    append(sb, entry.getValue(), childPrefix(prefix, entry.getKey()));
                }
            }
        } else if (value instanceof ParamValue.Sequence sequence) {
            int index = 0;
            for (ParamValue item : sequence.items()) {
                if (!item.isEmpty()) {
                    append(sb, item, childPrefix(prefix, String.valueOf(index)));
                }
                index++;
            }
        } else if (value instanceof ParamValue.Scalar scalar) {
            if (prefix == null) {
                throw new IllegalArgumentException("Scalar value needs a key to be encoded");
            }
            sb.append(prefix).append('=').append(percentEncode(scalar.text())).append('&');
        }
    }

    private String childPrefix(String prefix, String key) {
        String encodedKey = percentEncode(key);
        return prefix == null ? encodedKey : prefix + "[" + encodedKey + "]";
    }

    /**
     * UTF-8 percent-encoding that leaves {@code A-Z a-z 0-9 - . _ ~ /} untouched and writes space
     * as {@code %20}.
     */
    public static String percentEncode(String value) {
        return URLEncoder.encode(value, StandardCharsets.UTF_8)
                .replace("+", "%20")
                .replace("*", "%2A")
                .replace("%7E", "~")
                .replace("%2F", "/");
    }
}
