package com.delivery.console.common.signing;

import com.delivery.console.common.param.ParamValue;

import java.util.Comparator;
import java.util.Map;
import java.util.TreeMap;

/**
 * Flattens a parameter tree into the delimiter-free string the server signs. Mapping keys are
 * visited in ascending code point order so insertion order never affects the result; sequences
 * keep their order. Empty values contribute nothing.
 */
public class Canonicalizer {
    /**
     * Orders keys by Unicode code point, which differs from {@link String#compareTo} for
     * characters outside the Basic Multilingual Plane.
     */
    static final Comparator<String> CODE_POINT_ORDER = (left, right) -> {
        int i = 0;
        int j = 0;
        while (i < left.length() && j < right.length()) {
            int a = left.codePointAt(i);
            int b = right.codePointAt(j);
            if (a != b) {
                return Integer.compare(a, b);
            }
            i += Character.charCount(a);
            j += Character.charCount(b);
        }
        return Boolean.compare(i < left.length(), j < right.length());
    };

    public String canonicalize(ParamValue value) {
        StringBuilder sb = new StringBuilder();
        append(sb, value);
        return sb.toString();
    }

    private void append(StringBuilder sb, ParamValue value) {
        if (value instanceof ParamValue.Scalar scalar) {
            sb.append(scalar.text());
        } else if (value instanceof ParamValue.Sequence sequence) {
            for (ParamValue item : sequence.items()) {
                if (!item.isEmpty()) {
                    append(sb, item);
                }
            }
        } else if (value instanceof ParamValue.Mapping mapping) {
            Map<String, ParamValue> sorted = new TreeMap<>(CODE_POINT_ORDER);
            sorted.putAll(mapping.entries());
            for (Map.Entry<String, ParamValue> entry : sorted.entrySet()) {
                if (!entry.getValue().isEmpty()) {
                    append(sb, entry.getValue());
                }
            }
        }
    }
}
