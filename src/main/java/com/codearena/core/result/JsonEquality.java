package com.codearena.core.result;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.Iterator;
import java.util.Map;

/**
 * The canonical equality rule applied to expected and actual values, whatever
 * runtime produced them.
 *
 * <ul>
 *   <li>numbers compare by numeric value, so {@code 10}, {@code 10.0} and
 *       {@code 1e1} are equal</li>
 *   <li>arrays compare element-wise, in order</li>
 *   <li>objects compare by key set and per-key value, ignoring key order</li>
 *   <li>a missing value equals JSON {@code null}</li>
 *   <li>everything else compares by JSON value</li>
 * </ul>
 */
public final class JsonEquality {

    private JsonEquality() {}

    public static boolean equivalent(JsonNode expected, JsonNode actual) {
        boolean expectedAbsent = expected == null || expected.isNull() || expected.isMissingNode();
        boolean actualAbsent = actual == null || actual.isNull() || actual.isMissingNode();
        if (expectedAbsent || actualAbsent) {
            return expectedAbsent && actualAbsent;
        }

        if (expected.isNumber() && actual.isNumber()) {
            return expected.decimalValue().compareTo(actual.decimalValue()) == 0;
        }

        if (expected.isArray() && actual.isArray()) {
            if (expected.size() != actual.size()) return false;
            for (int i = 0; i < expected.size(); i++) {
                if (!equivalent(expected.get(i), actual.get(i))) return false;
            }
            return true;
        }

        if (expected.isObject() && actual.isObject()) {
            if (expected.size() != actual.size()) return false;
            Iterator<Map.Entry<String, JsonNode>> fields = expected.fields();
            while (fields.hasNext()) {
                var field = fields.next();
                if (!actual.has(field.getKey())) return false;
                if (!equivalent(field.getValue(), actual.get(field.getKey()))) return false;
            }
            return true;
        }

        return expected.equals(actual);
    }
}
