package com.eventboard.data.json;

import org.json.JSONException;
import org.json.JSONObject;
import org.json.JSONTokener;
import org.json.JSONWriter;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * JSON reading and writing that keeps object keys in document order.
 * <p>
 * Objects become {@code LinkedHashMap<String, Object>}, arrays become {@code List<Object>},
 * JSON null becomes {@link JSONObject#NULL}; strings, numbers and booleans are returned as parsed by
 * {@link JSONTokener}.
 */
public final class OrderedJson {

    private OrderedJson() {
    }

    public static Object parse(String text) {
        if (text == null || text.isBlank()) {
            throw new JSONException("empty JSON document");
        }
        JSONTokener x = new JSONTokener(text);
        Object value = readValue(x);
        if (x.nextClean() != 0) {
            throw x.syntaxError("trailing content after JSON value");
        }
        return value;
    }

    @SuppressWarnings("unchecked")
    public static Map<String, Object> parseObject(String text) {
        Object value = parse(text);
        if (!(value instanceof Map)) {
            throw new JSONException("expected a JSON object");
        }
        return (Map<String, Object>) value;
    }

    public static String toJson(Object value) {
        StringBuilder sb = new StringBuilder();
        write(value, sb);
        return sb.toString();
    }

    public static void write(Object value, Appendable out) {
        writeValue(new JSONWriter(out), value);
    }

    @SuppressWarnings("unchecked")
    public static Map<String, Object> asObject(Object value) {
        return value instanceof Map ? (Map<String, Object>) value : Map.of();
    }

    @SuppressWarnings("unchecked")
    public static List<Object> asList(Object value) {
        return value instanceof List ? (List<Object>) value : List.of();
    }

    public static String optString(Map<String, Object> object, String key, String fallback) {
        Object value = object == null ? null : object.get(key);
        if (value == null || value == JSONObject.NULL) {
            return fallback;
        }
        return String.valueOf(value);
    }

    public static int optInt(Map<String, Object> object, String key, int fallback) {
        Object value = object == null ? null : object.get(key);
        if (value instanceof Number) {
            return ((Number) value).intValue();
        }
        if (value instanceof String) {
            try {
                return Integer.parseInt(((String) value).trim());
            } catch (NumberFormatException ignored) {
                return fallback;
            }
        }
        return fallback;
    }

    public static boolean optBoolean(Map<String, Object> object, String key, boolean fallback) {
        Object value = object == null ? null : object.get(key);
        if (value instanceof Boolean) {
            return (Boolean) value;
        }
        if (value instanceof String) {
            String s = ((String) value).trim();
            if ("true".equalsIgnoreCase(s)) {
                return true;
            }
            if ("false".equalsIgnoreCase(s)) {
                return false;
            }
        }
        return fallback;
    }

    private static Object readValue(JSONTokener x) {
        char c = x.nextClean();
        switch (c) {
            case '{':
                return readObject(x);
            case '[':
                return readArray(x);
            default:
                x.back();
                return x.nextValue();
        }
    }

    private static Map<String, Object> readObject(JSONTokener x) {
        Map<String, Object> out = new LinkedHashMap<>();
        char c = x.nextClean();
        if (c == '}') {
            return out;
        }
        x.back();
        while (true) {
            c = x.nextClean();
            if (c != '"' && c != '\'') {
                throw x.syntaxError("expected a quoted object key");
            }
            String key = x.nextString(c);
            if (x.nextClean() != ':') {
                throw x.syntaxError("expected ':' after key " + key);
            }
            out.put(key, readValue(x));
            c = x.nextClean();
            if (c == '}') {
                return out;
            }
            if (c != ',') {
                throw x.syntaxError("expected ',' or '}'");
            }
        }
    }

    private static List<Object> readArray(JSONTokener x) {
        List<Object> out = new ArrayList<>();
        char c = x.nextClean();
        if (c == ']') {
            return out;
        }
        x.back();
        while (true) {
            out.add(readValue(x));
            c = x.nextClean();
            if (c == ']') {
                return out;
            }
            if (c != ',') {
                throw x.syntaxError("expected ',' or ']'");
            }
        }
    }

    private static void writeValue(JSONWriter w, Object value) {
        if (value instanceof Map<?, ?> map) {
            w.object();
            for (Map.Entry<?, ?> entry : map.entrySet()) {
                w.key(String.valueOf(entry.getKey()));
                writeValue(w, entry.getValue());
            }
            w.endObject();
            return;
        }
        if (value instanceof List<?> list) {
            w.array();
            for (Object item : list) {
                writeValue(w, item);
            }
            w.endArray();
            return;
        }
        w.value(value == null ? JSONObject.NULL : value);
    }
}
