package com.eventboard.core;

import com.eventboard.model.FetchError;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Success-or-failure value returned by single-attempt operations such as a page request.
 */
public final class Outcome<T> {
    public final boolean success;
    public final T value;
    public final FetchError error;
    public final String owner;
    public final Map<String, Object> details;

    private Outcome(boolean success, T value, FetchError error, String owner, Map<String, Object> details) {
        this.success = success;
        this.value = value;
        this.error = error;
        this.owner = owner == null ? "" : owner;
        this.details = details == null ? Map.of() : Map.copyOf(details);
    }

    public static <T> Outcome<T> success(T value, String owner) {
        return new Outcome<>(true, value, null, owner, Map.of());
    }

    public static <T> Outcome<T> success(T value, String owner, Map<String, Object> details) {
        return new Outcome<>(true, value, null, owner, copy(details));
    }

    public static <T> Outcome<T> failure(FetchError error, String owner) {
        return new Outcome<>(false, null, error, owner, Map.of());
    }

    public static <T> Outcome<T> failure(FetchError error, String owner, Map<String, Object> details) {
        return new Outcome<>(false, null, error, owner, copy(details));
    }

    private static Map<String, Object> copy(Map<String, Object> in) {
        if (in == null || in.isEmpty()) {
            return Map.of();
        }
        Map<String, Object> out = new LinkedHashMap<>();
        for (Map.Entry<String, Object> entry : in.entrySet()) {
            if (entry.getKey() != null && entry.getValue() != null) {
                out.put(entry.getKey(), entry.getValue());
            }
        }
        return out;
    }
}
