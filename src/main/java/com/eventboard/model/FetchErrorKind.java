package com.eventboard.model;

public enum FetchErrorKind {
    TRANSPORT("transport"),
    HTTP("http"),
    API("api"),
    INTERRUPTED("interrupted");

    private final String label;

    FetchErrorKind(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }

    public static FetchErrorKind fromLabel(String raw) {
        if (raw == null || raw.trim().isEmpty()) {
            return null;
        }
        String target = raw.trim().toLowerCase();
        for (FetchErrorKind kind : values()) {
            if (kind.label.equals(target) || kind.name().equalsIgnoreCase(target)) {
                return kind;
            }
        }
        return API;
    }
}
