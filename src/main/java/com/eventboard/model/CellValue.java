package com.eventboard.model;

import java.util.Locale;

/**
 * A single field value, tagged once when a record is ingested.
 * <p>
 * {@link Scalar} covers plain JSON values, {@link Rich} covers the structured
 * {@code {text, type, link}} cells the source uses for symbols and attachments.
 */
public interface CellValue {

    /**
     * Raw text of the cell, never null.
     */
    String text();

    /**
     * Whether substring search applies to this cell. Only strings and rich cells are searchable.
     */
    boolean textual();

    static Scalar string(String text) {
        return new Scalar(text, ScalarType.STRING);
    }

    static Scalar empty() {
        return new Scalar("", ScalarType.NULL);
    }

    static Rich rich(String text, String kind, String link) {
        return new Rich(text, kind, link);
    }

    enum ScalarType {
        STRING,
        NUMBER,
        BOOLEAN,
        NULL,
        STRUCTURE
    }

    record Scalar(String text, ScalarType type) implements CellValue {
        public Scalar {
            text = text == null ? "" : text;
            type = type == null ? ScalarType.STRING : type;
        }

        @Override
        public boolean textual() {
            return type == ScalarType.STRING;
        }
    }

    record Rich(String text, String kind, String link) implements CellValue {
        public Rich {
            text = text == null ? "" : text;
            kind = kind == null ? "" : kind.trim().toLowerCase(Locale.ROOT);
            link = link == null || link.isBlank() ? null : link.trim();
        }

        @Override
        public boolean textual() {
            return true;
        }

        public boolean hasLink() {
            return link != null;
        }
    }
}
