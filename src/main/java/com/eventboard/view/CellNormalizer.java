package com.eventboard.view;

import com.eventboard.model.CellValue;

import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Turns cells into display text and export text. Never throws; absent cells become the empty string.
 */
public final class CellNormalizer {
    private static final Map<String, String> ARTIFACT_TAGS = Map.of(
            "pdf", "PDF",
            "document", "PDF",
            "xbrl", "XBRL",
            "structured-data", "XBRL",
            "structured_data", "XBRL"
    );

    private CellNormalizer() {
    }

    /**
     * Display form: rich cells that point at a downloadable artifact get a tag, e.g. {@code "Q3 Results [PDF]"}.
     */
    public static String display(CellValue cell) {
        if (cell == null) {
            return "";
        }
        String text = exportValue(cell);
        if (cell instanceof CellValue.Rich rich) {
            String tag = artifactTag(rich.kind());
            if (tag != null) {
                return text.isEmpty() ? "[" + tag + "]" : text + " [" + tag + "]";
            }
        }
        return text;
    }

    public static String display(Optional<CellValue> cell) {
        return cell == null ? "" : display(cell.orElse(null));
    }

    /**
     * Machine-readable form: the cell text without any tag.
     */
    public static String exportValue(CellValue cell) {
        if (cell == null) {
            return "";
        }
        if (cell instanceof CellValue.Scalar scalar && scalar.type() == CellValue.ScalarType.NULL) {
            return "";
        }
        String text = cell.text();
        return text == null ? "" : text;
    }

    public static String exportValue(Optional<CellValue> cell) {
        return cell == null ? "" : exportValue(cell.orElse(null));
    }

    /**
     * Tag shown for an artifact kind, or null when the kind is not a downloadable artifact.
     */
    public static String artifactTag(String kind) {
        if (kind == null || kind.isBlank()) {
            return null;
        }
        return ARTIFACT_TAGS.get(kind.trim().toLowerCase(Locale.ROOT));
    }
}
