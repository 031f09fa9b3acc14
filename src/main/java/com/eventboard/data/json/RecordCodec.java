package com.eventboard.data.json;

import com.eventboard.model.CellValue;
import com.eventboard.model.DataRecord;
import org.json.JSONException;
import org.json.JSONObject;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Converts between parsed JSON trees and {@link DataRecord}s.
 * Every value is classified here, once, as a plain scalar or a rich {@code {text, type, link}} cell.
 */
public final class RecordCodec {
    private static final String TEXT = "text";
    private static final String TYPE = "type";
    private static final String LINK = "link";

    private RecordCodec() {
    }

    public static List<DataRecord> toRecords(Object array) {
        List<DataRecord> out = new ArrayList<>();
        for (Object item : OrderedJson.asList(array)) {
            if (item instanceof Map) {
                out.add(toRecord(OrderedJson.asObject(item)));
            }
        }
        return out;
    }

    public static DataRecord toRecord(Map<String, Object> object) {
        Map<String, CellValue> fields = new LinkedHashMap<>();
        for (Map.Entry<String, Object> entry : object.entrySet()) {
            fields.put(entry.getKey(), toCell(entry.getValue()));
        }
        return new DataRecord(fields);
    }

    public static CellValue toCell(Object raw) {
        if (raw == null || raw == JSONObject.NULL) {
            return CellValue.empty();
        }
        if (raw instanceof String) {
            return CellValue.string((String) raw);
        }
        if (raw instanceof Number) {
            return new CellValue.Scalar(numberText((Number) raw), CellValue.ScalarType.NUMBER);
        }
        if (raw instanceof Boolean) {
            return new CellValue.Scalar(raw.toString(), CellValue.ScalarType.BOOLEAN);
        }
        if (raw instanceof Map) {
            Map<String, Object> object = OrderedJson.asObject(raw);
            if (object.containsKey(TEXT)) {
                return CellValue.rich(
                        OrderedJson.optString(object, TEXT, ""),
                        OrderedJson.optString(object, TYPE, ""),
                        OrderedJson.optString(object, LINK, null)
                );
            }
        }
        return new CellValue.Scalar(OrderedJson.toJson(raw), CellValue.ScalarType.STRUCTURE);
    }

    public static List<Object> fromRecords(List<DataRecord> records) {
        List<Object> out = new ArrayList<>();
        if (records == null) {
            return out;
        }
        for (DataRecord record : records) {
            out.add(fromRecord(record));
        }
        return out;
    }

    public static Map<String, Object> fromRecord(DataRecord record) {
        Map<String, Object> out = new LinkedHashMap<>();
        for (Map.Entry<String, CellValue> entry : record.fields().entrySet()) {
            out.put(entry.getKey(), fromCell(entry.getValue()));
        }
        return out;
    }

    public static Object fromCell(CellValue cell) {
        if (cell instanceof CellValue.Rich rich) {
            Map<String, Object> out = new LinkedHashMap<>();
            out.put(TEXT, rich.text());
            if (!rich.kind().isEmpty()) {
                out.put(TYPE, rich.kind());
            }
            if (rich.hasLink()) {
                out.put(LINK, rich.link());
            }
            return out;
        }
        CellValue.Scalar scalar = (CellValue.Scalar) cell;
        switch (scalar.type()) {
            case NULL:
                return JSONObject.NULL;
            case NUMBER:
                try {
                    return new BigDecimal(scalar.text());
                } catch (NumberFormatException e) {
                    return scalar.text();
                }
            case BOOLEAN:
                return Boolean.valueOf(scalar.text());
            case STRUCTURE:
                try {
                    return OrderedJson.parse(scalar.text());
                } catch (JSONException e) {
                    return scalar.text();
                }
            default:
                return scalar.text();
        }
    }

    private static String numberText(Number number) {
        if (number instanceof BigDecimal) {
            return ((BigDecimal) number).toPlainString();
        }
        return JSONObject.numberToString(number);
    }
}
