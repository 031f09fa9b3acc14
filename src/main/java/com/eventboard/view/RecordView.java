package com.eventboard.view;

import com.eventboard.model.CellValue;
import com.eventboard.model.DataRecord;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.BufferedWriter;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * 模块说明：RecordView（class）。
 * 主要职责：对已加载的数据集做过滤、频次统计、表格渲染与 CSV 导出，不修改输入记录。
 * 使用建议：所有方法为无状态静态方法，可对任意子集（如过滤结果）重复调用。
 */
public final class RecordView {
    private static final Logger log = LogManager.getLogger(RecordView.class);

    public static final String UNKNOWN = "Unknown";
    private static final String ELLIPSIS = "...";
    private static final char BOM = '\uFEFF';

    private RecordView() {
    }

/**
 * 方法说明：filter，负责按字段子串过滤记录。
 * 处理流程：对字段的展示形式做大小写不敏感的子串匹配；缺失字段或非文本值不匹配。
 * 维护提示：空关键字匹配所有带文本值的记录。
 */
    public static List<DataRecord> filter(List<DataRecord> records, String field, String keyword) {
        List<DataRecord> out = new ArrayList<>();
        if (records == null || field == null) {
            return out;
        }
        String needle = keyword == null ? "" : keyword.trim().toLowerCase(Locale.ROOT);
        for (DataRecord record : records) {
            if (matches(record, field, needle)) {
                out.add(record);
            }
        }
        return out;
    }

    /**
     * Records where any of {@code fields} matches, e.g. company name or symbol.
     */
    public static List<DataRecord> filterAny(List<DataRecord> records, List<String> fields, String keyword) {
        List<DataRecord> out = new ArrayList<>();
        if (records == null || fields == null || fields.isEmpty()) {
            return out;
        }
        String needle = keyword == null ? "" : keyword.trim().toLowerCase(Locale.ROOT);
        for (DataRecord record : records) {
            for (String field : fields) {
                if (matches(record, field, needle)) {
                    out.add(record);
                    break;
                }
            }
        }
        return out;
    }

    private static boolean matches(DataRecord record, String field, String needle) {
        Optional<CellValue> cell = record.get(field);
        if (cell.isEmpty() || !cell.get().textual()) {
            return false;
        }
        return CellNormalizer.display(cell.get()).toLowerCase(Locale.ROOT).contains(needle);
    }

/**
 * 方法说明：frequency，负责统计字段取值的出现次数。
 * 处理流程：按首次出现顺序累计；缺失或空值计入 "Unknown"。
 * 维护提示：返回 LinkedHashMap，topN 依赖其插入顺序做稳定排序。
 */
    public static Map<String, Integer> frequency(List<DataRecord> records, String field) {
        Map<String, Integer> counts = new LinkedHashMap<>();
        if (records == null) {
            return counts;
        }
        for (DataRecord record : records) {
            String key = CellNormalizer.exportValue(record.get(field)).trim();
            if (key.isEmpty()) {
                key = UNKNOWN;
            }
            counts.merge(key, 1, Integer::sum);
        }
        return counts;
    }

    /**
     * Entries ordered by count descending, ties keep first-seen order. {@code n <= 0} keeps all.
     */
    public static List<Map.Entry<String, Integer>> topN(Map<String, Integer> counts, int n) {
        List<Map.Entry<String, Integer>> entries = new ArrayList<>();
        if (counts == null) {
            return entries;
        }
        for (Map.Entry<String, Integer> entry : counts.entrySet()) {
            entries.add(Map.entry(entry.getKey(), entry.getValue()));
        }
        entries.sort(Comparator.comparing((Map.Entry<String, Integer> e) -> e.getValue()).reversed());
        if (n > 0 && entries.size() > n) {
            return new ArrayList<>(entries.subList(0, n));
        }
        return entries;
    }

    public static int uniqueCount(List<DataRecord> records, String field) {
        Set<String> seen = new HashSet<>();
        if (records == null) {
            return 0;
        }
        for (DataRecord record : records) {
            String value = CellNormalizer.exportValue(record.get(field)).trim();
            if (!value.isEmpty()) {
                seen.add(value);
            }
        }
        return seen.size();
    }

    /**
     * Number of records whose {@code field} is a rich cell of the given kind.
     */
    public static int countKind(List<DataRecord> records, String field, String kind) {
        if (records == null || kind == null) {
            return 0;
        }
        String wanted = kind.trim().toLowerCase(Locale.ROOT);
        int count = 0;
        for (DataRecord record : records) {
            Optional<CellValue> cell = record.get(field);
            if (cell.isPresent() && cell.get() instanceof CellValue.Rich rich && rich.kind().equals(wanted)) {
                count++;
            }
        }
        return count;
    }

    public static DatasetStatistics statistics(List<DataRecord> records, DatasetProfile profile) {
        List<DataRecord> rows = records == null ? List.of() : records;
        Integer uniqueCompanies = null;
        if (profile != null && !profile.getCompanyFields().isEmpty()) {
            uniqueCompanies = uniqueCount(rows, profile.getCompanyFields().get(0));
        }
        Map<String, Integer> kinds = new LinkedHashMap<>();
        Map<String, List<Map.Entry<String, Integer>>> tables = new LinkedHashMap<>();
        if (profile != null) {
            for (DatasetProfile.KindCounter counter : profile.getKindCounters()) {
                kinds.put(counter.label(), countKind(rows, counter.field(), counter.kind()));
            }
            for (DatasetProfile.FieldStat stat : profile.getStats()) {
                tables.put(stat.label(), topN(frequency(rows, stat.field()), stat.topN()));
            }
        }
        return new DatasetStatistics(rows.size(), uniqueCompanies, kinds, tables);
    }

/**
 * 方法说明：render，负责把记录渲染为网格表格文本。
 * 处理流程：列取自首条记录；单元格按 maxColumnWidth 截断；超出 maxRows 时追加总数提示。
 * 维护提示：maxRows 为 null 或不大于 0 时渲染全部记录。
 */
    public static String render(List<DataRecord> records, Integer maxRows, int maxColumnWidth) {
        if (records == null || records.isEmpty()) {
            return "No data to display";
        }
        int width = Math.max(maxColumnWidth, ELLIPSIS.length() + 1);
        List<String> columns = records.get(0).fieldNames();
        int total = records.size();
        int shown = maxRows != null && maxRows > 0 ? Math.min(maxRows, total) : total;

        List<List<String>> rows = new ArrayList<>();
        for (DataRecord record : records.subList(0, shown)) {
            List<String> row = new ArrayList<>();
            for (String column : columns) {
                row.add(truncate(CellNormalizer.display(record.get(column)), width));
            }
            rows.add(row);
        }
        List<String> header = new ArrayList<>();
        for (String column : columns) {
            header.add(truncate(column, width));
        }

        int[] widths = new int[columns.size()];
        for (int i = 0; i < columns.size(); i++) {
            widths[i] = header.get(i).length();
            for (List<String> row : rows) {
                widths[i] = Math.max(widths[i], row.get(i).length());
            }
        }

        StringBuilder sb = new StringBuilder();
        appendRule(sb, widths, '-');
        appendRow(sb, widths, header);
        appendRule(sb, widths, '=');
        for (List<String> row : rows) {
            appendRow(sb, widths, row);
            appendRule(sb, widths, '-');
        }
        if (shown < total) {
            sb.append('\n').append("... showing ").append(shown).append(" of ").append(total).append(" total records");
        }
        return sb.toString().stripTrailing();
    }

    private static void appendRule(StringBuilder sb, int[] widths, char fill) {
        sb.append('+');
        for (int w : widths) {
            sb.append(String.valueOf(fill).repeat(w + 2)).append('+');
        }
        sb.append('\n');
    }

    private static void appendRow(StringBuilder sb, int[] widths, List<String> cells) {
        sb.append('|');
        for (int i = 0; i < widths.length; i++) {
            String cell = cells.get(i);
            sb.append(' ').append(cell).append(" ".repeat(widths[i] - cell.length())).append(" |");
        }
        sb.append('\n');
    }

    static String truncate(String text, int width) {
        String flat = text == null ? "" : text.replaceAll("\\s*[\\r\\n]+\\s*", " ").trim();
        if (flat.length() <= width) {
            return flat;
        }
        return flat.substring(0, width - ELLIPSIS.length()) + ELLIPSIS;
    }

/**
 * 方法说明：exportCsv，负责把记录导出为 CSV 文件。
 * 处理流程：表头取首条记录字段；单元格用导出值；UTF-8 带 BOM，RFC 4180 转义。
 * 维护提示：无记录时抛 ExportException，不创建文件。
 */
    public static void exportCsv(List<DataRecord> records, Path path) throws ExportException {
        if (records == null || records.isEmpty()) {
            throw new ExportException("No data to export");
        }
        if (path == null) {
            throw new ExportException("No export path given");
        }
        List<String> columns = records.get(0).fieldNames();
        try {
            Path parent = path.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            try (BufferedWriter writer = Files.newBufferedWriter(path, StandardCharsets.UTF_8)) {
                writer.write(BOM);
                writeCsvRow(writer, columns);
                for (DataRecord record : records) {
                    List<String> values = new ArrayList<>(columns.size());
                    for (String column : columns) {
                        values.add(CellNormalizer.exportValue(record.get(column)));
                    }
                    writeCsvRow(writer, values);
                }
            }
        } catch (IOException e) {
            throw new ExportException("Failed to write " + path + ": " + e.getMessage(), e);
        }
        log.info("Exported {} records to {}", records.size(), path);
    }

    private static void writeCsvRow(BufferedWriter writer, List<String> values) throws IOException {
        for (int i = 0; i < values.size(); i++) {
            if (i > 0) {
                writer.write(',');
            }
            writer.write(csvEscape(values.get(i)));
        }
        writer.write('\n');
    }

    static String csvEscape(String value) {
        String text = value == null ? "" : value;
        if (text.contains(",") || text.contains("\"") || text.contains("\n") || text.contains("\r")) {
            return "\"" + text.replace("\"", "\"\"") + "\"";
        }
        return text;
    }
}
