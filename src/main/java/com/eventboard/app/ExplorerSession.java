package com.eventboard.app;

import com.eventboard.config.Config;
import com.eventboard.model.DataRecord;
import com.eventboard.model.Dataset;
import com.eventboard.model.FetchMetadata;
import com.eventboard.storage.DatasetFile;
import com.eventboard.storage.DatasetStore;
import com.eventboard.storage.StorageException;
import com.eventboard.view.DatasetProfile;
import com.eventboard.view.DatasetProfiles;
import com.eventboard.view.ExportException;
import com.eventboard.view.RecordView;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Path;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * 模块说明：ExplorerSession（class）。
 * 主要职责：交互式浏览已保存的数据集，菜单驱动过滤、统计、导出与切换文件。
 * 使用建议：输入输出均由调用方注入，输入结束（EOF）视同退出。
 */
public final class ExplorerSession {
    private static final Logger LOG = LogManager.getLogger(ExplorerSession.class);
    private static final DateTimeFormatter EXPORT_TS = DateTimeFormatter.ofPattern("yyyyMMdd_HHmmss");
    private static final String RULE = "=".repeat(80);

    private final Config config;
    private final DatasetStore store;
    private final BufferedReader in;
    private final PrintStream out;
    private final int maxColumnWidth;
    private final int previewRows;
    private final int pageRows;

    private String datasetName;
    private Dataset dataset;
    private DatasetProfile profile;
    private List<DataRecord> selection;

    public ExplorerSession(Config config, DatasetStore store, BufferedReader in, PrintStream out) {
        this.config = config;
        this.store = store;
        this.in = in;
        this.out = out;
        this.maxColumnWidth = config.getInt("view.max_column_width", 40);
        this.previewRows = config.getInt("view.preview_rows", 10);
        this.pageRows = config.getInt("view.page_rows", 20);
    }

/**
 * 方法说明：run，负责执行交互会话主循环。
 * 处理流程：先加载指定文件或让用户选择，再循环读取菜单选项直到退出或输入结束。
 * 维护提示：返回 0 表示正常退出，1 表示没有可浏览的数据集。
 */
    public int run(String fileName) throws IOException {
        if (!open(fileName)) {
            return 1;
        }
        while (true) {
            printMenu();
            String choice = prompt("Enter choice (0-10): ");
            if (choice == null || choice.equals("0")) {
                out.println("Goodbye!");
                return 0;
            }
            try {
                if (!handle(choice)) {
                    return 1;
                }
            } catch (ExportException e) {
                out.println("ERROR: " + e.getMessage());
            }
        }
    }

    private boolean handle(String choice) throws IOException, ExportException {
        switch (choice) {
            case "1":
                show(dataset.records, previewRows);
                break;
            case "2":
                showAll();
                break;
            case "3":
                filterBySubject();
                break;
            case "4":
                filterAnyOf(profile.getCompanyFields(), "Company name or symbol");
                break;
            case "5":
                filterByDate();
                break;
            case "6":
                out.println(RecordView.statistics(dataset.records, profile).format(profile.getRecordNoun()));
                break;
            case "7":
                presets();
                break;
            case "8":
                export();
                break;
            case "9":
                printMetadata();
                break;
            case "10":
                return open(null);
            default:
                out.println("Invalid choice");
        }
        return true;
    }

    private boolean open(String fileName) throws IOException {
        List<DatasetFile> files;
        try {
            files = store.list();
        } catch (StorageException e) {
            out.println("ERROR: " + e.getMessage());
            return false;
        }
        if (files.isEmpty()) {
            out.println("No data files found in " + store.dir());
            return false;
        }
        DatasetFile chosen = fileName == null ? choose(files) : find(files, fileName);
        if (chosen == null) {
            return false;
        }
        try {
            Dataset loaded = store.load(chosen.path);
            this.datasetName = chosen.name;
            this.dataset = loaded;
            this.profile = DatasetProfiles.forDataset(chosen.name, loaded);
            this.selection = null;
            out.println("Loaded " + loaded.size() + " " + profile.getRecordNoun() + " from " + chosen.path.getFileName());
            LOG.info("Explorer loaded {} ({} records, profile={})", chosen.path, loaded.size(), profile.getName());
            return true;
        } catch (StorageException e) {
            out.println("ERROR: " + e.getMessage());
            return false;
        }
    }

    private DatasetFile find(List<DatasetFile> files, String fileName) {
        String wanted = fileName.endsWith(".json") ? fileName.substring(0, fileName.length() - 5) : fileName;
        for (DatasetFile file : files) {
            if (file.name.equals(wanted) || file.path.getFileName().toString().equals(fileName)) {
                return file;
            }
        }
        out.println("No data file named " + fileName + " in " + store.dir());
        return null;
    }

    private DatasetFile choose(List<DatasetFile> files) throws IOException {
        out.println("Available data files:");
        for (int i = 0; i < files.size(); i++) {
            DatasetFile file = files.get(i);
            out.printf("  %d. %s (%.1f KB)%n", i + 1, file.path.getFileName(), file.sizeBytes / 1024.0);
        }
        while (true) {
            String raw = prompt("Select file number: ");
            if (raw == null) {
                return null;
            }
            Integer index = parseIndex(raw, files.size());
            if (index != null) {
                return files.get(index);
            }
            out.println("Invalid choice");
        }
    }

    private void printMenu() {
        out.println();
        out.println(RULE);
        out.println(profile.getTitle() + " - " + datasetName + " (" + dataset.size() + " " + profile.getRecordNoun() + ")");
        out.println(RULE);
        out.println("1. Preview (first " + previewRows + ")");
        out.println("2. View all");
        out.println("3. Filter by subject");
        out.println("4. Filter by company/symbol");
        out.println("5. Filter by date");
        out.println("6. Statistics");
        out.println("7. Preset filters");
        out.println("8. Export to CSV");
        out.println("9. Metadata");
        out.println("10. Switch file");
        out.println("0. Exit");
    }

    private void show(List<DataRecord> records, int maxRows) {
        out.println(RecordView.render(records, maxRows, maxColumnWidth));
    }

    private void showAll() throws IOException {
        List<DataRecord> records = dataset.records;
        if (records.isEmpty()) {
            show(records, 0);
            return;
        }
        for (int start = 0; start < records.size(); start += pageRows) {
            int end = Math.min(start + pageRows, records.size());
            out.println(RecordView.render(records.subList(start, end), null, maxColumnWidth));
            out.println("Records " + (start + 1) + "-" + end + " of " + records.size());
            if (end < records.size()) {
                String next = prompt("Press Enter for more, q to stop: ");
                if (next == null || next.equalsIgnoreCase("q")) {
                    return;
                }
            }
        }
    }

    private void filterBySubject() throws IOException {
        List<String> fields = profile.searchableFields();
        String field;
        if (fields.isEmpty()) {
            field = prompt("Field name: ");
        } else if (fields.size() == 1) {
            field = fields.get(0);
        } else {
            for (int i = 0; i < fields.size(); i++) {
                out.println("  " + (i + 1) + ". " + fields.get(i));
            }
            String raw = prompt("Search in: ");
            Integer index = raw == null ? null : parseIndex(raw, fields.size());
            field = index == null ? null : fields.get(index);
        }
        if (field == null || field.isBlank()) {
            out.println("Invalid choice");
            return;
        }
        filterAnyOf(List.of(field), field);
    }

    private void filterByDate() throws IOException {
        if (!profile.hasDate()) {
            String field = prompt("Date field name: ");
            if (field == null || field.isBlank()) {
                return;
            }
            filterAnyOf(List.of(field.trim()), "Date");
            return;
        }
        filterAnyOf(List.of(profile.getDateField()), "Date (e.g. 15-Jan-2024 or Jan-2024)");
    }

    private void filterAnyOf(List<String> fields, String label) throws IOException {
        if (fields == null || fields.isEmpty()) {
            out.println("This dataset has no such field");
            return;
        }
        String keyword = prompt(label + ": ");
        if (keyword == null || keyword.isBlank()) {
            return;
        }
        List<DataRecord> result = RecordView.filterAny(dataset.records, fields, keyword);
        report(result, "matching '" + keyword.trim() + "'");
    }

    private void presets() throws IOException {
        List<DatasetProfile.Preset> presets = profile.getPresets();
        if (presets.isEmpty()) {
            out.println("No preset filters for this dataset");
            return;
        }
        for (int i = 0; i < presets.size(); i++) {
            out.println("  " + (i + 1) + ". " + presets.get(i).label());
        }
        String raw = prompt("Select preset: ");
        Integer index = raw == null ? null : parseIndex(raw, presets.size());
        if (index == null) {
            out.println("Invalid choice");
            return;
        }
        DatasetProfile.Preset preset = presets.get(index);
        report(RecordView.filter(dataset.records, preset.field(), preset.keyword()), "for " + preset.label());
    }

    private void report(List<DataRecord> result, String what) {
        selection = result;
        out.println("Found " + result.size() + " " + profile.getRecordNoun() + " " + what);
        if (!result.isEmpty()) {
            show(result, pageRows);
        }
    }

    private void export() throws IOException, ExportException {
        List<DataRecord> records = selection == null ? dataset.records : selection;
        String defaultName = datasetName + "_export_" + LocalDateTime.now().format(EXPORT_TS) + ".csv";
        String raw = prompt("Filename (Enter for " + defaultName + "): ");
        String name = raw == null || raw.isBlank() ? defaultName : raw.trim();
        if (!name.toLowerCase(Locale.ROOT).endsWith(".csv")) {
            name = name + ".csv";
        }
        Path target = config.getPath("export.dir").resolve(name);
        RecordView.exportCsv(records, target);
        out.println("Exported " + records.size() + " records to " + target);
    }

    private void printMetadata() {
        FetchMetadata meta = dataset.metadata;
        out.println("Records: " + dataset.size());
        out.println("Fetched at: " + dataset.fetchedAt);
        if (meta != null) {
            out.println("Source endpoint: " + nullToDash(meta.sourceEndpoint));
            out.println("Source URL: " + nullToDash(meta.sourceUrl));
            out.println("Scrape timestamp: " + nullToDash(meta.scrapeTimestamp));
            out.println("Market: " + meta.marketTypeOr("-"));
            out.println("Pages scraped: " + meta.totalPagesScraped);
            if (meta.requestParams != null) {
                for (Map.Entry<String, String> param : meta.requestParams.entrySet()) {
                    out.println("Param " + param.getKey() + ": " + param.getValue());
                }
            }
        }
        dataset.error().ifPresent(error -> out.println("Partial fetch: " + error.describe()));
    }

    private String prompt(String text) throws IOException {
        out.print(text);
        out.flush();
        String line = in.readLine();
        return line == null ? null : line.trim();
    }

    private static Integer parseIndex(String raw, int size) {
        try {
            int value = Integer.parseInt(raw.trim());
            return value >= 1 && value <= size ? value - 1 : null;
        } catch (NumberFormatException e) {
            return null;
        }
    }

    private static String nullToDash(String value) {
        return value == null || value.isBlank() ? "-" : value;
    }
}
