package com.eventboard.view;

import com.eventboard.model.CellValue;
import com.eventboard.model.DataRecord;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class RecordViewTest {

    @TempDir
    Path dir;

    private final List<DataRecord> announcements = List.of(
            DataRecord.of("SYMBOL", CellValue.rich("TCS", "link", "/q/TCS"), "SUBJECT", "Dividend declared",
                    "ATTACHMENT", CellValue.rich("Notice", "pdf", "/n.pdf")),
            DataRecord.of("SYMBOL", "INFY", "SUBJECT", "Financial Results",
                    "ATTACHMENT", CellValue.empty()),
            DataRecord.of("SYMBOL", "ITC", "SUBJECT", "Interim DIVIDEND",
                    "ATTACHMENT", CellValue.rich("Outcome", "pdf", "/o.pdf")),
            DataRecord.of("SYMBOL", "HDFC", "SUBJECT", new CellValue.Scalar("7", CellValue.ScalarType.NUMBER)),
            DataRecord.of("SYMBOL", "WIPRO")
    );

    @Test
    void filterShouldMatchCaseInsensitiveSubstrings() {
        List<DataRecord> result = RecordView.filter(announcements, "SUBJECT", "dividend");

        assertEquals(2, result.size());
        assertEquals("TCS", result.get(0).get("SYMBOL").orElseThrow().text());
        assertEquals("ITC", result.get(1).get("SYMBOL").orElseThrow().text());
        assertEquals(result, RecordView.filter(result, "SUBJECT", "dividend"));
    }

    @Test
    void filterShouldSkipMissingAndNonTextValues() {
        assertTrue(RecordView.filter(announcements, "SUBJECT", "7").isEmpty());
        assertEquals(3, RecordView.filter(announcements, "SUBJECT", "").size());
    }

    @Test
    void filterShouldSeeDisplayTags() {
        assertEquals(2, RecordView.filter(announcements, "ATTACHMENT", "[pdf]").size());
    }

    @Test
    void filterAnyShouldMatchAnyListedField() {
        List<DataRecord> records = List.of(
                DataRecord.of("COMPANY NAME", "Tata Consultancy", "SYMBOL", "TCS"),
                DataRecord.of("COMPANY NAME", "Infosys", "SYMBOL", "INFY")
        );

        assertEquals(1, RecordView.filterAny(records, List.of("COMPANY NAME", "SYMBOL"), "infy").size());
        assertEquals(1, RecordView.filterAny(records, List.of("COMPANY NAME", "SYMBOL"), "tata").size());
    }

    @Test
    void frequencyOverUniformFieldShouldHaveSingleEntry() {
        List<DataRecord> records = List.of(
                DataRecord.of("PURPOSE", "Dividend"),
                DataRecord.of("PURPOSE", "Dividend"),
                DataRecord.of("PURPOSE", "Dividend")
        );

        assertEquals(Map.of("Dividend", 3), RecordView.frequency(records, "PURPOSE"));
    }

    @Test
    void frequencyShouldCountMissingValuesAsUnknown() {
        Map<String, Integer> counts = RecordView.frequency(announcements, "ATTACHMENT");

        assertEquals(3, counts.get(RecordView.UNKNOWN));
        assertEquals(1, counts.get("Notice"));
    }

    @Test
    void topNShouldBreakTiesByFirstSeenOrder() {
        List<DataRecord> records = List.of(
                DataRecord.of("P", "b"),
                DataRecord.of("P", "a"),
                DataRecord.of("P", "c"),
                DataRecord.of("P", "a"),
                DataRecord.of("P", "c")
        );

        List<Map.Entry<String, Integer>> top = RecordView.topN(RecordView.frequency(records, "P"), 2);

        assertEquals(List.of(Map.entry("a", 2), Map.entry("c", 2)), top);
        assertEquals(3, RecordView.topN(RecordView.frequency(records, "P"), 0).size());
    }

    @Test
    void countsShouldUseCellKinds() {
        assertEquals(2, RecordView.countKind(announcements, "ATTACHMENT", "PDF"));
        assertEquals(5, RecordView.uniqueCount(announcements, "SYMBOL"));
    }

    @Test
    void statisticsShouldFollowTheProfile() {
        DatasetStatistics stats = RecordView.statistics(announcements, DatasetProfiles.ANNOUNCEMENTS);

        assertEquals(5, stats.totalRecords);
        assertEquals(2, stats.kindCounts.get("With PDF"));
        assertEquals(0, stats.kindCounts.get("With XBRL"));
        assertTrue(stats.frequencyTables.containsKey("Top Announcement Subjects"));
        assertTrue(stats.format("announcements").contains("Total announcements: 5"));
    }

    @Test
    void renderShouldUseFirstRecordColumnsAndTruncate() {
        String table = RecordView.render(announcements, 2, 10);

        assertTrue(table.contains("| SYMBOL "));
        assertTrue(table.contains("Dividen..."));
        assertTrue(table.contains("Notice ..."));
        assertFalse(table.contains("ITC"));
        assertTrue(table.endsWith("... showing 2 of 5 total records"));
    }

    @Test
    void renderShouldNotAnnounceTruncationWhenAllRowsFit() {
        String table = RecordView.render(announcements, 10, 40);

        assertFalse(table.contains("showing"));
        assertTrue(table.contains("Notice [PDF]"));
        assertTrue(table.contains("WIPRO"));
        assertEquals("No data to display", RecordView.render(List.of(), 10, 40));
    }

    @Test
    void exportShouldWriteHeaderFromFirstRecordAndPlainValues() throws Exception {
        Path csv = dir.resolve("out/announcements.csv");
        List<DataRecord> records = List.of(
                DataRecord.of("SYMBOL", CellValue.rich("TCS", "link", "/q"), "SUBJECT", "Board, \"AGM\"",
                        "ATTACHMENT", CellValue.rich("Notice", "pdf", "/n.pdf")),
                DataRecord.of("SYMBOL", "INFY", "EXTRA", "ignored")
        );

        RecordView.exportCsv(records, csv);

        String content = Files.readString(csv, StandardCharsets.UTF_8);
        assertTrue(content.startsWith("\uFEFF"));
        assertEquals(List.of(
                "SYMBOL,SUBJECT,ATTACHMENT",
                "TCS,\"Board, \"\"AGM\"\"\",Notice",
                "INFY,,"
        ), List.of(content.substring(1).split("\n")));
    }

    @Test
    void exportOfNothingShouldFail() {
        Path csv = dir.resolve("empty.csv");

        assertThrows(ExportException.class, () -> RecordView.exportCsv(List.of(), csv));
        assertFalse(Files.exists(csv));
    }
}
