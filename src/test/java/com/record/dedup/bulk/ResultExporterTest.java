package com.record.dedup.bulk;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.record.dedup.api.DedupOptions;
import com.record.dedup.api.DeduplicationEngine;
import com.record.dedup.core.model.DedupResult;
import com.record.dedup.core.model.Record;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.StringReader;
import java.io.StringWriter;
import java.nio.charset.StandardCharsets;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ResultExporterTest {

    private RecordTable table;
    private DedupResult result;

    @BeforeEach
    void setUp() {
        table = new RecordTable(List.of("name", "city"), List.of(
                Record.of(0, "apple pie", "Springfield"),
                Record.of(1, "appel pie", "Springfield"),
                Record.of(2, "banana", null),
                Record.of(3, "applle pie", "Springfield")));
        result = new DeduplicationEngine().deduplicateRecords(table.records(), DedupOptions.of(0.85, 2), null, null);
    }

    @Nested
    @DisplayName("CSV")
    class CsvTests {

        @Test
        @DisplayName("Rows get their group and duplicate rows appended")
        void writesColumns() throws IOException {
            StringWriter writer = new StringWriter();
            ExportResult exported = new CsvResultExporter().export(writer, table, result, null);

            String[] lines = writer.toString().split("\\R");
            assertEquals("name,city,duplicate_group,duplicate_rows", lines[0]);
            assertEquals("apple pie,Springfield,0,\"2, 4\"", lines[1]);
            assertEquals("appel pie,Springfield,0,\"1, 4\"", lines[2]);
            assertEquals("banana,,-1,", lines[3]);
            assertEquals("applle pie,Springfield,0,\"1, 2\"", lines[4]);
            assertEquals(new ExportResult(4, 1, 3), exported);
        }

        @Test
        @DisplayName("Written CSV reads back with the same values")
        void readsBack() throws IOException {
            RecordTable quoted = new RecordTable(List.of("name"), List.of(
                    Record.of(0, "Acme, \"Corp\""), Record.of(1, "Acme, \"Corp\"")));
            DedupResult grouped = new DeduplicationEngine()
                    .deduplicateRecords(quoted.records(), DedupOptions.defaults(), null, null);
            StringWriter writer = new StringWriter();
            new CsvResultExporter().export(writer, quoted, grouped, null);

            RecordTable back = new CsvRecordReader().read(new StringReader(writer.toString()), null);
            assertEquals(List.of("name", "duplicate_group", "duplicate_rows"), back.header());
            assertEquals(List.of("Acme, \"Corp\"", "0", "2"), back.records().get(0).fields());
        }

        @Test
        @DisplayName("Rows narrower than the header are rejected instead of shifting the group columns")
        void raggedRow() {
            RecordTable ragged = new RecordTable(List.of("name", "city", "zip"), List.of(
                    Record.of(0, "apple pie", "Springfield", "111"),
                    Record.of(1, "apple pie", "Springfield")));
            DedupResult grouped = new DeduplicationEngine()
                    .deduplicateRecords(ragged.records(), DedupOptions.defaults(), null, null);

            IllegalArgumentException e = assertThrows(IllegalArgumentException.class,
                    () -> new CsvResultExporter().export(new StringWriter(), ragged, grouped, null));
            assertEquals("Record 2 has 2 fields but the header has 3", e.getMessage());
        }

        @Test
        @DisplayName("Misaligned result is rejected")
        void misaligned() {
            assertThrows(IllegalArgumentException.class,
                    () -> new CsvResultExporter().export(new StringWriter(), table, DedupResult.empty(), null));
        }
    }

    @Nested
    @DisplayName("JSON")
    class JsonTests {

        @Test
        @DisplayName("Summary, records and groups are written")
        void writesDocument() throws IOException {
            ByteArrayOutputStream output = new ByteArrayOutputStream();
            new JsonResultExporter().export(output, table, result, null);

            JsonNode root = new ObjectMapper().readTree(output.toString(StandardCharsets.UTF_8));
            assertEquals(4, root.path("summary").path("records").asInt());
            assertEquals(1, root.path("summary").path("groups").asInt());
            assertEquals(3, root.path("summary").path("comparisons").asInt());

            JsonNode first = root.path("records").get(0);
            assertEquals(1, first.path("row").asInt());
            assertEquals(0, first.path("groupId").asInt());
            assertEquals(2, first.path("duplicateRows").get(0).asInt());
            assertEquals("apple pie", first.path("values").path("name").asText());

            JsonNode banana = root.path("records").get(2);
            assertEquals(-1, banana.path("groupId").asInt());
            assertEquals(0, banana.path("duplicateRows").size());
            assertTrue(banana.path("values").path("city").isNull());

            JsonNode group = root.path("groups").get(0);
            assertEquals(0, group.path("id").asInt());
            assertEquals("[1,2,4]", group.path("rows").toString());
        }

        @Test
        @DisplayName("Repeated and missing column names get distinct keys")
        void distinctColumnKeys() throws IOException {
            RecordTable repeated = new RecordTable(List.of("name", "name", "name_2"), List.of(
                    Record.of(0, "a", "b", "c", "d")));
            DedupResult single = new DeduplicationEngine()
                    .deduplicateRecords(repeated.records(), DedupOptions.defaults(), null, null);
            StringWriter writer = new StringWriter();
            new JsonResultExporter().export(writer, repeated, single, null);

            JsonNode values = new ObjectMapper().readTree(writer.toString()).path("records").get(0).path("values");
            assertEquals(4, values.size());
            assertEquals("a", values.path("name").asText());
            assertEquals("b", values.path("name_2").asText());
            assertEquals("c", values.path("name_2_2").asText());
            assertEquals("d", values.path("column_4").asText());
        }

        @Test
        @DisplayName("Writer is left open after export")
        void leavesWriterOpen() throws IOException {
            StringWriter writer = new StringWriter();
            new JsonResultExporter().export(writer, table, result, null);
            writer.write("\n");
            assertTrue(writer.toString().endsWith("}\n"));
            assertEquals("json", new JsonResultExporter().getFormat());
        }
    }
}
