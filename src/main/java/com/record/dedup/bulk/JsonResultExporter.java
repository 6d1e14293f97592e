package com.record.dedup.bulk;

import com.fasterxml.jackson.core.StreamWriteFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.record.dedup.core.ProgressCallback;
import com.record.dedup.core.model.DedupResult;
import com.record.dedup.core.model.DuplicateAssignment;
import com.record.dedup.core.model.DuplicateGroup;
import com.record.dedup.core.model.Record;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.OutputStream;
import java.io.OutputStreamWriter;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * JSON result exporter.
 *
 * <p>Output format:</p>
 * <pre>
 * {
 *   "summary" : { "records" : 4, "groups" : 1, "duplicates" : 3, "comparisons" : 3 },
 *   "records" : [ { "row" : 1, "groupId" : 0, "duplicateRows" : [ 2, 4 ], "values" : { "name" : "apple pie" } } ],
 *   "groups" : [ { "id" : 0, "rows" : [ 1, 2, 4 ] } ]
 * }
 * </pre>
 */
public class JsonResultExporter implements ResultExporter {
    private static final Logger log = LoggerFactory.getLogger(JsonResultExporter.class);

    private final ObjectMapper objectMapper;

    public JsonResultExporter() {
        this.objectMapper = JsonMapper.builder()
                .disable(StreamWriteFeature.AUTO_CLOSE_TARGET)
                .build();
    }

    @Override
    public ExportResult export(OutputStream output, RecordTable table, DedupResult result,
                               ProgressCallback callback) throws IOException {
        return export(new OutputStreamWriter(output, StandardCharsets.UTF_8), table, result, callback);
    }

    @Override
    public ExportResult export(Writer writer, RecordTable table, DedupResult result,
                               ProgressCallback callback) throws IOException {
        ProgressCallback cb = callback != null ? callback : ProgressCallback.NOOP;
        CsvResultExporter.checkAligned(table, result);

        ObjectNode root = objectMapper.createObjectNode();

        ObjectNode summary = root.putObject("summary");
        summary.put("records", result.recordCount());
        summary.put("groups", result.groupCount());
        summary.put("duplicates", result.duplicateRecordCount());
        summary.put("comparisons", result.comparisons());

        ArrayNode records = root.putArray("records");
        List<String> columns = columnKeys(table);
        for (Record record : table.records()) {
            DuplicateAssignment assignment = result.assignmentOf(record.index());
            ObjectNode node = records.addObject();
            node.put("row", record.rowNumber());
            node.put("groupId", assignment.groupId());
            ArrayNode rows = node.putArray("duplicateRows");
            for (int row : assignment.duplicateRows()) {
                rows.add(row);
            }

            ObjectNode values = node.putObject("values");
            List<Object> fields = record.fields();
            for (int i = 0; i < fields.size(); i++) {
                String column = columns.get(i);
                Object value = fields.get(i);
                if (value == null) {
                    values.putNull(column);
                } else {
                    values.put(column, String.valueOf(value));
                }
            }
        }

        ArrayNode groups = root.putArray("groups");
        for (DuplicateGroup group : result.groups()) {
            ObjectNode node = groups.addObject();
            node.put("id", group.id());
            ArrayNode rows = node.putArray("rows");
            for (int row : group.rowNumbers()) {
                rows.add(row);
            }
        }

        objectMapper.writerWithDefaultPrettyPrinter().writeValue(writer, root);
        writer.flush();

        ExportResult exportResult = new ExportResult(table.size(), result.groupCount(), result.duplicateRecordCount());
        cb.onProgress(table.size(), table.size(), "Export completed");
        log.info("export.completed format=json result={}", exportResult);
        return exportResult;
    }

    /**
     * One unique key per column position. Positions past the header are named
     * {@code column_N}; repeated names get a {@code _2}, {@code _3}, ... suffix.
     */
    static List<String> columnKeys(RecordTable table) {
        List<String> header = table.header();
        int width = header.size();
        for (Record record : table.records()) {
            width = Math.max(width, record.fields().size());
        }

        List<String> keys = new ArrayList<>(width);
        Set<String> used = new HashSet<>();
        for (int i = 0; i < width; i++) {
            String base = i < header.size() ? header.get(i) : "column_" + (i + 1);
            String key = base;
            for (int n = 2; !used.add(key); n++) {
                key = base + "_" + n;
            }
            keys.add(key);
        }
        return keys;
    }

    @Override
    public String getFormat() {
        return "json";
    }
}
