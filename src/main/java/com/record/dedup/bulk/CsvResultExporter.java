package com.record.dedup.bulk;

import com.record.dedup.core.ProgressCallback;
import com.record.dedup.core.model.DedupResult;
import com.record.dedup.core.model.DuplicateAssignment;
import com.record.dedup.core.model.Record;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedWriter;
import java.io.IOException;
import java.io.OutputStream;
import java.io.OutputStreamWriter;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * CSV result exporter.
 * Writes every input row followed by its group id and the rows it duplicates.
 *
 * <p>Output format:</p>
 * <pre>
 * name,city,duplicate_group,duplicate_rows
 * apple pie,Springfield,0,"2, 4"
 * appel pie,Springfield,0,"1, 4"
 * banana,Shelbyville,-1,
 * </pre>
 */
public class CsvResultExporter implements ResultExporter {
    private static final Logger log = LoggerFactory.getLogger(CsvResultExporter.class);
    private static final int PROGRESS_INTERVAL = 500;

    public static final String GROUP_COLUMN = "duplicate_group";
    public static final String ROWS_COLUMN = "duplicate_rows";

    @Override
    public ExportResult export(OutputStream output, RecordTable table, DedupResult result,
                               ProgressCallback callback) throws IOException {
        return export(new OutputStreamWriter(output, StandardCharsets.UTF_8), table, result, callback);
    }

    @Override
    public ExportResult export(Writer writer, RecordTable table, DedupResult result,
                               ProgressCallback callback) throws IOException {
        ProgressCallback cb = callback != null ? callback : ProgressCallback.NOOP;
        checkAligned(table, result);
        checkRectangular(table);

        BufferedWriter out = new BufferedWriter(writer);
        List<String> header = new ArrayList<>(table.header());
        header.add(GROUP_COLUMN);
        header.add(ROWS_COLUMN);
        writeLine(out, header);

        long rows = 0;
        for (Record record : table.records()) {
            DuplicateAssignment assignment = result.assignmentOf(record.index());
            List<String> line = new ArrayList<>(record.fields().size() + 2);
            for (Object value : record.fields()) {
                line.add(value != null ? String.valueOf(value) : "");
            }
            line.add(String.valueOf(assignment.groupId()));
            line.add(joinRows(assignment.duplicateRows()));
            writeLine(out, line);
            rows++;

            if (rows % PROGRESS_INTERVAL == 0) {
                cb.onProgress(rows, table.size(), "Exported " + rows + " rows");
            }
        }
        out.flush();

        ExportResult exportResult = new ExportResult(rows, result.groupCount(), result.duplicateRecordCount());
        cb.onProgress(rows, rows, "Export completed");
        log.info("export.completed format=csv result={}", exportResult);
        return exportResult;
    }

    @Override
    public String getFormat() {
        return "csv";
    }

    static void checkAligned(RecordTable table, DedupResult result) {
        if (table.size() != result.recordCount()) {
            throw new IllegalArgumentException("Result covers " + result.recordCount()
                    + " records but the table has " + table.size());
        }
    }

    private static void checkRectangular(RecordTable table) {
        int width = table.header().size();
        for (Record record : table.records()) {
            if (record.fields().size() != width) {
                throw new IllegalArgumentException("Record " + record.rowNumber() + " has "
                        + record.fields().size() + " fields but the header has " + width);
            }
        }
    }

    private static String joinRows(List<Integer> rows) {
        return rows.stream().map(String::valueOf).collect(Collectors.joining(", "));
    }

    private static void writeLine(BufferedWriter out, List<String> values) throws IOException {
        for (int i = 0; i < values.size(); i++) {
            if (i > 0) {
                out.write(',');
            }
            out.write(csvEscape(values.get(i)));
        }
        out.newLine();
    }

    private static String csvEscape(String value) {
        if (value == null) return "";
        if (value.contains(",") || value.contains("\"") || value.contains("\n") || value.contains("\r")) {
            return "\"" + value.replace("\"", "\"\"") + "\"";
        }
        return value;
    }
}
