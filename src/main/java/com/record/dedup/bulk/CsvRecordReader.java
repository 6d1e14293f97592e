package com.record.dedup.bulk;

import com.record.dedup.core.ProgressCallback;
import com.record.dedup.core.model.Record;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

/**
 * CSV reader producing a {@link RecordTable}.
 *
 * <p>Expected CSV format:</p>
 * <pre>
 * name,city
 * "Acme, Corp",Springfield
 * Big Blue,
 * </pre>
 *
 * <p>The first line is the header row. Fields may be quoted; quoted fields may contain the
 * delimiter, doubled quotes and line breaks. Empty fields become {@code null} (missing).
 * Blank lines are skipped. Every row must have as many fields as the header.</p>
 */
public class CsvRecordReader {
    private static final Logger log = LoggerFactory.getLogger(CsvRecordReader.class);
    private static final int PROGRESS_INTERVAL = 100;

    private final char delimiter;

    public CsvRecordReader() {
        this(',');
    }

    public CsvRecordReader(char delimiter) {
        if (delimiter == '"' || delimiter == '\n' || delimiter == '\r') {
            throw new IllegalArgumentException("Invalid delimiter: " + delimiter);
        }
        this.delimiter = delimiter;
    }

    public RecordTable read(InputStream input, ProgressCallback callback) throws IOException {
        return read(new InputStreamReader(input, StandardCharsets.UTF_8), callback);
    }

    /**
     * Reads the whole table. The reader is closed afterwards.
     *
     * @throws IOException on read failure, an unterminated quoted field or a row whose
     *                     field count differs from the header
     */
    public RecordTable read(Reader reader, ProgressCallback callback) throws IOException {
        ProgressCallback cb = callback != null ? callback : ProgressCallback.NOOP;

        try (BufferedReader br = reader instanceof BufferedReader b ? b : new BufferedReader(reader)) {
            LineCursor cursor = new LineCursor(br);
            List<String> header = readRow(cursor);
            while (header != null && isBlank(header)) {
                header = readRow(cursor);
            }
            if (header == null) {
                return RecordTable.empty();
            }

            List<Record> records = new ArrayList<>();
            List<String> row;
            long rowLine = cursor.lineNumber + 1;
            while ((row = readRow(cursor)) != null) {
                if (isBlank(row)) {
                    rowLine = cursor.lineNumber + 1;
                    continue;
                }
                if (row.size() != header.size()) {
                    throw new IOException("Row at line " + rowLine + " has " + row.size()
                            + " fields, expected " + header.size());
                }
                rowLine = cursor.lineNumber + 1;
                records.add(new Record(records.size(), toFields(row)));
                if (records.size() % PROGRESS_INTERVAL == 0) {
                    cb.onProgress(records.size(), -1, "Read " + records.size() + " records");
                }
            }

            RecordTable table = new RecordTable(header, records);
            cb.onProgress(records.size(), records.size(), "Import completed");
            log.info("import.completed columns={} records={}", header.size(), records.size());
            return table;
        }
    }

    /**
     * Parses one logical row, which may span several physical lines.
     * Returns {@code null} at end of input.
     */
    private List<String> readRow(LineCursor cursor) throws IOException {
        String line = cursor.next();
        if (line == null) {
            return null;
        }
        long startLine = cursor.lineNumber;

        List<String> fields = new ArrayList<>();
        StringBuilder field = new StringBuilder();
        boolean inQuotes = false;
        int pos = 0;

        while (true) {
            if (pos >= line.length()) {
                if (!inQuotes) {
                    break;
                }
                String continuation = cursor.next();
                if (continuation == null) {
                    throw new IOException("Unterminated quoted field starting at line " + startLine);
                }
                field.append('\n');
                line = continuation;
                pos = 0;
                continue;
            }

            char c = line.charAt(pos);
            if (inQuotes) {
                if (c == '"') {
                    if (pos + 1 < line.length() && line.charAt(pos + 1) == '"') {
                        field.append('"');
                        pos++;
                    } else {
                        inQuotes = false;
                    }
                } else {
                    field.append(c);
                }
            } else if (c == '"' && field.length() == 0) {
                inQuotes = true;
            } else if (c == delimiter) {
                fields.add(field.toString());
                field.setLength(0);
            } else {
                field.append(c);
            }
            pos++;
        }
        fields.add(field.toString());
        return fields;
    }

    private static List<Object> toFields(List<String> row) {
        List<Object> fields = new ArrayList<>(row.size());
        for (String value : row) {
            fields.add(value.isEmpty() ? null : value);
        }
        return fields;
    }

    private static boolean isBlank(List<String> row) {
        return row.size() == 1 && row.get(0).isBlank();
    }

    private static final class LineCursor {
        private final BufferedReader reader;
        private long lineNumber;

        LineCursor(BufferedReader reader) {
            this.reader = reader;
        }

        String next() throws IOException {
            String line = reader.readLine();
            if (line != null) {
                lineNumber++;
            }
            return line;
        }
    }
}
