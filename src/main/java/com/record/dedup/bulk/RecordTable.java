package com.record.dedup.bulk;

import com.record.dedup.core.model.Record;

import java.util.List;

/**
 * Tabular input: column names plus the data rows as records.
 *
 * @param header  column names in order
 * @param records data rows, record {@code i} has index {@code i}
 */
public record RecordTable(List<String> header, List<Record> records) {

    public RecordTable {
        header = header != null ? List.copyOf(header) : List.of();
        records = records != null ? List.copyOf(records) : List.of();
    }

    public static RecordTable empty() {
        return new RecordTable(List.of(), List.of());
    }

    public int size() {
        return records.size();
    }

    public boolean isEmpty() {
        return records.isEmpty();
    }
}
