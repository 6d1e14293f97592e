package com.record.dedup.core.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * A single input row: an ordered sequence of field values identified by its
 * 0-based position in the original dataset.
 *
 * <p>Field values may be {@code null} for missing cells.</p>
 *
 * @param index  0-based row index in original order
 * @param fields field values in column order
 */
public record Record(int index, List<Object> fields) {

    public Record {
        if (index < 0) {
            throw new IllegalArgumentException("index must be >= 0");
        }
        // List.copyOf rejects null elements, missing cells are legitimate here
        fields = fields != null
                ? Collections.unmodifiableList(new ArrayList<>(fields))
                : List.of();
    }

    public static Record of(int index, Object... fields) {
        List<Object> values = new ArrayList<>(fields.length);
        Collections.addAll(values, fields);
        return new Record(index, values);
    }

    /**
     * Returns the 1-based spreadsheet row number of this record.
     */
    public int rowNumber() {
        return index + 1;
    }
}
