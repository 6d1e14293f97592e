package com.record.dedup.normalize;

import com.record.dedup.core.model.Record;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.StringJoiner;

/**
 * Converts a record into the single text string that is blocked and compared.
 * Field values are coerced to text and joined with a delimiter; missing
 * ({@code null}) fields are left out.
 */
public class RecordNormalizer {
    private static final Logger log = LoggerFactory.getLogger(RecordNormalizer.class);

    public static final String DEFAULT_DELIMITER = " ";

    private final String delimiter;

    public RecordNormalizer() {
        this(DEFAULT_DELIMITER);
    }

    public RecordNormalizer(String delimiter) {
        if (delimiter == null) {
            throw new IllegalArgumentException("delimiter must not be null");
        }
        this.delimiter = delimiter;
    }

    /**
     * Normalizes one record.
     */
    public String normalize(Record record) {
        return normalizeFields(record.fields());
    }

    /**
     * Joins the given field values into one string.
     */
    public String normalizeFields(List<?> fields) {
        if (fields == null || fields.isEmpty()) {
            return "";
        }
        StringJoiner joiner = new StringJoiner(delimiter);
        for (Object value : fields) {
            if (value != null) {
                joiner.add(String.valueOf(value));
            }
        }
        return joiner.toString();
    }

    /**
     * Normalizes all records, keeping input order.
     */
    public List<String> normalizeAll(List<Record> records) {
        List<String> texts = new ArrayList<>(records.size());
        for (Record record : records) {
            texts.add(normalize(record));
        }
        log.debug("Normalized {} records", texts.size());
        return texts;
    }
}
