package com.record.dedup.bulk;

/**
 * Result of an export operation.
 *
 * @param rowsWritten      number of record rows written
 * @param groups           number of duplicate groups
 * @param duplicateRecords number of records that belong to a group
 */
public record ExportResult(long rowsWritten, long groups, long duplicateRecords) {

    @Override
    public String toString() {
        return "ExportResult{rows=" + rowsWritten +
                ", groups=" + groups +
                ", duplicates=" + duplicateRecords + '}';
    }
}
