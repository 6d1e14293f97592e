package com.record.dedup.bulk;

import com.record.dedup.core.ProgressCallback;
import com.record.dedup.core.model.DedupResult;

import java.io.IOException;
import java.io.OutputStream;
import java.io.Writer;

/**
 * Interface for writing deduplication results.
 * Implementations write the input rows with their group assignment in a specific format.
 */
public interface ResultExporter {

    /**
     * Exports results to an output stream as UTF-8.
     *
     * @param output   the output stream to write to
     * @param table    the records the result was computed for
     * @param result   the deduplication result, index-aligned with {@code table}
     * @param callback optional progress callback
     * @return the export result
     * @throws IOException if writing fails
     */
    ExportResult export(OutputStream output, RecordTable table, DedupResult result,
                        ProgressCallback callback) throws IOException;

    /**
     * Exports results to a writer. The writer is flushed but not closed.
     *
     * @param writer   the writer to write to
     * @param table    the records the result was computed for
     * @param result   the deduplication result, index-aligned with {@code table}
     * @param callback optional progress callback
     * @return the export result
     * @throws IOException if writing fails
     */
    ExportResult export(Writer writer, RecordTable table, DedupResult result,
                        ProgressCallback callback) throws IOException;

    /**
     * Returns the format produced by this exporter (e.g., "csv", "json").
     */
    String getFormat();
}
