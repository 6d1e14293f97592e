package com.record.dedup.cli;

import com.record.dedup.api.ComparisonEstimate;
import com.record.dedup.api.DedupOptions;
import com.record.dedup.api.DeduplicationEngine;
import com.record.dedup.api.ScorerType;
import com.record.dedup.bulk.CsvRecordReader;
import com.record.dedup.bulk.CsvResultExporter;
import com.record.dedup.bulk.ExportResult;
import com.record.dedup.bulk.JsonResultExporter;
import com.record.dedup.bulk.RecordTable;
import com.record.dedup.bulk.ResultExporter;
import com.record.dedup.cache.CacheConfig;
import com.record.dedup.core.CancellationToken;
import com.record.dedup.core.ProgressCallback;
import com.record.dedup.core.exception.InvalidParameterException;
import com.record.dedup.core.model.DedupResult;
import com.record.dedup.logging.LogContext;
import com.record.dedup.normalize.RecordNormalizer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Spec;

import java.io.IOException;
import java.io.PrintWriter;
import java.io.Reader;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.Callable;

@Command(
    name = "dedup",
    mixinStandardHelpOptions = true,
    version = "dedup 1.0.0",
    description = "Groups near-duplicate rows of a CSV file using blocking and fuzzy string similarity"
)
public class DedupCli implements Callable<Integer> {
    private static final Logger log = LoggerFactory.getLogger(DedupCli.class);

    enum OutputFormat { CSV, JSON }

    @Spec
    CommandSpec spec;

    @Option(names = {"-i", "--input"}, description = "Input CSV file with a header row", required = true)
    private Path input;

    @Option(names = {"-o", "--output"}, description = "Output file (required unless --estimate-only)")
    private Path output;

    @Option(names = {"-t", "--threshold"}, description = "Similarity threshold between 0.5 and 1.0", defaultValue = "0.9")
    private double threshold;

    @Option(names = {"-p", "--prefix-length"},
            description = "Leading characters records must share to be compared (1-10). "
                    + "Higher values run faster but may miss duplicates", defaultValue = "3")
    private int prefixLength;

    @Option(names = {"-s", "--scorer"}, description = "Similarity algorithm: ${COMPLETION-CANDIDATES}",
            defaultValue = "JARO_WINKLER")
    private ScorerType scorer;

    @Option(names = {"-j", "--parallelism"}, description = "Worker threads for bucket scoring", defaultValue = "1")
    private int parallelism;

    @Option(names = {"-f", "--format"}, description = "Output format: ${COMPLETION-CANDIDATES}", defaultValue = "CSV")
    private OutputFormat format;

    @Option(names = {"-d", "--delimiter"}, description = "Input field delimiter", defaultValue = ",")
    private char delimiter;

    @Option(names = {"--cache-scores"}, description = "Memoize pair scores (helps with many repeated rows)",
            defaultValue = "false")
    private boolean cacheScores;

    @Option(names = {"--estimate-only"}, description = "Only report the number of comparisons", defaultValue = "false")
    private boolean estimateOnly;

    public static void main(String[] args) {
        int exitCode = new CommandLine(new DedupCli())
            .setCaseInsensitiveEnumValuesAllowed(true)
            .execute(args);
        System.exit(exitCode);
    }

    @Override
    public Integer call() {
        PrintWriter out = spec.commandLine().getOut();
        PrintWriter err = spec.commandLine().getErr();
        try (LogContext ctx = LogContext.forTransfer("cli", input.toString())
                .with("format", format.name().toLowerCase(Locale.ROOT))) {
            DedupOptions options = DedupOptions.builder()
                    .threshold(threshold)
                    .prefixLength(prefixLength)
                    .scorerType(scorer)
                    .parallelism(parallelism)
                    .scoreCache(cacheScores ? CacheConfig.defaults() : CacheConfig.disabled())
                    .build();
            if (!estimateOnly && output == null) {
                throw new InvalidParameterException("output", "is required unless --estimate-only is given");
            }

            RecordTable table = readTable();
            out.printf("Loaded %,d rows and %d columns%n", table.size(), table.header().size());

            DeduplicationEngine engine = new DeduplicationEngine();
            List<String> texts = new RecordNormalizer().normalizeAll(table.records());

            ComparisonEstimate estimate = engine.estimateComparisons(texts, options.getPrefixLength());
            out.printf("Will perform %,d comparisons%n", estimate.comparisons());
            out.printf("(Reduced from %,d possible comparisons - %.1f%% of original)%n",
                    estimate.possibleComparisons(), estimate.percentOfFull());
            if (estimateOnly) {
                return 0;
            }

            DedupResult result = engine.deduplicate(texts, options, progressPrinter(err), CancellationToken.none());
            out.printf("Found %,d records in %,d duplicate groups%n",
                    result.duplicateRecordCount(), result.groupCount());

            ExportResult exported = writeResult(table, result);
            out.printf("Wrote %,d rows to %s%n", exported.rowsWritten(), output);
            out.flush();
            return 0;
        } catch (InvalidParameterException e) {
            err.println("Invalid parameter: " + e.getMessage());
            return 2;
        } catch (IOException e) {
            log.error("cli.failed error={}", e.getMessage());
            err.println("Error: " + e.getMessage());
            return 1;
        }
    }

    private RecordTable readTable() throws IOException {
        try (Reader reader = Files.newBufferedReader(input, StandardCharsets.UTF_8)) {
            return new CsvRecordReader(delimiter).read(reader, null);
        }
    }

    private ExportResult writeResult(RecordTable table, DedupResult result) throws IOException {
        ResultExporter exporter = format == OutputFormat.JSON ? new JsonResultExporter() : new CsvResultExporter();
        try (Writer writer = Files.newBufferedWriter(output, StandardCharsets.UTF_8)) {
            return exporter.export(writer, table, result, null);
        }
    }

    private static ProgressCallback progressPrinter(PrintWriter err) {
        return (processed, total, message) -> {
            err.printf("\r%s", message);
            if (processed == total) {
                err.println();
            }
            err.flush();
        };
    }
}
