package com.harvest.coordinator.crawl.iteration;

import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVPrinter;

import java.io.IOException;
import java.io.StringWriter;
import java.io.UncheckedIOException;
import java.util.Set;
import java.util.TreeSet;

/**
 * Flattens a comparison into one CSV row per URI.
 */
public final class ComparisonCsvWriter {
    private static final String[] HEADER = {"uri", "change_type", "baseline_iteration", "current_iteration"};

    private ComparisonCsvWriter() {
    }

    public static String toCsv(IterationComparison comparison) {
        StringWriter out = new StringWriter();
        CSVFormat format = CSVFormat.DEFAULT.builder().setHeader(HEADER).build();
        try (CSVPrinter printer = new CSVPrinter(out, format)) {
            writeRows(printer, comparison, comparison.newUris(), ChangeType.NEW);
            writeRows(printer, comparison, comparison.modifiedUris(), ChangeType.MODIFIED);
            writeRows(printer, comparison, comparison.unchangedUris(), ChangeType.UNCHANGED);
            writeRows(printer, comparison, comparison.deletedUris(), ChangeType.DELETED);
        } catch (IOException e) {
            throw new UncheckedIOException("Unable to write comparison CSV", e);
        }
        return out.toString();
    }

    private static void writeRows(
        CSVPrinter printer,
        IterationComparison comparison,
        Set<String> uris,
        ChangeType type
    ) throws IOException {
        for (String uri : new TreeSet<>(uris)) {
            printer.printRecord(uri, type.name(), comparison.baselineIteration(), comparison.currentIteration());
        }
    }
}
