package com.eventquery.infrastructure.export;

import com.eventquery.domain.model.QueryResult;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVPrinter;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.StringWriter;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Writes a query result as CSV: the select list as header, then one record per row.
 */
@Slf4j
@Component
public class CsvResultWriter {

    private static final CSVFormat FORMAT = CSVFormat.DEFAULT.builder()
            .setRecordSeparator("\n")
            .build();

    public void write(QueryResult result, Writer out) throws IOException {
        CSVPrinter printer = new CSVPrinter(out, FORMAT);
        printer.printRecord(result.getColumns());
        for (List<Object> row : result.getRows()) {
            List<String> values = new ArrayList<>(row.size());
            for (Object value : row) {
                values.add(ValueFormatter.format(value));
            }
            printer.printRecord(values);
        }
        printer.flush();
    }

    public void write(QueryResult result, Path file) throws IOException {
        Files.createDirectories(file.toAbsolutePath().getParent());
        try (Writer out = Files.newBufferedWriter(file, StandardCharsets.UTF_8)) {
            write(result, out);
        }
        log.debug("Wrote {} rows to {}", result.getRowCount(), file);
    }

    public String toCsv(QueryResult result) {
        StringWriter out = new StringWriter();
        try {
            write(result, out);
        } catch (IOException e) {
            throw new IllegalStateException("Writing to a StringWriter failed", e);
        }
        return out.toString();
    }
}
