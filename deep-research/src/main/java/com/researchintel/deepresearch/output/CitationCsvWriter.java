package com.researchintel.deepresearch.output;

import com.opencsv.CSVWriter;
import com.researchintel.deepresearch.model.Citation;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * Writes the citation registry of a run as a CSV bibliography.
 *
 * Output path: {runDir}/evidence/citations.csv, one row per citation in registration order.
 */
@Component
@Slf4j
public class CitationCsvWriter {

    static final String[] HEADERS = {
            "cid", "url", "title", "locator",
            "fetched_at", "quote_hash", "local_path"
    };

    public void write(Path outputPath, List<Citation> citations) {
        try (Writer out = Files.newBufferedWriter(outputPath, StandardCharsets.UTF_8);
             CSVWriter writer = new CSVWriter(out,
                     CSVWriter.DEFAULT_SEPARATOR,
                     CSVWriter.DEFAULT_QUOTE_CHARACTER,
                     CSVWriter.DEFAULT_ESCAPE_CHARACTER,
                     CSVWriter.DEFAULT_LINE_END)) {

            writer.writeNext(HEADERS);
            for (Citation c : citations) {
                writer.writeNext(toRow(c));
            }

            log.debug("Written {} citations to CSV: {}", citations.size(), outputPath);

        } catch (IOException e) {
            log.error("Failed to write citation CSV {}: {}", outputPath, e.getMessage(), e);
            throw new UncheckedIOException("Citation CSV write failed", e);
        }
    }

    private String[] toRow(Citation c) {
        return new String[]{
                str(c.cid()),
                str(c.url()),
                str(c.title()),
                str(c.locator()),
                str(c.fetchedAt()),
                str(c.quoteHash()),
                str(c.localPath())
        };
    }

    private String str(Object val) {
        return val == null ? "" : val.toString();
    }
}
