package com.researchintel.deepresearch.output;

import com.opencsv.CSVReader;
import com.researchintel.deepresearch.model.Citation;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class CitationCsvWriterTest {

    @TempDir
    Path tempDir;

    private final CitationCsvWriter writer = new CitationCsvWriter();

    @Test
    void writesHeaderAndOneRowPerCitation() throws Exception {
        Path csv = tempDir.resolve("citations.csv");
        Instant fetchedAt = Instant.parse("2026-03-14T09:26:53Z");

        writer.write(csv, List.of(
                new Citation("C001", "https://example.com/0", "Surface codes, a survey", "https://example.com/0",
                        fetchedAt, "0123456789abcdef", null),
                new Citation("C002", "https://example.com/1", "Title with \"quotes\"", "", fetchedAt, null, null)));

        List<String[]> rows;
        try (Reader in = Files.newBufferedReader(csv, StandardCharsets.UTF_8);
             CSVReader reader = new CSVReader(in)) {
            rows = reader.readAll();
        }

        assertThat(rows).hasSize(3);
        assertThat(rows.get(0)).containsExactly(CitationCsvWriter.HEADERS);
        assertThat(rows.get(1)).containsExactly("C001", "https://example.com/0", "Surface codes, a survey",
                "https://example.com/0", "2026-03-14T09:26:53Z", "0123456789abcdef", "");
        assertThat(rows.get(2)[2]).isEqualTo("Title with \"quotes\"");
        assertThat(rows.get(2)[5]).isEmpty();
    }

    @Test
    void emptyRegistryWritesOnlyTheHeader() throws Exception {
        Path csv = tempDir.resolve("empty.csv");

        writer.write(csv, List.of());

        assertThat(Files.readAllLines(csv)).hasSize(1);
    }
}
