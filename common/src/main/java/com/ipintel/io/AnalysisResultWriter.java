package com.ipintel.io;

import com.fasterxml.jackson.databind.SequenceWriter;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvSchema;
import com.ipintel.model.EnrichedRecord;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Clock;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeSet;

/**
 * Writes enrichment results to a timestamped CSV file.
 *
 * <p>The column set is the union of every row's keys, sorted by name; a row without a
 * column leaves that cell empty.  The file is written to a temporary name first and moved
 * into place, so a failed write never leaves a partial result behind.</p>
 */
@Slf4j
public class AnalysisResultWriter {

    private static final DateTimeFormatter TIMESTAMP = DateTimeFormatter.ofPattern("yyyyMMdd_HHmmss");

    private final Path outputDir;
    private final Clock clock;
    private final CsvMapper csvMapper = new CsvMapper();

    public AnalysisResultWriter(Path outputDir) {
        this(outputDir, Clock.systemDefaultZone());
    }

    public AnalysisResultWriter(Path outputDir, Clock clock) {
        this.outputDir = outputDir;
        this.clock = clock;
    }

    /**
     * @return the path of the written file
     */
    public Path write(List<? extends EnrichedRecord> results) throws IOException {
        List<Map<String, String>> rows = new ArrayList<>(results.size());
        TreeSet<String> columns = new TreeSet<>();
        for (EnrichedRecord result : results) {
            Map<String, String> row = result.toRow();
            columns.addAll(row.keySet());
            rows.add(row);
        }

        CsvSchema.Builder schema = CsvSchema.builder().setUseHeader(true);
        columns.forEach(schema::addColumn);

        Files.createDirectories(outputDir);
        String fileName = "ip_analysis_" + LocalDateTime.now(clock).format(TIMESTAMP) + ".csv";
        Path target = outputDir.resolve(fileName);
        // a plain sibling file, so the result gets the usual default permissions
        Path temp = outputDir.resolve(fileName + ".tmp");

        try {
            try (Writer writer = Files.newBufferedWriter(temp, StandardCharsets.UTF_8);
                 SequenceWriter sequence = csvMapper.writer(schema.build()).writeValues(writer)) {
                sequence.writeAll(rows);
            }
            moveIntoPlace(temp, target);
        } catch (IOException | RuntimeException e) {
            Files.deleteIfExists(temp);
            log.error("Error writing analysis results to {}: {}", target, e.getMessage());
            throw e;
        }

        log.info("Successfully wrote {} rows to {}", rows.size(), target);
        return target;
    }

    private static void moveIntoPlace(Path temp, Path target) throws IOException {
        try {
            Files.move(temp, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
        } catch (AtomicMoveNotSupportedException e) {
            Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING);
        }
    }
}
