package com.ipintel.io;

import com.fasterxml.jackson.databind.MappingIterator;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvParser;
import com.fasterxml.jackson.dataformat.csv.CsvSchema;
import com.ipintel.model.NetworkRecord;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

/**
 * Reads the network summary CSV into {@link NetworkRecord}s.
 *
 * <p>The {@code Path} column holds {@code host[:port]}; only the part before the first colon
 * is kept, and rows whose host is empty or contains no {@code .} (hostnames without a
 * domain, IPv6 literals, local pipes) are skipped.</p>
 */
@Slf4j
public class NetworkSummaryReader {

    static final String PATH = "Path";
    static final String TOTAL_EVENTS = "Total Events";
    static final String CONNECTS = "Connects";
    static final String DISCONNECTS = "Disconnects";
    static final String SENDS = "Sends";
    static final String RECEIVES = "Receives";
    static final String SEND_BYTES = "Send Bytes";
    static final String RECEIVE_BYTES = "Receive Bytes";

    static final List<String> REQUIRED_COLUMNS = List.of(
            PATH, TOTAL_EVENTS, CONNECTS, DISCONNECTS, SENDS, RECEIVES, SEND_BYTES, RECEIVE_BYTES);

    private final Path inputDir;
    private final CsvMapper csvMapper;

    public NetworkSummaryReader(Path inputDir) {
        this.inputDir = inputDir;
        this.csvMapper = CsvMapper.builder()
                .enable(CsvParser.Feature.TRIM_SPACES)
                .enable(CsvParser.Feature.SKIP_EMPTY_LINES)
                .build();
    }

    /**
     * Lists the {@code *.csv} files in the input directory, sorted by name.  Creates the
     * directory when it does not exist yet.
     */
    public List<String> listInputFiles() throws IOException {
        Files.createDirectories(inputDir);
        Set<String> names = new TreeSet<>();
        try (DirectoryStream<Path> stream = Files.newDirectoryStream(inputDir, "*.csv")) {
            for (Path file : stream) {
                names.add(file.getFileName().toString());
            }
        }
        return new ArrayList<>(names);
    }

    /** Reads {@code fileName} from the input directory. */
    public List<NetworkRecord> read(String fileName) throws IOException {
        return read(inputDir.resolve(fileName));
    }

    public List<NetworkRecord> read(Path file) throws IOException {
        List<NetworkRecord> records = new ArrayList<>();
        int skipped = 0;

        CsvSchema schema = CsvSchema.emptySchema().withHeader();
        try (Reader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8);
             MappingIterator<Map<String, String>> rows =
                     csvMapper.readerForMapOf(String.class).with(schema).readValues(reader)) {

            boolean hasRows = rows.hasNext();
            checkHeader(file, (CsvSchema) rows.getParserSchema());

            int rowNumber = 0;
            while (hasRows && rows.hasNext()) {
                Map<String, String> row = rows.next();
                rowNumber++;

                String address = extractAddress(row.get(PATH));
                if (address == null) {
                    skipped++;
                    continue;
                }
                records.add(NetworkRecord.builder()
                        .rowNumber(rowNumber)
                        .address(address)
                        .totalEvents(counter(file, rowNumber, row, TOTAL_EVENTS))
                        .connects(counter(file, rowNumber, row, CONNECTS))
                        .disconnects(counter(file, rowNumber, row, DISCONNECTS))
                        .sends(counter(file, rowNumber, row, SENDS))
                        .receives(counter(file, rowNumber, row, RECEIVES))
                        .sendBytes(counter(file, rowNumber, row, SEND_BYTES))
                        .receiveBytes(counter(file, rowNumber, row, RECEIVE_BYTES))
                        .build());
            }
        } catch (InputFormatException e) {
            throw e;
        } catch (RuntimeException e) {
            // Jackson wraps parse errors from MappingIterator in RuntimeJsonMappingException
            throw new InputFormatException("Malformed CSV in " + file + ": " + e.getMessage(), e);
        }

        log.info("Successfully read {} addresses from {} ({} rows skipped)",
                records.size(), file.getFileName(), skipped);
        return records;
    }

    /**
     * Host part of a {@code host[:port]} path, or {@code null} when the row should be skipped.
     */
    static String extractAddress(String path) {
        if (path == null) {
            return null;
        }
        String address = path.strip();
        int colon = address.indexOf(':');
        if (colon >= 0) {
            address = address.substring(0, colon).strip();
        }
        if (address.isEmpty() || address.indexOf('.') < 0) {
            return null;
        }
        return address;
    }

    private static void checkHeader(Path file, CsvSchema header) throws InputFormatException {
        Set<String> present = new TreeSet<>();
        if (header != null) {
            header.forEach(column -> present.add(column.getName().strip()));
        }
        List<String> missing = new ArrayList<>();
        for (String column : REQUIRED_COLUMNS) {
            if (!present.contains(column)) {
                missing.add(column);
            }
        }
        if (!missing.isEmpty()) {
            throw new InputFormatException("CSV file " + file.getFileName()
                    + " is missing required columns: " + String.join(", ", missing));
        }
    }

    // blank cells count as zero
    private static long counter(Path file, int rowNumber, Map<String, String> row, String column)
            throws InputFormatException {
        String value = row.get(column);
        if (value == null || value.isBlank()) {
            return 0L;
        }
        try {
            return Long.parseLong(value.strip());
        } catch (NumberFormatException e) {
            throw new InputFormatException("Row " + rowNumber + " of " + file.getFileName()
                    + ": column '" + column + "' is not a number: " + value, e);
        }
    }
}
