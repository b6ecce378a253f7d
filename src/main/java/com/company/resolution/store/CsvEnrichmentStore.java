package com.company.resolution.store;

import com.company.resolution.core.model.EnrichedCluster;
import com.company.resolution.core.model.EnrichmentStatus;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVParser;
import org.apache.commons.csv.CSVPrinter;
import org.apache.commons.csv.CSVRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.Reader;
import java.io.StringReader;
import java.io.UncheckedIOException;
import java.io.Writer;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Append-only CSV file of enrichment results.
 *
 * <p>Each append opens the file, writes one row and closes it, so every completed
 * row survives a crash. Rows that cannot be parsed, such as a line cut short by a
 * crash, are skipped on read and the cluster is processed again. Before the next
 * append a cut-short final row is removed, so new rows never continue it.</p>
 */
public class CsvEnrichmentStore implements EnrichmentStore {
    private static final Logger log = LoggerFactory.getLogger(CsvEnrichmentStore.class);

    static final String[] HEADERS = {
            "cluster_id", "representative_name", "member_count",
            "chosen_url", "confidence", "status", "detail"
    };

    private static final CSVFormat WRITE_FORMAT = CSVFormat.DEFAULT.builder()
            .setRecordSeparator("\n")
            .build();

    private static final CSVFormat READ_FORMAT = CSVFormat.DEFAULT.builder()
            .setHeader(HEADERS)
            .setSkipHeaderRecord(true)
            .setIgnoreEmptyLines(true)
            .build();

    private final Path file;

    public CsvEnrichmentStore(Path file) {
        this.file = file;
    }

    public Path getFile() {
        return file;
    }

    @Override
    public Map<String, EnrichedCluster> readAll() {
        Map<String, EnrichedCluster> current = new LinkedHashMap<>();
        if (!Files.exists(file)) {
            return current;
        }
        int skipped = 0;
        try (Reader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8);
             CSVParser parser = READ_FORMAT.parse(reader)) {
            for (CSVRecord row : parser) {
                try {
                    EnrichedCluster result = fromRow(row);
                    current.put(result.clusterId(), result);
                } catch (IllegalArgumentException e) {
                    skipped++;
                    log.warn("store.row-skipped file={} line={} reason={}",
                            file, row.getRecordNumber(), e.getMessage());
                }
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot read enrichment results from " + file, e);
        } catch (UncheckedIOException | IllegalStateException e) {
            // a truncated final row leaves an unterminated quote
            log.warn("store.truncated file={} rowsRead={} reason={}", file, current.size(), e.getMessage());
        }
        log.debug("store.read file={} clusters={} skipped={}", file, current.size(), skipped);
        return current;
    }

    @Override
    public void append(EnrichedCluster result) {
        try {
            Path parent = file.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            removeIncompleteTail();
            boolean needsHeader = !Files.exists(file) || Files.size(file) == 0;
            try (Writer writer = Files.newBufferedWriter(file, StandardCharsets.UTF_8,
                    StandardOpenOption.CREATE, StandardOpenOption.APPEND);
                 CSVPrinter printer = new CSVPrinter(writer, WRITE_FORMAT)) {
                if (needsHeader) {
                    printer.printRecord((Object[]) HEADERS);
                }
                printer.printRecord(
                        result.clusterId(),
                        result.representativeName(),
                        result.memberCount(),
                        result.chosenUrl() != null ? result.chosenUrl() : "",
                        result.confidence(),
                        result.status().name(),
                        result.detail());
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot append enrichment result to " + file, e);
        }
    }

    /**
     * Truncates the file after its last complete record if it does not end with a newline.
     * Every record is written with a trailing newline, so any other ending is a cut-short row.
     * A newline inside a quoted field leaves the quote open in the prefix, so the cut is the
     * last newline whose prefix parses cleanly.
     */
    private void removeIncompleteTail() throws IOException {
        if (!Files.exists(file)) {
            return;
        }
        long size = Files.size(file);
        if (size == 0 || lastByte(size) == '\n') {
            return;
        }
        byte[] content = Files.readAllBytes(file);
        int keep = 0;
        for (int i = content.length - 1; i >= 0; i--) {
            if (content[i] == '\n' && parsesCleanly(new String(content, 0, i + 1, StandardCharsets.UTF_8))) {
                keep = i + 1;
                break;
            }
        }
        try (FileChannel channel = FileChannel.open(file, StandardOpenOption.WRITE)) {
            channel.truncate(keep);
        }
        log.warn("store.tail-removed file={} removedBytes={}", file, content.length - keep);
    }

    private byte lastByte(long size) throws IOException {
        try (FileChannel channel = FileChannel.open(file, StandardOpenOption.READ)) {
            ByteBuffer buffer = ByteBuffer.allocate(1);
            channel.read(buffer, size - 1);
            return buffer.get(0);
        }
    }

    private static boolean parsesCleanly(String text) {
        try (CSVParser parser = CSVFormat.DEFAULT.parse(new StringReader(text))) {
            for (CSVRecord ignored : parser) {
                // consume every record
            }
            return true;
        } catch (IOException | UncheckedIOException | IllegalStateException e) {
            return false;
        }
    }

    private static EnrichedCluster fromRow(CSVRecord row) {
        if (!row.isConsistent()) {
            throw new IllegalArgumentException("expected " + HEADERS.length + " columns, got " + row.size());
        }
        return new EnrichedCluster(
                row.get("cluster_id"),
                row.get("representative_name"),
                Integer.parseInt(row.get("member_count")),
                row.get("chosen_url"),
                Double.parseDouble(row.get("confidence")),
                EnrichmentStatus.valueOf(row.get("status")),
                row.get("detail"));
    }
}
