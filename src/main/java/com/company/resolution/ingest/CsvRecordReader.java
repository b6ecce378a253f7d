package com.company.resolution.ingest;

import com.company.resolution.config.ConfigurationException;
import com.company.resolution.core.model.RawRecord;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVParser;
import org.apache.commons.csv.CSVRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.Reader;
import java.io.StringReader;
import java.io.UncheckedIOException;
import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Reads company name records from a CSV file with a header row.
 *
 * <p>Expected CSV format:</p>
 * <pre>
 * company,country
 * "Acme, Inc.",US
 * Globex LLC,US
 * </pre>
 *
 * <p>The name column is chosen by header, or defaults to the first column. All
 * other columns are kept as source metadata. Record ids are the 1-based data row
 * numbers. Files that are not valid UTF-8 are decoded as ISO-8859-1.</p>
 */
public class CsvRecordReader {
    private static final Logger log = LoggerFactory.getLogger(CsvRecordReader.class);

    private static final CSVFormat FORMAT = CSVFormat.DEFAULT.builder()
            .setHeader()
            .setSkipHeaderRecord(true)
            .setIgnoreEmptyLines(true)
            .setAllowMissingColumnNames(true)
            .build();

    private final String nameColumn;

    public CsvRecordReader() {
        this(null);
    }

    /**
     * @param nameColumn header of the name column, or {@code null} for the first column
     */
    public CsvRecordReader(String nameColumn) {
        this.nameColumn = nameColumn;
    }

    /**
     * Reads all rows of the given file.
     */
    public List<RawRecord> read(Path path) {
        byte[] bytes;
        try {
            bytes = Files.readAllBytes(path);
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot read input " + path, e);
        }
        List<RawRecord> records = read(new StringReader(decode(bytes, path)));
        log.info("input.read path={} rows={}", path, records.size());
        return records;
    }

    /**
     * Reads all rows from the given reader.
     */
    public List<RawRecord> read(Reader reader) {
        List<RawRecord> records = new ArrayList<>();
        try (CSVParser parser = FORMAT.parse(reader)) {
            List<String> headers = parser.getHeaderNames();
            if (headers.isEmpty()) {
                return records;
            }
            String column = resolveNameColumn(headers);

            long rowNumber = 0;
            for (CSVRecord row : parser) {
                rowNumber++;
                String rawName = row.isMapped(column) && row.isSet(column) ? row.get(column) : null;
                Map<String, String> metadata = new LinkedHashMap<>();
                for (String header : headers) {
                    if (!header.equals(column) && row.isSet(header)) {
                        metadata.put(header, row.get(header));
                    }
                }
                records.add(new RawRecord(String.valueOf(rowNumber), rawName, metadata));
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Malformed CSV input", e);
        }
        return records;
    }

    private String resolveNameColumn(List<String> headers) {
        if (nameColumn == null) {
            return headers.get(0);
        }
        for (String header : headers) {
            if (header.strip().equalsIgnoreCase(nameColumn)) {
                return header;
            }
        }
        throw new ConfigurationException("Name column '" + nameColumn + "' not found in header " + headers);
    }

    private static String decode(byte[] bytes, Path path) {
        String text;
        try {
            text = StandardCharsets.UTF_8.newDecoder()
                    .onMalformedInput(CodingErrorAction.REPORT)
                    .onUnmappableCharacter(CodingErrorAction.REPORT)
                    .decode(ByteBuffer.wrap(bytes))
                    .toString();
        } catch (CharacterCodingException e) {
            log.warn("input.encoding path={} fallback=ISO-8859-1", path);
            text = new String(bytes, StandardCharsets.ISO_8859_1);
        }
        // Drop a UTF-8 byte order mark so it does not end up in the first header
        if (!text.isEmpty() && text.charAt(0) == '\uFEFF') {
            text = text.substring(1);
        }
        return text;
    }
}
