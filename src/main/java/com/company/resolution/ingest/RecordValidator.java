package com.company.resolution.ingest;

import com.company.resolution.core.model.RawRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Validates raw records before normalization.
 * Rejects blank, overly long or control-character-containing names and duplicate ids.
 */
public class RecordValidator {
    private static final Logger log = LoggerFactory.getLogger(RecordValidator.class);

    /** Maximum allowed length for company names. */
    public static final int MAX_NAME_LENGTH = 1000;

    /**
     * Validates a single record.
     *
     * @throws ValidationException if the record cannot be clustered
     */
    public void validate(RawRecord record) {
        String name = record.rawName();
        if (name == null || name.isBlank()) {
            throw new ValidationException(record.id(), "Company name is blank");
        }
        if (name.length() > MAX_NAME_LENGTH) {
            throw new ValidationException(record.id(),
                    "Company name exceeds maximum length of " + MAX_NAME_LENGTH +
                            " characters (was " + name.length() + ")");
        }
        if (containsControlCharacters(name)) {
            throw new ValidationException(record.id(), "Company name contains control characters");
        }
    }

    /**
     * Splits records into accepted and dropped. Never throws for a bad row.
     */
    public IngestResult partition(List<RawRecord> records) {
        List<RawRecord> accepted = new ArrayList<>(records.size());
        List<IngestResult.DroppedRecord> dropped = new ArrayList<>();
        Set<String> seenIds = new HashSet<>();

        for (RawRecord record : records) {
            try {
                if (!seenIds.add(record.id())) {
                    throw new ValidationException(record.id(), "Duplicate record id");
                }
                validate(record);
                accepted.add(record);
            } catch (ValidationException e) {
                dropped.add(new IngestResult.DroppedRecord(record.id(), record.rawName(), e.getMessage()));
                log.warn("record.dropped id={} reason={}", record.id(), e.getMessage());
            }
        }

        IngestResult result = new IngestResult(accepted, dropped);
        log.info("validation.completed result={}", result);
        return result;
    }

    /**
     * Checks whether a string contains ASCII control characters (0x00-0x1F, 0x7F),
     * excluding tab, newline and carriage return.
     */
    private static boolean containsControlCharacters(String s) {
        for (int i = 0; i < s.length(); i++) {
            char c = s.charAt(i);
            if (c < 0x20 && c != '\t' && c != '\n' && c != '\r') {
                return true;
            }
            if (c == 0x7F) {
                return true;
            }
        }
        return false;
    }
}
