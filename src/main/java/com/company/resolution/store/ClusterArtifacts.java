package com.company.resolution.store;

import com.company.resolution.core.model.Batch;
import com.company.resolution.core.model.Cluster;
import com.company.resolution.ingest.IngestResult;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVParser;
import org.apache.commons.csv.CSVPrinter;
import org.apache.commons.csv.CSVRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.Reader;
import java.io.UncheckedIOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.TreeSet;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Reads and writes the files of a pipeline working directory.
 *
 * <pre>
 * workDir/
 *   clusters.csv
 *   batches/batch_001.csv
 *   batches/batch_002.csv
 *   dropped.csv
 *   enriched.csv
 * </pre>
 *
 * <p>Cluster and batch files share one schema. A list column holds one nested CSV record
 * delimited by {@code |}, so a value containing {@code |} or a quote is quoted and reads back unchanged.</p>
 */
public class ClusterArtifacts {
    private static final Logger log = LoggerFactory.getLogger(ClusterArtifacts.class);

    public static final String CLUSTERS_FILE = "clusters.csv";
    public static final String BATCHES_DIR = "batches";
    public static final String ENRICHED_FILE = "enriched.csv";
    public static final String DROPPED_FILE = "dropped.csv";
    public static final char LIST_DELIMITER = '|';

    static final String[] HEADERS = {
            "cluster_id", "representative_name", "canonical_key",
            "member_count", "member_ids", "member_names"
    };

    private static final CSVFormat WRITE_FORMAT = CSVFormat.DEFAULT.builder()
            .setHeader(HEADERS)
            .setRecordSeparator("\n")
            .build();

    private static final CSVFormat READ_FORMAT = CSVFormat.DEFAULT.builder()
            .setHeader(HEADERS)
            .setSkipHeaderRecord(true)
            .setIgnoreEmptyLines(true)
            .build();

    private static final CSVFormat LIST_FORMAT = CSVFormat.DEFAULT.builder()
            .setDelimiter(LIST_DELIMITER)
            .setRecordSeparator("")
            .build();

    private static final String[] DROPPED_HEADERS = {"record_id", "raw_name", "reason"};

    private static final CSVFormat DROPPED_WRITE_FORMAT = CSVFormat.DEFAULT.builder()
            .setHeader(DROPPED_HEADERS)
            .setRecordSeparator("\n")
            .build();

    private static final CSVFormat DROPPED_READ_FORMAT = CSVFormat.DEFAULT.builder()
            .setHeader(DROPPED_HEADERS)
            .setSkipHeaderRecord(true)
            .build();

    private final Path workDir;

    public ClusterArtifacts(Path workDir) {
        this.workDir = workDir;
    }

    public Path getWorkDir() {
        return workDir;
    }

    public Path clustersFile() {
        return workDir.resolve(CLUSTERS_FILE);
    }

    public Path batchesDir() {
        return workDir.resolve(BATCHES_DIR);
    }

    public Path batchFile(String batchId) {
        return batchesDir().resolve(batchId + ".csv");
    }

    public Path enrichedFile() {
        return workDir.resolve(ENRICHED_FILE);
    }

    public Path droppedFile() {
        return workDir.resolve(DROPPED_FILE);
    }

    public boolean hasClusters() {
        return Files.isRegularFile(clustersFile());
    }

    /**
     * Writes the cluster table, replacing any previous one.
     */
    public void writeClusters(Collection<Cluster> clusters) {
        write(clustersFile(), clusters);
        log.info("artifacts.clusters-written path={} clusters={}", clustersFile(), clusters.size());
    }

    public List<Cluster> readClusters() {
        return read(clustersFile());
    }

    /**
     * Writes one file per batch, replacing previous batch files.
     */
    public void writeBatches(List<Batch> batches, Map<String, Cluster> clustersById) {
        try {
            Files.createDirectories(batchesDir());
            try (Stream<Path> old = Files.list(batchesDir())) {
                for (Path path : old.filter(p -> p.getFileName().toString().endsWith(".csv"))
                        .collect(Collectors.toList())) {
                    Files.delete(path);
                }
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot prepare batch directory " + batchesDir(), e);
        }
        for (Batch batch : batches) {
            List<Cluster> members = new ArrayList<>(batch.size());
            for (String clusterId : batch.clusterIds()) {
                Cluster cluster = clustersById.get(clusterId);
                if (cluster == null) {
                    throw new IllegalArgumentException("Batch " + batch.batchId() + " names unknown cluster " + clusterId);
                }
                members.add(cluster);
            }
            write(batchFile(batch.batchId()), members);
        }
        log.info("artifacts.batches-written dir={} batches={}", batchesDir(), batches.size());
    }

    /**
     * Reads the batch files in batch id order. Returns an empty list if there are none.
     */
    public List<Batch> readBatches() {
        if (!Files.isDirectory(batchesDir())) {
            return List.of();
        }
        List<Path> files;
        try (Stream<Path> listing = Files.list(batchesDir())) {
            files = listing.filter(p -> p.getFileName().toString().endsWith(".csv"))
                    .sorted()
                    .collect(Collectors.toList());
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot list batch directory " + batchesDir(), e);
        }
        List<Batch> batches = new ArrayList<>(files.size());
        for (Path file : files) {
            String name = file.getFileName().toString();
            String batchId = name.substring(0, name.length() - ".csv".length());
            batches.add(new Batch(batchId, read(file).stream().map(Cluster::clusterId).collect(Collectors.toList())));
        }
        return batches;
    }

    /**
     * Writes the rows rejected by validation, replacing any previous list.
     */
    public void writeDropped(List<IngestResult.DroppedRecord> dropped) {
        try {
            Files.createDirectories(workDir);
            try (Writer writer = Files.newBufferedWriter(droppedFile(), StandardCharsets.UTF_8);
                 CSVPrinter printer = new CSVPrinter(writer, DROPPED_WRITE_FORMAT)) {
                for (IngestResult.DroppedRecord record : dropped) {
                    printer.printRecord(record.recordId(), record.rawName(), record.reason());
                }
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot write " + droppedFile(), e);
        }
    }

    /**
     * Counts the rows of the dropped-records file, or 0 if there is none.
     */
    public int readDroppedCount() {
        if (!Files.isRegularFile(droppedFile())) {
            return 0;
        }
        try (Reader reader = Files.newBufferedReader(droppedFile(), StandardCharsets.UTF_8);
             CSVParser parser = DROPPED_READ_FORMAT.parse(reader)) {
            return parser.getRecords().size();
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot read " + droppedFile(), e);
        }
    }

    private static void write(Path file, Collection<Cluster> clusters) {
        try {
            Path parent = file.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            try (Writer writer = Files.newBufferedWriter(file, StandardCharsets.UTF_8);
                 CSVPrinter printer = new CSVPrinter(writer, WRITE_FORMAT)) {
                for (Cluster cluster : clusters) {
                    printer.printRecord(
                            cluster.clusterId(),
                            cluster.representativeName(),
                            cluster.canonicalKey(),
                            cluster.memberCount(),
                            joinList(cluster.memberIds()),
                            joinList(cluster.memberNames()));
                }
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot write " + file, e);
        }
    }

    private static List<Cluster> read(Path file) {
        List<Cluster> clusters = new ArrayList<>();
        try (Reader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8);
             CSVParser parser = READ_FORMAT.parse(reader)) {
            for (CSVRecord row : parser) {
                clusters.add(new Cluster(
                        row.get("cluster_id"),
                        row.get("representative_name"),
                        row.get("canonical_key"),
                        new TreeSet<>(split(row.get("member_ids"))),
                        split(row.get("member_names"))));
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot read " + file, e);
        }
        return clusters;
    }

    static String joinList(Collection<String> values) {
        if (values.isEmpty()) {
            return "";
        }
        StringBuilder out = new StringBuilder();
        try (CSVPrinter printer = new CSVPrinter(out, LIST_FORMAT)) {
            printer.printRecord(values);
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot encode list column", e);
        }
        return out.toString();
    }

    static List<String> split(String joined) {
        if (joined == null || joined.isEmpty()) {
            return List.of();
        }
        try (CSVParser parser = CSVParser.parse(joined, LIST_FORMAT)) {
            List<CSVRecord> records = parser.getRecords();
            if (records.size() != 1) {
                throw new IllegalArgumentException("List column must hold one record: " + joined);
            }
            return records.get(0).toList();
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot decode list column " + joined, e);
        }
    }
}
