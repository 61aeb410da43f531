package org.dependencytrack.debiantracker.source.debian;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.dependencytrack.debiantracker.api.Database;
import org.dependencytrack.debiantracker.api.Importer;
import org.dependencytrack.debiantracker.api.Source;
import org.dependencytrack.debiantracker.api.VulnerabilityRecord;
import org.dependencytrack.debiantracker.store.SnapshotWriter;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

import static java.util.Objects.requireNonNull;

public final class DebianTrackerImporter implements Importer {

    private static final Logger LOGGER = LoggerFactory.getLogger(DebianTrackerImporter.class);

    public static final Source SOURCE = new Source(
            "debian", "Debian Security Tracker", "https://security-tracker.debian.org/tracker/");

    static final String METADATA_KEY_RECORDS = "last_import_records";
    static final String METADATA_KEY_SKIPPED = "last_import_skipped";

    private static final int BATCH_SIZE = 500;

    private final Path dumpFilePath;
    private final int threads;
    private final boolean excludeLowConfidence;
    private final @Nullable Path snapshotFilePath;
    private final ObjectMapper objectMapper;
    private final TrackerDocumentLoader loader;
    private Database database;
    private ConversionResult lastResult;

    public DebianTrackerImporter(
            final Path dumpFilePath,
            final int threads,
            final boolean excludeLowConfidence,
            final @Nullable Path snapshotFilePath) {
        this.dumpFilePath = requireNonNull(dumpFilePath, "dumpFilePath must not be null");
        if (threads < 1) {
            throw new IllegalArgumentException("threads must be at least 1, but is " + threads);
        }
        this.threads = threads;
        this.excludeLowConfidence = excludeLowConfidence;
        this.snapshotFilePath = snapshotFilePath;
        this.objectMapper = new ObjectMapper();
        this.loader = new TrackerDocumentLoader();
    }

    @Override
    public Source source() {
        return SOURCE;
    }

    @Override
    public void init(final Database database) {
        this.database = database;
    }

    @Override
    public void runImport() throws Exception {
        if (database == null) {
            throw new IllegalStateException("Importer has not been initialized");
        }

        try (var ignoredMdcSource = MDC.putCloseable("source", source().name())) {
            doImport();
        }
    }

    private void doImport() throws Exception {
        LOGGER.info("Reading tracker dump from {}", dumpFilePath);
        final JsonNode document = objectMapper.readTree(dumpFilePath.toFile());
        final ConversionResult result = threads > 1
                ? convertConcurrently(document)
                : loader.load(document).convertAll();

        List<VulnerabilityRecord> records = result.records();
        if (excludeLowConfidence) {
            records = records.stream()
                    .map(VulnerabilityRecord::withoutLowConfidenceRanges)
                    .toList();
        }

        int recordsStored = 0;
        for (int i = 0; i < records.size(); i += BATCH_SIZE) {
            final List<VulnerabilityRecord> batch = records.subList(i, Math.min(i + BATCH_SIZE, records.size()));
            database.storeVulnerabilities(batch);
            recordsStored += batch.size();
            LOGGER.info("Stored {}/{} records", recordsStored, records.size());
        }

        final int deleted = deleteWithdrawnVulnerabilities(records, result.skippedEntries());
        if (deleted > 0) {
            LOGGER.info("Deleted {} records no longer reported", deleted);
        }

        database.putSourceMetadata(METADATA_KEY_RECORDS, String.valueOf(records.size()));
        database.putSourceMetadata(METADATA_KEY_SKIPPED, String.valueOf(result.skippedEntries().size()));

        if (snapshotFilePath != null) {
            LOGGER.info("Writing snapshot to {}", snapshotFilePath);
            new SnapshotWriter().write(records, snapshotFilePath);
        }

        lastResult = new ConversionResult(records, result.skippedEntries());
    }

    private int deleteWithdrawnVulnerabilities(
            final List<VulnerabilityRecord> records,
            final List<SkippedEntry> skippedEntries) {
        final var retainedVulnIdsByPackage = new HashMap<String, Set<String>>();
        final var untouchedPackages = new HashSet<String>();

        for (final VulnerabilityRecord record : records) {
            retainedVulnIdsByPackage.computeIfAbsent(record.packageName(), ignored -> new HashSet<>()).add(record.cveId());
        }

        // Skipped entries could not be read, what was stored for them before is kept.
        for (final SkippedEntry skippedEntry : skippedEntries) {
            if (skippedEntry.cveId() == null) {
                untouchedPackages.add(skippedEntry.packageName());
            } else {
                retainedVulnIdsByPackage.computeIfAbsent(skippedEntry.packageName(), ignored -> new HashSet<>())
                        .add(skippedEntry.cveId());
            }
        }

        return database.deleteVulnerabilitiesExcept(retainedVulnIdsByPackage, untouchedPackages);
    }

    public @Nullable ConversionResult lastResult() {
        return lastResult;
    }

    private ConversionResult convertConcurrently(final JsonNode document)
            throws InterruptedException, ExecutionException {
        final List<String> packageNames = loader.load(document).packageNames();
        LOGGER.info("Converting {} packages using {} threads", packageNames.size(), threads);

        final ExecutorService executorService = Executors.newFixedThreadPool(threads);
        try {
            final var futures = new ArrayList<Future<ConversionResult>>(packageNames.size());
            for (final String packageName : packageNames) {
                futures.add(executorService.submit(() -> convertPackage(document, packageName)));
            }

            // Futures are drained in document order, so skipped entries keep that order too.
            final var records = new ArrayList<VulnerabilityRecord>();
            final var skippedEntries = new ArrayList<SkippedEntry>();
            for (final Future<ConversionResult> future : futures) {
                final ConversionResult packageResult = future.get();
                records.addAll(packageResult.records());
                skippedEntries.addAll(packageResult.skippedEntries());
            }
            records.sort(VulnerabilityRecord.CANONICAL_ORDER);

            LOGGER.info("Converted {} records; Skipped {} entries", records.size(), skippedEntries.size());
            return new ConversionResult(records, skippedEntries);
        } finally {
            executorService.shutdownNow();
        }
    }

    private ConversionResult convertPackage(final JsonNode document, final String packageName) {
        try (var ignoredMdcSource = MDC.putCloseable("source", source().name())) {
            final var skippedEntries = new ArrayList<SkippedEntry>();
            final List<VulnerabilityRecord> records =
                    loader.load(document, skippedEntries::add).convertPackage(packageName);
            return new ConversionResult(records, skippedEntries);
        }
    }

}
