package org.dependencytrack.debiantracker.source.debian;

import org.dependencytrack.debiantracker.api.AffectedRange;
import org.dependencytrack.debiantracker.api.VulnerabilityRecord;
import org.dependencytrack.debiantracker.store.DatabaseImpl;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatExceptionOfType;
import static org.assertj.core.api.Assertions.assertThatIllegalArgumentException;
import static org.assertj.core.api.Assertions.assertThatIllegalStateException;

class DebianTrackerImporterTest {

    @TempDir
    Path tempDir;

    private Path dumpFilePath;

    @BeforeEach
    void beforeEach() throws IOException {
        dumpFilePath = tempDir.resolve("tracker.json");
        try (final InputStream inputStream = getClass().getClassLoader()
                .getResourceAsStream("fixtures/tracker-sample.json")) {
            Files.copy(inputStream, dumpFilePath);
        }
    }

    @Test
    void shouldImportDump() throws Exception {
        final var importer = new DebianTrackerImporter(dumpFilePath, 1, false, null);

        try (final var database = DatabaseImpl.forSource(tempDir, importer.source())) {
            importer.init(database);
            importer.runImport();

            assertThat(database.getDataRecords()).hasSize(4);
            assertThat(database.getRangeRecords("busybox", "bookworm"))
                    .extracting(record -> record.vulnId())
                    .containsExactly("CVE-2018-1000500", "CVE-2021-42374");
            assertThat(database.getSourceMetadata())
                    .containsEntry(DebianTrackerImporter.METADATA_KEY_RECORDS, "4")
                    .containsEntry(DebianTrackerImporter.METADATA_KEY_SKIPPED, "2");
        }

        assertThat(importer.lastResult()).isNotNull();
        assertThat(importer.lastResult().skippedEntries()).hasSize(2);
    }

    @Test
    void shouldDeleteVulnerabilitiesNoLongerInDump() throws Exception {
        final Path workspacePath = Files.createTempDirectory(tempDir, "workspace");
        final Path updatedDumpFilePath = tempDir.resolve("tracker-updated.json");
        Files.writeString(updatedDumpFilePath, /* language=JSON */ """
                {
                  "apparmor": {
                    "TEMP-0000000-6A1B2C": {
                      "releases": {
                        "bookworm": {"status": "undetermined"}
                      }
                    }
                  },
                  "busybox": {
                    "CVE-2018-1000500": {
                      "releases": "not an object"
                    },
                    "CVE-2021-42374": {
                      "releases": {
                        "bookworm": {"status": "resolved", "fixed_version": "1:1.35.0-5"}
                      }
                    }
                  },
                  "zlib": "not an object"
                }
                """);

        try (final var database = DatabaseImpl.forSource(workspacePath, DebianTrackerImporter.SOURCE)) {
            final var importer = new DebianTrackerImporter(dumpFilePath, 1, false, null);
            importer.init(database);
            importer.runImport();

            final var updatedImporter = new DebianTrackerImporter(updatedDumpFilePath, 1, false, null);
            updatedImporter.init(database);
            updatedImporter.runImport();

            assertThat(database.getDataRecords())
                    .extracting(record -> record.packageName() + "/" + record.vulnId())
                    .containsExactly(
                            "apparmor/TEMP-0000000-6A1B2C",
                            "busybox/CVE-2018-1000500",
                            "busybox/CVE-2021-42374");
            assertThat(database.getRangeRecords("apparmor", "bookworm"))
                    .extracting(record -> record.vulnId())
                    .containsExactly("TEMP-0000000-6A1B2C");
        }
    }

    @Test
    void shouldProduceSameResultWhenConvertingConcurrently() throws Exception {
        final ConversionResult sequential = runImport(1, false, null);
        final ConversionResult concurrent = runImport(4, false, null);

        assertThat(concurrent).isEqualTo(sequential);
    }

    @Test
    void shouldExcludeLowConfidenceRanges() throws Exception {
        final ConversionResult result = runImport(1, true, null);

        assertThat(result.records()).hasSize(4);
        assertThat(result.records())
                .flatExtracting(VulnerabilityRecord::ranges)
                .noneMatch(AffectedRange::lowConfidence);
        assertThat(result.records())
                .filteredOn(record -> "CVE-2021-42374".equals(record.cveId()))
                .singleElement()
                .satisfies(record -> assertThat(record.ranges()).isEmpty());
    }

    @Test
    void shouldWriteSnapshot() throws Exception {
        final Path snapshotFilePath = tempDir.resolve("snapshot.jsonl");

        runImport(2, false, snapshotFilePath);

        final List<String> lines = Files.readAllLines(snapshotFilePath);
        assertThat(lines).hasSize(4);
        assertThat(lines.get(0)).contains("\"cveId\":\"CVE-2017-6507\"");
        assertThat(lines.get(3)).contains("\"cveId\":\"CVE-2021-42374\"");
    }

    @Test
    void shouldFailForMissingDump() {
        final var importer = new DebianTrackerImporter(tempDir.resolve("missing.json"), 1, false, null);

        try (final var database = DatabaseImpl.forSource(tempDir, importer.source())) {
            importer.init(database);
            assertThatExceptionOfType(IOException.class).isThrownBy(importer::runImport);
        }
    }

    @Test
    void shouldRequireInitialization() {
        final var importer = new DebianTrackerImporter(dumpFilePath, 1, false, null);

        assertThatIllegalStateException().isThrownBy(importer::runImport);
    }

    @Test
    void shouldRejectInvalidThreadCount() {
        assertThatIllegalArgumentException()
                .isThrownBy(() -> new DebianTrackerImporter(dumpFilePath, 0, false, null));
    }

    private ConversionResult runImport(
            final int threads,
            final boolean excludeLowConfidence,
            final Path snapshotFilePath) throws Exception {
        final Path workspacePath = Files.createTempDirectory(tempDir, "workspace");
        final var importer = new DebianTrackerImporter(dumpFilePath, threads, excludeLowConfidence, snapshotFilePath);

        try (final var database = DatabaseImpl.forSource(workspacePath, importer.source())) {
            importer.init(database);
            importer.runImport();
        }

        return importer.lastResult();
    }

}
