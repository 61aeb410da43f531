package org.dependencytrack.debiantracker.store;

import org.dependencytrack.debiantracker.api.AffectedRange;
import org.dependencytrack.debiantracker.api.VulnerabilityRecord;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import static net.javacrumbs.jsonunit.assertj.JsonAssertions.assertThatJson;
import static org.assertj.core.api.Assertions.assertThat;

class SnapshotWriterTest {

    private final SnapshotWriter writer = new SnapshotWriter();

    @Test
    void shouldWriteOneRecordPerLine() throws IOException {
        final var outputStream = new ByteArrayOutputStream();

        writer.write(List.of(busyboxRecord(), apparmorRecord()), outputStream);

        final String[] lines = outputStream.toString(StandardCharsets.UTF_8).split("\n");
        assertThat(lines).hasSize(2);
        assertThatJson(lines[0]).isEqualTo(/* language=JSON */ """
                {
                  "cveId": "CVE-2018-1000500",
                  "packageName": "busybox",
                  "description": null,
                  "scope": "remote",
                  "debianBug": 802702,
                  "ranges": [
                    {
                      "release": "bookworm",
                      "ecosystem": "Debian:12",
                      "status": "OPEN",
                      "lowerBound": "unbounded",
                      "upperBound": "unbounded",
                      "fixedVersion": null,
                      "empty": false,
                      "lowConfidence": false,
                      "reason": null,
                      "urgency": "low",
                      "affectedRepositories": {
                        "bookworm": "1:1.35.0-4"
                      }
                    }
                  ]
                }
                """);
        assertThatJson(lines[1]).inPath("$.ranges[0].status").isString().isEqualTo("NOT_AFFECTED");
        assertThatJson(lines[1]).inPath("$.ranges[0].fixedVersion").isString().isEqualTo("0");
    }

    @Test
    void shouldProduceIdenticalOutputForIdenticalRecords(@TempDir final Path tempDir) throws IOException {
        final Path first = tempDir.resolve("first.jsonl");
        final Path second = tempDir.resolve("second.jsonl");

        writer.write(List.of(busyboxRecord(), apparmorRecord()), first);
        new SnapshotWriter().write(List.of(busyboxRecord(), apparmorRecord()), second);

        assertThat(Files.readAllBytes(second)).isEqualTo(Files.readAllBytes(first));
    }

    @Test
    void shouldWriteNothingForNoRecords() throws IOException {
        final var outputStream = new ByteArrayOutputStream();

        writer.write(List.of(), outputStream);

        assertThat(outputStream.toByteArray()).isEmpty();
    }

    private static VulnerabilityRecord busyboxRecord() {
        return new VulnerabilityRecord("CVE-2018-1000500", "busybox", null, "remote", 802702L, List.of(
                AffectedRange.open("bookworm", "low")
                        .withEcosystem("Debian:12")
                        .withAffectedRepositories(Map.of("bookworm", "1:1.35.0-4"))));
    }

    private static VulnerabilityRecord apparmorRecord() {
        return new VulnerabilityRecord("CVE-2017-6507", "apparmor", null, "local", null, List.of(
                AffectedRange.notAffected("buster", "low").withEcosystem("Debian:10")));
    }

}
