package org.dependencytrack.debiantracker.cli;

import org.dependencytrack.debiantracker.Application;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import picocli.CommandLine;

import java.io.IOException;
import java.io.InputStream;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;

class CommandsTest {

    @TempDir
    Path workspacePath;

    private Path dumpFilePath;
    private Path databaseFilePath;
    private StringWriter out;
    private StringWriter err;

    @BeforeEach
    void beforeEach() throws IOException {
        dumpFilePath = workspacePath.resolve("tracker.json");
        databaseFilePath = workspacePath.resolve("debian.sqlite");
        try (final InputStream inputStream = getClass().getClassLoader()
                .getResourceAsStream("fixtures/tracker-sample.json")) {
            Files.copy(inputStream, dumpFilePath);
        }

        out = new StringWriter();
        err = new StringWriter();
    }

    @Test
    void shouldNormalizeIntoWorkspace() {
        final Path snapshotFilePath = workspacePath.resolve("snapshot.jsonl");

        final int exitCode = execute("normalize", "-w", workspacePath.toString(),
                "--threads", "2", "--snapshot", snapshotFilePath.toString(), dumpFilePath.toString());

        assertThat(exitCode).isZero();
        assertThat(databaseFilePath).exists();
        assertThat(snapshotFilePath).exists();
    }

    @Test
    void shouldFailNormalizeForMissingWorkspace() {
        final int exitCode = execute("normalize", "-w", workspacePath.resolve("nope").toString(), dumpFilePath.toString());

        assertThat(exitCode).isNotZero();
    }

    @Test
    void shouldReportOpenVulnerability() {
        normalize();

        final int exitCode = execute("check", "-d", databaseFilePath.toString(),
                "pkg:deb/debian/busybox@1%3A1.35.0-4?distro=bookworm");

        assertThat(exitCode).isZero();
        assertThat(out.toString().lines()).containsExactly("CVE-2018-1000500");
    }

    @Test
    void shouldIncludeLowConfidenceRangesOnRequest() {
        normalize();

        final int exitCode = execute("check", "-d", databaseFilePath.toString(), "--include-low-confidence",
                "pkg:deb/debian/busybox@1%3A1.35.0-4?distro=bookworm");

        assertThat(exitCode).isZero();
        assertThat(out.toString().lines()).containsExactly("CVE-2018-1000500", "CVE-2021-42374");
    }

    @Test
    void shouldReportVulnerabilityOnlyBeforeFixedVersion() {
        normalize();

        assertThat(execute("check", "-d", databaseFilePath.toString(),
                "pkg:deb/debian/apparmor@2.10.95-4?distro=bookworm")).isZero();
        assertThat(out.toString().lines()).containsExactly("CVE-2017-6507");

        out.getBuffer().setLength(0);
        assertThat(execute("check", "-d", databaseFilePath.toString(),
                "pkg:deb/debian/apparmor@3.0.8-3?distro=bookworm")).isZero();
        assertThat(out.toString()).isEmpty();
    }

    @Test
    void shouldPrintAdvisoryUrls() {
        normalize();

        assertThat(execute("check", "-d", databaseFilePath.toString(), "--urls",
                "pkg:deb/debian/busybox@1%3A1.35.0-4?distro=bookworm")).isZero();
        assertThat(out.toString().lines()).containsExactly(
                "CVE-2018-1000500\thttps://security-tracker.debian.org/tracker/CVE-2018-1000500");
    }

    @Test
    void shouldNotReportReleaseThatWasNeverAffected() {
        normalize();

        assertThat(execute("check", "-d", databaseFilePath.toString(),
                "pkg:deb/debian/busybox@1%3A1.30.1-4?distro=buster")).isZero();
        assertThat(out.toString()).isEmpty();
    }

    @Test
    void shouldRejectInvalidPackageUrls() {
        normalize();

        assertThat(execute("check", "-d", databaseFilePath.toString(), "pkg:npm/lodash@4.17.20")).isEqualTo(1);
        assertThat(execute("check", "-d", databaseFilePath.toString(), "pkg:deb/debian/busybox@1.0")).isEqualTo(1);
        assertThat(execute("check", "-d", databaseFilePath.toString(), "not a purl")).isEqualTo(1);
        assertThat(err.toString()).isNotEmpty();
    }

    @Test
    void shouldFailCheckForMissingDatabase() {
        final int exitCode = execute("check", "-d", databaseFilePath.toString(),
                "pkg:deb/debian/busybox@1%3A1.35.0-4?distro=bookworm");

        assertThat(exitCode).isEqualTo(1);
        assertThat(err.toString()).contains("does not exist");
    }

    private void normalize() {
        assertThat(execute("normalize", "-w", workspacePath.toString(), dumpFilePath.toString())).isZero();
        out.getBuffer().setLength(0);
        err.getBuffer().setLength(0);
    }

    private int execute(final String... args) {
        final var commandLine = new CommandLine(new Application());
        commandLine.setOut(new PrintWriter(out, true));
        commandLine.setErr(new PrintWriter(err, true));
        return commandLine.execute(args);
    }

}
