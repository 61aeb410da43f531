package org.dependencytrack.debiantracker.cli;

import com.github.packageurl.MalformedPackageURLException;
import com.github.packageurl.PackageURL;
import org.dependencytrack.debiantracker.api.AffectedRange;
import org.dependencytrack.debiantracker.source.debian.DebianTrackerImporter;
import org.dependencytrack.debiantracker.store.AffectedRangeRecord;
import org.dependencytrack.debiantracker.store.DatabaseImpl;
import org.dependencytrack.debiantracker.version.DebianVersion;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.Spec;

import java.io.PrintWriter;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.TreeSet;
import java.util.concurrent.Callable;

@Command(name = "check", description = "Test a database by checking a Debian package URL against it.")
public class CheckCommand implements Callable<Integer> {

    @Spec
    CommandSpec spec;

    @Option(names = {"-d", "--database"}, required = true)
    Path databaseFilePath;

    @Option(names = "--include-low-confidence", description = "Also consider ranges whose derivation is uncertain")
    boolean includeLowConfidence;

    @Option(names = "--urls", description = "Print the advisory URL next to each vulnerability")
    boolean printUrls;

    @Parameters(description = "Package URL, e.g. pkg:deb/debian/busybox@1:1.35.0-4?distro=bookworm")
    String purlString;

    @Override
    public Integer call() {
        final PrintWriter out = spec.commandLine().getOut();
        final PrintWriter err = spec.commandLine().getErr();

        if (!Files.isRegularFile(databaseFilePath)) {
            err.println("Database %s does not exist".formatted(databaseFilePath));
            return 1;
        }

        final PackageURL purl;
        try {
            purl = new PackageURL(purlString);
        } catch (MalformedPackageURLException e) {
            err.println("Invalid package URL: " + e.getMessage());
            return 1;
        }

        if (!PackageURL.StandardTypes.DEBIAN.equals(purl.getType())) {
            err.println("Package URL must be of type deb, but is " + purl.getType());
            return 1;
        }

        final Map<String, String> qualifiers = purl.getQualifiers();
        final String release = qualifiers != null ? qualifiers.get("distro") : null;
        if (release == null || purl.getVersion() == null) {
            err.println("Package URL must have a version and a distro qualifier");
            return 1;
        }
        if (!DebianVersion.isValid(purl.getVersion())) {
            err.println("Invalid Debian version: " + purl.getVersion());
            return 1;
        }

        final List<AffectedRangeRecord> rangeRecords;
        try (final var database = DatabaseImpl.open(databaseFilePath, DebianTrackerImporter.SOURCE)) {
            rangeRecords = database.getRangeRecords(purl.getName(), release);
        }

        final var affectedVulnIds = new TreeSet<String>();
        for (final AffectedRangeRecord rangeRecord : rangeRecords) {
            if (rangeRecord.lowConfidence() && !includeLowConfidence) {
                continue;
            }

            final AffectedRange range = rangeRecord.toAffectedRange();
            if (range.contains(purl.getVersion())) {
                affectedVulnIds.add(rangeRecord.vulnId());
            }
        }

        for (final String vulnId : affectedVulnIds) {
            if (printUrls) {
                out.println(vulnId + "\t" + DebianTrackerImporter.SOURCE.advisoryUrl(vulnId));
            } else {
                out.println(vulnId);
            }
        }
        out.flush();

        return 0;
    }

}
