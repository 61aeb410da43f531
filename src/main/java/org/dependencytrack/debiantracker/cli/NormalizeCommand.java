package org.dependencytrack.debiantracker.cli;

import org.dependencytrack.debiantracker.source.debian.ConversionResult;
import org.dependencytrack.debiantracker.source.debian.DebianTrackerImporter;
import org.dependencytrack.debiantracker.store.DatabaseImpl;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.concurrent.Callable;

@Command(name = "normalize", description = "Normalize a Debian security tracker dump into the workspace database.")
public class NormalizeCommand implements Callable<Integer> {

    private static final Logger LOGGER = LoggerFactory.getLogger(NormalizeCommand.class);

    @Option(names = {"--workspace", "-w"}, description = "Directory the database is written to")
    Path workspacePath;

    @Option(names = "--threads", defaultValue = "1", description = "Number of packages to convert concurrently")
    int threads;

    @Option(names = "--snapshot", description = "File to write the records to as JSON lines")
    Path snapshotFilePath;

    @Option(names = "--exclude-low-confidence", description = "Omit ranges whose derivation is uncertain")
    boolean excludeLowConfidence;

    @Parameters(description = "Tracker dump in JSON format")
    Path dumpFilePath;

    @Override
    public Integer call() {
        if (dumpFilePath == null) {
            throw new IllegalArgumentException("No tracker dump specified");
        }
        if (!Files.isRegularFile(dumpFilePath)) {
            throw new IllegalArgumentException("Tracker dump %s does not exist".formatted(dumpFilePath));
        }

        if (workspacePath == null) {
            workspacePath = Paths.get("");
        }
        workspacePath = workspacePath.normalize().toAbsolutePath();
        if (!Files.exists(workspacePath)) {
            throw new IllegalArgumentException("Workspace directory %s does not exist".formatted(workspacePath));
        }
        if (!Files.isDirectory(workspacePath)) {
            throw new IllegalArgumentException("Workspace path %s is not a directory".formatted(workspacePath));
        }

        final var importer = new DebianTrackerImporter(dumpFilePath, threads, excludeLowConfidence, snapshotFilePath);
        try (final var database = DatabaseImpl.forSource(workspacePath, importer.source())) {
            importer.init(database);
            importer.runImport();
        } catch (Exception e) {
            LOGGER.error("Import of source {} failed", importer.source().name(), e);
            return 1;
        }

        final ConversionResult result = importer.lastResult();
        if (result != null) {
            LOGGER.info("Normalized {} records; Skipped {} malformed entries",
                    result.records().size(), result.skippedEntries().size());
        }

        return 0;
    }

}
