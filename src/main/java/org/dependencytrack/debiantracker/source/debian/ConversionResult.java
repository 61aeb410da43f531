package org.dependencytrack.debiantracker.source.debian;

import org.dependencytrack.debiantracker.api.VulnerabilityRecord;

import java.util.List;

public record ConversionResult(List<VulnerabilityRecord> records, List<SkippedEntry> skippedEntries) {

    public ConversionResult {
        records = List.copyOf(records);
        skippedEntries = List.copyOf(skippedEntries);
    }

}
