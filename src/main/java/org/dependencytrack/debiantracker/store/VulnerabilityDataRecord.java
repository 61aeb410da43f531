package org.dependencytrack.debiantracker.store;

import org.dependencytrack.debiantracker.api.Source;
import org.dependencytrack.debiantracker.api.VulnerabilityRecord;
import org.jspecify.annotations.Nullable;

import java.time.Instant;

public record VulnerabilityDataRecord(
        String sourceName,
        String vulnId,
        String packageName,
        @Nullable String description,
        @Nullable String scope,
        @Nullable Long debianBug,
        @Nullable Instant createdAt,
        @Nullable Instant updatedAt) {

    static VulnerabilityDataRecord of(final Source source, final VulnerabilityRecord vuln) {
        return new VulnerabilityDataRecord(
                source.name(),
                vuln.cveId(),
                vuln.packageName(),
                vuln.description(),
                vuln.scope(),
                vuln.debianBug(),
                null,
                null);
    }

}
