package org.dependencytrack.debiantracker.api;

import org.jspecify.annotations.Nullable;

import java.util.Comparator;
import java.util.List;

import static java.util.Objects.requireNonNull;

public record VulnerabilityRecord(
        String cveId,
        String packageName,
        @Nullable String description,
        @Nullable String scope,
        @Nullable Long debianBug,
        List<AffectedRange> ranges) {

    public static final Comparator<VulnerabilityRecord> CANONICAL_ORDER =
            Comparator.comparing(VulnerabilityRecord::packageName, Utf8Order.COMPARATOR)
                    .thenComparing(VulnerabilityRecord::cveId, Utf8Order.COMPARATOR);

    public VulnerabilityRecord {
        requireNonNull(cveId, "cveId must not be null");
        requireNonNull(packageName, "packageName must not be null");
        ranges = ranges != null ? List.copyOf(ranges) : List.of();
    }

    public List<AffectedRange> confidentRanges() {
        return ranges.stream()
                .filter(range -> !range.lowConfidence())
                .toList();
    }

    public VulnerabilityRecord withoutLowConfidenceRanges() {
        return new VulnerabilityRecord(cveId, packageName, description, scope, debianBug, confidentRanges());
    }

}
