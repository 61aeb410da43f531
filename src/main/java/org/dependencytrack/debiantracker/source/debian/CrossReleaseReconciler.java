package org.dependencytrack.debiantracker.source.debian;

import org.dependencytrack.debiantracker.api.AffectedRange;
import org.dependencytrack.debiantracker.api.RangeStatus;
import org.dependencytrack.debiantracker.api.Utf8Order;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;

import static java.util.Objects.requireNonNull;

/**
 * Validates and labels the per-release ranges of a CVE.
 * <p>
 * Every release is its own ecosystem, ranges of different releases are never merged.
 * The output is ordered by release name, and contains no data other than what was
 * derived from the input, so reconciling the same input always yields the same output.
 */
public final class CrossReleaseReconciler {

    private static final Logger LOGGER = LoggerFactory.getLogger(CrossReleaseReconciler.class);

    private final DebianReleases releases;

    public CrossReleaseReconciler(final DebianReleases releases) {
        this.releases = requireNonNull(releases, "releases must not be null");
    }

    public List<AffectedRange> reconcile(final Map<String, AffectedRange> rangeByRelease) {
        final var ranges = new ArrayList<AffectedRange>(rangeByRelease.size());

        for (final Map.Entry<String, AffectedRange> entry : rangeByRelease.entrySet()) {
            final String release = requireNonNull(entry.getKey(), "release must not be null");
            AffectedRange range = requireNonNull(entry.getValue(), "range must not be null");

            if (!release.equals(range.release())) {
                LOGGER.debug("Relabeling range of {} as {}", range.release(), release);
                range = range.withRelease(release);
            }

            range = validate(range).withEcosystem(releases.ecosystemOf(release));
            ranges.add(range);
        }

        ranges.sort((a, b) -> Utf8Order.compare(a.release(), b.release()));

        if (LOGGER.isDebugEnabled()) {
            final long distinctUrgencies = ranges.stream()
                    .map(AffectedRange::urgency)
                    .filter(Objects::nonNull)
                    .distinct()
                    .count();
            if (distinctUrgencies > 1) {
                LOGGER.debug("Releases report {} different urgencies; Keeping them as-is", distinctUrgencies);
            }
        }

        return List.copyOf(ranges);
    }

    private static AffectedRange validate(final AffectedRange range) {
        if (range.lowConfidence()) {
            return range;
        }

        if (range.reason() != null) {
            return range.withLowConfidence(range.reason());
        }
        if (range.status() == RangeStatus.INDETERMINATE) {
            return range.withLowConfidence("Status is indeterminate");
        }
        if (range.status() == RangeStatus.FIXED
            && (range.fixedVersion() == null || !range.fixedVersion().equals(range.upperBound()))) {
            return range.withLowConfidence("Fixed version does not match the upper bound of the range");
        }

        return range;
    }

}
