package org.dependencytrack.debiantracker.api;

import org.dependencytrack.debiantracker.version.DebianVersion;
import org.jspecify.annotations.Nullable;

import java.util.Collections;
import java.util.Map;
import java.util.TreeMap;

import static java.util.Objects.requireNonNull;

/**
 * Half-open range {@code [lowerBound, upperBound)} of versions affected in a single release.
 *
 * @param release              Name of the release, e.g. {@code bookworm}
 * @param ecosystem            Ecosystem of the release, e.g. {@code Debian:12}
 * @param status               Classification of the range
 * @param lowerBound           Inclusive lower bound, or {@value #UNBOUNDED}; {@code null} for empty ranges
 * @param upperBound           Exclusive upper bound, or {@value #UNBOUNDED}; {@code null} for empty ranges
 * @param fixedVersion         Version the issue was fixed in, {@value #FIXED_BEFORE_TRACKING} if it never affected the release
 * @param empty                Whether no version is affected
 * @param lowConfidence        Whether the range was derived from incomplete or contradictory data
 * @param reason               Diagnostic explaining a low confidence range
 * @param urgency              Urgency as reported by the tracker, not interpreted
 * @param affectedRepositories Shipped versions that fall into this range, keyed by suite
 */
public record AffectedRange(
        String release,
        @Nullable String ecosystem,
        RangeStatus status,
        @Nullable String lowerBound,
        @Nullable String upperBound,
        @Nullable String fixedVersion,
        boolean empty,
        boolean lowConfidence,
        @Nullable String reason,
        @Nullable String urgency,
        Map<String, String> affectedRepositories) {

    public static final String UNBOUNDED = "unbounded";
    public static final String FIXED_BEFORE_TRACKING = "0";

    public AffectedRange {
        requireNonNull(release, "release must not be null");
        requireNonNull(status, "status must not be null");
        if (empty && (lowerBound != null || upperBound != null)) {
            throw new IllegalArgumentException("Empty ranges must not have bounds");
        }
        if (!empty && (lowerBound == null || upperBound == null)) {
            throw new IllegalArgumentException("Non-empty ranges must have bounds");
        }
        affectedRepositories = affectedRepositories != null
                ? Collections.unmodifiableSortedMap(new TreeMap<>(affectedRepositories))
                : Collections.emptySortedMap();
    }

    public static AffectedRange open(final String release, final @Nullable String urgency) {
        return new AffectedRange(release, null, RangeStatus.OPEN, UNBOUNDED, UNBOUNDED,
                null, false, false, null, urgency, null);
    }

    public static AffectedRange fixed(final String release, final String fixedVersion, final @Nullable String urgency) {
        return new AffectedRange(release, null, RangeStatus.FIXED, UNBOUNDED, fixedVersion,
                fixedVersion, false, false, null, urgency, null);
    }

    public static AffectedRange notAffected(final String release, final @Nullable String urgency) {
        return new AffectedRange(release, null, RangeStatus.NOT_AFFECTED, null, null,
                FIXED_BEFORE_TRACKING, true, false, null, urgency, null);
    }

    public static AffectedRange indeterminate(
            final String release,
            final RangeStatus status,
            final String reason,
            final @Nullable String urgency) {
        return new AffectedRange(release, null, status, UNBOUNDED, UNBOUNDED,
                null, false, true, reason, urgency, null);
    }

    /**
     * @param version The version to check
     * @return {@code true} when {@code version} is inside this range
     * @throws org.dependencytrack.debiantracker.version.MalformedVersionException When {@code version} is invalid
     */
    public boolean contains(final String version) {
        final DebianVersion parsedVersion = DebianVersion.parse(version);
        if (empty) {
            return false;
        }

        if (!UNBOUNDED.equals(lowerBound)
            && parsedVersion.compareTo(DebianVersion.parse(lowerBound)) < 0) {
            return false;
        }

        return UNBOUNDED.equals(upperBound)
               || parsedVersion.compareTo(DebianVersion.parse(upperBound)) < 0;
    }

    public AffectedRange withRelease(final String release) {
        return new AffectedRange(release, ecosystem, status, lowerBound, upperBound,
                fixedVersion, empty, lowConfidence, reason, urgency, affectedRepositories);
    }

    public AffectedRange withEcosystem(final String ecosystem) {
        return new AffectedRange(release, ecosystem, status, lowerBound, upperBound,
                fixedVersion, empty, lowConfidence, reason, urgency, affectedRepositories);
    }

    public AffectedRange withLowConfidence(final String reason) {
        return new AffectedRange(release, ecosystem, status, lowerBound, upperBound,
                fixedVersion, empty, true, reason, urgency, affectedRepositories);
    }

    public AffectedRange withAffectedRepositories(final Map<String, String> affectedRepositories) {
        return new AffectedRange(release, ecosystem, status, lowerBound, upperBound,
                fixedVersion, empty, lowConfidence, reason, urgency, affectedRepositories);
    }

}
