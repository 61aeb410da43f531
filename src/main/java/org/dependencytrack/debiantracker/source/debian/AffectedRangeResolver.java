package org.dependencytrack.debiantracker.source.debian;

import org.dependencytrack.debiantracker.api.AffectedRange;
import org.dependencytrack.debiantracker.api.RangeStatus;
import org.dependencytrack.debiantracker.version.DebianVersion;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.TreeMap;

public final class AffectedRangeResolver {

    private static final Logger LOGGER = LoggerFactory.getLogger(AffectedRangeResolver.class);

    public AffectedRange resolve(final String release, final ReleaseStatus status) {
        final AffectedRange range = resolveRange(release, status);
        return range.withAffectedRepositories(affectedRepositories(range, status.repositories()));
    }

    private AffectedRange resolveRange(final String release, final ReleaseStatus status) {
        if (status instanceof final ReleaseStatus.Open open) {
            if (open.conflictingFixedVersion() != null) {
                return AffectedRange.indeterminate(release, RangeStatus.OPEN,
                        "Status is open, but fixed version %s is reported".formatted(open.conflictingFixedVersion()),
                        open.urgency());
            }

            return AffectedRange.open(release, open.urgency());
        } else if (status instanceof final ReleaseStatus.Resolved resolved) {
            final DebianVersion fixedVersion = resolved.fixedVersion();
            if (fixedVersion == null) {
                // Not proof of safety, the tracker simply lacks the version.
                return AffectedRange.indeterminate(release, RangeStatus.INDETERMINATE,
                        "Status is resolved, but no fixed version is reported", resolved.urgency());
            } else if (AffectedRange.FIXED_BEFORE_TRACKING.equals(fixedVersion.toString())) {
                return AffectedRange.notAffected(release, resolved.urgency());
            }

            return AffectedRange.fixed(release, fixedVersion.toString(), resolved.urgency());
        } else if (status instanceof final ReleaseStatus.Indeterminate indeterminate) {
            return AffectedRange.indeterminate(release, RangeStatus.INDETERMINATE,
                    indeterminate.reason(), indeterminate.urgency());
        }

        throw new IllegalStateException("Unexpected status: " + status);
    }

    private static Map<String, String> affectedRepositories(
            final AffectedRange range,
            final Map<String, String> repositories) {
        final var affected = new TreeMap<String, String>();
        for (final Map.Entry<String, String> entry : repositories.entrySet()) {
            if (!DebianVersion.isValid(entry.getValue())) {
                LOGGER.debug("Ignoring invalid version {} of suite {}", entry.getValue(), entry.getKey());
                continue;
            }

            if (range.contains(entry.getValue())) {
                affected.put(entry.getKey(), entry.getValue());
            }
        }

        return affected;
    }

}
