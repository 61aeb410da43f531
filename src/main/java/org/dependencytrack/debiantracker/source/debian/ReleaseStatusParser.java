package org.dependencytrack.debiantracker.source.debian;

import org.dependencytrack.debiantracker.version.DebianVersion;
import org.dependencytrack.debiantracker.version.MalformedVersionException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Locale;

public final class ReleaseStatusParser {

    private static final Logger LOGGER = LoggerFactory.getLogger(ReleaseStatusParser.class);

    static final String STATUS_OPEN = "open";
    static final String STATUS_RESOLVED = "resolved";
    static final String STATUS_UNDETERMINED = "undetermined";

    public ReleaseStatus parse(final DebianTrackerRelease release) {
        final String rawStatus = release.status();
        if (rawStatus == null || rawStatus.isBlank()) {
            return new ReleaseStatus.Indeterminate(
                    rawStatus, release.urgency(), release.repositories(), "No status reported");
        }

        return switch (rawStatus.trim().toLowerCase(Locale.ROOT)) {
            case STATUS_OPEN -> parseOpen(release);
            case STATUS_RESOLVED -> parseResolved(release);
            case STATUS_UNDETERMINED -> new ReleaseStatus.Indeterminate(
                    rawStatus, release.urgency(), release.repositories(), "Status is undetermined");
            default -> {
                LOGGER.debug("Unrecognized status \"{}\"", rawStatus);
                yield new ReleaseStatus.Indeterminate(
                        rawStatus, release.urgency(), release.repositories(),
                        "Unrecognized status \"%s\"".formatted(rawStatus));
            }
        };
    }

    private ReleaseStatus parseOpen(final DebianTrackerRelease release) {
        final String fixedVersion = release.fixedVersion();
        if (fixedVersion != null && !fixedVersion.isBlank()) {
            LOGGER.debug("Release is open, but reports fixed version {}", fixedVersion);
            return new ReleaseStatus.Open(release.status(), release.urgency(), release.repositories(), fixedVersion);
        }

        return new ReleaseStatus.Open(release.status(), release.urgency(), release.repositories(), null);
    }

    private ReleaseStatus parseResolved(final DebianTrackerRelease release) {
        if (release.fixedVersion() == null) {
            return new ReleaseStatus.Resolved(release.status(), release.urgency(), release.repositories(), null);
        }

        try {
            final DebianVersion fixedVersion = DebianVersion.parse(release.fixedVersion());
            return new ReleaseStatus.Resolved(release.status(), release.urgency(), release.repositories(), fixedVersion);
        } catch (MalformedVersionException e) {
            LOGGER.debug("Degrading release with invalid fixed version", e);
            return new ReleaseStatus.Indeterminate(
                    release.status(), release.urgency(), release.repositories(),
                    "Invalid fixed version: " + e.getMessage());
        }
    }

}
