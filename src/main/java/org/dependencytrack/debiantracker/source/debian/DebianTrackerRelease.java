package org.dependencytrack.debiantracker.source.debian;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.Map;

public record DebianTrackerRelease(
        String status,
        Map<String, String> repositories,
        String urgency,
        String fixedVersion) {

    static DebianTrackerRelease of(final JsonNode releaseNode) {
        return new DebianTrackerRelease(
                TrackerFields.text(releaseNode, "status"),
                TrackerFields.textMap(releaseNode, "repositories"),
                TrackerFields.text(releaseNode, "urgency"),
                TrackerFields.text(releaseNode, "fixed_version"));
    }

}
