package org.dependencytrack.debiantracker.source.debian;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.LinkedHashMap;
import java.util.Map;

record DebianTrackerCve(
        String description,
        String scope,
        Long debianbug,
        Map<String, JsonNode> releases) {

    static DebianTrackerCve of(final JsonNode cveNode, final JsonNode releasesNode) {
        final var releases = new LinkedHashMap<String, JsonNode>(releasesNode.size());
        releasesNode.fields().forEachRemaining(entry -> releases.put(entry.getKey(), entry.getValue()));

        return new DebianTrackerCve(
                TrackerFields.text(cveNode, "description"),
                TrackerFields.text(cveNode, "scope"),
                TrackerFields.integer(cveNode, "debianbug"),
                releases);
    }

}
