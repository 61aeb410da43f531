package org.dependencytrack.debiantracker.source.debian;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.dependencytrack.debiantracker.api.AffectedRange;
import org.dependencytrack.debiantracker.api.VulnerabilityRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static java.util.Objects.requireNonNull;

public final class TrackerDocumentLoader {

    private static final Logger LOGGER = LoggerFactory.getLogger(TrackerDocumentLoader.class);

    private final ReleaseStatusParser statusParser;
    private final AffectedRangeResolver rangeResolver;
    private final CrossReleaseReconciler reconciler;

    public TrackerDocumentLoader() {
        this(new ReleaseStatusParser(),
                new AffectedRangeResolver(),
                new CrossReleaseReconciler(DebianReleases.fromClasspath()));
    }

    TrackerDocumentLoader(
            final ReleaseStatusParser statusParser,
            final AffectedRangeResolver rangeResolver,
            final CrossReleaseReconciler reconciler) {
        this.statusParser = statusParser;
        this.rangeResolver = rangeResolver;
        this.reconciler = reconciler;
    }

    public TrackerConversion load(final JsonNode document) {
        return load(document, SkippedEntryListener.NOOP);
    }

    public TrackerConversion load(final JsonNode document, final SkippedEntryListener skippedListener) {
        requireNonNull(document, "document must not be null");
        requireNonNull(skippedListener, "skippedListener must not be null");
        if (!(document instanceof final ObjectNode objectNode)) {
            throw new IllegalArgumentException("Tracker document must be a JSON object, but is " + document.getNodeType());
        }

        return new TrackerConversion(this, objectNode, skippedListener);
    }

    VulnerabilityRecord convert(final String packageName, final String cveId, final JsonNode cveNode) {
        try (var ignoredMdcPackage = MDC.putCloseable("package", packageName);
             var ignoredMdcVulnId = MDC.putCloseable("vulnId", cveId)) {
            return convertCve(packageName, cveId, cveNode);
        }
    }

    private VulnerabilityRecord convertCve(final String packageName, final String cveId, final JsonNode cveNode) {
        if (!cveNode.isObject()) {
            throw new StructuralException(packageName, cveId, "Entry is not an object");
        }

        final JsonNode releasesNode = cveNode.get("releases");
        if (releasesNode == null || releasesNode.isNull()) {
            throw new StructuralException(packageName, cveId, "Entry has no releases");
        }
        if (!releasesNode.isObject()) {
            throw new StructuralException(packageName, cveId, "Releases are not an object");
        }

        final DebianTrackerCve cve = DebianTrackerCve.of(cveNode, releasesNode);

        final var rangeByRelease = new LinkedHashMap<String, AffectedRange>(cve.releases().size());
        for (final Map.Entry<String, JsonNode> entry : cve.releases().entrySet()) {
            final ReleaseStatus status = parseRelease(entry.getKey(), entry.getValue());
            rangeByRelease.put(entry.getKey(), rangeResolver.resolve(entry.getKey(), status));
        }

        final List<AffectedRange> ranges = reconciler.reconcile(rangeByRelease);
        if (LOGGER.isDebugEnabled()) {
            LOGGER.debug("Converted {} releases, {} of which with low confidence",
                    ranges.size(), ranges.stream().filter(AffectedRange::lowConfidence).count());
        }

        return new VulnerabilityRecord(
                cveId,
                packageName,
                cve.description(),
                cve.scope(),
                cve.debianbug(),
                ranges);
    }

    private ReleaseStatus parseRelease(final String release, final JsonNode releaseNode) {
        if (releaseNode == null || !releaseNode.isObject()) {
            LOGGER.debug("Entry of release {} is not an object; Treating it as indeterminate", release);
            return new ReleaseStatus.Indeterminate(null, null, null, "Release entry is not an object");
        }

        final DebianTrackerRelease trackerRelease = DebianTrackerRelease.of(releaseNode);
        for (final String fieldName : List.of("status", "fixed_version")) {
            if (!TrackerFields.isScalarOrAbsent(releaseNode, fieldName)) {
                LOGGER.debug("Field {} of release {} is of type {}; Treating it as indeterminate",
                        fieldName, release, releaseNode.get(fieldName).getNodeType());
                return new ReleaseStatus.Indeterminate(
                        trackerRelease.status(),
                        trackerRelease.urgency(),
                        trackerRelease.repositories(),
                        "Field %s is not a string".formatted(fieldName));
            }
        }

        return statusParser.parse(trackerRelease);
    }

}
