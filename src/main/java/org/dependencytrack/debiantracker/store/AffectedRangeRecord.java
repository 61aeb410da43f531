package org.dependencytrack.debiantracker.store;

import com.github.packageurl.MalformedPackageURLException;
import com.github.packageurl.PackageURL;
import io.github.nscuro.versatile.Comparator;
import io.github.nscuro.versatile.Vers;
import io.github.nscuro.versatile.version.VersioningScheme;
import org.dependencytrack.debiantracker.api.AffectedRange;
import org.dependencytrack.debiantracker.api.RangeStatus;
import org.dependencytrack.debiantracker.api.Source;
import org.dependencytrack.debiantracker.api.VulnerabilityRecord;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.Map;

import static com.github.packageurl.PackageURLBuilder.aPackageURL;

public record AffectedRangeRecord(
        long id,
        String sourceName,
        String vulnId,
        String packageName,
        String releaseName,
        @Nullable String ecosystem,
        String status,
        @Nullable String lowerBound,
        @Nullable String upperBound,
        @Nullable String fixedVersion,
        boolean isEmpty,
        boolean lowConfidence,
        @Nullable String reason,
        @Nullable String urgency,
        @Nullable String affectedRepositories,
        @Nullable String purl,
        @Nullable String versions,
        @Nullable Instant createdAt,
        @Nullable Instant updatedAt) {

    private static final Logger LOGGER = LoggerFactory.getLogger(AffectedRangeRecord.class);

    static AffectedRangeRecord of(
            final Source source,
            final VulnerabilityRecord vuln,
            final AffectedRange range,
            final @Nullable String affectedRepositoriesJson) {
        return new AffectedRangeRecord(
                -1,
                source.name(),
                vuln.cveId(),
                vuln.packageName(),
                range.release(),
                range.ecosystem(),
                range.status().name(),
                range.lowerBound(),
                range.upperBound(),
                range.fixedVersion(),
                range.empty(),
                range.lowConfidence(),
                range.reason(),
                range.urgency(),
                affectedRepositoriesJson,
                purlOf(vuln.packageName(), range.release()),
                versOf(range),
                null,
                null);
    }

    public AffectedRange toAffectedRange() {
        return new AffectedRange(
                releaseName,
                ecosystem,
                RangeStatus.valueOf(status),
                lowerBound,
                upperBound,
                fixedVersion,
                isEmpty,
                lowConfidence,
                reason,
                urgency,
                Map.of());
    }

    private static @Nullable String purlOf(final String packageName, final String release) {
        try {
            return aPackageURL()
                    .withType(PackageURL.StandardTypes.DEBIAN)
                    .withNamespace("debian")
                    .withName(packageName)
                    .withQualifier("distro", release)
                    .build()
                    .canonicalize();
        } catch (MalformedPackageURLException e) {
            LOGGER.warn("Failed to build PURL for package {} in release {}", packageName, release, e);
            return null;
        }
    }

    private static @Nullable String versOf(final AffectedRange range) {
        if (range.empty()) {
            return null;
        }

        try {
            var versBuilder = Vers.builder(VersioningScheme.DEB);
            if (!AffectedRange.UNBOUNDED.equals(range.lowerBound())) {
                versBuilder = versBuilder.withConstraint(Comparator.GREATER_THAN_OR_EQUAL, range.lowerBound());
            }
            if (!AffectedRange.UNBOUNDED.equals(range.upperBound())) {
                versBuilder = versBuilder.withConstraint(Comparator.LESS_THAN, range.upperBound());
            } else if (AffectedRange.UNBOUNDED.equals(range.lowerBound())) {
                versBuilder = versBuilder.withConstraint(Comparator.WILDCARD, (String) null);
            }

            return versBuilder.build().toString();
        } catch (RuntimeException e) {
            LOGGER.warn("Failed to build vers for {}", range, e);
            return null;
        }
    }

}
