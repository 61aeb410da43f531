package org.dependencytrack.debiantracker.source.debian;

import org.dependencytrack.debiantracker.version.DebianVersion;
import org.jspecify.annotations.Nullable;

import java.util.Collections;
import java.util.Map;
import java.util.TreeMap;

import static java.util.Objects.requireNonNull;

public sealed interface ReleaseStatus {

    @Nullable
    String rawStatus();

    @Nullable
    String urgency();

    Map<String, String> repositories();

    record Open(
            String rawStatus,
            @Nullable String urgency,
            Map<String, String> repositories,
            @Nullable String conflictingFixedVersion) implements ReleaseStatus {

        public Open {
            repositories = sortedCopy(repositories);
        }

    }

    // fixedVersion is null when the tracker omits it.
    record Resolved(
            String rawStatus,
            @Nullable String urgency,
            Map<String, String> repositories,
            @Nullable DebianVersion fixedVersion) implements ReleaseStatus {

        public Resolved {
            repositories = sortedCopy(repositories);
        }

    }

    record Indeterminate(
            @Nullable String rawStatus,
            @Nullable String urgency,
            Map<String, String> repositories,
            String reason) implements ReleaseStatus {

        public Indeterminate {
            requireNonNull(reason, "reason must not be null");
            repositories = sortedCopy(repositories);
        }

    }

    private static Map<String, String> sortedCopy(final Map<String, String> repositories) {
        if (repositories == null || repositories.isEmpty()) {
            return Collections.emptyMap();
        }

        final var sorted = new TreeMap<String, String>();
        repositories.forEach((suite, version) -> {
            if (suite != null && version != null) {
                sorted.put(suite, version);
            }
        });

        return Collections.unmodifiableSortedMap(sorted);
    }

}
