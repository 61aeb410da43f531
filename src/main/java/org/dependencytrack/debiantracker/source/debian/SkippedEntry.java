package org.dependencytrack.debiantracker.source.debian;

import org.jspecify.annotations.Nullable;

public record SkippedEntry(String packageName, @Nullable String cveId, String reason) {

    static SkippedEntry of(final StructuralException exception) {
        return new SkippedEntry(exception.packageName(), exception.cveId(), exception.getMessage());
    }

}
