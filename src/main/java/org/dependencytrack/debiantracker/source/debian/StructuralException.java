package org.dependencytrack.debiantracker.source.debian;

import org.jspecify.annotations.Nullable;

public final class StructuralException extends RuntimeException {

    private final String packageName;
    private final @Nullable String cveId;

    StructuralException(final String packageName, final @Nullable String cveId, final String message) {
        super(cveId != null
                ? "%s/%s: %s".formatted(packageName, cveId, message)
                : "%s: %s".formatted(packageName, message));
        this.packageName = packageName;
        this.cveId = cveId;
    }

    public String packageName() {
        return packageName;
    }

    public @Nullable String cveId() {
        return cveId;
    }

}
