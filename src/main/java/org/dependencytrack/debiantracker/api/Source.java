package org.dependencytrack.debiantracker.api;

import org.jspecify.annotations.Nullable;

import java.util.regex.Pattern;

import static java.util.Objects.requireNonNull;

public record Source(String name, String displayName, @Nullable String url) {

    private static final Pattern NAME_PATTERN = Pattern.compile("^[a-z0-9]+$");

    public Source {
        requireNonNull(name, "name must not be null");
        requireNonNull(displayName, "displayName must not be null");
        if (!NAME_PATTERN.matcher(name).matches()) {
            throw new IllegalArgumentException("Source name %s does not match %s".formatted(name, NAME_PATTERN.pattern()));
        }
        if (url != null && !url.endsWith("/")) {
            throw new IllegalArgumentException("Source URL %s must end with a slash".formatted(url));
        }
    }

    public @Nullable String advisoryUrl(final String vulnId) {
        return url != null ? url + vulnId : null;
    }

}
