package org.dependencytrack.debiantracker.version;

public final class MalformedVersionException extends IllegalArgumentException {

    private final String version;

    MalformedVersionException(final String version, final String message) {
        super("Malformed version \"%s\": %s".formatted(version, message));
        this.version = version;
    }

    public String version() {
        return version;
    }

}
