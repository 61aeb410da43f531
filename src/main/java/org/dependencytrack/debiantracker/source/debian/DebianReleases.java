package org.dependencytrack.debiantracker.source.debian;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.util.Map;
import java.util.Properties;
import java.util.stream.Collectors;

import static java.util.Objects.requireNonNull;

public final class DebianReleases {

    private static final String ECOSYSTEM_PREFIX = "Debian:";

    private final Map<String, String> versionByCodename;

    DebianReleases(final Map<String, String> versionByCodename) {
        this.versionByCodename = Map.copyOf(versionByCodename);
    }

    public static DebianReleases fromClasspath() {
        final var properties = new Properties();
        try (final InputStream inputStream = DebianReleases.class.getClassLoader()
                .getResourceAsStream("debian-releases.properties")) {
            if (inputStream == null) {
                throw new IllegalStateException("Release mapping not found");
            }

            properties.load(inputStream);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read release mapping", e);
        }

        return new DebianReleases(properties.stringPropertyNames().stream()
                .collect(Collectors.toMap(
                        codename -> codename,
                        codename -> properties.getProperty(codename).trim())));
    }

    public String ecosystemOf(final String codename) {
        requireNonNull(codename, "codename must not be null");
        return ECOSYSTEM_PREFIX + versionByCodename.getOrDefault(codename, codename);
    }

}
