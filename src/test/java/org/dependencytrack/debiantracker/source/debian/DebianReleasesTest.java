package org.dependencytrack.debiantracker.source.debian;

import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.assertj.core.api.Assertions.assertThat;

class DebianReleasesTest {

    private final DebianReleases releases = DebianReleases.fromClasspath();

    @ParameterizedTest
    @CsvSource(value = {
            "buster,   Debian:10",
            "bullseye, Debian:11",
            "bookworm, Debian:12",
            "trixie,   Debian:13",
            "sid,      Debian:sid",
            "experimental, Debian:experimental"
    })
    void shouldMapCodenameToEcosystem(final String codename, final String expectedEcosystem) {
        assertThat(releases.ecosystemOf(codename)).isEqualTo(expectedEcosystem);
    }

}
