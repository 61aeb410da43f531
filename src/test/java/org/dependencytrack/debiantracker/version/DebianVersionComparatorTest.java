package org.dependencytrack.debiantracker.version;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.ArrayList;
import java.util.List;
import java.util.Random;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatExceptionOfType;

class DebianVersionComparatorTest {

    private static final String FRAGMENT_CHARACTERS = "0123456789abcz.+~";

    private final DebianVersionComparator comparator = DebianVersionComparator.INSTANCE;

    @Test
    void shouldReportOrdering() {
        assertThat(comparator.order("1.0~rc1", "1.0")).isEqualTo(Ordering.LESS);
        assertThat(comparator.order("1:1.0", "2.0")).isEqualTo(Ordering.GREATER);
        assertThat(comparator.order("1.0", "1.00")).isEqualTo(Ordering.EQUAL);
    }

    @Test
    void shouldThrowForMalformedVersion() {
        assertThatExceptionOfType(MalformedVersionException.class)
                .isThrownBy(() -> comparator.compare("1.0", "abc!@#"));
        assertThatExceptionOfType(MalformedVersionException.class)
                .isThrownBy(() -> comparator.order("", "1.0"));
    }

    @Test
    void shouldSortTrackerVersions() {
        final var versions = new ArrayList<>(List.of(
                "1:1.35.0-4", "1:1.30.1-6+b3", "1.36.1-1", "1:1.35.0-4~bpo11+1", "1:1.35.0-4+deb12u1"));

        versions.sort(comparator);

        assertThat(versions).containsExactly(
                "1.36.1-1", "1:1.30.1-6+b3", "1:1.35.0-4~bpo11+1", "1:1.35.0-4", "1:1.35.0-4+deb12u1");
    }

    @ParameterizedTest
    @ValueSource(longs = {1L, 42L, 1337L, 20240601L})
    void shouldBeReflexiveAndAntisymmetric(final long seed) {
        final var random = new Random(seed);

        for (int i = 0; i < 500; i++) {
            final String a = randomVersion(random);
            final String b = randomVersion(random);

            assertThat(comparator.compare(a, a)).as("compare(%s, %s)", a, a).isZero();
            assertThat(comparator.compare(a, b))
                    .as("compare(%s, %s)", a, b)
                    .isEqualTo(-comparator.compare(b, a));
        }
    }

    @ParameterizedTest
    @ValueSource(longs = {7L, 99L, 4711L})
    void shouldBeTransitive(final long seed) {
        final var random = new Random(seed);

        for (int i = 0; i < 300; i++) {
            final var versions = new ArrayList<String>(List.of(
                    randomVersion(random), randomVersion(random), randomVersion(random)));
            versions.sort(comparator);

            final String low = versions.get(0);
            final String middle = versions.get(1);
            final String high = versions.get(2);

            assertThat(comparator.compare(low, middle)).isLessThanOrEqualTo(0);
            assertThat(comparator.compare(middle, high)).isLessThanOrEqualTo(0);
            assertThat(comparator.compare(low, high))
                    .as("%s <= %s <= %s", low, middle, high)
                    .isLessThanOrEqualTo(0);
        }
    }

    @ParameterizedTest
    @ValueSource(longs = {3L, 31L})
    void shouldProduceSameOrderForParsedVersions(final long seed) {
        final var random = new Random(seed);

        for (int i = 0; i < 300; i++) {
            final String a = randomVersion(random);
            final String b = randomVersion(random);

            assertThat(comparator.compare(a, b))
                    .isEqualTo(DebianVersion.parse(a).compareTo(DebianVersion.parse(b)));
        }
    }

    private static String randomVersion(final Random random) {
        final var version = new StringBuilder();
        if (random.nextInt(4) == 0) {
            version.append(random.nextInt(3)).append(':');
        }

        version.append(random.nextInt(10));
        version.append(randomFragment(random));

        if (random.nextBoolean()) {
            version.append('-').append(random.nextInt(5)).append(randomFragment(random));
        }

        return version.toString();
    }

    private static String randomFragment(final Random random) {
        final int length = random.nextInt(6);
        final var fragment = new StringBuilder(length);
        for (int i = 0; i < length; i++) {
            fragment.append(FRAGMENT_CHARACTERS.charAt(random.nextInt(FRAGMENT_CHARACTERS.length())));
        }

        return fragment.toString();
    }

}
