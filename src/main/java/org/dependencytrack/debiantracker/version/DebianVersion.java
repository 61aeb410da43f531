package org.dependencytrack.debiantracker.version;

import java.math.BigInteger;
import java.util.Objects;
import java.util.regex.Pattern;

import static java.util.Objects.requireNonNull;

/**
 * A Debian package version of the form {@code [epoch:]upstream_version[-debian_revision]}.
 * <p>
 * Ordering follows the rules of the Debian policy manual (section 5.6.12), as implemented by dpkg.
 * Note that the natural ordering is <em>not</em> consistent with {@link #equals(Object)}:
 * {@code 1.0} and {@code 1.00} compare as equal, but are different versions textually.
 */
public final class DebianVersion implements Comparable<DebianVersion> {

    private static final Pattern ALLOWED_CHARACTERS_PATTERN = Pattern.compile("^[A-Za-z0-9.+~:-]+$");
    private static final Pattern EPOCH_PATTERN = Pattern.compile("^[0-9]+$");

    private final String version;
    private final BigInteger epoch;
    private final String upstreamVersion;
    private final String debianRevision;

    private DebianVersion(
            final String version,
            final BigInteger epoch,
            final String upstreamVersion,
            final String debianRevision) {
        this.version = version;
        this.epoch = epoch;
        this.upstreamVersion = upstreamVersion;
        this.debianRevision = debianRevision;
    }

    /**
     * @param version The version string to parse
     * @return The parsed {@link DebianVersion}
     * @throws MalformedVersionException When {@code version} is blank, contains characters
     *                                   outside of {@code [A-Za-z0-9.+~:-]}, has a non-numeric
     *                                   epoch, or has an empty upstream version
     */
    public static DebianVersion parse(final String version) {
        if (version == null || version.isBlank()) {
            throw new MalformedVersionException(version, "must not be blank");
        }
        if (!ALLOWED_CHARACTERS_PATTERN.matcher(version).matches()) {
            throw new MalformedVersionException(version, "contains characters outside of [A-Za-z0-9.+~:-]");
        }

        String remainder = version;

        BigInteger epoch = BigInteger.ZERO;
        final int epochSeparatorIndex = remainder.indexOf(':');
        if (epochSeparatorIndex >= 0) {
            final String epochStr = remainder.substring(0, epochSeparatorIndex);
            if (!EPOCH_PATTERN.matcher(epochStr).matches()) {
                throw new MalformedVersionException(version, "epoch must be numeric");
            }

            epoch = new BigInteger(epochStr);
            remainder = remainder.substring(epochSeparatorIndex + 1);
        }

        String debianRevision = "";
        final int revisionSeparatorIndex = remainder.lastIndexOf('-');
        if (revisionSeparatorIndex >= 0) {
            debianRevision = remainder.substring(revisionSeparatorIndex + 1);
            remainder = remainder.substring(0, revisionSeparatorIndex);
        }

        if (remainder.isEmpty()) {
            throw new MalformedVersionException(version, "upstream version must not be empty");
        }

        return new DebianVersion(version, epoch, remainder, debianRevision);
    }

    public static boolean isValid(final String version) {
        try {
            parse(version);
            return true;
        } catch (MalformedVersionException e) {
            return false;
        }
    }

    public BigInteger epoch() {
        return epoch;
    }

    public String upstreamVersion() {
        return upstreamVersion;
    }

    public String debianRevision() {
        return debianRevision;
    }

    @Override
    public int compareTo(final DebianVersion other) {
        requireNonNull(other, "other must not be null");

        final int epochResult = epoch.compareTo(other.epoch);
        if (epochResult != 0) {
            return Integer.signum(epochResult);
        }

        final int upstreamResult = compareFragment(upstreamVersion, other.upstreamVersion);
        if (upstreamResult != 0) {
            return Integer.signum(upstreamResult);
        }

        return Integer.signum(compareFragment(debianRevision, other.debianRevision));
    }

    // Alternates between non-digit and digit runs, see dpkg's verrevcmp.
    private static int compareFragment(final String a, final String b) {
        int i = 0;
        int j = 0;

        while (i < a.length() || j < b.length()) {
            while ((i < a.length() && !isDigit(a.charAt(i)))
                   || (j < b.length() && !isDigit(b.charAt(j)))) {
                final int aWeight = weightAt(a, i);
                final int bWeight = weightAt(b, j);
                if (aWeight != bWeight) {
                    return aWeight - bWeight;
                }

                i++;
                j++;
            }

            while (i < a.length() && a.charAt(i) == '0') {
                i++;
            }
            while (j < b.length() && b.charAt(j) == '0') {
                j++;
            }

            int firstDifference = 0;
            while (i < a.length() && isDigit(a.charAt(i))
                   && j < b.length() && isDigit(b.charAt(j))) {
                if (firstDifference == 0) {
                    firstDifference = a.charAt(i) - b.charAt(j);
                }

                i++;
                j++;
            }

            if (i < a.length() && isDigit(a.charAt(i))) {
                return 1;
            }
            if (j < b.length() && isDigit(b.charAt(j))) {
                return -1;
            }
            if (firstDifference != 0) {
                return firstDifference;
            }
        }

        return 0;
    }

    // ~ sorts before the end of the string, which sorts before letters,
    // which sort before everything else. Digits never reach this in a comparison.
    private static int weightAt(final String str, final int index) {
        if (index >= str.length()) {
            return 0;
        }

        final char c = str.charAt(index);
        if (isDigit(c)) {
            return 0;
        } else if (isLetter(c)) {
            return c;
        } else if (c == '~') {
            return -1;
        }

        return c + 256;
    }

    private static boolean isDigit(final char c) {
        return c >= '0' && c <= '9';
    }

    private static boolean isLetter(final char c) {
        return (c >= 'A' && c <= 'Z') || (c >= 'a' && c <= 'z');
    }

    @Override
    public boolean equals(final Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof final DebianVersion other)) {
            return false;
        }

        return version.equals(other.version);
    }

    @Override
    public int hashCode() {
        return Objects.hash(version);
    }

    @Override
    public String toString() {
        return version;
    }

}
