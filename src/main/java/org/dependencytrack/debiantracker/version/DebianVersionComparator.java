package org.dependencytrack.debiantracker.version;

import java.util.Comparator;

/**
 * A {@link Comparator} for raw Debian version strings.
 * <p>
 * Both arguments are parsed on every invocation. Callers that compare the same version
 * repeatedly should hold on to a parsed {@link DebianVersion} instead.
 *
 * @see DebianVersion#compareTo(DebianVersion)
 */
public final class DebianVersionComparator implements Comparator<String> {

    public static final DebianVersionComparator INSTANCE = new DebianVersionComparator();

    private DebianVersionComparator() {
    }

    /**
     * @throws MalformedVersionException When either version is not a valid Debian version
     */
    @Override
    public int compare(final String a, final String b) {
        return DebianVersion.parse(a).compareTo(DebianVersion.parse(b));
    }

    /**
     * @throws MalformedVersionException When either version is not a valid Debian version
     */
    public Ordering order(final String a, final String b) {
        return Ordering.of(compare(a, b));
    }

}
