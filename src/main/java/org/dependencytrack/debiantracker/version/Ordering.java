package org.dependencytrack.debiantracker.version;

public enum Ordering {

    LESS,
    EQUAL,
    GREATER;

    static Ordering of(final int comparisonResult) {
        if (comparisonResult < 0) {
            return LESS;
        } else if (comparisonResult > 0) {
            return GREATER;
        }

        return EQUAL;
    }

}
