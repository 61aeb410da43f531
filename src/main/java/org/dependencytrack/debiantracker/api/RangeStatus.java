package org.dependencytrack.debiantracker.api;

public enum RangeStatus {

    OPEN,
    FIXED,
    NOT_AFFECTED,
    INDETERMINATE

}
