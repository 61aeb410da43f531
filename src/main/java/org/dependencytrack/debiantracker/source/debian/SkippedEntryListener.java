package org.dependencytrack.debiantracker.source.debian;

@FunctionalInterface
public interface SkippedEntryListener {

    SkippedEntryListener NOOP = entry -> {
    };

    void onSkipped(SkippedEntry entry);

}
