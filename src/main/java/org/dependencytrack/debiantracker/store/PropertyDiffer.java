package org.dependencytrack.debiantracker.store;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.SortedMap;
import java.util.TreeMap;
import java.util.function.Function;

final class PropertyDiffer<T> {

    record Diff(Object before, Object after) {

        @Override
        public String toString() {
            return "%s -> %s".formatted(before, after);
        }

    }

    private final Map<String, Function<T, ?>> getterByPropertyName = new LinkedHashMap<>();

    PropertyDiffer<T> withProperty(final String propertyName, final Function<T, ?> getter) {
        if (getterByPropertyName.putIfAbsent(propertyName, getter) != null) {
            throw new IllegalArgumentException("Property %s is already registered".formatted(propertyName));
        }

        return this;
    }

    SortedMap<String, Diff> diff(final T before, final T after) {
        final var diffByPropertyName = new TreeMap<String, Diff>();

        for (final Map.Entry<String, Function<T, ?>> entry : getterByPropertyName.entrySet()) {
            final Object beforeValue = entry.getValue().apply(before);
            final Object afterValue = entry.getValue().apply(after);
            if (!Objects.equals(beforeValue, afterValue)) {
                diffByPropertyName.put(entry.getKey(), new Diff(beforeValue, afterValue));
            }
        }

        return Collections.unmodifiableSortedMap(diffByPropertyName);
    }

}
