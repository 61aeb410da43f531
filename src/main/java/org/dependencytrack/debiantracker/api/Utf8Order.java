package org.dependencytrack.debiantracker.api;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.Comparator;

public final class Utf8Order {

    public static final Comparator<String> COMPARATOR = Utf8Order::compare;

    private Utf8Order() {
    }

    public static int compare(final String a, final String b) {
        return Arrays.compareUnsigned(
                a.getBytes(StandardCharsets.UTF_8),
                b.getBytes(StandardCharsets.UTF_8));
    }

}
