package org.dependencytrack.debiantracker.store;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatIllegalArgumentException;

class PropertyDifferTest {

    private record Range(String status, String upperBound, Long bug) {
    }

    private final PropertyDiffer<Range> differ = new PropertyDiffer<Range>()
            .withProperty("upperBound", Range::upperBound)
            .withProperty("status", Range::status)
            .withProperty("bug", Range::bug);

    @Test
    void shouldReportNoDiffsForEqualRecords() {
        assertThat(differ.diff(new Range("OPEN", null, 1L), new Range("OPEN", null, 1L))).isEmpty();
    }

    @Test
    void shouldReportDiffsInPropertyNameOrder() {
        final var diffs = differ.diff(new Range("OPEN", "unbounded", null), new Range("FIXED", "1.0-2", 42L));

        assertThat(diffs).containsOnlyKeys("bug", "status", "upperBound");
        assertThat(diffs.firstKey()).isEqualTo("bug");
        assertThat(diffs.get("status")).isEqualTo(new PropertyDiffer.Diff("OPEN", "FIXED"));
        assertThat(diffs.get("upperBound")).hasToString("unbounded -> 1.0-2");
        assertThat(diffs.get("bug")).hasToString("null -> 42");
    }

    @Test
    void shouldRejectDuplicateProperty() {
        assertThatIllegalArgumentException()
                .isThrownBy(() -> differ.withProperty("status", Range::status));
    }

}
